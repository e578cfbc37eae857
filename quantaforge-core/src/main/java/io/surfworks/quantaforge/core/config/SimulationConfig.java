package io.surfworks.quantaforge.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ShotMode;
import io.surfworks.quantaforge.core.noise.ChannelType;
import io.surfworks.quantaforge.core.noise.NoiseChannel;
import io.surfworks.quantaforge.core.noise.NoiseModel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Simulation settings read from JSON.
 *
 * <pre>{@code
 * {
 *   "backend": "density_matrix",
 *   "seed": 42,
 *   "shots": 100,
 *   "recordHistory": false,
 *   "shotMode": "REUSE_COLLAPSED",
 *   "noise": {
 *     "0": [ { "channel": "depolarizing", "parameter": 0.01 } ]
 *   }
 * }
 * }</pre>
 *
 * <p>Every field is optional. Without a backend the selector decides; without
 * a seed each execution is unseeded.
 */
public final class SimulationConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private final String backend;
    private final Long seed;
    private final int shots;
    private final boolean recordHistory;
    private final ShotMode shotMode;
    private final Map<Integer, List<ChannelSpec>> noise;

    /**
     * One configured noise channel.
     *
     * @param type      channel kind
     * @param parameter probability or damping parameter
     */
    public record ChannelSpec(ChannelType type, double parameter) {
        public NoiseChannel toChannel() {
            return NoiseChannel.of(type, parameter);
        }
    }

    private SimulationConfig(Builder builder) {
        this.backend = builder.backend;
        this.seed = builder.seed;
        this.shots = builder.shots;
        this.recordHistory = builder.recordHistory;
        this.shotMode = builder.shotMode;
        Map<Integer, List<ChannelSpec>> copy = new TreeMap<>();
        builder.noise.forEach((q, list) -> copy.put(q, List.copyOf(list)));
        this.noise = Collections.unmodifiableMap(copy);
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Loading ====================

    /**
     * Read a configuration file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the content is malformed
     */
    public static SimulationConfig load(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid simulation config " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a configuration document.
     *
     * @throws IllegalArgumentException if the content is malformed
     */
    public static SimulationConfig fromJson(String json) {
        JsonObject root;
        try {
            root = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException | ClassCastException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            return defaults();
        }
        try {
            Builder builder = builder();
            if (has(root, "backend")) {
                builder.backend(root.get("backend").getAsString());
            }
            if (has(root, "seed")) {
                builder.seed(root.get("seed").getAsLong());
            }
            if (has(root, "shots")) {
                builder.shots(root.get("shots").getAsInt());
            }
            if (has(root, "recordHistory")) {
                builder.recordHistory(root.get("recordHistory").getAsBoolean());
            }
            if (has(root, "shotMode")) {
                builder.shotMode(ShotMode.valueOf(root.get("shotMode").getAsString().toUpperCase(Locale.ROOT)));
            }
            if (has(root, "noise")) {
                for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("noise").entrySet()) {
                    int qubit = Integer.parseInt(entry.getKey().trim());
                    JsonArray channels = entry.getValue().getAsJsonArray();
                    for (JsonElement element : channels) {
                        JsonObject channel = element.getAsJsonObject();
                        if (!has(channel, "channel") || !has(channel, "parameter")) {
                            throw new IllegalArgumentException(
                                "Noise entry for qubit " + qubit + " needs 'channel' and 'parameter'");
                        }
                        ChannelType type = ChannelType.fromString(channel.get("channel").getAsString());
                        builder.addNoise(qubit, type, channel.get("parameter").getAsDouble());
                    }
                }
            }
            return builder.build();
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            // Gson signals a wrong JSON type through these
            throw new IllegalArgumentException("Unexpected value type: " + e.getMessage(), e);
        }
    }

    private static boolean has(JsonObject object, String member) {
        return object.has(member) && !object.get(member).isJsonNull();
    }

    /**
     * Serialize to the same document shape {@link #fromJson} reads.
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        if (backend != null) {
            root.addProperty("backend", backend);
        }
        if (seed != null) {
            root.addProperty("seed", seed);
        }
        root.addProperty("shots", shots);
        root.addProperty("recordHistory", recordHistory);
        root.addProperty("shotMode", shotMode.name());
        if (!noise.isEmpty()) {
            JsonObject noiseObj = new JsonObject();
            noise.forEach((qubit, specs) -> {
                JsonArray array = new JsonArray();
                for (ChannelSpec spec : specs) {
                    JsonObject channel = new JsonObject();
                    channel.addProperty("channel", spec.type().displayName());
                    channel.addProperty("parameter", spec.parameter());
                    array.add(channel);
                }
                noiseObj.add(String.valueOf(qubit), array);
            });
            root.add("noise", noiseObj);
        }
        return GSON.toJson(root);
    }

    // ==================== Accessors ====================

    public Optional<String> backend() {
        return Optional.ofNullable(backend);
    }

    public OptionalLong seed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public int shots() {
        return shots;
    }

    public boolean recordHistory() {
        return recordHistory;
    }

    public ShotMode shotMode() {
        return shotMode;
    }

    public Map<Integer, List<ChannelSpec>> noise() {
        return noise;
    }

    public boolean hasNoise() {
        return !noise.isEmpty();
    }

    /**
     * Build the noise model described by this configuration.
     *
     * @throws io.surfworks.quantaforge.core.error.InvalidChannelParameterException
     *         if a parameter lies outside [0, 1]
     */
    public NoiseModel noiseModel() {
        NoiseModel model = NoiseModel.empty();
        noise.forEach((qubit, specs) -> specs.forEach(spec -> model.add(qubit, spec.toChannel())));
        return model;
    }

    /**
     * Execution options carrying the configured shots, seed, history flag and shot mode.
     */
    public ExecutionOptions toExecutionOptions() {
        ExecutionOptions.Builder options = ExecutionOptions.builder()
            .shots(shots)
            .recordHistory(recordHistory)
            .shotMode(shotMode);
        if (seed != null) {
            options.seed(seed);
        }
        return options.build();
    }

    @Override
    public String toString() {
        return "SimulationConfig[backend=" + backend + ", seed=" + seed + ", shots=" + shots
            + ", recordHistory=" + recordHistory + ", shotMode=" + shotMode + ", noise=" + noise + "]";
    }

    public static final class Builder {
        private String backend;
        private Long seed;
        private int shots = 1;
        private boolean recordHistory = false;
        private ShotMode shotMode = ShotMode.REUSE_COLLAPSED;
        private final Map<Integer, List<ChannelSpec>> noise = new TreeMap<>();

        private Builder() {}

        public Builder backend(String backend) {
            this.backend = backend;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder shots(int shots) {
            if (shots < 1) {
                throw new IllegalArgumentException("shots must be at least 1, got " + shots);
            }
            this.shots = shots;
            return this;
        }

        public Builder recordHistory(boolean recordHistory) {
            this.recordHistory = recordHistory;
            return this;
        }

        public Builder shotMode(ShotMode shotMode) {
            this.shotMode = shotMode;
            return this;
        }

        public Builder addNoise(int qubit, ChannelType type, double parameter) {
            if (qubit < 0) {
                throw new IllegalArgumentException("Qubit index must be non-negative, got " + qubit);
            }
            if (type == ChannelType.CUSTOM || type == ChannelType.CROSSTALK) {
                throw new IllegalArgumentException(type.displayName() + " channels cannot be configured by parameter");
            }
            noise.computeIfAbsent(qubit, q -> new ArrayList<>()).add(new ChannelSpec(type, parameter));
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
