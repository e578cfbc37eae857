package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Caller-side options for one {@link Backend#execute} call.
 */
public final class ExecutionOptions {

    private static final ExecutionOptions DEFAULTS = builder().build();

    private final QuantumState initialState;
    private final int shots;
    private final boolean recordHistory;
    private final Long seed;
    private final Random random;
    private final ShotMode shotMode;

    private ExecutionOptions(Builder builder) {
        this.initialState = builder.initialState;
        this.shots = builder.shots;
        this.recordHistory = builder.recordHistory;
        this.seed = builder.seed;
        this.random = builder.random;
        this.shotMode = builder.shotMode;
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<QuantumState> initialState() {
        return Optional.ofNullable(initialState);
    }

    public int shots() {
        return shots;
    }

    public boolean recordHistory() {
        return recordHistory;
    }

    public OptionalLong seed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public ShotMode shotMode() {
        return shotMode;
    }

    /**
     * The randomness source for one execution: the caller's {@link Random} if
     * given, else a new one seeded from {@link #seed()}, else an unseeded one.
     */
    public Random newRandom() {
        if (random != null) {
            return random;
        }
        return seed != null ? new Random(seed) : new Random();
    }

    /**
     * A builder pre-filled with these options.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.initialState = initialState;
        b.shots = shots;
        b.recordHistory = recordHistory;
        b.seed = seed;
        b.random = random;
        b.shotMode = shotMode;
        return b;
    }

    @Override
    public String toString() {
        return "ExecutionOptions[shots=" + shots + ", recordHistory=" + recordHistory
            + ", seed=" + seed + ", shotMode=" + shotMode
            + ", initialState=" + (initialState != null) + "]";
    }

    public static final class Builder {
        private QuantumState initialState;
        private int shots = 1;
        private boolean recordHistory = false;
        private Long seed;
        private Random random;
        private ShotMode shotMode = ShotMode.REUSE_COLLAPSED;

        private Builder() {}

        public Builder initialState(QuantumState initialState) {
            this.initialState = initialState;
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

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Use this randomness source; takes precedence over {@link #seed(long)}.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder shotMode(ShotMode shotMode) {
            this.shotMode = Objects.requireNonNull(shotMode, "shotMode cannot be null");
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
