package io.surfworks.quantaforge.core.noise;

import io.surfworks.quantaforge.core.error.IncompleteChannelException;
import io.surfworks.quantaforge.core.error.InvalidChannelParameterException;
import io.surfworks.quantaforge.core.gate.Gates;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * A single-qubit noise channel given by its Kraus operators.
 *
 * <p>Channels are immutable and stateless, so one instance may be registered on
 * any number of qubits and reused across executions. Every channel satisfies
 * {@code Σ K_i† K_i = I} within {@link KrausOperators#COMPLETENESS_TOLERANCE}.
 *
 * <p>A {@linkplain #crosstalk crosstalk} channel wraps another channel and
 * spreads it to correlated qubits. Which qubits it reaches is sampled from the
 * caller's {@link Random}, so it is applied through {@link #apply(QuantumState, int, Random)}.
 */
public final class NoiseChannel {

    private static final Logger LOGGER = Logger.getLogger(NoiseChannel.class.getName());

    private final ChannelType type;
    private final String name;
    private final Map<String, Double> params;
    private final List<ComplexMatrix> kraus;
    private final NoiseChannel base;
    private final List<Integer> correlatedQubits;

    private NoiseChannel(ChannelType type, String name, Map<String, Double> params, List<ComplexMatrix> kraus) {
        this(type, name, params, kraus, null, List.of());
    }

    private NoiseChannel(ChannelType type, String name, Map<String, Double> params, List<ComplexMatrix> kraus,
                         NoiseChannel base, List<Integer> correlatedQubits) {
        this.type = type;
        this.name = name;
        this.params = params;
        this.kraus = kraus;
        this.base = base;
        this.correlatedQubits = correlatedQubits;
    }

    // ==================== Factory Methods ====================

    /**
     * Depolarizing channel: {√(1−p) I, √(p/3) X, √(p/3) Y, √(p/3) Z}.
     */
    public static NoiseChannel depolarizing(double p) {
        checkProbability(ChannelType.DEPOLARIZING, p);
        double a = Math.sqrt(1 - p);
        double b = Math.sqrt(p / 3);
        return named(ChannelType.DEPOLARIZING, p, List.of(
            ComplexMatrix.identity(2).scale(a),
            Gates.x().matrix().scale(b),
            Gates.y().matrix().scale(b),
            Gates.z().matrix().scale(b)));
    }

    /**
     * Amplitude damping (energy relaxation toward |0⟩) with decay probability {@code gamma}.
     */
    public static NoiseChannel amplitudeDamping(double gamma) {
        checkProbability(ChannelType.AMPLITUDE_DAMPING, gamma);
        return named(ChannelType.AMPLITUDE_DAMPING, gamma, List.of(
            ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, Math.sqrt(1 - gamma)}}),
            ComplexMatrix.ofReal(new double[][] {{0, Math.sqrt(gamma)}, {0, 0}})));
    }

    /**
     * Phase damping (dephasing without energy loss): {√(1−γ) I, √γ |0⟩⟨0|, √γ |1⟩⟨1|}.
     */
    public static NoiseChannel phaseDamping(double gamma) {
        checkProbability(ChannelType.PHASE_DAMPING, gamma);
        double g = Math.sqrt(gamma);
        return named(ChannelType.PHASE_DAMPING, gamma, List.of(
            ComplexMatrix.identity(2).scale(Math.sqrt(1 - gamma)),
            ComplexMatrix.ofReal(new double[][] {{g, 0}, {0, 0}}),
            ComplexMatrix.ofReal(new double[][] {{0, 0}, {0, g}})));
    }

    /**
     * Applies X with probability {@code p}.
     */
    public static NoiseChannel bitFlip(double p) {
        checkProbability(ChannelType.BIT_FLIP, p);
        return named(ChannelType.BIT_FLIP, p, List.of(
            ComplexMatrix.identity(2).scale(Math.sqrt(1 - p)),
            Gates.x().matrix().scale(Math.sqrt(p))));
    }

    /**
     * Applies Z with probability {@code p}.
     */
    public static NoiseChannel phaseFlip(double p) {
        checkProbability(ChannelType.PHASE_FLIP, p);
        return named(ChannelType.PHASE_FLIP, p, List.of(
            ComplexMatrix.identity(2).scale(Math.sqrt(1 - p)),
            Gates.z().matrix().scale(Math.sqrt(p))));
    }

    /**
     * A channel built from a caller-supplied set of 2x2 Kraus operators.
     *
     * @throws IncompleteChannelException if the set is empty, not 2x2, or not complete
     */
    public static NoiseChannel custom(String name, List<ComplexMatrix> kraus) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kraus, "kraus cannot be null");
        if (kraus.isEmpty()) {
            throw new IncompleteChannelException(name, "no Kraus operators given");
        }
        for (ComplexMatrix k : kraus) {
            if (k.dimension() != 2) {
                throw new IncompleteChannelException(name,
                    "expected 2x2 operators, got " + k.dimension() + "x" + k.dimension());
            }
        }
        double deviation = KrausOperators.completenessDeviation(kraus);
        if (!(deviation <= KrausOperators.COMPLETENESS_TOLERANCE)) {
            throw new IncompleteChannelException(name, deviation);
        }
        return new NoiseChannel(ChannelType.CUSTOM, name, Map.of(), List.copyOf(kraus));
    }

    /**
     * Correlated noise: {@code base} acts on the qubit the channel is triggered
     * for, and on each other qubit of {@code correlatedQubits} with probability
     * {@code correlation}.
     *
     * @param base             channel spread across the qubits; must not itself be crosstalk
     * @param correlatedQubits qubits the noise may spread to
     * @param correlation      spreading probability in [0, 1]
     * @throws InvalidChannelParameterException if {@code correlation} is outside [0, 1]
     */
    public static NoiseChannel crosstalk(NoiseChannel base, List<Integer> correlatedQubits, double correlation) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(correlatedQubits, "correlatedQubits cannot be null");
        checkProbability(ChannelType.CROSSTALK, correlation);
        if (base.type == ChannelType.CROSSTALK) {
            throw new IllegalArgumentException("Crosstalk cannot wrap another crosstalk channel");
        }
        for (int q : correlatedQubits) {
            if (q < 0) {
                throw new IllegalArgumentException("Qubit index must be non-negative, got " + q);
            }
        }
        Map<String, Double> params = new LinkedHashMap<>();
        params.put(ChannelType.CROSSTALK.parameterName(), correlation);
        return new NoiseChannel(ChannelType.CROSSTALK, ChannelType.CROSSTALK.displayName(),
            Collections.unmodifiableMap(params), base.kraus, base, List.copyOf(correlatedQubits));
    }

    /**
     * A built-in channel by kind, as read from configuration.
     */
    public static NoiseChannel of(ChannelType type, double parameter) {
        return switch (type) {
            case DEPOLARIZING -> depolarizing(parameter);
            case AMPLITUDE_DAMPING -> amplitudeDamping(parameter);
            case PHASE_DAMPING -> phaseDamping(parameter);
            case BIT_FLIP -> bitFlip(parameter);
            case PHASE_FLIP -> phaseFlip(parameter);
            case CROSSTALK -> throw new IllegalArgumentException("Crosstalk channels need a base channel and qubits");
            case CUSTOM -> throw new IllegalArgumentException("Custom channels need explicit Kraus operators");
        };
    }

    private static NoiseChannel named(ChannelType type, double value, List<ComplexMatrix> kraus) {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put(type.parameterName(), value);
        return new NoiseChannel(type, type.displayName(), Collections.unmodifiableMap(params), kraus);
    }

    private static void checkProbability(ChannelType type, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidChannelParameterException(type.displayName(), type.parameterName(), value);
        }
    }

    // ==================== Accessors ====================

    public ChannelType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public Map<String, Double> params() {
        return params;
    }

    /**
     * The 2x2 Kraus operators of this channel. For crosstalk, those of the base
     * channel, applied to each affected qubit in turn.
     */
    public List<ComplexMatrix> kraus() {
        return kraus;
    }

    /**
     * The Kraus operators embedded into an n-qubit space at {@code qubit}.
     */
    public List<ComplexMatrix> embeddedKraus(int qubit, int numQubits) {
        return kraus.stream()
            .map(k -> KrausOperators.embed(k, qubit, numQubits))
            .collect(Collectors.toUnmodifiableList());
    }

    public boolean isCrosstalk() {
        return type == ChannelType.CROSSTALK;
    }

    /**
     * The wrapped channel of a crosstalk channel.
     */
    public Optional<NoiseChannel> baseChannel() {
        return Optional.ofNullable(base);
    }

    /**
     * Qubits a crosstalk channel may spread to; empty for other channels.
     */
    public List<Integer> correlatedQubits() {
        return correlatedQubits;
    }

    /**
     * The qubits this channel acts on when triggered for {@code qubit}: {@code qubit}
     * itself, then, for crosstalk, each other correlated qubit whose draw
     * {@code rng.nextDouble()} falls below the correlation.
     */
    public List<Integer> affectedQubits(int qubit, Random rng) {
        if (!isCrosstalk()) {
            return List.of(qubit);
        }
        Objects.requireNonNull(rng, "rng cannot be null");
        double correlation = params.get(ChannelType.CROSSTALK.parameterName());
        List<Integer> affected = new ArrayList<>();
        affected.add(qubit);
        for (int q : correlatedQubits) {
            if (q != qubit && !affected.contains(q) && rng.nextDouble() < correlation) {
                affected.add(q);
            }
        }
        return Collections.unmodifiableList(affected);
    }

    // ==================== Application ====================

    /**
     * Apply this channel to {@code qubit} of a density-matrix state, replacing its tensor.
     *
     * @throws IllegalStateException if {@code state} is a statevector, or this is a
     *                               crosstalk channel, which needs a random source
     */
    public void apply(QuantumState state, int qubit) {
        if (isCrosstalk()) {
            throw new IllegalStateException("Crosstalk samples its qubits; apply it with a Random");
        }
        applyKraus(state, qubit);
    }

    /**
     * Apply this channel, sampling crosstalk spreading from {@code rng}.
     *
     * @return the qubits the channel acted on, in application order
     * @throws IllegalStateException if {@code state} is a statevector
     */
    public List<Integer> apply(QuantumState state, int qubit, Random rng) {
        List<Integer> affected = affectedQubits(qubit, rng);
        for (int q : affected) {
            applyKraus(state, q);
        }
        return affected;
    }

    private void applyKraus(QuantumState state, int qubit) {
        if (!state.isDensityMatrix()) {
            throw new IllegalStateException(name + " requires a density matrix state, got a statevector");
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Applying " + this + " to qubit " + qubit);
        }
        KrausOperators.applyLocal(state, kraus, qubit);
    }

    @Override
    public String toString() {
        if (params.isEmpty()) {
            return name;
        }
        String args = params.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        if (isCrosstalk()) {
            return name + "(" + base + " on " + correlatedQubits + ", " + args + ")";
        }
        return name + "(" + args + ")";
    }
}
