package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.config.SimulationConfig;
import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.Objects;

/**
 * Runs circuits according to a {@link SimulationConfig}.
 *
 * <p>Example usage:
 * <pre>{@code
 * SimulationConfig config = SimulationConfig.load(Path.of("simulation.json"));
 * SimulationRunner runner = new SimulationRunner(config);
 * ExecutionResult result = runner.run(circuit);
 * Map<String, Integer> counts = result.counts();
 * }</pre>
 */
public final class SimulationRunner {

    private final SimulationConfig config;
    private final BackendSelector selector;

    public SimulationRunner(SimulationConfig config) {
        this(config, new BackendSelector());
    }

    /**
     * Create a runner using the given selector.
     *
     * @param config   Backend, shots, seed, history and noise settings
     * @param selector Selector used to choose the backend
     */
    public SimulationRunner(SimulationConfig config, BackendSelector selector) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.selector = Objects.requireNonNull(selector, "selector cannot be null");
    }

    public SimulationConfig config() {
        return config;
    }

    /**
     * Pick a backend for {@code circuit} and report why, without executing.
     */
    public BackendSelector.Selection plan(Circuit circuit) {
        return selector.select(circuit, config.backend().orElse(null), config.noiseModel(), config.hasNoise());
    }

    /**
     * Execute {@code circuit} from |0…0⟩.
     */
    public ExecutionResult run(Circuit circuit) {
        return run(circuit, config.toExecutionOptions());
    }

    /**
     * Execute {@code circuit} from the given initial state.
     */
    public ExecutionResult run(Circuit circuit, QuantumState initialState) {
        return run(circuit, config.toExecutionOptions().toBuilder().initialState(initialState).build());
    }

    private ExecutionResult run(Circuit circuit, ExecutionOptions options) {
        BackendSelector.Selection selection = plan(circuit);
        return selection.backend().execute(circuit, options);
    }
}
