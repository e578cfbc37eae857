package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.UnknownBackendException;
import io.surfworks.quantaforge.core.state.QuantumState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackendRegistryTest {

    private BackendRegistry registry;

    /** Returns |0…0⟩ without evolving anything. */
    private static final class IdleBackend implements Backend {
        private final String name;

        IdleBackend(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public BackendCapabilities capabilities() {
            return BackendCapabilities.statevector();
        }

        @Override
        public CapabilityCheck canExecute(Circuit circuit) {
            return CapabilityCheck.ok();
        }

        @Override
        public ExecutionResult execute(Circuit circuit, ExecutionOptions options) {
            return new ExecutionResult(QuantumState.zero(circuit.numQubits()), List.of(), null,
                Map.of(ExecutionResult.KEY_BACKEND, name), List.of());
        }
    }

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry()
            .register(new BackendInfo("idle", "does nothing", "O(1)"), () -> new IdleBackend("idle"))
            .register(new BackendInfo("Other", "also nothing", "O(1)"), () -> new IdleBackend("other"));
    }

    @Test
    void lookupIsCaseInsensitive() {
        assertTrue(registry.isRegistered("IDLE"));
        assertEquals("idle", registry.get("Idle").name());
        assertEquals("does nothing", registry.info("idle").description());
    }

    @Test
    void eachLookupCreatesNewInstance() {
        assertNotSame(registry.get("idle"), registry.get("idle"));
    }

    @Test
    void availableIsSorted() {
        assertEquals(List.of("idle", "other"), registry.available());
    }

    @Test
    void unknownNameListsAvailableBackends() {
        UnknownBackendException e = assertThrows(UnknownBackendException.class, () -> registry.get("gpu"));
        assertEquals("gpu", e.name());
        assertEquals(List.of("idle", "other"), e.available());
        assertThrows(UnknownBackendException.class, () -> registry.info(null));
    }

    @Test
    void unregister() {
        registry.unregister("OTHER");
        assertFalse(registry.isRegistered("other"));
        assertEquals(List.of("idle"), registry.available());
    }

    @Test
    void defaultExecuteUsesDefaultOptions() {
        ExecutionResult result = registry.get("idle").execute(Circuit.builder(2).build());
        assertEquals("idle", result.backendName());
        assertEquals(2, result.state().numQubits());
    }
}
