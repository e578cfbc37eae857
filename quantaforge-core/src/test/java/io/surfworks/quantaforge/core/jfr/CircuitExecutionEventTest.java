package io.surfworks.quantaforge.core.jfr;

import jdk.jfr.Category;
import jdk.jfr.EventType;
import jdk.jfr.Name;
import jdk.jfr.ValueDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Unit tests for CircuitExecutionEvent.
 */
@DisplayName("CircuitExecutionEvent Unit Tests")
class CircuitExecutionEventTest {

    @Nested
    @DisplayName("Field Assignment")
    class FieldAssignment {

        @Test
        @DisplayName("circuit fields are assignable")
        void circuitFieldsAssignable() {
            CircuitExecutionEvent event = new CircuitExecutionEvent();

            event.backend = "density_matrix";
            event.numQubits = 3;
            event.numGates = 12;
            event.depth = 5;

            assertEquals("density_matrix", event.backend);
            assertEquals(3, event.numQubits);
            assertEquals(12, event.numGates);
            assertEquals(5, event.depth);
        }

        @Test
        @DisplayName("sampling fields are assignable")
        void samplingFieldsAssignable() {
            CircuitExecutionEvent event = new CircuitExecutionEvent();

            event.shots = 1000;
            event.shotMode = "INDEPENDENT";
            event.noiseApplications = 24;
            event.stateBytes = 1024L;

            assertEquals(1000, event.shots);
            assertEquals("INDEPENDENT", event.shotMode);
            assertEquals(24, event.noiseApplications);
            assertEquals(1024L, event.stateBytes);
        }

        @Test
        @DisplayName("begin and commit without recording do not fail")
        void lifecycleWithoutRecording() {
            CircuitExecutionEvent event = new CircuitExecutionEvent();
            event.begin();
            event.backend = "statevector";
            event.commit();
        }
    }

    @Nested
    @DisplayName("Event Metadata")
    class EventMetadata {

        @Test
        @DisplayName("event is registered under its qualified name")
        void eventName() {
            EventType type = EventType.getEventType(CircuitExecutionEvent.class);
            assertEquals("io.surfworks.quantaforge.CircuitExecution", type.getName());
            assertEquals("io.surfworks.quantaforge.CircuitExecution",
                CircuitExecutionEvent.class.getAnnotation(Name.class).value());
        }

        @Test
        @DisplayName("event carries the simulation category")
        void eventCategory() {
            assertArrayEquals(new String[] {"QuantaForge", "Simulation"},
                CircuitExecutionEvent.class.getAnnotation(Category.class).value());
        }

        @Test
        @DisplayName("all fields are exposed")
        void fieldsExposed() {
            EventType type = EventType.getEventType(CircuitExecutionEvent.class);
            for (String field : new String[] {"backend", "numQubits", "numGates", "depth",
                "shots", "shotMode", "noiseApplications", "stateBytes"}) {
                ValueDescriptor descriptor = type.getField(field);
                assertNotNull(descriptor, field);
            }
        }
    }
}
