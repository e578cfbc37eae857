package io.surfworks.quantaforge.core.backend;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a capability pre-flight.
 *
 * <p>{@code executable} with a message means the circuit runs but the message is
 * a soft warning. Not executable means the message names the reason.
 *
 * @param executable whether the backend accepts the circuit
 * @param message    warning or refusal reason, if any
 */
public record CapabilityCheck(boolean executable, Optional<String> message) {

    private static final CapabilityCheck OK = new CapabilityCheck(true, Optional.empty());

    public CapabilityCheck {
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static CapabilityCheck ok() {
        return OK;
    }

    public static CapabilityCheck warning(String warning) {
        return new CapabilityCheck(true, Optional.of(warning));
    }

    public static CapabilityCheck refused(String reason) {
        return new CapabilityCheck(false, Optional.of(reason));
    }

    public boolean hasWarning() {
        return executable && message.isPresent();
    }
}
