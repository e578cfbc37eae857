package io.surfworks.quantaforge.core.noise;

import java.util.Locale;

/**
 * The closed set of noise channel kinds.
 */
public enum ChannelType {
    DEPOLARIZING("Depolarizing", "p"),
    AMPLITUDE_DAMPING("AmplitudeDamping", "gamma"),
    PHASE_DAMPING("PhaseDamping", "gamma"),
    BIT_FLIP("BitFlip", "p"),
    PHASE_FLIP("PhaseFlip", "p"),
    CROSSTALK("Crosstalk", "correlation"),
    CUSTOM("Custom", null);

    private final String displayName;
    private final String parameterName;

    ChannelType(String displayName, String parameterName) {
        this.displayName = displayName;
        this.parameterName = parameterName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Name of the single probability parameter, or {@code null} for {@link #CUSTOM}.
     */
    public String parameterName() {
        return parameterName;
    }

    /**
     * Resolve a channel kind from its enum name or display name, ignoring case,
     * hyphens and underscores ("bit_flip", "BitFlip", "amplitude-damping").
     */
    public static ChannelType fromString(String value) {
        String key = value.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (ChannelType type : values()) {
            if (type.displayName.toLowerCase(Locale.ROOT).equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown noise channel: " + value);
    }
}
