package io.surfworks.quantaforge.core.backend;

/**
 * How repeated shots obtain the state they measure.
 */
public enum ShotMode {
    /**
     * Every shot after the first measures a copy of the state left collapsed by
     * the previous shot, so shots 1..n-1 repeat the outcomes of shot 0.
     */
    REUSE_COLLAPSED,
    /**
     * Every shot measures a fresh copy of the state taken after the last gate,
     * giving independent draws.
     */
    INDEPENDENT
}
