package com.realtimeanalytics.core.model;

import java.util.Locale;

/**
 * Discrete classification of how far a value strays from its baseline.
 *
 * @since 1.0.0
 */
public enum Severity {

    /** Deviation in {@code [threshold, 2 × threshold)}. */
    MEDIUM,

    /** Deviation of at least {@code 2 × threshold}, or any change of a constant series. */
    HIGH;

    /**
     * @return lowercase label, e.g. {@code "medium"}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
