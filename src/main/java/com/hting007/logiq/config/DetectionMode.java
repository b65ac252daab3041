package com.hting007.logiq.config;

import java.util.Locale;

/**
 * How the frequency check counts a window.
 */
public enum DetectionMode {
    /** One rolling baseline over the total event count of each window. */
    GLOBAL_RATE,
    /** One rolling baseline per template, with a noise floor on the mean. */
    PER_TEMPLATE;

    /**
     * Accepts the enum name as well as the short forms {@code global} and {@code per-template}.
     */
    public static DetectionMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("templateSimilarityMode must not be null");
        }
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (v) {
            case "GLOBAL":
            case "GLOBAL_RATE":
                return GLOBAL_RATE;
            case "TEMPLATE":
            case "PER_TEMPLATE":
                return PER_TEMPLATE;
            default:
                throw new IllegalArgumentException(
                        "templateSimilarityMode must be 'global-rate' or 'per-template', got: " + value);
        }
    }
}
