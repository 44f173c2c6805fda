package org.dparam.core;

import java.util.Locale;

/**
 * Smoothing algorithms available for the pre- and post-differentiation passes.
 */
public enum SmoothingAlgorithm {
    GAUSSIAN("Gaussian"),
    SAVITZKY_GOLAY("Savitzky-Golay"),
    MOVING_AVERAGE("Moving Average"),
    WIENER("Wiener"),
    NONE("None");

    private final String label;

    SmoothingAlgorithm(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolve an algorithm from its display label or constant name, ignoring case.
     * Older result files spell Savitzky-Golay as "Savitsky-Golay", which is accepted too.
     *
     * @throws UnsupportedAlgorithmException if the name matches no algorithm
     */
    public static SmoothingAlgorithm fromName(String name) {
        if (name == null) {
            throw new UnsupportedAlgorithmException(null);
        }
        String trimmed = name.trim();
        for (SmoothingAlgorithm a : values()) {
            if (a.label.equalsIgnoreCase(trimmed) || a.name().equalsIgnoreCase(trimmed)) {
                return a;
            }
        }
        if (trimmed.toLowerCase(Locale.ROOT).equals("savitsky-golay")) {
            return SAVITZKY_GOLAY;
        }
        throw new UnsupportedAlgorithmException(name);
    }

    @Override
    public String toString() {
        return label;
    }
}
