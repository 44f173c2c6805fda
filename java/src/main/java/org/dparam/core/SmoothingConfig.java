package org.dparam.core;

import java.util.Objects;

/**
 * One smoothing stage: an algorithm and its width.
 *
 * <p>For {@link SmoothingAlgorithm#GAUSSIAN} the width is the kernel sigma in samples;
 * the window based algorithms derive their window length as {@code floor(width * 10)}.
 */
public final class SmoothingConfig {
    private final SmoothingAlgorithm algorithm;
    private final double width;

    public SmoothingConfig(SmoothingAlgorithm algorithm, double width) {
        if (algorithm == null) {
            throw new UnsupportedAlgorithmException(null);
        }
        if (!(width > 0) || Double.isInfinite(width)) {
            throw new InvalidParameterException("Smoothing width must be positive, got " + width);
        }
        this.algorithm = algorithm;
        this.width = width;
    }

    public SmoothingAlgorithm getAlgorithm() { return algorithm; }
    public double getWidth() { return width; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SmoothingConfig)) return false;
        SmoothingConfig that = (SmoothingConfig) o;
        return Double.compare(width, that.width) == 0 && algorithm == that.algorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, width);
    }

    @Override
    public String toString() {
        return String.format("SmoothingConfig(%s, width=%.3f)", algorithm, width);
    }
}
