package org.dparam.core;

import java.util.Objects;

/**
 * Parameters of one D-parameter run. The algorithm is shared by the
 * pre-smoothing of the data and the post-smoothing of the derivative.
 */
public final class PipelineConfig {
    public static final double DEFAULT_SMOOTH_WIDTH = 7.0;
    public static final int DEFAULT_PRE_SMOOTH_PASSES = 2;
    public static final double DEFAULT_DIFF_WIDTH = 1.0;
    public static final int DEFAULT_POST_SMOOTH_PASSES = 1;

    private final double smoothWidth;
    private final int preSmoothPasses;
    private final double diffWidth;
    private final int postSmoothPasses;
    private final SmoothingAlgorithm algorithm;

    public PipelineConfig(double smoothWidth, int preSmoothPasses, double diffWidth,
                          int postSmoothPasses, SmoothingAlgorithm algorithm) {
        this.smoothWidth = smoothWidth;
        this.preSmoothPasses = preSmoothPasses;
        this.diffWidth = diffWidth;
        this.postSmoothPasses = postSmoothPasses;
        this.algorithm = algorithm;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_SMOOTH_WIDTH, DEFAULT_PRE_SMOOTH_PASSES,
            DEFAULT_DIFF_WIDTH, DEFAULT_POST_SMOOTH_PASSES, SmoothingAlgorithm.GAUSSIAN);
    }

    /**
     * Check widths and pass counts.
     *
     * @throws InvalidParameterException on a non-positive width or a negative pass count
     * @throws UnsupportedAlgorithmException if no algorithm is set
     */
    public void validate() {
        if (algorithm == null) {
            throw new UnsupportedAlgorithmException(null);
        }
        checkWidth("Smooth width", smoothWidth);
        checkWidth("Differentiation width", diffWidth);
        if (preSmoothPasses < 0) {
            throw new InvalidParameterException("Pre-smooth passes must not be negative, got " + preSmoothPasses);
        }
        if (postSmoothPasses < 0) {
            throw new InvalidParameterException("Post-smooth passes must not be negative, got " + postSmoothPasses);
        }
    }

    private static void checkWidth(String what, double width) {
        if (!(width > 0) || Double.isInfinite(width)) {
            throw new InvalidParameterException(what + " must be positive, got " + width);
        }
    }

    public SmoothingConfig preSmoothing() {
        return new SmoothingConfig(algorithm, smoothWidth);
    }

    public SmoothingConfig postSmoothing() {
        return new SmoothingConfig(algorithm, diffWidth);
    }

    public double getSmoothWidth() { return smoothWidth; }
    public int getPreSmoothPasses() { return preSmoothPasses; }
    public double getDiffWidth() { return diffWidth; }
    public int getPostSmoothPasses() { return postSmoothPasses; }
    public SmoothingAlgorithm getAlgorithm() { return algorithm; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipelineConfig)) return false;
        PipelineConfig that = (PipelineConfig) o;
        return Double.compare(smoothWidth, that.smoothWidth) == 0
            && preSmoothPasses == that.preSmoothPasses
            && Double.compare(diffWidth, that.diffWidth) == 0
            && postSmoothPasses == that.postSmoothPasses
            && algorithm == that.algorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(smoothWidth, preSmoothPasses, diffWidth, postSmoothPasses, algorithm);
    }

    @Override
    public String toString() {
        return String.format("PipelineConfig(smooth=%.2f x%d, diff=%.2f x%d, %s)",
            smoothWidth, preSmoothPasses, diffWidth, postSmoothPasses, algorithm);
    }
}
