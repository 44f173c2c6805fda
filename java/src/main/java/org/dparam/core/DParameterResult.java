package org.dparam.core;

/**
 * Outcome of one D-parameter run: the normalized derivative curve and the
 * extrema measured on it.
 */
public final class DParameterResult {
    private final double[] normalizedDerivative;
    private final int minIndex;
    private final int maxIndex;
    private final double center;
    private final double separation;
    private final PipelineConfig config;

    public DParameterResult(double[] normalizedDerivative, int minIndex, int maxIndex,
                            double center, double separation, PipelineConfig config) {
        this.normalizedDerivative = normalizedDerivative.clone();
        this.minIndex = minIndex;
        this.maxIndex = maxIndex;
        this.center = center;
        this.separation = separation;
        this.config = config;
    }

    public double[] getNormalizedDerivative() { return normalizedDerivative.clone(); }
    public double getNormalizedDerivativeAt(int i) { return normalizedDerivative[i]; }
    public int size() { return normalizedDerivative.length; }

    public int getMinIndex() { return minIndex; }
    public int getMaxIndex() { return maxIndex; }

    /** Midpoint between the x positions of the two extrema. */
    public double getCenter() { return center; }

    /** The D-parameter, rounded to two decimals. */
    public double getSeparation() { return separation; }

    public PipelineConfig getConfig() { return config; }

    @Override
    public String toString() {
        return String.format("DParameterResult(separation=%.2f, center=%.3f, min=%d, max=%d)",
            separation, center, minIndex, maxIndex);
    }
}
