package org.dparam.processing;

/**
 * Positions of the global minimum and maximum of a curve.
 */
public final class Extrema {
    private final int minIndex;
    private final int maxIndex;
    private final double center;
    private final double separation;

    public Extrema(int minIndex, int maxIndex, double center, double separation) {
        this.minIndex = minIndex;
        this.maxIndex = maxIndex;
        this.center = center;
        this.separation = separation;
    }

    public int getMinIndex() { return minIndex; }
    public int getMaxIndex() { return maxIndex; }
    public double getCenter() { return center; }
    public double getSeparation() { return separation; }

    @Override
    public String toString() {
        return String.format("Extrema(min=%d, max=%d, center=%.3f, separation=%.2f)",
            minIndex, maxIndex, center, separation);
    }
}
