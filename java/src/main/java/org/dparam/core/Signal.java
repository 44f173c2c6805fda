package org.dparam.core;

/**
 * A measured curve (intensity vs energy) of one core level.
 *
 * <p>Point order is kept exactly as supplied; XPS data is commonly listed with
 * decreasing binding energy and is never re-sorted.
 */
public final class Signal {
    public static final String DEFAULT_X_LABEL = "X Values";
    public static final String DEFAULT_Y_LABEL = "Y Values";

    private final String sourceId;
    private final String xLabel;
    private final String yLabel;
    private final double[] x;
    private final double[] y;

    // Cached statistics
    private final double xMin;
    private final double xMax;
    private final double yMin;
    private final double yMax;

    public Signal(double[] x, double[] y) {
        this(null, DEFAULT_X_LABEL, DEFAULT_Y_LABEL, x, y);
    }

    public Signal(String sourceId, String xLabel, String yLabel, double[] x, double[] y) {
        if (x == null || y == null) {
            throw new InvalidInputException("x and y arrays are required");
        }
        if (x.length != y.length) {
            throw new InvalidInputException(String.format(
                "x and y arrays must have same length (x=%d, y=%d)", x.length, y.length));
        }
        this.sourceId = sourceId;
        this.xLabel = xLabel != null ? xLabel : DEFAULT_X_LABEL;
        this.yLabel = yLabel != null ? yLabel : DEFAULT_Y_LABEL;
        this.x = x.clone();
        this.y = y.clone();

        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : this.x) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        this.xMin = this.x.length == 0 ? 0 : lo;
        this.xMax = this.x.length == 0 ? 0 : hi;

        lo = Double.POSITIVE_INFINITY;
        hi = Double.NEGATIVE_INFINITY;
        for (double v : this.y) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        this.yMin = this.y.length == 0 ? 0 : lo;
        this.yMax = this.y.length == 0 ? 0 : hi;
    }

    /**
     * Check that the curve can be differentiated: at least two points, finite
     * values, no two neighbouring points at the same x and no point whose two
     * neighbours share an x (the centred difference spans zero width there).
     *
     * @throws InvalidInputException describing the first problem found
     */
    public void validate() {
        if (x.length < 2) {
            throw new InvalidInputException("Signal needs at least 2 points, got " + x.length);
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw new InvalidInputException(String.format(
                    "Non-finite value at point %d (x=%s, y=%s)", i, x[i], y[i]));
            }
            if (i > 0 && x[i] == x[i - 1]) {
                throw new InvalidInputException(String.format(
                    "Points %d and %d share x=%s", i - 1, i, x[i]));
            }
            if (i > 1 && x[i] == x[i - 2]) {
                throw new InvalidInputException(String.format(
                    "Neighbours %d and %d of point %d share x=%s", i - 2, i, i - 1, x[i]));
            }
        }
    }

    public int size() { return x.length; }

    public String getSourceId() { return sourceId; }
    public String getXLabel() { return xLabel; }
    public String getYLabel() { return yLabel; }

    public double[] getX() { return x.clone(); }
    public double[] getY() { return y.clone(); }

    public double getXAt(int i) { return x[i]; }
    public double getYAt(int i) { return y[i]; }

    public double getXMin() { return xMin; }
    public double getXMax() { return xMax; }
    public double getYMin() { return yMin; }
    public double getYMax() { return yMax; }

    /**
     * True if x never increases from one point to the next.
     */
    public boolean isDescending() {
        for (int i = 1; i < x.length; i++) {
            if (x[i] > x[i - 1]) return false;
        }
        return true;
    }

    /**
     * True if x never decreases from one point to the next.
     */
    public boolean isAscending() {
        for (int i = 1; i < x.length; i++) {
            if (x[i] < x[i - 1]) return false;
        }
        return true;
    }

    /**
     * The same points listed end to end in the opposite order.
     */
    public Signal reversed() {
        int n = x.length;
        double[] rx = new double[n];
        double[] ry = new double[n];
        for (int i = 0; i < n; i++) {
            rx[i] = x[n - 1 - i];
            ry[i] = y[n - 1 - i];
        }
        return new Signal(sourceId, xLabel, yLabel, rx, ry);
    }

    @Override
    public String toString() {
        return String.format("Signal(%s, size=%d, x=[%.2f, %.2f])",
            sourceId, size(), xMin, xMax);
    }
}
