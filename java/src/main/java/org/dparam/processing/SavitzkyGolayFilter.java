package org.dparam.processing;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.dparam.core.InvalidParameterException;

/**
 * Savitzky-Golay smoothing with a cubic fitted over an odd-length window.
 *
 * <p>Interior samples use the fixed convolution weights of the full window. Where
 * the window runs past either end the cubic is fitted to the samples that remain
 * (a lower degree when fewer than four remain) and evaluated at the sample itself.
 */
public class SavitzkyGolayFilter {

    public static final int POLYNOMIAL_ORDER = 3;

    private final int window;
    private final int halfWindow;
    private final double[] weights;

    public SavitzkyGolayFilter(int window) {
        if (window <= POLYNOMIAL_ORDER) {
            throw new InvalidParameterException(String.format(
                "Savitzky-Golay window of %d is too short for polynomial order %d",
                window, POLYNOMIAL_ORDER));
        }
        if (window % 2 == 0) {
            throw new InvalidParameterException("Savitzky-Golay window must be odd, got " + window);
        }
        this.window = window;
        this.halfWindow = (window - 1) / 2;
        this.weights = fitWeights(-halfWindow, halfWindow, POLYNOMIAL_ORDER);
    }

    public int getWindow() { return window; }

    /**
     * Weights of the interior window, centre sample at index {@code window / 2}.
     */
    public double[] getWeights() { return weights.clone(); }

    public double[] filter(double[] data) {
        int n = data.length;
        double[] out = new double[n];

        for (int i = 0; i < n; i++) {
            int lo = Math.max(0, i - halfWindow);
            int hi = Math.min(n - 1, i + halfWindow);

            double[] w;
            if (lo == i - halfWindow && hi == i + halfWindow) {
                w = weights;
            } else {
                int count = hi - lo + 1;
                w = fitWeights(lo - i, hi - i, Math.min(POLYNOMIAL_ORDER, count - 1));
            }

            double sum = 0;
            for (int j = lo; j <= hi; j++) {
                sum += w[j - lo] * data[j];
            }
            out[i] = sum;
        }
        return out;
    }

    /**
     * Least-squares weights that give the fitted polynomial's value at offset 0
     * from the samples at offsets {@code from..to}.
     */
    static double[] fitWeights(int from, int to, int degree) {
        int count = to - from + 1;
        // Offsets scaled into [-1, 1] to keep the Vandermonde matrix well conditioned
        double scale = Math.max(1, Math.max(Math.abs(from), Math.abs(to)));

        double[][] vander = new double[count][degree + 1];
        for (int r = 0; r < count; r++) {
            double t = (from + r) / scale;
            double power = 1.0;
            for (int c = 0; c <= degree; c++) {
                vander[r][c] = power;
                power *= t;
            }
        }

        RealMatrix matrix = new Array2DRowRealMatrix(vander, false);
        DecompositionSolver solver = new SingularValueDecomposition(matrix).getSolver();
        RealMatrix pseudoInverse = solver.getInverse();

        // Row 0 yields the constant coefficient, i.e. the value at offset 0
        return pseudoInverse.getRow(0);
    }
}
