package org.dparam.processing;

import org.dparam.core.InvalidInputException;

/**
 * Numerical derivative on a possibly non-uniform grid, with the sign flipped.
 *
 * <p>The negative slope is what a D-parameter is measured on: on a binding energy
 * axis a rising edge turns into a positive lobe. Interior points use the
 * second-order centred difference weighted by the spacing on each side; the two
 * end points use one-sided differences.
 */
public class DerivativeEngine {

    public double[] differentiate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new InvalidInputException(String.format(
                "x and y arrays must have same length (x=%d, y=%d)", x.length, y.length));
        }
        int n = y.length;
        if (n < 2) {
            throw new InvalidInputException("Derivative needs at least 2 points, got " + n);
        }

        double[] d = new double[n];
        d[0] = -(y[1] - y[0]) / (x[1] - x[0]);
        d[n - 1] = -(y[n - 1] - y[n - 2]) / (x[n - 1] - x[n - 2]);

        for (int i = 1; i < n - 1; i++) {
            double h1 = x[i] - x[i - 1];
            double h2 = x[i + 1] - x[i];
            double a = -h2 / (h1 * (h1 + h2));
            double b = (h2 - h1) / (h1 * h2);
            double c = h1 / (h2 * (h1 + h2));
            d[i] = -(a * y[i - 1] + b * y[i] + c * y[i + 1]);
        }
        return d;
    }
}
