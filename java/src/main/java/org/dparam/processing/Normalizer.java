package org.dparam.processing;

import org.dparam.core.DegenerateRangeException;
import org.dparam.core.InvalidInputException;

/**
 * Maps a derivative linearly onto the value range of the measured data so both
 * can be drawn on one axis.
 */
public class Normalizer {

    /**
     * A derivative range at or below this fraction of {@code max(1, |min(y)|, |max(y)|)}
     * counts as flat.
     */
    public static final double FLAT_TOLERANCE = 1e-12;

    /**
     * @throws DegenerateRangeException if the derivative is flat
     * @throws InvalidInputException if the derivative holds NaN or infinite values
     */
    public double[] normalize(double[] derivative, double[] referenceY) {
        if (derivative.length == 0 || referenceY.length == 0) {
            throw new InvalidInputException("Cannot normalize an empty sequence");
        }

        double dMin = derivative[0];
        double dMax = derivative[0];
        for (int i = 0; i < derivative.length; i++) {
            double v = derivative[i];
            if (!Double.isFinite(v)) {
                throw new InvalidInputException(String.format("Derivative is %s at point %d", v, i));
            }
            if (v < dMin) dMin = v;
            if (v > dMax) dMax = v;
        }
        double yMin = referenceY[0];
        double yMax = referenceY[0];
        for (double v : referenceY) {
            if (v < yMin) yMin = v;
            if (v > yMax) yMax = v;
        }

        double derivRange = dMax - dMin;
        double scale = Math.max(1.0, Math.max(Math.abs(yMin), Math.abs(yMax)));
        if (!(derivRange > FLAT_TOLERANCE * scale)) {
            throw new DegenerateRangeException(derivRange);
        }

        double dataRange = yMax - yMin;
        double[] out = new double[derivative.length];
        for (int i = 0; i < derivative.length; i++) {
            out[i] = (derivative[i] - dMin) / derivRange * dataRange + yMin;
        }
        return out;
    }
}
