package org.dparam.processing;

import org.dparam.core.InvalidInputException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Finds the global extrema of a curve and the x distance between them.
 */
public class ExtremaLocator {

    /** Decimal places kept in the separation. */
    public static final int SEPARATION_SCALE = 2;

    /**
     * Ties go to the lowest index. The separation is rounded half-even on the
     * exact binary value of the distance.
     */
    public Extrema locate(double[] values, double[] x) {
        if (values.length == 0) {
            throw new InvalidInputException("Cannot locate extrema of an empty sequence");
        }
        if (values.length != x.length) {
            throw new InvalidInputException(String.format(
                "Values and x must have same length (values=%d, x=%d)", values.length, x.length));
        }

        int minIndex = 0;
        int maxIndex = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[minIndex]) minIndex = i;
            if (values[i] > values[maxIndex]) maxIndex = i;
        }

        double xMin = x[minIndex];
        double xMax = x[maxIndex];
        double center = (xMax + xMin) / 2;
        double separation = round(Math.abs(xMax - xMin), SEPARATION_SCALE);
        return new Extrema(minIndex, maxIndex, center, separation);
    }

    static double round(double value, int places) {
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
