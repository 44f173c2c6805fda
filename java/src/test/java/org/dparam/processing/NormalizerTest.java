package org.dparam.processing;

import org.dparam.core.DegenerateRangeException;
import org.dparam.core.InvalidInputException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    void testMapsOntoReferenceRange() {
        double[] derivative = {-2, 0, 2, 6};
        double[] y = {100, 300, 140, 180};
        double[] out = normalizer.normalize(derivative, y);
        Assertions.assertArrayEquals(new double[]{100, 150, 200, 300}, out, 1e-9);
    }

    @Test
    void testExtremaMatchReference() {
        double[] derivative = {0.3, -1.7, 4.2, 0.01, -0.5, 2.2};
        double[] y = {12.5, 3.1, 9.9, 44.0, -6.5, 0.0};
        double[] out = normalizer.normalize(derivative, y);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : out) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        Assertions.assertEquals(-6.5, min, 1e-12);
        Assertions.assertEquals(44.0, max, 1e-12);
    }

    @Test
    void testFlatDerivativeIsRejected() {
        Assertions.assertThrows(DegenerateRangeException.class,
            () -> normalizer.normalize(new double[]{0, 0, 0}, new double[]{1, 2, 3}));
        Assertions.assertThrows(DegenerateRangeException.class,
            () -> normalizer.normalize(new double[]{3.5, 3.5}, new double[]{1, 2}));
    }

    @Test
    void testRoundingResidueCountsAsFlat() {
        double[] derivative = {1e-15, -2e-15, 0, 3e-15};
        double[] y = {1000, 1000, 1000, 1000};
        DegenerateRangeException e = Assertions.assertThrows(DegenerateRangeException.class,
            () -> normalizer.normalize(derivative, y));
        Assertions.assertEquals(5e-15, e.getRange(), 1e-20);
    }

    @Test
    void testSmallButRealDerivativeIsKept() {
        double[] out = normalizer.normalize(new double[]{0, 1e-6, 2e-6}, new double[]{0, 5, 10});
        Assertions.assertArrayEquals(new double[]{0, 5, 10}, out, 1e-9);
    }

    @Test
    void testNonFiniteDerivativeIsRejected() {
        double[] y = {1, 2, 3};
        Assertions.assertThrows(InvalidInputException.class,
            () -> normalizer.normalize(new double[]{0, Double.NaN, 1}, y));
        Assertions.assertThrows(InvalidInputException.class,
            () -> normalizer.normalize(new double[]{0, 1, Double.NEGATIVE_INFINITY}, y));
    }
}
