package org.dparam.processing;

import org.dparam.core.InvalidParameterException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WienerFilterTest {

    @Test
    void testSpikeAgainstNoiseEstimate() {
        // Local variance 200/9 around the spike, mean noise 40/3
        double[] out = new WienerFilter(3).filter(new double[]{0, 0, 10, 0, 0});
        Assertions.assertArrayEquals(new double[]{0, 2, 6, 2, 0}, out, 1e-9);
    }

    @Test
    void testSingleSampleWindowIsIdentity() {
        double[] data = {1.5, -2, 8, 3.25};
        Assertions.assertArrayEquals(data, new WienerFilter(1).filter(data), 1e-12);
    }

    @Test
    void testConstantInputGivesNoNaN() {
        double[] data = {4, 4, 4, 4, 4, 4};
        double[] out = new WienerFilter(3).filter(data);
        for (double v : out) {
            Assertions.assertFalse(Double.isNaN(v));
            Assertions.assertEquals(4, v, 1e-12);
        }
    }

    @Test
    void testInvalidWindow() {
        Assertions.assertThrows(InvalidParameterException.class, () -> new WienerFilter(0));
    }
}
