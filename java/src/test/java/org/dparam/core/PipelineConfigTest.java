package org.dparam.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

    @Test
    void testDefaults() {
        PipelineConfig c = PipelineConfig.defaults();
        Assertions.assertEquals(7.0, c.getSmoothWidth());
        Assertions.assertEquals(2, c.getPreSmoothPasses());
        Assertions.assertEquals(1.0, c.getDiffWidth());
        Assertions.assertEquals(1, c.getPostSmoothPasses());
        Assertions.assertEquals(SmoothingAlgorithm.GAUSSIAN, c.getAlgorithm());
        c.validate();
    }

    @Test
    void testStagesShareAlgorithm() {
        PipelineConfig c = new PipelineConfig(2.5, 1, 0.8, 3, SmoothingAlgorithm.WIENER);
        Assertions.assertEquals(new SmoothingConfig(SmoothingAlgorithm.WIENER, 2.5), c.preSmoothing());
        Assertions.assertEquals(new SmoothingConfig(SmoothingAlgorithm.WIENER, 0.8), c.postSmoothing());
    }

    @Test
    void testValidation() {
        Assertions.assertThrows(InvalidParameterException.class,
            () -> new PipelineConfig(0, 1, 1, 1, SmoothingAlgorithm.GAUSSIAN).validate());
        Assertions.assertThrows(InvalidParameterException.class,
            () -> new PipelineConfig(1, 1, Double.NaN, 1, SmoothingAlgorithm.GAUSSIAN).validate());
        Assertions.assertThrows(InvalidParameterException.class,
            () -> new PipelineConfig(1, -1, 1, 1, SmoothingAlgorithm.GAUSSIAN).validate());
        Assertions.assertThrows(InvalidParameterException.class,
            () -> new PipelineConfig(1, 1, 1, -1, SmoothingAlgorithm.GAUSSIAN).validate());
        Assertions.assertThrows(UnsupportedAlgorithmException.class,
            () -> new PipelineConfig(1, 1, 1, 1, null).validate());
        new PipelineConfig(0.1, 0, 0.1, 0, SmoothingAlgorithm.NONE).validate();
    }

    @Test
    void testEquality() {
        Assertions.assertEquals(PipelineConfig.defaults(), PipelineConfig.defaults());
        Assertions.assertEquals(PipelineConfig.defaults().hashCode(), PipelineConfig.defaults().hashCode());
        Assertions.assertNotEquals(PipelineConfig.defaults(),
            new PipelineConfig(7.0, 2, 1.0, 1, SmoothingAlgorithm.WIENER));
    }
}
