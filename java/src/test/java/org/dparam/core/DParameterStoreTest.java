package org.dparam.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DParameterStoreTest {

    private static DParameterResult result(double separation) {
        return new DParameterResult(new double[]{0, 1}, 0, 1, 1.5, separation, PipelineConfig.defaults());
    }

    @Test
    void testPutAndReplace() {
        DParameterStore store = new DParameterStore();
        Assertions.assertNull(store.put("C1s", DParameterStore.DEFAULT_PEAK_LABEL, result(13.1)));
        DParameterResult old = store.put("C1s", DParameterStore.DEFAULT_PEAK_LABEL, result(14.2));

        Assertions.assertEquals(13.1, old.getSeparation());
        Assertions.assertEquals(14.2, store.get("C1s", DParameterStore.DEFAULT_PEAK_LABEL).getSeparation());
        Assertions.assertEquals(1, store.getCoreLevel("C1s").getPeakCount());
    }

    @Test
    void testClearTouchesOneSourceOnly() {
        DParameterStore store = new DParameterStore();
        store.put("C1s", "D-parameter", result(13.1));
        store.put("C1s", "D-parameter (2)", result(12.0));
        store.put("O1s", "D-parameter", result(2.5));

        Assertions.assertEquals(2, store.clear("C1s"));
        Assertions.assertTrue(store.sourceIds().contains("C1s"));
        Assertions.assertFalse(store.getCoreLevel("C1s").hasPeaks());
        Assertions.assertEquals(2.5, store.get("O1s", "D-parameter").getSeparation());
        Assertions.assertEquals(0, store.clear("missing"));
    }

    @Test
    void testRemove() {
        DParameterStore store = new DParameterStore();
        store.put("C1s", "a", result(1));
        store.put("C1s", "b", result(2));

        Assertions.assertNotNull(store.remove("C1s", "a"));
        Assertions.assertNull(store.remove("C1s", "a"));
        Assertions.assertNull(store.remove("N1s", "a"));
        Assertions.assertFalse(store.contains("C1s", "a"));
        Assertions.assertTrue(store.contains("C1s", "b"));
    }

    @Test
    void testRegisterKeepsResults() {
        DParameterStore store = new DParameterStore();
        store.put("C KLL", "D-parameter", result(13.4));
        Signal signal = new Signal("C KLL", "Kinetic Energy", "Intensity", new double[]{0, 1}, new double[]{0, 1});

        CoreLevel level = store.register(signal);
        Assertions.assertEquals("Kinetic Energy", level.getXLabel());
        Assertions.assertEquals("Intensity", level.getYLabel());
        Assertions.assertTrue(store.contains("C KLL", "D-parameter"));
    }

    @Test
    void testKeysAreRequired() {
        DParameterStore store = new DParameterStore();
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.put("", "a", result(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.put("C1s", null, result(1)));
        Assertions.assertThrows(NullPointerException.class, () -> store.put("C1s", "a", null));
    }
}
