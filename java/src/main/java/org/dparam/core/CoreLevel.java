package org.dparam.core;

import java.util.*;

/**
 * Results recorded for one core level (one data source), keyed by peak label.
 */
public class CoreLevel {
    private final String sourceId;
    private String xLabel;
    private String yLabel;
    private final Map<String, DParameterResult> peaks;

    public CoreLevel(String sourceId) {
        this.sourceId = sourceId;
        this.xLabel = Signal.DEFAULT_X_LABEL;
        this.yLabel = Signal.DEFAULT_Y_LABEL;
        this.peaks = new LinkedHashMap<>();
    }

    public String getSourceId() { return sourceId; }

    public String getXLabel() { return xLabel; }
    public void setXLabel(String xLabel) { this.xLabel = xLabel; }

    public String getYLabel() { return yLabel; }
    public void setYLabel(String yLabel) { this.yLabel = yLabel; }

    public int getPeakCount() { return peaks.size(); }
    public boolean hasPeaks() { return !peaks.isEmpty(); }

    public DParameterResult getPeak(String label) { return peaks.get(label); }
    public Set<String> getPeakLabels() { return Collections.unmodifiableSet(peaks.keySet()); }
    public Map<String, DParameterResult> getPeaks() { return Collections.unmodifiableMap(peaks); }

    /**
     * Store a result under the label, replacing any earlier one.
     *
     * @return the replaced result, or null
     */
    DParameterResult putPeak(String label, DParameterResult result) {
        return peaks.put(label, result);
    }

    DParameterResult removePeak(String label) {
        return peaks.remove(label);
    }

    void clearPeaks() {
        peaks.clear();
    }

    @Override
    public String toString() {
        return String.format("CoreLevel(%s, peaks=%s)", sourceId, peaks.keySet());
    }
}
