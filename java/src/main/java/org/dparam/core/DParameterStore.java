package org.dparam.core;

import java.util.*;

/**
 * In-memory record of computed D-parameters, keyed by source id and peak label.
 *
 * <p>Each mutation touches exactly one (source, peak) key or one source; results
 * stored for other keys are never altered. Not synchronized.
 */
public class DParameterStore {
    public static final String DEFAULT_PEAK_LABEL = "D-parameter";

    private final Map<String, CoreLevel> coreLevels;

    public DParameterStore() {
        this.coreLevels = new LinkedHashMap<>();
    }

    public int getCoreLevelCount() { return coreLevels.size(); }
    public boolean isEmpty() { return coreLevels.isEmpty(); }

    public Set<String> sourceIds() {
        return Collections.unmodifiableSet(coreLevels.keySet());
    }

    public CoreLevel getCoreLevel(String sourceId) {
        return coreLevels.get(sourceId);
    }

    public Collection<CoreLevel> getCoreLevels() {
        return Collections.unmodifiableCollection(coreLevels.values());
    }

    /**
     * Register a source, taking its axis labels from the signal. An existing
     * core level keeps its results.
     */
    public CoreLevel register(Signal signal) {
        CoreLevel level = coreLevels.computeIfAbsent(requireSourceId(signal.getSourceId()), CoreLevel::new);
        level.setXLabel(signal.getXLabel());
        level.setYLabel(signal.getYLabel());
        return level;
    }

    /**
     * Insert or replace the result stored for (sourceId, peakLabel).
     *
     * @return the replaced result, or null if the key was empty
     */
    public DParameterResult put(String sourceId, String peakLabel, DParameterResult result) {
        Objects.requireNonNull(result, "result");
        CoreLevel level = coreLevels.computeIfAbsent(requireSourceId(sourceId), CoreLevel::new);
        return level.putPeak(requirePeakLabel(peakLabel), result);
    }

    public DParameterResult get(String sourceId, String peakLabel) {
        CoreLevel level = coreLevels.get(sourceId);
        return level == null ? null : level.getPeak(peakLabel);
    }

    public boolean contains(String sourceId, String peakLabel) {
        return get(sourceId, peakLabel) != null;
    }

    public DParameterResult remove(String sourceId, String peakLabel) {
        CoreLevel level = coreLevels.get(sourceId);
        return level == null ? null : level.removePeak(peakLabel);
    }

    /**
     * Drop every result of one source. The source itself stays registered.
     *
     * @return number of results removed
     */
    public int clear(String sourceId) {
        CoreLevel level = coreLevels.get(sourceId);
        if (level == null) return 0;
        int n = level.getPeakCount();
        level.clearPeaks();
        return n;
    }

    private static String requireSourceId(String sourceId) {
        if (sourceId == null || sourceId.isEmpty()) {
            throw new IllegalArgumentException("Source id is required");
        }
        return sourceId;
    }

    private static String requirePeakLabel(String peakLabel) {
        if (peakLabel == null || peakLabel.isEmpty()) {
            throw new IllegalArgumentException("Peak label is required");
        }
        return peakLabel;
    }

    @Override
    public String toString() {
        return String.format("DParameterStore(coreLevels=%s)", coreLevels.keySet());
    }
}
