package org.dparam.io;

import org.dparam.core.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Tab separated table of persisted D-parameter results, one row per
 * (source, peak) key.
 *
 * <p>Updates rewrite the file through a temporary sibling that is moved into
 * place, and leave rows of keys they are not about untouched.
 *
 * <p>Only the scalar fields of a result are kept here. The normalized derivative
 * sequence is persisted next to its curve by {@link DerivativeTableWriter}, one
 * table per source.
 */
public class ResultSummaryFile {

    public static final String SEP = "\t";
    public static final List<String> HEADER = List.of(
        "source", "peak", "position", "separation",
        "pre_passes", "post_passes", "smooth_width", "diff_width", "algorithm");

    private final Path path;

    public ResultSummaryFile(Path path) {
        this.path = path;
    }

    public Path getPath() { return path; }

    public boolean exists() {
        return Files.exists(path);
    }

    public List<Entry> read() throws IOException {
        List<Entry> entries = new ArrayList<>();
        for (String line : readRows()) {
            entries.add(Entry.parse(line));
        }
        return entries;
    }

    /**
     * Write every result held by the store. A row whose (source, peak) key is in
     * the store is replaced; all other rows, including other peaks of the same
     * source, are kept as they are. Use {@link #remove} to delete rows.
     *
     * @return number of rows written from the store
     */
    public int merge(DParameterStore store) throws IOException {
        List<String> rows = new ArrayList<>();
        for (String line : readRows()) {
            String[] key = keyOf(line);
            if (!store.contains(key[0], key[1])) {
                rows.add(line);
            }
        }

        int written = 0;
        for (CoreLevel level : store.getCoreLevels()) {
            for (Map.Entry<String, DParameterResult> peak : level.getPeaks().entrySet()) {
                rows.add(Entry.of(level.getSourceId(), peak.getKey(), peak.getValue()).toLine());
                written++;
            }
        }
        writeRows(rows);
        return written;
    }

    /**
     * Delete the rows of one source, or of one of its peaks when a label is given.
     *
     * @return number of rows removed
     */
    public int remove(String sourceId, String peakLabel) throws IOException {
        if (!exists()) return 0;

        List<String> rows = new ArrayList<>();
        int removed = 0;
        for (String line : readRows()) {
            String[] key = keyOf(line);
            boolean match = key[0].equals(sourceId) && (peakLabel == null || key[1].equals(peakLabel));
            if (match) {
                removed++;
            } else {
                rows.add(line);
            }
        }
        if (removed > 0) {
            writeRows(rows);
        }
        return removed;
    }

    private List<String> readRows() throws IOException {
        if (!exists()) return new ArrayList<>();

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        List<String> rows = new ArrayList<>();
        boolean header = true;
        for (String line : lines) {
            if (line.trim().isEmpty()) continue;
            if (header) {
                header = false;
                if (!line.startsWith(HEADER.get(0) + SEP)) {
                    throw new IOException("Not a D-parameter summary file: " + path);
                }
                continue;
            }
            rows.add(line);
        }
        return rows;
    }

    private void writeRows(List<String> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = (parent != null ? parent : Paths.get("."))
            .resolve(path.getFileName().toString() + ".tmp");

        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(String.join(SEP, HEADER));
        lines.addAll(rows);
        Files.write(tmp, lines, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String[] keyOf(String line) {
        String[] cells = line.split(SEP, -1);
        return new String[]{cells[0], cells.length > 1 ? cells[1] : ""};
    }

    /**
     * One persisted row.
     */
    public static final class Entry {
        private final String source;
        private final String peak;
        private final double position;
        private final double separation;
        private final int prePasses;
        private final int postPasses;
        private final double smoothWidth;
        private final double diffWidth;
        private final SmoothingAlgorithm algorithm;

        public Entry(String source, String peak, double position, double separation,
                     int prePasses, int postPasses, double smoothWidth, double diffWidth,
                     SmoothingAlgorithm algorithm) {
            this.source = source;
            this.peak = peak;
            this.position = position;
            this.separation = separation;
            this.prePasses = prePasses;
            this.postPasses = postPasses;
            this.smoothWidth = smoothWidth;
            this.diffWidth = diffWidth;
            this.algorithm = algorithm;
        }

        public static Entry of(String source, String peak, DParameterResult result) {
            PipelineConfig c = result.getConfig();
            return new Entry(source, peak, result.getCenter(), result.getSeparation(),
                c.getPreSmoothPasses(), c.getPostSmoothPasses(),
                c.getSmoothWidth(), c.getDiffWidth(), c.getAlgorithm());
        }

        static Entry parse(String line) throws IOException {
            String[] cells = line.split(SEP, -1);
            if (cells.length < HEADER.size()) {
                throw new IOException("Summary row has " + cells.length + " columns: " + line);
            }
            try {
                return new Entry(cells[0], cells[1],
                    Double.parseDouble(cells[2]), Double.parseDouble(cells[3]),
                    Integer.parseInt(cells[4]), Integer.parseInt(cells[5]),
                    Double.parseDouble(cells[6]), Double.parseDouble(cells[7]),
                    SmoothingAlgorithm.fromName(cells[8]));
            } catch (NumberFormatException | UnsupportedAlgorithmException e) {
                throw new IOException("Malformed summary row: " + line, e);
            }
        }

        String toLine() {
            return String.join(SEP,
                source, peak,
                String.valueOf(position), String.valueOf(separation),
                String.valueOf(prePasses), String.valueOf(postPasses),
                String.valueOf(smoothWidth), String.valueOf(diffWidth),
                algorithm.getLabel());
        }

        public String getSource() { return source; }
        public String getPeak() { return peak; }
        public double getPosition() { return position; }
        public double getSeparation() { return separation; }
        public int getPrePasses() { return prePasses; }
        public int getPostPasses() { return postPasses; }
        public double getSmoothWidth() { return smoothWidth; }
        public double getDiffWidth() { return diffWidth; }
        public SmoothingAlgorithm getAlgorithm() { return algorithm; }

        @Override
        public String toString() {
            return String.format("Entry(%s/%s, separation=%.2f)", source, peak, separation);
        }
    }
}
