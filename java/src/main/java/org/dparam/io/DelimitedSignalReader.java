package org.dparam.io;

import org.dparam.core.Signal;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

/**
 * Reader for two-column curves stored as delimited text.
 *
 * <p>The first non-blank line is a header naming the x and y axes. Only the first
 * two columns are used; rows where either of them is missing or not a number are
 * skipped. Files ending in {@code .csv} are comma separated, anything else is
 * tab separated.
 */
public class DelimitedSignalReader {
    private static final Logger logger = Logger.getLogger(DelimitedSignalReader.class.getName());

    public static final int MIN_POINTS = 2;

    public Signal read(String filename) throws IOException {
        return read(new File(filename));
    }

    public Signal read(File file) throws IOException {
        String sep = separatorFor(file.getName());
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8))) {
            return read(reader, sourceIdOf(file.getName()), sep);
        }
    }

    public Signal read(BufferedReader reader, String sourceId, String sep) throws IOException {
        String header = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.trim().isEmpty()) {
                header = line;
                break;
            }
        }
        if (header == null) {
            throw new IOException("No header row found in " + sourceId);
        }

        String[] labels = header.split(sep, -1);
        if (labels.length < 2) {
            throw new IOException("Header of " + sourceId + " must name at least 2 columns");
        }
        String xLabel = unquote(labels[0]);
        String yLabel = unquote(labels[1]);

        List<double[]> points = new ArrayList<>();
        int skipped = 0;
        while ((line = reader.readLine()) != null) {
            if (line.trim().isEmpty()) continue;

            String[] cells = line.split(sep, -1);
            if (cells.length < 2) {
                skipped++;
                continue;
            }
            Double x = parse(cells[0]);
            Double y = parse(cells[1]);
            if (x == null || y == null) {
                skipped++;
                continue;
            }
            points.add(new double[]{x, y});
        }

        if (skipped > 0) {
            logger.warning(String.format("%s: skipped %d row(s) with missing values", sourceId, skipped));
        }
        if (points.size() < MIN_POINTS) {
            throw new IOException(String.format(
                "%s must contain at least %d data points in the first two columns, found %d",
                sourceId, MIN_POINTS, points.size()));
        }

        double[] x = new double[points.size()];
        double[] y = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            x[i] = points.get(i)[0];
            y[i] = points.get(i)[1];
        }
        return new Signal(sourceId, xLabel, yLabel, x, y);
    }

    static String separatorFor(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(".csv") ? "," : "\t";
    }

    /**
     * File name without its extension.
     */
    public static String sourceIdOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static Double parse(String cell) {
        String s = unquote(cell);
        if (s.isEmpty()) return null;
        try {
            double v = Double.parseDouble(s);
            return Double.isNaN(v) ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String unquote(String cell) {
        String s = cell.trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }
}
