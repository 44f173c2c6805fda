package org.dparam.io;

import org.dparam.core.DParameterResult;
import org.dparam.core.Signal;

import java.io.*;
import java.nio.charset.StandardCharsets;

/**
 * Writes a curve together with its normalized derivative as three columns.
 */
public class DerivativeTableWriter {

    public static final String DERIVATIVE_COLUMN = "Derivative";

    public void write(File file, Signal signal, DParameterResult result) throws IOException {
        if (result != null && result.size() != signal.size()) {
            throw new IllegalArgumentException(String.format(
                "Derivative has %d points but signal has %d", result.size(), signal.size()));
        }
        String sep = DelimitedSignalReader.separatorFor(file.getName());

        try (PrintWriter writer = new PrintWriter(new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)))) {
            if (result != null) {
                writer.println(String.join(sep, signal.getXLabel(), signal.getYLabel(), DERIVATIVE_COLUMN));
            } else {
                writer.println(String.join(sep, signal.getXLabel(), signal.getYLabel()));
            }

            for (int i = 0; i < signal.size(); i++) {
                StringBuilder row = new StringBuilder();
                row.append(signal.getXAt(i)).append(sep).append(signal.getYAt(i));
                if (result != null) {
                    row.append(sep).append(result.getNormalizedDerivativeAt(i));
                }
                writer.println(row);
            }
            if (writer.checkError()) {
                throw new IOException("Error writing " + file);
            }
        }
    }
}
