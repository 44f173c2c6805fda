package org.dparam.tools;

import org.dparam.core.Signal;
import org.dparam.io.DelimitedSignalReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Display information about a curve file.
 */
@Command(
    name = "info",
    description = "Display information about an XPS curve file"
)
public class InfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input file (CSV or TSV)")
    private File inputFile;

    @Override
    public Integer call() throws Exception {
        if (!inputFile.exists()) {
            System.err.println("Error: File not found: " + inputFile);
            return 1;
        }

        Signal signal;
        try {
            signal = new DelimitedSignalReader().read(inputFile);
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            return 1;
        }

        System.out.println("=== File Information ===");
        System.out.println("File: " + inputFile.getAbsolutePath());
        System.out.println("Source: " + signal.getSourceId());

        System.out.println();
        System.out.println("=== Data Summary ===");
        System.out.println("Points: " + signal.size());
        System.out.println("X axis: " + signal.getXLabel());
        System.out.println("Y axis: " + signal.getYLabel());
        System.out.printf("X range: %.4f - %.4f%n", signal.getXMin(), signal.getXMax());
        System.out.printf("Y range: %.4g - %.4g%n", signal.getYMin(), signal.getYMax());
        System.out.println("X order: " + ordering(signal));

        return 0;
    }

    private String ordering(Signal signal) {
        if (signal.isDescending()) return "descending";
        if (signal.isAscending()) return "ascending";
        return "unsorted";
    }
}
