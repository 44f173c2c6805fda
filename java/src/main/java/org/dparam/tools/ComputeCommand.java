package org.dparam.tools;

import org.dparam.core.*;
import org.dparam.io.DelimitedSignalReader;
import org.dparam.io.DerivativeTableWriter;
import org.dparam.io.ResultSummaryFile;
import org.dparam.processing.DParameterPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Compute the D-parameter of one or more curves.
 */
@Command(
    name = "compute",
    description = "Compute the D-parameter of XPS curves (CSV or TSV, x and y in the first two columns)"
)
public class ComputeCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Input file(s)")
    private List<File> inputFiles;

    @Option(names = {"--smooth-width"}, description = "Smooth width (default: 7.0)", defaultValue = "7.0")
    private double smoothWidth;

    @Option(names = {"--pre-passes"}, description = "Pre-smooth passes (default: 2)", defaultValue = "2")
    private int prePasses;

    @Option(names = {"--diff-width"}, description = "Differentiation width (default: 1.0)", defaultValue = "1.0")
    private double diffWidth;

    @Option(names = {"--post-passes"}, description = "Post-smooth passes (default: 1)", defaultValue = "1")
    private int postPasses;

    @Option(names = {"-a", "--algorithm"},
        description = "Smoothing algorithm: Gaussian, Savitzky-Golay, Moving Average, Wiener, None (default: Gaussian)",
        defaultValue = "Gaussian")
    private String algorithm;

    @Option(names = {"--peak-label"}, description = "Label the result is stored under (default: D-parameter)",
        defaultValue = DParameterStore.DEFAULT_PEAK_LABEL)
    private String peakLabel;

    @Option(names = {"-o", "--output-dir"}, description = "Write x, y and derivative tables into this directory")
    private File outputDir;

    @Option(names = {"--csv"}, description = "Write derivative tables as CSV instead of TSV")
    private boolean csv;

    @Option(names = {"-s", "--summary"}, description = "Merge results into this summary file (TSV)")
    private File summaryFile;

    private final DParameterStore store = new DParameterStore();

    @Override
    public Integer call() throws Exception {
        PipelineConfig config;
        try {
            config = new PipelineConfig(smoothWidth, prePasses, diffWidth, postPasses,
                SmoothingAlgorithm.fromName(algorithm));
            config.validate();
        } catch (DParameterException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (outputDir != null && !outputDir.isDirectory() && !outputDir.mkdirs()) {
            System.err.println("Error: Cannot create output directory: " + outputDir);
            return 1;
        }

        DelimitedSignalReader reader = new DelimitedSignalReader();
        DerivativeTableWriter tableWriter = new DerivativeTableWriter();
        DParameterPipeline pipeline = new DParameterPipeline();
        int failures = 0;

        System.out.println("Settings: " + config);
        for (File inputFile : inputFiles) {
            if (!inputFile.exists()) {
                System.err.println("Error: Input file not found: " + inputFile);
                failures++;
                continue;
            }

            Signal signal;
            try {
                signal = reader.read(inputFile);
            } catch (IOException e) {
                System.err.println("Error reading file: " + e.getMessage());
                failures++;
                continue;
            }
            DParameterResult result;
            try {
                result = pipeline.run(signal, config);
            } catch (DParameterException e) {
                System.err.printf("Error: %s: %s%n", signal.getSourceId(), e.getMessage());
                failures++;
                continue;
            }
            store.register(signal);
            store.put(signal.getSourceId(), peakLabel, result);

            System.out.printf("%s: D-parameter = %.2f eV (center %.3f eV, %d points)%n",
                signal.getSourceId(), result.getSeparation(), result.getCenter(), signal.size());

            if (outputDir != null) {
                File out = new File(outputDir, signal.getSourceId() + (csv ? ".csv" : ".tsv"));
                try {
                    tableWriter.write(out, signal, result);
                } catch (IOException e) {
                    System.err.println("Error writing file: " + e.getMessage());
                    failures++;
                    continue;
                }
                System.out.println("  Derivative written to: " + out);
            }
        }

        if (summaryFile != null && !store.isEmpty()) {
            int rows = new ResultSummaryFile(summaryFile.toPath()).merge(store);
            System.out.printf("Merged %d result(s) into: %s%n", rows, summaryFile);
        }

        return failures == 0 ? 0 : 1;
    }

    DParameterStore getStore() {
        return store;
    }
}
