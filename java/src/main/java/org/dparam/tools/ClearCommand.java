package org.dparam.tools;

import org.dparam.io.ResultSummaryFile;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Remove persisted D-parameter results of one source.
 */
@Command(
    name = "clear",
    description = "Remove stored D-parameter results of a source from a summary file"
)
public class ClearCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Summary file")
    private File summaryFile;

    @Parameters(index = "1", description = "Source id (input file name without extension)")
    private String sourceId;

    @Option(names = {"--peak-label"}, description = "Only remove this peak (default: all peaks of the source)")
    private String peakLabel;

    @Override
    public Integer call() throws Exception {
        if (!summaryFile.exists()) {
            System.err.println("Error: Summary file not found: " + summaryFile);
            return 1;
        }

        int removed;
        try {
            removed = new ResultSummaryFile(summaryFile.toPath()).remove(sourceId, peakLabel);
        } catch (IOException e) {
            System.err.println("Error updating summary: " + e.getMessage());
            return 1;
        }

        System.out.printf("Removed %d result(s) of %s%n", removed, sourceId);
        return 0;
    }
}
