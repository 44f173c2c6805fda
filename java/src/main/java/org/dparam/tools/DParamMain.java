package org.dparam.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main entry point for the D-parameter command-line tools.
 */
@Command(
    name = "dparam",
    mixinStandardHelpOptions = true,
    version = "D-Parameter Tools 1.0.0",
    description = "D-parameter measurement of XPS core-level spectra",
    subcommands = {
        ComputeCommand.class,
        InfoCommand.class,
        ClearCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class DParamMain implements Runnable {

    private static final Logger packageLogger = Logger.getLogger("org.dparam");

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DParamMain()).execute(args);
        System.exit(exitCode);
    }

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            packageLogger.addHandler(handler);
            packageLogger.setLevel(Level.FINE);
            packageLogger.setUseParentHandlers(false);
        }
    }

    @Override
    public void run() {
        // When called without subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public boolean isVerbose() {
        return verbose;
    }
}
