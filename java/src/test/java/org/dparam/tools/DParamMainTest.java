package org.dparam.tools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

class DParamMainTest {

    private final Logger packageLogger = Logger.getLogger("org.dparam");

    @TempDir
    Path dir;

    @AfterEach
    void resetLogging() {
        for (Handler handler : packageLogger.getHandlers()) {
            packageLogger.removeHandler(handler);
        }
        packageLogger.setLevel(null);
        packageLogger.setUseParentHandlers(true);
    }

    @Test
    void testVerboseLogsOnlyThroughOwnHandler() throws IOException {
        Path input = dir.resolve("edge.csv");
        Files.writeString(input, "x,y\n0,0\n1,0\n2,0\n3,4\n4,0\n5,1\n6,10\n7,10\n8,10\n9,10\n");

        int exit = new CommandLine(new DParamMain()).execute("-v", "info", input.toString());
        Assertions.assertEquals(0, exit);
        Assertions.assertFalse(packageLogger.getUseParentHandlers());
        Assertions.assertEquals(1, packageLogger.getHandlers().length);
        Assertions.assertTrue(packageLogger.getHandlers()[0] instanceof ConsoleHandler);
    }
}
