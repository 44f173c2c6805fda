package org.dparam.io;

import org.dparam.core.Signal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class DelimitedSignalReaderTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    @Test
    void testCsvWithHeaderAndMissingRows() throws IOException {
        Path file = write("C1s.csv",
            "Binding Energy (eV),Counts,Comment\n"
                + "290.0,120,a\n"
                + "289.9,,b\n"
                + "289.8,135\n"
                + "\n"
                + "289.7,n/a\n"
                + "289.6,NaN\n"
                + "289.5,160,c\n");

        Signal s = new DelimitedSignalReader().read(file.toFile());
        Assertions.assertEquals("C1s", s.getSourceId());
        Assertions.assertEquals("Binding Energy (eV)", s.getXLabel());
        Assertions.assertEquals("Counts", s.getYLabel());
        Assertions.assertArrayEquals(new double[]{290.0, 289.8, 289.5}, s.getX());
        Assertions.assertArrayEquals(new double[]{120, 135, 160}, s.getY());
        Assertions.assertTrue(s.isDescending());
    }

    @Test
    void testTabSeparatedWithQuotes() throws IOException {
        Path file = write("O1s.tsv", "\"BE\"\t\"I\"\n531.0\t1.5\n530.5\t\"2.5\"\n");
        Signal s = new DelimitedSignalReader().read(file.toString());
        Assertions.assertEquals("BE", s.getXLabel());
        Assertions.assertEquals("I", s.getYLabel());
        Assertions.assertArrayEquals(new double[]{1.5, 2.5}, s.getY());
    }

    @Test
    void testTooFewPoints() throws IOException {
        Path file = write("few.csv", "x,y\n1,2\n3,\n");
        IOException e = Assertions.assertThrows(IOException.class,
            () -> new DelimitedSignalReader().read(file.toFile()));
        Assertions.assertTrue(e.getMessage().contains("at least 2"));
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = write("empty.csv", "\n\n");
        Assertions.assertThrows(IOException.class, () -> new DelimitedSignalReader().read(file.toFile()));
    }

    @Test
    void testSourceId() {
        Assertions.assertEquals("Cu2p", DelimitedSignalReader.sourceIdOf("Cu2p.csv"));
        Assertions.assertEquals("run.1", DelimitedSignalReader.sourceIdOf("run.1.tsv"));
        Assertions.assertEquals("noext", DelimitedSignalReader.sourceIdOf("noext"));
    }
}
