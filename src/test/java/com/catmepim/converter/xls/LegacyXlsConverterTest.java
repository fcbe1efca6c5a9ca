package com.catmepim.converter.xls;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.catmepim.converter.xls.testing.SampleWorkbooks;

public class LegacyXlsConverterTest {

    @TempDir
    Path tempDir;

    @Test
    public void convertsWorkbook() throws Exception {
        Path input = tempDir.resolve("people.xls");
        Files.write(input, SampleWorkbooks.people());
        Path out = tempDir.resolve("out");

        int code = LegacyXlsConverter.run(new String[] {"-i", input.toString(), "-f", "ndjson", "-o", out.toString()});

        assertEquals(0, code);
        assertTrue(Files.exists(out.resolve("people-People.ndjson")));
        assertTrue(Files.exists(out.resolve("people-Numbers.ndjson")));
    }

    @Test
    public void helpExitsCleanly() {
        assertEquals(0, LegacyXlsConverter.run(new String[] {"--help"}));
        assertEquals(0, LegacyXlsConverter.run(new String[] {"--version"}));
    }

    @Test
    public void badArgumentsUseInvalidInputCode() {
        assertEquals(2, LegacyXlsConverter.run(new String[] {"-f", "csv"}));
        assertEquals(2, LegacyXlsConverter.run(new String[] {"-i", "x.xls", "-f", "xml"}));
    }

    @Test
    public void failuresExitWithOne() {
        Path missing = tempDir.resolve("missing.xls");
        assertEquals(1, LegacyXlsConverter.run(new String[] {"-i", missing.toString(), "-f", "csv"}));
        assertEquals(1, LegacyXlsConverter.run(new String[] {"-i", missing.toString(), "-f", "csv", "-b", "0"}));
    }
}
