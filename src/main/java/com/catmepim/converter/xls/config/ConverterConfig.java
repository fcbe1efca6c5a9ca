package com.catmepim.converter.xls.config;

import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.catmepim.converter.xls.core.biff.ReadMode;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command definition and configuration holder for the {@code LegacyXlsConverter}.
 * Fields are populated by picocli and must not change after {@link #validate()}.
 *
 * @invariant inputFile != null && format != null && batchSize > 0 after validation
 */
@Command(name = "legacy-xls-converter",
         mixinStandardHelpOptions = true,
         version = "Legacy XLS Converter 1.0.0",
         description = "Extracts worksheet tables from legacy .xls (BIFF5/BIFF8) workbooks into CSV, JSON or NDJSON files.")
public class ConverterConfig {

    @Option(names = {"-i", "--input"}, required = true, description = "Path to the input .xls file.")
    public Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Output directory. One file per worksheet is written here. Default: data/out")
    public Path outputDir = Path.of("data", "out");

    @Option(names = {"-f", "--format"}, required = true, description = "Target output format: ${COMPLETION-CANDIDATES}")
    public OutputFormat format;

    @Option(names = {"--read-mode"}, description = "STRICT fails on truncated records, LOOSE truncates and continues: ${COMPLETION-CANDIDATES}. Default: STRICT")
    public ReadMode readMode = ReadMode.STRICT;

    @Option(names = {"-s", "--sheetName"}, description = "Only export the worksheet with this name (case-insensitive).")
    public String sheetName = null;

    @Option(names = {"--sheet-index"}, description = "Only export the worksheet at this 0-based position. Overrides --sheetName.")
    public Integer sheetIndex = null;

    @Option(names = {"--date-format"}, description = "java.time pattern for date cells (e.g. yyyy-MM-dd HH:mm:ss). Default: ISO-8601.")
    public String dateFormat = null;

    @Option(names = {"--pretty-print"}, description = "Pretty print JSON output.")
    public boolean prettyPrint = false;

    @Option(names = {"--overwrite"}, description = "Overwrite output files if they already exist.")
    public boolean overwrite = false;

    @Option(names = {"-b", "--batchSize"}, description = "Number of rows written between flushes. Default: 50000")
    public int batchSize = 50000;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose (DEBUG) logging.")
    public boolean verbose = false;

    public ConverterConfig() {
    }

    /**
     * Checks the values picocli cannot check on its own.
     *
     * @throws IllegalArgumentException if a value is out of range or malformed
     * @pre All required options are set.
     * @post Configuration is valid; fields are not mutated afterwards.
     */
    public void validate() {
        if (inputFile == null) {
            throw new IllegalArgumentException("Input file (--input) is required");
        }
        if (format == null) {
            throw new IllegalArgumentException("Output format (--format) is required");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("Output directory (--output) must not be empty");
        }
        if (readMode == null) {
            throw new IllegalArgumentException("Read mode must be STRICT or LOOSE");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        if (sheetIndex != null && sheetIndex < 0) {
            throw new IllegalArgumentException("Sheet index cannot be negative: " + sheetIndex);
        }
        if (sheetName != null && sheetName.trim().isEmpty()) {
            throw new IllegalArgumentException("Sheet name cannot be blank");
        }
        if (dateFormat != null) {
            dateFormatter();
        }
    }

    /**
     * @return the formatter for date cells
     * @throws IllegalArgumentException if {@link #dateFormat} is not a valid pattern
     */
    public DateTimeFormatter dateFormatter() {
        if (dateFormat == null) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME;
        }
        try {
            return DateTimeFormatter.ofPattern(dateFormat, Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid date format '" + dateFormat + "': " + e.getMessage(), e);
        }
    }

    /**
     * Output file for one worksheet: {@code <input base name>-<sheet name>.<ext>} inside
     * {@link #outputDir}. Characters that are unsafe in file names are replaced by '_'.
     */
    public Path resolveOutputFile(String worksheetName) {
        String fileName = inputFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputDir.resolve(baseName + "-" + sanitize(worksheetName) + "." + format.getExtension());
    }

    static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return "sheet";
        }
        String cleaned = name.replaceAll("[^\\p{L}\\p{N}._-]+", "_");
        return cleaned.isEmpty() ? "sheet" : cleaned;
    }

    public enum OutputFormat {
        CSV("csv"),
        NDJSON("ndjson"),
        JSON("json");

        private final String extension;

        OutputFormat(String extension) {
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }
}
