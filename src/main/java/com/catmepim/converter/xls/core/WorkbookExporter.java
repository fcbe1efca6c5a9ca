package com.catmepim.converter.xls.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.config.ConverterConfig;
import com.catmepim.converter.xls.core.globals.Worksheet;
import com.catmepim.converter.xls.core.writers.CsvDataWriter;
import com.catmepim.converter.xls.core.writers.IDataWriter;
import com.catmepim.converter.xls.core.writers.JsonDataWriter;
import com.catmepim.converter.xls.core.writers.NdjsonDataWriter;
import com.catmepim.converter.xls.exception.ConversionException;

/**
 * Reads a workbook with {@link LegacyXlsReader} and writes each selected worksheet table to
 * its own output file in the configured format.
 *
 * @invariant The ConverterConfig instance is not modified.
 * @invariant Every opened writer is closed, on success and on failure.
 */
public class WorkbookExporter {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookExporter.class);

    private final ConverterConfig config;

    /**
     * @pre config != null and has been validated
     */
    public WorkbookExporter(ConverterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
    }

    /**
     * @return the files written, one per exported worksheet
     * @throws ConversionException if the input cannot be read, the workbook is unreadable, the
     *         requested sheet does not exist, or an output file cannot be written
     */
    public List<Path> export() {
        logger.info("Exporting {} as {} (read mode {})", config.inputFile, config.format, config.readMode);
        try (LegacyXlsReader reader = new LegacyXlsReader(config.readMode)) {
            try {
                reader.open(Files.newInputStream(config.inputFile));
            } catch (IOException e) {
                throw new ConversionException("Cannot open input file " + config.inputFile + ": " + e.getMessage(), e);
            }

            List<SheetTable> tables = reader.produceAll();
            if (!reader.isValid()) {
                throw new ConversionException("Failed to read workbook " + config.inputFile + ": "
                        + reader.getFailure().getMessage(), reader.getFailure());
            }

            List<SheetTable> selected = selectTables(tables, reader.getWorksheets());
            List<Path> outputFiles = planOutputFiles(selected);
            if (!config.overwrite) {
                for (Path outputFile : outputFiles) {
                    if (Files.exists(outputFile)) {
                        throw new ConversionException("Output file " + outputFile
                                + " already exists; use --overwrite to replace it");
                    }
                }
            }

            List<Path> written = new ArrayList<>();
            long totalRows = 0;
            for (int i = 0; i < selected.size(); i++) {
                totalRows += writeTable(selected.get(i), outputFiles.get(i));
                written.add(outputFiles.get(i));
            }
            logger.info("Wrote {} file(s), {} row(s) in total", written.size(), totalRows);
            return written;
        }
    }

    /**
     * Assigns every table its own output file. When a sheet name maps to a file already taken
     * by an earlier sheet of this export, the sheet index is appended to the name.
     */
    List<Path> planOutputFiles(List<SheetTable> tables) {
        List<Path> files = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (SheetTable table : tables) {
            Path file = config.resolveOutputFile(table.getName());
            String firstChoice = file.getFileName().toString();
            int attempt = 0;
            while (!taken.add(file.getFileName().toString().toLowerCase(Locale.ROOT))) {
                attempt++;
                String variant = table.getName() + "-" + table.getSheetIndex() + (attempt > 1 ? "-" + attempt : "");
                file = config.resolveOutputFile(variant);
            }
            if (attempt > 0) {
                logger.warn("Sheet '{}' maps to {} like an earlier sheet, writing it to {} instead",
                        table.getName(), firstChoice, file.getFileName());
            }
            files.add(file);
        }
        return files;
    }

    List<SheetTable> selectTables(List<SheetTable> tables, List<Worksheet> worksheets) {
        Integer wantedIndex = config.sheetIndex;
        if (wantedIndex == null && config.sheetName != null) {
            for (Worksheet sheet : worksheets) {
                if (sheet.getName().equalsIgnoreCase(config.sheetName.trim())) {
                    wantedIndex = sheet.getIndex();
                    break;
                }
            }
            if (wantedIndex == null) {
                throw new ConversionException("No worksheet named '" + config.sheetName + "' in " + config.inputFile);
            }
        }
        if (wantedIndex == null) {
            return tables;
        }
        if (wantedIndex >= worksheets.size()) {
            throw new ConversionException("Sheet index " + wantedIndex + " is out of range: workbook has "
                    + worksheets.size() + " worksheet(s)");
        }

        List<SheetTable> selected = new ArrayList<>();
        for (SheetTable table : tables) {
            if (table.getSheetIndex() == wantedIndex) {
                selected.add(table);
            }
        }
        if (selected.isEmpty()) {
            logger.warn("Worksheet {} ('{}') has no rows, nothing to export", wantedIndex, worksheets.get(wantedIndex).getName());
        }
        return selected;
    }

    private long writeTable(SheetTable table, Path outputFile) {
        try (IDataWriter writer = createWriter(outputFile)) {
            writer.open();
            writer.writeHeader(table.getColumnNames());
            for (int i = 0; i < table.getRowCount(); i++) {
                writer.writeRow(table.getRows().get(i));
            }
            logger.info("Sheet '{}' -> {} ({} rows)", table.getName(), outputFile, writer.getRowsWrittenCount());
            return writer.getRowsWrittenCount();
        } catch (IOException e) {
            throw new ConversionException("Failed to write sheet '" + table.getName() + "' to " + outputFile
                    + ": " + e.getMessage(), e);
        }
    }

    IDataWriter createWriter(Path outputFile) {
        switch (config.format) {
            case CSV:
                return new CsvDataWriter(outputFile, config);
            case JSON:
                return new JsonDataWriter(outputFile, config);
            case NDJSON:
                return new NdjsonDataWriter(outputFile, config);
            default:
                throw new IllegalArgumentException("Unsupported output format: " + config.format);
        }
    }
}
