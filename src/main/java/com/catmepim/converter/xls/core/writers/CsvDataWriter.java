package com.catmepim.converter.xls.core.writers;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.config.ConverterConfig;
import com.catmepim.converter.xls.core.cell.CellValue;

/**
 * Implements {@link IDataWriter} for CSV. The first record holds the column names; empty
 * cells are written as empty fields. Hyperlink targets are not part of the CSV output.
 *
 * @invariant If open, csvPrinter is not null.
 */
public class CsvDataWriter implements IDataWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvDataWriter.class);

    private final Path outputFile;
    private final ConverterConfig config;
    private final CellValueRenderer renderer;

    private CSVPrinter csvPrinter;
    private long rowsWrittenCount = 0;

    /**
     * @pre outputFile != null && config has been validated
     */
    public CsvDataWriter(Path outputFile, ConverterConfig config) {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        this.outputFile = outputFile;
        this.config = config;
        this.renderer = new CellValueRenderer(config.dateFormatter());
    }

    @Override
    public void open() throws IOException {
        if (csvPrinter != null) {
            logger.warn("CsvDataWriter is already open. Ignoring open() call.");
            return;
        }
        OutputFiles.prepare(outputFile, config.overwrite);
        BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT);
        logger.info("CsvDataWriter opened: {}", outputFile);
    }

    @Override
    public void writeHeader(List<String> columnNames) throws IOException {
        if (csvPrinter == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        csvPrinter.printRecord(columnNames);
    }

    @Override
    public void writeRow(CellValue[] values) throws IOException {
        if (csvPrinter == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        List<String> record = new ArrayList<>(values.length);
        for (CellValue value : values) {
            record.add(renderer.asText(value));
        }
        csvPrinter.printRecord(record);
        rowsWrittenCount++;
        if (rowsWrittenCount % config.batchSize == 0) {
            logger.debug("{} rows written to {}, flushing", rowsWrittenCount, outputFile);
            flush();
        }
    }

    @Override
    public void flush() throws IOException {
        if (csvPrinter == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        csvPrinter.flush();
    }

    @Override
    public void close() throws IOException {
        if (csvPrinter == null) {
            return;
        }
        try {
            csvPrinter.close(true);
        } finally {
            csvPrinter = null;
            logger.info("Closed CSV file {} ({} rows)", outputFile, rowsWrittenCount);
        }
    }

    @Override
    public long getRowsWrittenCount() {
        return rowsWrittenCount;
    }

    @Override
    public Path getOutputFile() {
        return outputFile;
    }
}
