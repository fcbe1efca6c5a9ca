package com.catmepim.converter.xls.core.writers;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.config.ConverterConfig;
import com.catmepim.converter.xls.core.cell.CellValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Implements IDataWriter for NDJSON (newline delimited JSON): one JSON object per row,
 * one row per line. Pretty printing does not apply.
 */
public class NdjsonDataWriter implements IDataWriter {
    private static final Logger LOG = LoggerFactory.getLogger(NdjsonDataWriter.class);

    private final Path outputFile;
    private final ConverterConfig config;
    private final CellValueRenderer renderer;
    private final JsonFactory jsonFactory = new JsonFactory();
    private List<String> columnNames = new ArrayList<>();

    private BufferedWriter writer;
    private JsonGenerator jsonGenerator;
    private long rowsWrittenCount;

    /**
     * @pre {@code outputFile != null}
     * @pre {@code config} has been validated
     */
    public NdjsonDataWriter(Path outputFile, ConverterConfig config) {
        if (outputFile == null) {
            throw new IllegalArgumentException("Output file cannot be null for NDJSON writer.");
        }
        this.outputFile = outputFile;
        this.config = config;
        this.renderer = new CellValueRenderer(config.dateFormatter());
        this.jsonFactory.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.jsonFactory.configure(JsonGenerator.Feature.FLUSH_PASSED_TO_STREAM, false);
    }

    @Override
    public void open() throws IOException {
        if (writer != null) {
            LOG.warn("NdjsonDataWriter is already open. Ignoring open() call.");
            return;
        }
        OutputFiles.prepare(outputFile, config.overwrite);
        writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8);
        jsonGenerator = jsonFactory.createGenerator(writer);
        jsonGenerator.setRootValueSeparator(null);
        LOG.info("NdjsonDataWriter opened: {}", outputFile);
    }

    @Override
    public void writeHeader(List<String> columnNames) throws IOException {
        if (writer == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        this.columnNames = new ArrayList<>(columnNames);
    }

    @Override
    public void writeRow(CellValue[] values) throws IOException {
        if (writer == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        jsonGenerator.writeStartObject();
        for (int i = 0; i < values.length; i++) {
            jsonGenerator.writeFieldName(i < columnNames.size() ? columnNames.get(i) : Integer.toString(i));
            renderer.writeJson(jsonGenerator, values[i]);
        }
        jsonGenerator.writeEndObject();
        jsonGenerator.flush();
        writer.newLine();
        rowsWrittenCount++;
        if (rowsWrittenCount % config.batchSize == 0) {
            LOG.debug("{} rows written to {}, flushing", rowsWrittenCount, outputFile);
            writer.flush();
        }
    }

    @Override
    public void flush() throws IOException {
        if (writer == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        jsonGenerator.flush();
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        if (writer == null) {
            return;
        }
        try {
            jsonGenerator.close();
        } finally {
            try {
                writer.close();
            } finally {
                jsonGenerator = null;
                writer = null;
                LOG.info("Closed NDJSON file {} ({} rows)", outputFile, rowsWrittenCount);
            }
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
