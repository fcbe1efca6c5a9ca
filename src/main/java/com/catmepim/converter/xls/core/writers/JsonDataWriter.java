package com.catmepim.converter.xls.core.writers;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.config.ConverterConfig;
import com.catmepim.converter.xls.core.cell.CellValue;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Implements {@link IDataWriter} as a single JSON array with one object per row, keyed by
 * column name. Uses the Jackson streaming API.
 *
 * @invariant The output is a well-formed JSON array once close() returns.
 */
public class JsonDataWriter implements IDataWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsonDataWriter.class);
    private static final int BUFFER_SIZE = 128 * 1024;

    private final Path outputFile;
    private final ConverterConfig config;
    private final CellValueRenderer renderer;
    private List<String> columnNames = new ArrayList<>();

    private OutputStream outputStream;
    private JsonGenerator jsonGenerator;
    private long rowsWrittenCount = 0;

    /**
     * @pre outputFile != null && config has been validated
     */
    public JsonDataWriter(Path outputFile, ConverterConfig config) {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        this.outputFile = outputFile;
        this.config = config;
        this.renderer = new CellValueRenderer(config.dateFormatter());
    }

    /**
     * @post The file is created and the opening '[' written.
     */
    @Override
    public void open() throws IOException {
        if (jsonGenerator != null) {
            logger.warn("JsonDataWriter is already open. Ignoring open() call.");
            return;
        }
        OutputFiles.prepare(outputFile, config.overwrite);
        outputStream = new BufferedOutputStream(Files.newOutputStream(outputFile), BUFFER_SIZE);

        JsonFactory factory = new JsonFactory();
        factory.configure(JsonFactory.Feature.CANONICALIZE_FIELD_NAMES, false);
        jsonGenerator = factory.createGenerator(outputStream, JsonEncoding.UTF8);
        jsonGenerator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        if (config.prettyPrint) {
            jsonGenerator.useDefaultPrettyPrinter();
        }
        jsonGenerator.writeStartArray();
        logger.info("JsonDataWriter opened: {}", outputFile);
    }

    @Override
    public void writeHeader(List<String> columnNames) throws IOException {
        if (jsonGenerator == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        this.columnNames = new ArrayList<>(columnNames);
    }

    @Override
    public void writeRow(CellValue[] values) throws IOException {
        if (jsonGenerator == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        jsonGenerator.writeStartObject();
        for (int i = 0; i < values.length; i++) {
            jsonGenerator.writeFieldName(i < columnNames.size() ? columnNames.get(i) : Integer.toString(i));
            renderer.writeJson(jsonGenerator, values[i]);
        }
        jsonGenerator.writeEndObject();
        rowsWrittenCount++;
        if (rowsWrittenCount % config.batchSize == 0) {
            logger.debug("{} rows written to {}, flushing", rowsWrittenCount, outputFile);
            flush();
        }
    }

    @Override
    public void flush() throws IOException {
        if (jsonGenerator == null) {
            throw new IOException("Writer is not open. Call open() first.");
        }
        jsonGenerator.flush();
        outputStream.flush();
    }

    /**
     * @post The JSON array is closed and the file released.
     */
    @Override
    public void close() throws IOException {
        if (jsonGenerator == null) {
            return;
        }
        try {
            if (!jsonGenerator.isClosed()) {
                jsonGenerator.writeEndArray();
                jsonGenerator.close();
            }
        } finally {
            try {
                outputStream.close();
            } finally {
                jsonGenerator = null;
                outputStream = null;
                logger.info("Closed JSON file {} ({} rows)", outputFile, rowsWrittenCount);
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
