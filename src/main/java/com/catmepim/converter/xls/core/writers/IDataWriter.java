package com.catmepim.converter.xls.core.writers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.catmepim.converter.xls.core.cell.CellValue;

/**
 * Writes one worksheet table to an output format. Implementations exist for CSV, JSON and
 * NDJSON.
 *
 * @invariant getRowsWrittenCount() equals the number of successful writeRow() calls.
 */
public interface IDataWriter extends AutoCloseable {

    /**
     * Creates the output file.
     *
     * @throws IOException if the file exists and overwriting is not allowed, or cannot be created
     * @post The writer accepts writeHeader() and writeRow().
     */
    void open() throws IOException;

    /**
     * @param columnNames names of the table columns, in column order
     * @pre The writer is open.
     */
    void writeHeader(List<String> columnNames) throws IOException;

    /**
     * @param values one slot per column; {@code null} marks an empty cell
     * @pre The writer is open and the header was written.
     */
    void writeRow(CellValue[] values) throws IOException;

    void flush() throws IOException;

    /**
     * Finishes the document and releases the file. Safe to call on a writer that was never
     * opened.
     */
    @Override
    void close() throws IOException;

    long getRowsWrittenCount();

    Path getOutputFile();
}
