package com.catmepim.converter.xls.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.RowSink;
import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.CellRecordDecoder;
import com.catmepim.converter.xls.core.biff.RecordType;
import com.catmepim.converter.xls.core.cell.CellValueDecoder;
import com.catmepim.converter.xls.core.cell.RowBuffer;
import com.catmepim.converter.xls.core.globals.WorksheetGlobals;
import com.catmepim.converter.xls.exception.BiffFormatException;

/**
 * The per-row loop shared by both traversal strategies.
 * <p>
 * Starting at the state's cell offset, reads records until the row is complete:
 * <ul>
 *   <li>DBCELL ends the row and the block; EOF or the end of the stream ends the sheet.
 *       Both are consumed.</li>
 *   <li>A cell of a later row ends the row and is left for the next call.</li>
 *   <li>A cell of an earlier row is stale and skipped.</li>
 *   <li>Cells of the current row inside [0, maxCol) are decoded; others are ignored.</li>
 * </ul>
 * A row is emitted, and depth advanced, when a later row's cell ends it or when it saw at
 * least one cell of its own. A block or sheet that ends before any cell of the current row
 * produces nothing.
 */
public class RowAssembler {

    private static final Logger logger = LoggerFactory.getLogger(RowAssembler.class);

    /** How the last assembled row ended. */
    public enum RowEnd {
        /** A cell of a later row follows. */
        NEXT_ROW,
        /** A DBCELL closed the current row block. */
        BLOCK_END,
        /** The sheet's EOF record or the end of the stream was reached. */
        SHEET_END
    }

    private final BiffRecordStream stream;
    private final WorksheetGlobals sheet;
    private final CellValueDecoder decoder;
    private final RowSink sink;
    private final RowBuffer buffer;

    public RowAssembler(BiffRecordStream stream, WorksheetGlobals sheet, CellValueDecoder decoder, RowSink sink) {
        this.stream = stream;
        this.sheet = sheet;
        this.decoder = decoder;
        this.sink = sink;
        this.buffer = new RowBuffer(sheet.getMaxCol());
    }

    public BiffRecordStream getStream() {
        return stream;
    }

    public WorksheetGlobals getSheet() {
        return sheet;
    }

    /**
     * Assembles the row at {@code state.getDepth()}.
     *
     * @post state.getNextCellOffset() points at the first record not consumed
     * @throws BiffFormatException on a truncated record in strict mode
     */
    public RowEnd assembleRow(TraversalState state) throws BiffFormatException {
        int depth = state.getDepth();
        int offset = state.getNextCellOffset();
        boolean sawCell = false;
        RowEnd end;

        buffer.reset();
        while (true) {
            BiffRecord record = stream.readAt(offset);
            if (record == null) {
                end = RowEnd.SHEET_END;
                break;
            }
            offset = record.getEndOffset();
            if (record.getType() == RecordType.DBCELL) {
                end = RowEnd.BLOCK_END;
                break;
            }
            if (record.getType() == RecordType.EOF) {
                end = RowEnd.SHEET_END;
                break;
            }
            if (!record.isCell()) {
                continue;
            }

            int row = CellRecordDecoder.rowIndex(record);
            if (row > depth) {
                offset = record.getOffset();
                end = RowEnd.NEXT_ROW;
                break;
            }
            if (row < depth) {
                logger.trace("Skipping stale cell of row {} while assembling row {}", row, depth);
                continue;
            }
            sawCell = true;
            if (CellRecordDecoder.columnIndex(record) < sheet.getMaxCol()) {
                decoder.decode(record, buffer, sheet.getHyperlinks());
            }
        }

        state.setNextCellOffset(offset);
        if (end == RowEnd.NEXT_ROW || sawCell) {
            sink.acceptRow(depth, buffer.snapshot());
            state.advanceDepth();
        }
        return end;
    }
}
