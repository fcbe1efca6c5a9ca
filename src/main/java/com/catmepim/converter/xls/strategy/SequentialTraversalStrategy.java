package com.catmepim.converter.xls.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.CellRecordDecoder;
import com.catmepim.converter.xls.core.biff.RecordType;
import com.catmepim.converter.xls.core.biff.RowInfo;
import com.catmepim.converter.xls.core.biff.SheetRecordDecoder;
import com.catmepim.converter.xls.core.globals.WorksheetGlobals;
import com.catmepim.converter.xls.exception.BiffFormatException;

/**
 * Walks a worksheet without an INDEX by scanning forward through ROW and cell records.
 * <p>
 * For each stretch of rows: find the ROW record of the row at or after the current depth,
 * then the first cell at or after that row, and assemble rows from there until a block or
 * the sheet ends. Rows skipped over come out empty, as they do in indexed traversal.
 */
public class SequentialTraversalStrategy implements RowTraversalStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SequentialTraversalStrategy.class);

    @Override
    public void traverse(RowAssembler assembler) throws BiffFormatException {
        WorksheetGlobals sheet = assembler.getSheet();
        BiffRecordStream stream = assembler.getStream();
        TraversalState state = TraversalState.sequential(sheet.getFirstRow());
        int maxRow = sheet.getMaxRow();

        while (state.getDepth() < maxRow) {
            RowInfo row = findRow(stream, state.getCurrentRow(), state.getDepth());
            if (row == null) {
                break;
            }
            state.setCurrentRow(row);

            int cellOffset = findFirstCell(stream, row.getEndOffset(), row.getRowIndex());
            if (cellOffset < 0) {
                break;
            }
            state.setNextCellOffset(cellOffset);

            RowAssembler.RowEnd end;
            do {
                end = assembler.assembleRow(state);
            } while (end == RowAssembler.RowEnd.NEXT_ROW && state.getDepth() < maxRow);

            if (end == RowAssembler.RowEnd.SHEET_END) {
                break;
            }
        }
        logger.debug("Sequential traversal of '{}' finished at depth {}", sheet.getWorksheet().getName(), state.getDepth());
    }

    /**
     * @return {@code current} if it is at or past {@code depth}, else the next ROW record that
     *         is, or {@code null} when the sheet ends first
     */
    private static RowInfo findRow(BiffRecordStream stream, RowInfo current, int depth) throws BiffFormatException {
        if (current.getRowIndex() >= depth) {
            return current;
        }
        int offset = current.getEndOffset();
        BiffRecord record;
        while ((record = stream.readAt(offset)) != null && record.getType() != RecordType.EOF) {
            if (record.getType() == RecordType.ROW) {
                RowInfo row = SheetRecordDecoder.row(record);
                if (row.getRowIndex() >= depth) {
                    return row;
                }
            }
            offset = record.getEndOffset();
        }
        return null;
    }

    /**
     * @return offset of the first cell record at or after {@code rowIndex}, or -1 when the
     *         sheet ends first
     */
    private static int findFirstCell(BiffRecordStream stream, int from, int rowIndex) throws BiffFormatException {
        int offset = from;
        BiffRecord record;
        while ((record = stream.readAt(offset)) != null && record.getType() != RecordType.EOF) {
            if (record.isCell() && CellRecordDecoder.rowIndex(record) >= rowIndex) {
                return offset;
            }
            offset = record.getEndOffset();
        }
        return -1;
    }
}
