package com.catmepim.converter.xls.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.RecordType;
import com.catmepim.converter.xls.core.biff.SheetRecordDecoder;
import com.catmepim.converter.xls.core.globals.WorksheetGlobals;
import com.catmepim.converter.xls.exception.BiffFormatException;
import com.catmepim.converter.xls.exception.MissingBlockBoundaryException;

/**
 * Walks a worksheet block by block using the DBCELL addresses of its INDEX record.
 * <p>
 * Each DBCELL points back to the ROW records of its block; the block's cells start right
 * after the last of them. The declared row count is authoritative: traversal stops once
 * depth reaches maxRow, even if blocks remain, and ends early if the blocks run out first.
 *
 * @pre sheet.hasIndex()
 */
public class IndexedTraversalStrategy implements RowTraversalStrategy {

    private static final Logger logger = LoggerFactory.getLogger(IndexedTraversalStrategy.class);

    /** Returned by {@link #locateFirstCell} when the block has no ROW records. */
    static final int NO_MORE_DATA = -1;

    @Override
    public void traverse(RowAssembler assembler) throws BiffFormatException {
        WorksheetGlobals sheet = assembler.getSheet();
        BiffRecordStream stream = assembler.getStream();
        TraversalState state = TraversalState.indexed(sheet.getIndex().getBlockAddresses());
        int maxRow = sheet.getMaxRow();

        while (state.getDepth() < maxRow && state.hasNextBlock()) {
            int address = state.nextBlockAddress();
            int cellOffset = locateFirstCell(stream, address);
            if (cellOffset == NO_MORE_DATA) {
                logger.debug("Block {} at {} has no ROW records, end of sheet data", state.getBlockCursor() - 1, address);
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
        logger.debug("Indexed traversal of '{}' finished at depth {} after {} of {} block(s)",
                sheet.getWorksheet().getName(), state.getDepth(), state.getBlockCursor(),
                sheet.getIndex().getBlockCount());
    }

    /**
     * Finds where the cells of the block addressed by {@code address} begin.
     *
     * @return offset of the first record after the block's ROW records, or
     *         {@link #NO_MORE_DATA} if the DBCELL points at no ROW record
     * @throws MissingBlockBoundaryException if no DBCELL is found before the sheet's EOF
     */
    static int locateFirstCell(BiffRecordStream stream, int address) throws BiffFormatException {
        int offset = address;
        BiffRecord dbCell;
        while (true) {
            dbCell = stream.readAt(offset);
            if (dbCell == null || dbCell.getType() == RecordType.EOF) {
                throw new MissingBlockBoundaryException(address);
            }
            if (dbCell.getType() == RecordType.DBCELL) {
                break;
            }
            offset = dbCell.getEndOffset();
        }

        int position = dbCell.getOffset() - SheetRecordDecoder.dbCellRowOffset(dbCell);
        boolean foundRow = false;
        BiffRecord row;
        while ((row = stream.readAt(position)) != null && row.getType() == RecordType.ROW) {
            position = row.getEndOffset();
            foundRow = true;
        }
        return foundRow ? position : NO_MORE_DATA;
    }
}
