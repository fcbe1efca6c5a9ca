package com.catmepim.converter.xls.core;

import com.catmepim.converter.xls.core.cell.CellValue;

/**
 * Receives the rows of one worksheet traversal, in increasing row order.
 */
public interface RowSink {

    /**
     * @param rowIndex zero-based row index; consecutive calls pass consecutive indexes
     * @param values one slot per column, {@code null} where the cell is empty; owned by the sink
     */
    void acceptRow(int rowIndex, CellValue[] values);
}
