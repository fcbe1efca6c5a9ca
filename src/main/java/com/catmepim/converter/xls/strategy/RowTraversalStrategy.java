package com.catmepim.converter.xls.strategy;

import com.catmepim.converter.xls.exception.BiffFormatException;

/**
 * A way of walking the cell records of one worksheet.
 * <p>
 * Implementations must emit the same rows for the same sheet: positional rows from 0 up to
 * the last populated row (never past maxRow), with empty rows for gaps.
 */
public interface RowTraversalStrategy {

    /**
     * Drives {@code assembler} over the whole worksheet.
     *
     * @pre assembler != null
     * @post every row was handed to the assembler's sink, in order
     * @throws BiffFormatException on a truncated record in strict mode, or
     *         {@link com.catmepim.converter.xls.exception.MissingBlockBoundaryException} when the
     *         sheet's row blocks cannot be located
     */
    void traverse(RowAssembler assembler) throws BiffFormatException;
}
