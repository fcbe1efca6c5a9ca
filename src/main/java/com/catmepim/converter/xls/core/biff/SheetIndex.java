package com.catmepim.converter.xls.core.biff;

import java.util.Arrays;

/**
 * Decoded INDEX record: the used row range and the stream offsets of the sheet's DBCELL records,
 * one per block of rows.
 */
public final class SheetIndex {

    private final int firstRow;
    private final int lastRow;
    private final int[] blockAddresses;

    /**
     * @param firstRow first row containing a cell
     * @param lastRow one past the last row containing a cell
     * @param blockAddresses DBCELL offsets in stream order
     */
    public SheetIndex(int firstRow, int lastRow, int[] blockAddresses) {
        this.firstRow = firstRow;
        this.lastRow = lastRow;
        this.blockAddresses = blockAddresses.clone();
    }

    public int getFirstRow() {
        return firstRow;
    }

    /**
     * @return one past the last row that contains a cell
     */
    public int getLastRow() {
        return lastRow;
    }

    public int[] getBlockAddresses() {
        return blockAddresses.clone();
    }

    public int getBlockCount() {
        return blockAddresses.length;
    }

    /**
     * @return true if the index reports no rows at all
     */
    public boolean isEmptyRange() {
        return lastRow <= firstRow;
    }

    @Override
    public String toString() {
        return "INDEX[rows " + firstRow + ".." + lastRow + ", blocks=" + Arrays.toString(blockAddresses) + "]";
    }
}
