package com.catmepim.converter.xls.core.biff;

/**
 * Decoded DIMENSIONS record. Upper bounds are exclusive.
 */
public final class Dimensions {

    private final int firstRow;
    private final int lastRow;
    private final int firstColumn;
    private final int lastColumn;

    public Dimensions(int firstRow, int lastRow, int firstColumn, int lastColumn) {
        this.firstRow = firstRow;
        this.lastRow = lastRow;
        this.firstColumn = firstColumn;
        this.lastColumn = lastColumn;
    }

    public int getFirstRow() {
        return firstRow;
    }

    /** @return one past the last used row */
    public int getLastRow() {
        return lastRow;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    /** @return one past the last used column */
    public int getLastColumn() {
        return lastColumn;
    }

    @Override
    public String toString() {
        return "DIMENSIONS[rows " + firstRow + ".." + lastRow + ", cols " + firstColumn + ".." + lastColumn + "]";
    }
}
