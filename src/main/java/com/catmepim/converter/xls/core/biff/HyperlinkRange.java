package com.catmepim.converter.xls.core.biff;

/**
 * Decoded HLINK record: a rectangular cell range (inclusive bounds) and its link target.
 */
public final class HyperlinkRange {

    private final int firstRow;
    private final int lastRow;
    private final int firstColumn;
    private final int lastColumn;
    private final String target;

    public HyperlinkRange(int firstRow, int lastRow, int firstColumn, int lastColumn, String target) {
        this.firstRow = firstRow;
        this.lastRow = lastRow;
        this.firstColumn = firstColumn;
        this.lastColumn = lastColumn;
        this.target = target;
    }

    public boolean contains(int row, int column) {
        return row >= firstRow && row <= lastRow && column >= firstColumn && column <= lastColumn;
    }

    public int getFirstRow() {
        return firstRow;
    }

    public int getLastRow() {
        return lastRow;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    public int getLastColumn() {
        return lastColumn;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "HLINK[" + firstRow + ":" + firstColumn + ".." + lastRow + ":" + lastColumn + " -> " + target + "]";
    }
}
