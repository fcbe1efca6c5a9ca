package com.catmepim.converter.xls.core.biff;

/**
 * Decoded ROW record, remembering where it sits in the stream.
 */
public final class RowInfo {

    private final int rowIndex;
    private final int firstColumn;
    private final int lastColumn;
    private final int offset;
    private final int size;

    public RowInfo(int rowIndex, int firstColumn, int lastColumn, int offset, int size) {
        this.rowIndex = rowIndex;
        this.firstColumn = firstColumn;
        this.lastColumn = lastColumn;
        this.offset = offset;
        this.size = size;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    /** @return one past the last defined column */
    public int getLastColumn() {
        return lastColumn;
    }

    public int getOffset() {
        return offset;
    }

    public int getSize() {
        return size;
    }

    public int getEndOffset() {
        return offset + size;
    }

    @Override
    public String toString() {
        return "ROW[" + rowIndex + " @" + offset + "]";
    }
}
