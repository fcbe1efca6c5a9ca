package com.catmepim.converter.xls.core.cell;

import java.util.Arrays;

/**
 * Fixed-width slot array for the row being assembled. Writes outside the width are dropped;
 * a second write to the same column replaces the first.
 */
public final class RowBuffer {

    private final CellValue[] cells;

    public RowBuffer(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0");
        }
        this.cells = new CellValue[width];
    }

    public int width() {
        return cells.length;
    }

    /**
     * @return true if the column was inside the row and the value was stored
     */
    public boolean set(int column, CellValue value) {
        if (column < 0 || column >= cells.length) {
            return false;
        }
        cells[column] = value;
        return true;
    }

    public CellValue get(int column) {
        return column >= 0 && column < cells.length ? cells[column] : null;
    }

    public void reset() {
        Arrays.fill(cells, null);
    }

    /**
     * @return a copy of the slots; empty columns are {@code null}
     */
    public CellValue[] snapshot() {
        return cells.clone();
    }
}
