package com.catmepim.converter.xls.core.globals;

import com.catmepim.converter.xls.core.biff.Dimensions;
import com.catmepim.converter.xls.core.biff.RowInfo;
import com.catmepim.converter.xls.core.biff.SheetIndex;

/**
 * Header metadata of one worksheet, as needed to traverse its cells.
 *
 * @invariant maxRow > 0 && maxCol > 0
 * @invariant firstRow != null
 */
public final class WorksheetGlobals {

    private final Worksheet worksheet;
    private final int maxRow;
    private final int maxCol;
    private final SheetIndex index;
    private final Dimensions dimensions;
    private final RowInfo firstRow;
    private final HyperlinkIndex hyperlinks;

    public WorksheetGlobals(Worksheet worksheet, int maxRow, int maxCol, SheetIndex index,
                            Dimensions dimensions, RowInfo firstRow, HyperlinkIndex hyperlinks) {
        this.worksheet = worksheet;
        this.maxRow = maxRow;
        this.maxCol = maxCol;
        this.index = index;
        this.dimensions = dimensions;
        this.firstRow = firstRow;
        this.hyperlinks = hyperlinks;
    }

    public Worksheet getWorksheet() {
        return worksheet;
    }

    /**
     * @return exclusive upper bound on row indexes; traversal stops once depth reaches it
     */
    public int getMaxRow() {
        return maxRow;
    }

    /**
     * @return exclusive upper bound on column indexes, and the width of every row
     */
    public int getMaxCol() {
        return maxCol;
    }

    public boolean hasIndex() {
        return index != null;
    }

    /**
     * @return the INDEX record contents, or {@code null} when the sheet has none
     */
    public SheetIndex getIndex() {
        return index;
    }

    /**
     * @return the DIMENSIONS record contents, or {@code null} when the sheet has none
     */
    public Dimensions getDimensions() {
        return dimensions;
    }

    public RowInfo getFirstRow() {
        return firstRow;
    }

    public HyperlinkIndex getHyperlinks() {
        return hyperlinks;
    }

    /**
     * @return a copy without the INDEX, for re-reading the sheet sequentially
     */
    public WorksheetGlobals withoutIndex() {
        return new WorksheetGlobals(worksheet, maxRow, maxCol, null, dimensions, firstRow, hyperlinks);
    }
}
