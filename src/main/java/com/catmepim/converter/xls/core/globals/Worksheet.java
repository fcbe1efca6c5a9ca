package com.catmepim.converter.xls.core.globals;

import com.catmepim.converter.xls.core.biff.BofInfo;

/**
 * Directory entry for one worksheet, created from its BOUNDSHEET record.
 */
public final class Worksheet {

    private final int index;
    private final String name;
    private final int dataOffset;
    private final int biffVersion;

    public Worksheet(int index, String name, int dataOffset, int biffVersion) {
        this.index = index;
        this.name = name;
        this.dataOffset = dataOffset;
        this.biffVersion = biffVersion;
    }

    /**
     * @return zero-based position among the workbook's worksheets (charts and macro sheets
     *         are not counted)
     */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    /**
     * @return stream offset of the worksheet's BOF record
     */
    public int getDataOffset() {
        return dataOffset;
    }

    /**
     * @return true if the sheet's records use the BIFF8 layouts
     */
    public boolean isV8() {
        return biffVersion >= BofInfo.VERSION_BIFF8;
    }

    @Override
    public String toString() {
        return "Worksheet{" + index + ", '" + name + "' @" + dataOffset + "}";
    }
}
