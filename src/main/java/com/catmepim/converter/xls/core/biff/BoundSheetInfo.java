package com.catmepim.converter.xls.core.biff;

/**
 * Decoded BOUNDSHEET record: one entry of the workbook's sheet directory.
 */
public final class BoundSheetInfo {

    public static final int SHEET_TYPE_WORKSHEET = 0x00;
    public static final int SHEET_TYPE_MACRO = 0x01;
    public static final int SHEET_TYPE_CHART = 0x02;
    public static final int SHEET_TYPE_VB_MODULE = 0x06;

    private final int dataOffset;
    private final int visibility;
    private final int sheetType;
    private final String name;

    public BoundSheetInfo(int dataOffset, int visibility, int sheetType, String name) {
        this.dataOffset = dataOffset;
        this.visibility = visibility;
        this.sheetType = sheetType;
        this.name = name;
    }

    /**
     * @return stream offset of the sheet's BOF record
     */
    public int getDataOffset() {
        return dataOffset;
    }

    public int getVisibility() {
        return visibility;
    }

    public int getSheetType() {
        return sheetType;
    }

    public String getName() {
        return name;
    }

    public boolean isWorksheet() {
        return sheetType == SHEET_TYPE_WORKSHEET;
    }
}
