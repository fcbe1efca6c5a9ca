package com.catmepim.converter.xls.core.biff;

/**
 * Decoded beginning-of-file record: BIFF version and substream type.
 */
public final class BofInfo {

    public static final int TYPE_WORKBOOK_GLOBALS = 0x0005;
    public static final int TYPE_VB_MODULE = 0x0006;
    public static final int TYPE_WORKSHEET = 0x0010;
    public static final int TYPE_CHART = 0x0020;
    public static final int TYPE_MACRO_SHEET = 0x0040;
    public static final int TYPE_WORKSPACE = 0x0100;

    /** BIFF8, written by Excel 97 and later. */
    public static final int VERSION_BIFF8 = 0x0600;
    /** BIFF5, written by Excel 5.0 and 95. */
    public static final int VERSION_BIFF5 = 0x0500;

    private final int version;
    private final int type;

    public BofInfo(int version, int type) {
        this.version = version;
        this.type = type;
    }

    public int getVersion() {
        return version;
    }

    public int getType() {
        return type;
    }

    public boolean isWorkbookGlobals() {
        return type == TYPE_WORKBOOK_GLOBALS;
    }

    public boolean isWorksheet() {
        return type == TYPE_WORKSHEET;
    }

    public boolean isV8() {
        return version >= VERSION_BIFF8;
    }

    @Override
    public String toString() {
        return String.format("BOF[version=0x%04X, type=0x%04X]", version, type);
    }
}
