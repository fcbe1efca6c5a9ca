package com.catmepim.converter.xls.core.biff;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of the BIFF record kinds this reader understands, keyed by record id (sid).
 * Every other sid maps to {@link #UNKNOWN}.
 * <p>
 * Names ending in {@code _OLD} or {@code _V2}/{@code _V3}/{@code _V4} are the layouts used by
 * earlier BIFF versions.
 */
public enum RecordType {

    // Workbook and sheet structure
    BOF(0x0809),
    BOF_V2(0x0009),
    BOF_V3(0x0209),
    BOF_V4(0x0409),
    EOF(0x000A),
    BOUNDSHEET(0x0085),
    CODEPAGE(0x0042),
    DATEMODE(0x0022),
    FILEPASS(0x002F),
    INTERFACEHDR(0x00E1),
    MMS(0x00C1),
    COUNTRY(0x008C),
    PROTECT(0x0012),
    PASSWORD(0x0013),
    PROT4REVPASSWORD(0x01BC),

    // Formatting
    FONT(0x0031),
    FONT_V34(0x0231),
    FORMAT(0x041E),
    FORMAT_V23(0x001E),
    XF(0x00E0),
    XF_V2(0x0043),
    XF_V3(0x0243),
    XF_V4(0x0443),

    // Shared strings
    SST(0x00FC),
    CONTINUE(0x003C),
    EXTSST(0x00FF),

    // Worksheet layout
    INDEX(0x020B),
    UNCALCED(0x005E),
    DIMENSIONS(0x0200),
    ROW(0x0208),
    DBCELL(0x00D7),
    HLINK(0x01B8),
    HLINKTOOLTIP(0x0800),

    // Records that trail a formula
    STRING(0x0207),
    STRING_OLD(0x0007),
    SHRFMLA(0x04BC),
    ARRAY(0x0221),
    TABLE(0x0236),

    // Cells
    BLANK(0x0201, true),
    BLANK_OLD(0x0001, true),
    MULBLANK(0x00BE, true),
    BOOLERR(0x0205, true),
    BOOLERR_OLD(0x0005, true),
    INTEGER(0x0202, true),
    INTEGER_OLD(0x0002, true),
    NUMBER(0x0203, true),
    NUMBER_OLD(0x0003, true),
    LABEL(0x0204, true),
    LABEL_OLD(0x0004, true),
    RSTRING(0x00D6, true),
    LABELSST(0x00FD, true),
    RK(0x027E, true),
    MULRK(0x00BD, true),
    FORMULA(0x0006, true),
    FORMULA_OLD(0x0406, true),

    UNKNOWN(-1);

    private static final Map<Integer, RecordType> BY_SID = new HashMap<>();

    static {
        for (RecordType type : values()) {
            if (type != UNKNOWN) {
                BY_SID.put(type.sid, type);
            }
        }
    }

    private final int sid;
    private final boolean cell;

    RecordType(int sid) {
        this(sid, false);
    }

    RecordType(int sid, boolean cell) {
        this.sid = sid;
        this.cell = cell;
    }

    public int getSid() {
        return sid;
    }

    /**
     * @return true if records of this kind start with a row and column index
     */
    public boolean isCell() {
        return cell;
    }

    /**
     * @return true for the four BOF layouts
     */
    public boolean isBof() {
        return this == BOF || this == BOF_V2 || this == BOF_V3 || this == BOF_V4;
    }

    /**
     * Cell layouts from BIFF2, where a 3-byte attribute block replaces the XF index.
     */
    public boolean isBiff2Cell() {
        return this == BLANK_OLD || this == BOOLERR_OLD || this == INTEGER_OLD
                || this == NUMBER_OLD || this == LABEL_OLD;
    }

    public static RecordType forSid(int sid) {
        RecordType type = BY_SID.get(sid);
        return type != null ? type : UNKNOWN;
    }
}
