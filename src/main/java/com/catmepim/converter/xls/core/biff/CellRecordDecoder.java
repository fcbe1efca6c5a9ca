package com.catmepim.converter.xls.core.biff;

import java.nio.charset.Charset;

import org.apache.poi.hssf.util.RKUtil;

/**
 * Decoders for cell records. Every cell record starts with row(2) and column(2); BIFF5/8
 * layouts follow with an XF index(2), BIFF2 layouts with a 3-byte attribute block.
 */
public final class CellRecordDecoder {

    private static final int SPECIAL_RESULT_MARKER = 0xFFFF;

    private CellRecordDecoder() {
    }

    public static int rowIndex(BiffRecord record) {
        return record.getUShort(0);
    }

    public static int columnIndex(BiffRecord record) {
        return record.getUShort(2);
    }

    /**
     * @return extended-format index of the cell
     */
    public static int xfIndex(BiffRecord record) {
        if (record.getType().isBiff2Cell()) {
            return record.getUByte(4) & 0x3F;
        }
        return record.getUShort(4);
    }

    private static int valueOffset(BiffRecord record) {
        return record.getType().isBiff2Cell() ? 7 : 6;
    }

    /**
     * @return true if a BOOLERR record holds an error code rather than a boolean
     */
    public static boolean isErrorValue(BiffRecord record) {
        return record.getUByte(valueOffset(record) + 1) != 0;
    }

    public static boolean booleanValue(BiffRecord record) {
        return record.getUByte(valueOffset(record)) != 0;
    }

    public static int integerValue(BiffRecord record) {
        return record.getUShort(valueOffset(record));
    }

    public static double numberValue(BiffRecord record) {
        return record.getDouble(valueOffset(record));
    }

    /**
     * Text of LABEL, LABEL_OLD and RSTRING records.
     */
    public static String labelText(BiffRecord record, boolean v8, Charset encoding) {
        if (record.getType() == RecordType.LABEL_OLD) {
            return BiffStrings.readByteString(record, 7, 1, encoding);
        }
        return v8
                ? BiffStrings.readUnicodeString(record, 6)
                : BiffStrings.readByteString(record, 6, 2, encoding);
    }

    public static int sstIndex(BiffRecord record) {
        return record.getInt(6);
    }

    public static double rkValue(BiffRecord record) {
        return RKUtil.decodeNumber(record.getInt(6));
    }

    /**
     * @return number of (XF, RK) pairs in a MULRK record
     */
    public static int mulRkCount(BiffRecord record) {
        return Math.max(0, (record.getLength() - 6) / 6);
    }

    public static int mulRkXfIndex(BiffRecord record, int i) {
        return record.getUShort(4 + 6 * i);
    }

    public static double mulRkValue(BiffRecord record, int i) {
        return RKUtil.decodeNumber(record.getInt(6 + 6 * i));
    }

    /**
     * Decodes the 8-byte cached result of a FORMULA record.
     */
    public static FormulaResult formulaResult(BiffRecord record) {
        if (record.getUShort(12) != SPECIAL_RESULT_MARKER) {
            return FormulaResult.number(record.getDouble(6));
        }
        switch (record.getUByte(6)) {
            case 0:
                return FormulaResult.special(FormulaResult.Kind.STRING, 0);
            case 1:
                return FormulaResult.special(FormulaResult.Kind.BOOLEAN, record.getUByte(8));
            case 2:
                return FormulaResult.special(FormulaResult.Kind.ERROR, record.getUByte(8));
            case 3:
                return FormulaResult.special(FormulaResult.Kind.EMPTY_STRING, 0);
            default:
                return FormulaResult.special(FormulaResult.Kind.ERROR, record.getUByte(6));
        }
    }

    /**
     * Text of a STRING record holding a formula's string result.
     */
    public static String stringResultText(BiffRecord record, boolean v8, Charset encoding) {
        if (record.getType() == RecordType.STRING_OLD) {
            return BiffStrings.readByteString(record, 0, 1, encoding);
        }
        return v8
                ? BiffStrings.readUnicodeString(record, 0)
                : BiffStrings.readByteString(record, 0, 2, encoding);
    }
}
