package com.catmepim.converter.xls.core.biff;

import java.nio.charset.Charset;

/**
 * Decoders for records of the workbook globals substream.
 * All methods are pure functions of the record bytes.
 */
public final class WorkbookRecordDecoder {

    private WorkbookRecordDecoder() {
    }

    /**
     * Decodes any of the four BOF layouts: version(2), substream type(2).
     */
    public static BofInfo bof(BiffRecord record) {
        return new BofInfo(record.getUShort(0), record.getUShort(2));
    }

    /**
     * BOUNDSHEET: BOF offset(4), visibility(1), sheet type(1), name.
     * BIFF8 names carry an option byte; BIFF5 names are codepage bytes.
     */
    public static BoundSheetInfo boundSheet(BiffRecord record, boolean v8, Charset encoding) {
        String name = v8
                ? BiffStrings.readShortUnicodeString(record, 6)
                : BiffStrings.readByteString(record, 6, 1, encoding);
        return new BoundSheetInfo((int) record.getUInt(0), record.getUByte(4), record.getUByte(5), name);
    }

    public static int codepage(BiffRecord record) {
        return record.getUShort(0);
    }

    /**
     * @return true if the workbook counts days from 1904-01-01
     */
    public static boolean uses1904DateSystem(BiffRecord record) {
        return record.getUShort(0) == 1;
    }

    /**
     * Decodes FORMAT and FORMAT_V23.
     *
     * @param implicitCode code to use for FORMAT_V23, which has no embedded index
     */
    public static FormatString format(BiffRecord record, boolean v8, Charset encoding, int implicitCode) {
        if (record.getType() == RecordType.FORMAT_V23) {
            return new FormatString(implicitCode, BiffStrings.readByteString(record, 0, 1, encoding));
        }
        String pattern = v8
                ? BiffStrings.readUnicodeString(record, 2)
                : BiffStrings.readByteString(record, 2, 1, encoding);
        return new FormatString(record.getUShort(0), pattern);
    }
}
