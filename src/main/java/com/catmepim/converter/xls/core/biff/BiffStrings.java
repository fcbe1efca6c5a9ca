package com.catmepim.converter.xls.core.biff;

import java.nio.charset.Charset;

import org.apache.poi.util.StringUtil;

/**
 * String layouts found inside record payloads.
 * <p>
 * BIFF8 stores text as "unicode strings": a character count, an option byte whose low bit
 * says whether each character takes one byte (compressed Latin-1) or two (UTF-16LE), then the
 * characters. Earlier versions store a byte count followed by bytes in the workbook codepage.
 * All readers clamp to the bytes present, so truncated records yield a shortened string.
 * Shared strings and hyperlink strings, which may span records, are left to POI.
 */
public final class BiffStrings {

    /** Option-flag bit: characters are stored as UTF-16LE. */
    static final int FLAG_HIGH_BYTE = 0x01;

    private BiffStrings() {
    }

    /**
     * Reads a BIFF8 string with a 16-bit character count at {@code pos}.
     */
    public static String readUnicodeString(BiffRecord record, int pos) {
        int cch = record.getUShort(pos);
        int flags = record.getUByte(pos + 2);
        return readCharacters(record, pos + 3, cch, (flags & FLAG_HIGH_BYTE) != 0);
    }

    /**
     * Reads a BIFF8 string with an 8-bit character count at {@code pos}.
     */
    public static String readShortUnicodeString(BiffRecord record, int pos) {
        int cch = record.getUByte(pos);
        int flags = record.getUByte(pos + 1);
        return readCharacters(record, pos + 2, cch, (flags & FLAG_HIGH_BYTE) != 0);
    }

    /**
     * Reads a pre-BIFF8 string: a byte count of {@code countSize} bytes (1 or 2) followed by
     * bytes in the given encoding.
     */
    public static String readByteString(BiffRecord record, int pos, int countSize, Charset encoding) {
        int count = countSize == 1 ? record.getUByte(pos) : record.getUShort(pos);
        byte[] bytes = record.getBytes(pos + countSize, count);
        return new String(bytes, encoding);
    }

    /**
     * Reads {@code charCount} characters starting at {@code pos}, clamped to the payload.
     */
    private static String readCharacters(BiffRecord record, int pos, int charCount, boolean highByte) {
        int width = highByte ? 2 : 1;
        byte[] bytes = record.getBytes(pos, charCount * width);
        return decode(bytes, 0, bytes.length / width, highByte);
    }

    private static String decode(byte[] bytes, int offset, int charCount, boolean highByte) {
        if (charCount <= 0) {
            return "";
        }
        return highByte
                ? StringUtil.getFromUnicodeLE(bytes, offset, charCount)
                : StringUtil.getFromCompressedUnicode(bytes, offset, charCount);
    }
}
