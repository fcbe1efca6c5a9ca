package com.catmepim.converter.xls.core.biff;

import org.apache.poi.util.LittleEndian;

/**
 * One raw record of a BIFF stream: its kind, where it starts, and a view of its payload.
 * <p>
 * The payload is not copied; the record shares the stream's backing array. Accessors take
 * offsets relative to the start of the payload. Reads beyond the payload end return zero,
 * so decoders working on a truncated record see missing bytes as zeros instead of failing.
 *
 * @invariant {@code getSize() == HEADER_SIZE + getLength()}
 */
public final class BiffRecord {

    /** sid(2) + length(2) */
    public static final int HEADER_SIZE = 4;

    private final RecordType type;
    private final int sid;
    private final int offset;
    private final byte[] data;
    private final int payloadStart;
    private final int length;
    private final boolean truncated;

    BiffRecord(int sid, int offset, byte[] data, int payloadStart, int length, boolean truncated) {
        this.type = RecordType.forSid(sid);
        this.sid = sid;
        this.offset = offset;
        this.data = data;
        this.payloadStart = payloadStart;
        this.length = length;
        this.truncated = truncated;
    }

    /**
     * Builds a record over a standalone payload. Used for synthetic records and tests.
     */
    public static BiffRecord of(int sid, byte[] payload) {
        return new BiffRecord(sid, 0, payload, 0, payload.length, false);
    }

    public RecordType getType() {
        return type;
    }

    public int getSid() {
        return sid;
    }

    /**
     * @return stream offset of the record header
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return payload length in bytes (after truncation, if any)
     */
    public int getLength() {
        return length;
    }

    /**
     * @return encoded size: header plus payload
     */
    public int getSize() {
        return HEADER_SIZE + length;
    }

    /**
     * @return offset of the first byte after this record
     */
    public int getEndOffset() {
        return offset + getSize();
    }

    /**
     * @return true if the stream ended before the declared payload did (loose mode only)
     */
    public boolean isTruncated() {
        return truncated;
    }

    public boolean isCell() {
        return type.isCell();
    }

    public boolean has(int pos, int count) {
        return pos >= 0 && pos + count <= length;
    }

    public int getUByte(int pos) {
        return has(pos, 1) ? LittleEndian.getUByte(data, payloadStart + pos) : 0;
    }

    public int getUShort(int pos) {
        return has(pos, 2) ? LittleEndian.getUShort(data, payloadStart + pos) : 0;
    }

    public int getInt(int pos) {
        return has(pos, 4) ? LittleEndian.getInt(data, payloadStart + pos) : 0;
    }

    public long getUInt(int pos) {
        return has(pos, 4) ? LittleEndian.getUInt(data, payloadStart + pos) : 0L;
    }

    public double getDouble(int pos) {
        return has(pos, 8) ? LittleEndian.getDouble(data, payloadStart + pos) : 0d;
    }

    /**
     * Copies part of the payload, clamped to the bytes present.
     */
    public byte[] getBytes(int pos, int count) {
        int available = Math.max(0, Math.min(count, length - pos));
        byte[] copy = new byte[available];
        if (available > 0) {
            System.arraycopy(data, payloadStart + pos, copy, 0, available);
        }
        return copy;
    }

    /**
     * @return a copy of the whole payload
     */
    public byte[] getPayload() {
        return getBytes(0, length);
    }

    /**
     * @return header and payload as a standalone record, with the length field set to the
     *         payload actually present
     */
    public byte[] toByteArray() {
        byte[] bytes = new byte[getSize()];
        LittleEndian.putUShort(bytes, 0, sid);
        LittleEndian.putUShort(bytes, 2, length);
        if (length > 0) {
            System.arraycopy(data, payloadStart, bytes, HEADER_SIZE, length);
        }
        return bytes;
    }

    @Override
    public String toString() {
        return String.format("%s(0x%04X)@%d[%d%s]", type, sid, offset, length, truncated ? ", truncated" : "");
    }
}
