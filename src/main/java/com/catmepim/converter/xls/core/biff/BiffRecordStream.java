package com.catmepim.converter.xls.core.biff;

import org.apache.poi.util.LittleEndian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.exception.RecordTruncatedException;

/**
 * Seekable cursor over the bytes of a workbook stream, yielding one {@link BiffRecord} at a time.
 * <p>
 * Supports sequential reads ({@link #readNext()}), absolute seeks, and peeks at arbitrary
 * offsets ({@link #readAt(int)}) that leave the main cursor untouched. Truncation handling is
 * governed by the {@link ReadMode} given at construction.
 *
 * @invariant 0 <= position() <= size()
 * @invariant The read mode never changes after construction.
 */
public class BiffRecordStream {

    private static final Logger logger = LoggerFactory.getLogger(BiffRecordStream.class);

    private final byte[] data;
    private final ReadMode readMode;
    private int position;

    /**
     * @param data the complete workbook stream
     * @param readMode truncation policy
     * @pre data != null && readMode != null
     */
    public BiffRecordStream(byte[] data, ReadMode readMode) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        if (readMode == null) {
            throw new IllegalArgumentException("readMode must not be null");
        }
        this.data = data;
        this.readMode = readMode;
        this.position = 0;
    }

    public ReadMode getReadMode() {
        return readMode;
    }

    public int position() {
        return position;
    }

    public int size() {
        return data.length;
    }

    /**
     * @return true if the cursor has reached the end of the stream
     */
    public boolean atEnd() {
        return position >= data.length;
    }

    /**
     * Moves the cursor to an absolute offset, clamped to [0, size()].
     */
    public void seek(int offset) {
        this.position = Math.max(0, Math.min(offset, data.length));
    }

    /**
     * Reads the record at the cursor and advances past it.
     *
     * @return the record, or {@code null} at end of stream
     * @throws RecordTruncatedException in strict mode if the record runs past the end
     */
    public BiffRecord readNext() throws RecordTruncatedException {
        BiffRecord record = readAt(position);
        if (record != null) {
            position = record.getEndOffset();
        }
        return record;
    }

    /**
     * Reads the record starting at {@code offset} without moving the cursor.
     *
     * @return the record, or {@code null} if {@code offset} is at or past the end of stream
     * @throws RecordTruncatedException in strict mode if the record runs past the end
     */
    public BiffRecord readAt(int offset) throws RecordTruncatedException {
        if (offset < 0 || offset >= data.length) {
            return null;
        }
        int remaining = data.length - offset;
        if (remaining < BiffRecord.HEADER_SIZE) {
            if (readMode == ReadMode.STRICT) {
                throw new RecordTruncatedException(offset, BiffRecord.HEADER_SIZE, remaining);
            }
            logger.warn("Ignoring {} dangling bytes at offset {} (loose mode)", remaining, offset);
            return null;
        }

        int sid = LittleEndian.getUShort(data, offset);
        int declared = LittleEndian.getUShort(data, offset + 2);
        int available = remaining - BiffRecord.HEADER_SIZE;

        if (declared > available) {
            if (readMode == ReadMode.STRICT) {
                throw new RecordTruncatedException(offset, declared, available);
            }
            logger.warn("Record 0x{} at offset {} declares {} bytes, truncating to {} (loose mode)",
                    Integer.toHexString(sid), offset, declared, available);
            return new BiffRecord(sid, offset, data, offset + BiffRecord.HEADER_SIZE, available, true);
        }
        return new BiffRecord(sid, offset, data, offset + BiffRecord.HEADER_SIZE, declared, false);
    }
}
