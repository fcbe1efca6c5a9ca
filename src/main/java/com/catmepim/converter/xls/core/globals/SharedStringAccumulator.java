package com.catmepim.converter.xls.core.globals;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.hssf.record.ContinueRecord;
import org.apache.poi.hssf.record.RecordInputStream;
import org.apache.poi.hssf.record.SSTRecord;
import org.apache.poi.hssf.record.common.UnicodeString;
import org.apache.poi.util.LittleEndian;
import org.apache.poi.util.RecordFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;

/**
 * Collects the payload of an SST record and the CONTINUE records that extend it, and
 * materializes the string pool once the globals section ends.
 * <p>
 * The collected segments are replayed through POI's {@link RecordInputStream}, so a string
 * whose characters continue in the next record, possibly switching between compressed and
 * UTF-16 storage, is read by {@link UnicodeString}. Rich-text runs and extended data are
 * skipped the same way.
 *
 * @invariant Segments are only appended while the accumulator is open.
 */
public class SharedStringAccumulator {

    private static final Logger logger = LoggerFactory.getLogger(SharedStringAccumulator.class);

    private final List<byte[]> segments = new ArrayList<>();
    private boolean open;

    /**
     * Starts accumulating at an SST record, discarding anything collected before.
     */
    public void start(BiffRecord sst) {
        segments.clear();
        segments.add(sst.getPayload());
        open = true;
    }

    /**
     * Absorbs a CONTINUE record. Ignored when no SST is being accumulated.
     */
    public void append(BiffRecord continuation) {
        if (!open) {
            return;
        }
        segments.add(continuation.getPayload());
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Stops absorbing CONTINUE records. Collected segments are kept for materialization.
     */
    public void close() {
        open = false;
    }

    /**
     * Decodes the collected segments. Decoding stops at the first string the data cannot
     * hold; the strings read up to that point are kept.
     *
     * @return the string pool; {@link SharedStringTable#EMPTY} if no SST was seen
     */
    public SharedStringTable materialize() {
        close();
        if (segments.isEmpty()) {
            return SharedStringTable.EMPTY;
        }
        RecordInputStream in;
        long total;
        long unique;
        try {
            in = new RecordInputStream(new ByteArrayInputStream(toRecordBytes()));
            in.nextRecord();
            total = in.readInt() & 0xFFFFFFFFL;
            unique = in.readInt() & 0xFFFFFFFFL;
        } catch (RecordFormatException e) {
            logger.warn("SST record too short for its header, ignoring shared strings: {}", e.getMessage());
            return SharedStringTable.EMPTY;
        }

        List<String> strings = new ArrayList<>((int) Math.min(unique, 65536));
        try {
            for (long i = 0; i < unique; i++) {
                if (in.remaining() == 0 && !in.hasNextRecord()) {
                    logger.warn("SST declares {} unique strings but data ends after {}", unique, i);
                    break;
                }
                strings.add(new UnicodeString(in).getString());
            }
        } catch (RecordFormatException e) {
            logger.warn("SST string {} of {} is truncated, keeping the strings before it: {}",
                    strings.size(), unique, e.getMessage());
        }
        logger.debug("Materialized {} shared strings from {} segment(s)", strings.size(), segments.size());
        return new SharedStringTable(total, strings);
    }

    /**
     * Lays the segments out again as an SST record followed by CONTINUE records.
     */
    private byte[] toRecordBytes() {
        int size = 0;
        for (byte[] segment : segments) {
            size += 4 + segment.length;
        }
        byte[] bytes = new byte[size];
        int pos = 0;
        for (int i = 0; i < segments.size(); i++) {
            byte[] segment = segments.get(i);
            LittleEndian.putUShort(bytes, pos, i == 0 ? SSTRecord.sid : ContinueRecord.sid);
            LittleEndian.putUShort(bytes, pos + 2, segment.length);
            System.arraycopy(segment, 0, bytes, pos + 4, segment.length);
            pos += 4 + segment.length;
        }
        return bytes;
    }
}
