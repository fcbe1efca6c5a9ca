package com.catmepim.converter.xls.core.biff;

import java.io.ByteArrayInputStream;

import org.apache.poi.hssf.record.HyperlinkRecord;
import org.apache.poi.hssf.record.RecordInputStream;
import org.apache.poi.util.RecordFormatException;

/**
 * Decoders for the structural records of a worksheet substream: INDEX, DIMENSIONS, ROW,
 * DBCELL and HLINK.
 */
public final class SheetRecordDecoder {

    private SheetRecordDecoder() {
    }

    /**
     * INDEX: reserved(4), first row, last row + 1, reserved, then one DBCELL address per
     * row block. Row fields are 32-bit in BIFF8 and 16-bit before.
     */
    public static SheetIndex index(BiffRecord record, boolean v8) {
        int firstRow;
        int lastRow;
        int addressStart;
        if (v8) {
            firstRow = record.getInt(4);
            lastRow = record.getInt(8);
            addressStart = 16;
        } else {
            firstRow = record.getUShort(4);
            lastRow = record.getUShort(6);
            addressStart = 12;
        }
        int count = Math.max(0, (record.getLength() - addressStart) / 4);
        int[] addresses = new int[count];
        for (int i = 0; i < count; i++) {
            addresses[i] = record.getInt(addressStart + 4 * i);
        }
        return new SheetIndex(firstRow, lastRow, addresses);
    }

    public static Dimensions dimensions(BiffRecord record, boolean v8) {
        if (v8) {
            return new Dimensions(record.getInt(0), record.getInt(4), record.getUShort(8), record.getUShort(10));
        }
        return new Dimensions(record.getUShort(0), record.getUShort(2), record.getUShort(4), record.getUShort(6));
    }

    public static RowInfo row(BiffRecord record) {
        return new RowInfo(record.getUShort(0), record.getUShort(2), record.getUShort(4),
                record.getOffset(), record.getSize());
    }

    /**
     * @return distance from the start of the DBCELL record back to the first ROW record of
     *         its block
     */
    public static int dbCellRowOffset(BiffRecord record) {
        return record.getInt(0);
    }

    /**
     * Decodes an HLINK record with POI's {@link HyperlinkRecord}. The target is the link
     * address as POI reports it: the path of a file link, the location of a link that carries
     * one, otherwise the URL or string moniker. A record POI cannot parse yields a range with
     * a {@code null} target.
     */
    public static HyperlinkRange hyperlink(BiffRecord record) {
        int firstRow = record.getUShort(0);
        int lastRow = record.getUShort(2);
        int firstColumn = record.getUShort(4);
        int lastColumn = record.getUShort(6);

        String target;
        try {
            RecordInputStream in = new RecordInputStream(new ByteArrayInputStream(record.toByteArray()));
            in.nextRecord();
            HyperlinkRecord link = new HyperlinkRecord(in);
            target = link.getAddress();
            if (target == null || target.isEmpty()) {
                target = link.getTextMark();
            }
        } catch (RecordFormatException | IllegalArgumentException e) {
            target = null;
        }
        if (target != null && target.isEmpty()) {
            target = null;
        }
        return new HyperlinkRange(firstRow, lastRow, firstColumn, lastColumn, target);
    }
}
