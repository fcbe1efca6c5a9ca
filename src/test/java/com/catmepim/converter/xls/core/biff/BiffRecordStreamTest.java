package com.catmepim.converter.xls.core.biff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.exception.RecordTruncatedException;
import com.catmepim.converter.xls.testing.Biff;

public class BiffRecordStreamTest {

    @Test
    public void readsRecordsInOrder() throws Exception {
        byte[] data = Biff.stream(Biff.globalsBof(), Biff.codepage(1252), Biff.eof());
        BiffRecordStream stream = new BiffRecordStream(data, ReadMode.STRICT);

        BiffRecord bof = stream.readNext();
        assertEquals(RecordType.BOF, bof.getType());
        assertEquals(0, bof.getOffset());
        assertEquals(16, bof.getLength());
        assertEquals(20, stream.position());

        BiffRecord codepage = stream.readNext();
        assertEquals(RecordType.CODEPAGE, codepage.getType());
        assertEquals(1252, codepage.getUShort(0));

        assertEquals(RecordType.EOF, stream.readNext().getType());
        assertTrue(stream.atEnd());
        assertNull(stream.readNext());
    }

    @Test
    public void readAtDoesNotMoveTheCursor() throws Exception {
        byte[] data = Biff.stream(Biff.globalsBof(), Biff.codepage(1252), Biff.eof());
        BiffRecordStream stream = new BiffRecordStream(data, ReadMode.STRICT);

        BiffRecord peeked = stream.readAt(20);
        assertEquals(RecordType.CODEPAGE, peeked.getType());
        assertEquals(0, stream.position());
        assertNull(stream.readAt(data.length));
        assertNull(stream.readAt(-1));
    }

    @Test
    public void seekIsClamped() {
        BiffRecordStream stream = new BiffRecordStream(Biff.stream(Biff.eof()), ReadMode.STRICT);
        stream.seek(1000);
        assertEquals(4, stream.position());
        stream.seek(-5);
        assertEquals(0, stream.position());
    }

    @Test
    public void strictModeRejectsTruncatedRecord() {
        byte[] full = Biff.stream(Biff.label(0, 0, 0, "Hello"));
        byte[] cut = Arrays.copyOf(full, full.length - 2);
        BiffRecordStream stream = new BiffRecordStream(cut, ReadMode.STRICT);

        RecordTruncatedException e = assertThrows(RecordTruncatedException.class, stream::readNext);
        assertEquals(0, e.getOffset());
        assertEquals(full.length - 4, e.getDeclaredLength());
        assertEquals(cut.length - 4, e.getAvailableLength());
    }

    @Test
    public void looseModeTruncatesRecord() throws Exception {
        byte[] full = Biff.stream(Biff.label(0, 0, 0, "Hello"));
        byte[] cut = Arrays.copyOf(full, full.length - 2);
        BiffRecordStream stream = new BiffRecordStream(cut, ReadMode.LOOSE);

        BiffRecord record = stream.readNext();
        assertTrue(record.isTruncated());
        assertEquals(cut.length - 4, record.getLength());
        assertEquals(cut.length, record.getEndOffset());
        assertTrue(stream.atEnd());
    }

    @Test
    public void danglingHeaderBytes() throws Exception {
        byte[] data = Arrays.copyOf(Biff.stream(Biff.eof()), 6);

        BiffRecordStream loose = new BiffRecordStream(data, ReadMode.LOOSE);
        assertEquals(RecordType.EOF, loose.readNext().getType());
        assertNull(loose.readNext());

        BiffRecordStream strict = new BiffRecordStream(data, ReadMode.STRICT);
        strict.readNext();
        assertThrows(RecordTruncatedException.class, strict::readNext);
    }

    @Test
    public void accessorsReturnZeroPastThePayload() {
        BiffRecord record = BiffRecord.of(0x0042, new byte[] {(byte) 0xE4, 0x04});
        assertEquals(1252, record.getUShort(0));
        assertEquals(0, record.getUShort(1));
        assertEquals(0, record.getInt(0));
        assertEquals(1, record.getBytes(1, 10).length);
    }
}
