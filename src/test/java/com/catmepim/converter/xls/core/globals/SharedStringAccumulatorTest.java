package com.catmepim.converter.xls.core.globals;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.testing.Biff;

public class SharedStringAccumulatorTest {

    private static BiffRecord record(Biff.Rec rec) {
        return BiffRecord.of(rec.sid, rec.payload);
    }

    @Test
    public void stringSplitAcrossContinueSwitchesWidth() {
        byte[] sst = Biff.payload()
                .u32(3).u32(3)
                .unicodeString("Hello")
                // rich string "ab" with one formatting run
                .u16(2).u8(0x08).u16(1).latin1("ab").u16(0).u16(1)
                // "World!" whose first three characters fit in the SST record
                .u16(6).u8(0).latin1("Wor")
                .toByteArray();
        byte[] continuation = Biff.payload().u8(0x01).utf16("ld!").toByteArray();

        SharedStringAccumulator accumulator = new SharedStringAccumulator();
        accumulator.start(BiffRecord.of(0x00FC, sst));
        accumulator.append(BiffRecord.of(0x003C, continuation));
        SharedStringTable table = accumulator.materialize();

        assertEquals(3, table.size());
        assertEquals(3, table.getDeclaredTotal());
        assertEquals("Hello", table.get(0));
        assertEquals("ab", table.get(1));
        assertEquals("World!", table.get(2));
        assertNull(table.get(3));
        assertNull(table.get(-1));
    }

    @Test
    public void continueOutsideSstIsIgnored() {
        SharedStringAccumulator accumulator = new SharedStringAccumulator();
        accumulator.append(record(Biff.continueRecord(new byte[] {1, 2, 3})));
        assertFalse(accumulator.isOpen());
        assertSame(SharedStringTable.EMPTY, accumulator.materialize());

        accumulator.start(record(Biff.sst("x")));
        accumulator.close();
        accumulator.append(record(Biff.continueRecord(new byte[] {1, 2, 3})));
        SharedStringTable table = accumulator.materialize();
        assertEquals(1, table.size());
        assertEquals("x", table.get(0));
    }

    @Test
    public void declaredCountBeyondDataStopsEarly() {
        byte[] sst = Biff.payload().u32(5).u32(5).unicodeString("only").toByteArray();
        SharedStringAccumulator accumulator = new SharedStringAccumulator();
        accumulator.start(BiffRecord.of(0x00FC, sst));

        SharedStringTable table = accumulator.materialize();
        assertEquals(1, table.size());
        assertEquals("only", table.get(0));
    }

    @Test
    public void truncatedStringKeepsTheStringsBeforeIt() {
        byte[] sst = Biff.payload().u32(2).u32(2)
                .unicodeString("ok")
                .u16(10).u8(0).latin1("abc")
                .toByteArray();
        SharedStringAccumulator accumulator = new SharedStringAccumulator();
        accumulator.start(BiffRecord.of(0x00FC, sst));

        SharedStringTable table = accumulator.materialize();
        assertEquals(1, table.size());
        assertEquals("ok", table.get(0));
        assertEquals(2, table.getDeclaredTotal());
    }

    @Test
    public void headerShorterThanCountsGivesEmptyTable() {
        SharedStringAccumulator accumulator = new SharedStringAccumulator();
        accumulator.start(BiffRecord.of(0x00FC, new byte[] {1, 0, 0}));
        assertSame(SharedStringTable.EMPTY, accumulator.materialize());
    }
}
