package com.catmepim.converter.xls.strategy;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.SheetTable;
import com.catmepim.converter.xls.core.cell.CellValue;
import com.catmepim.converter.xls.testing.Biff;
import com.catmepim.converter.xls.testing.WorkbookBuilder;

public class SequentialTraversalStrategyTest {

    @Test
    public void matchesIndexedTraversal() throws Exception {
        TraversalFixture fixture = new TraversalFixture(TraversalFixture.numberedRows(25, 10));

        SheetTable indexed = fixture.run(new IndexedTraversalStrategy());
        SheetTable sequential = fixture.run(new SequentialTraversalStrategy(), fixture.sheet.withoutIndex());

        assertEquals(25, sequential.getRowCount());
        for (int r = 0; r < 25; r++) {
            assertArrayEquals(indexed.getRows().get(r), sequential.getRows().get(r));
        }
    }

    @Test
    public void readsSheetWithoutIndex() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Data").noIndex().rowsPerBlock(4)
                .cell(Biff.rk(0, 0, 0, 1))
                .cell(Biff.rk(2, 0, 0, 3))
                .cell(Biff.rk(5, 1, 0, 6));
        TraversalFixture fixture = new TraversalFixture(builder);
        assertFalse(fixture.sheet.hasIndex());

        SheetTable table = fixture.run(new SequentialTraversalStrategy());

        assertEquals(6, table.getRowCount());
        assertEquals(CellValue.ofNumber(1.0), table.getValue(0, 0));
        assertNull(table.getValue(1, 0));
        assertEquals(CellValue.ofNumber(3.0), table.getValue(2, 0));
        assertNull(table.getValue(4, 1));
        assertEquals(CellValue.ofNumber(6.0), table.getValue(5, 1));
    }

    @Test
    public void recoversWithoutDbCells() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        WorkbookBuilder.SheetBuilder sheet = builder.sheet("Data").rowsPerBlock(10).omitDbCells();
        for (int r = 0; r < 25; r++) {
            sheet.cell(Biff.rk(r, 0, 0, r));
        }
        TraversalFixture fixture = new TraversalFixture(builder);

        SheetTable table = fixture.run(new SequentialTraversalStrategy(), fixture.sheet.withoutIndex());

        assertEquals(25, table.getRowCount());
        assertEquals(CellValue.ofNumber(24.0), table.getValue(24, 0));
    }
}
