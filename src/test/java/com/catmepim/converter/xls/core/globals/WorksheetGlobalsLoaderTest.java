package com.catmepim.converter.xls.core.globals;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.ReadMode;
import com.catmepim.converter.xls.testing.Biff;
import com.catmepim.converter.xls.testing.WorkbookBuilder;

public class WorksheetGlobalsLoaderTest {

    private BiffRecordStream stream;
    private WorkbookGlobals globals;

    private WorksheetGlobals loadSheet(WorkbookBuilder builder, int sheet) throws Exception {
        stream = new BiffRecordStream(builder.build(), ReadMode.STRICT);
        globals = new WorkbookGlobalsLoader().load(stream);
        return new WorksheetGlobalsLoader().load(stream, globals.getWorksheets().get(sheet));
    }

    @Test
    public void readsExtentsIndexAndHyperlinks() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Data")
                .cell(Biff.number(0, 0, 0, 1))
                .cell(Biff.number(0, 2, 0, 2))
                .cell(Biff.number(40, 1, 0, 3))
                .trailer(Biff.hlinkUrl(0, 0, 2, 2, "http://example.com/"))
                .trailer(Biff.hlinkTooltip(0, 2, "tip"))
                .trailer(Biff.hlinkLocation(40, 1, "jump", "Data!A1"));

        WorksheetGlobals sheet = loadSheet(builder, 0);

        assertNotNull(sheet);
        assertEquals(41, sheet.getMaxRow());
        assertEquals(3, sheet.getMaxCol());
        assertTrue(sheet.hasIndex());
        assertEquals(2, sheet.getIndex().getBlockCount());
        assertEquals(0, sheet.getFirstRow().getRowIndex());

        HyperlinkIndex links = sheet.getHyperlinks();
        assertEquals(2, links.size());
        assertEquals("http://example.com/", links.lookup(0, 2));
        assertEquals("Data!A1", links.lookup(40, 1));
        assertNull(links.lookup(0, 0));

        assertFalse(sheet.withoutIndex().hasIndex());
        assertEquals(sheet.getMaxRow(), sheet.withoutIndex().getMaxRow());
    }

    @Test
    public void defaultsWithoutDimensionsOrIndex() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Bare").noIndex().noDimensions().cell(Biff.number(0, 0, 0, 1));

        WorksheetGlobals sheet = loadSheet(builder, 0);

        assertNotNull(sheet);
        assertFalse(sheet.hasIndex());
        assertEquals(WorksheetGlobalsLoader.DEFAULT_MAX_ROW, sheet.getMaxRow());
        assertEquals(WorksheetGlobalsLoader.DEFAULT_MAX_COL, sheet.getMaxCol());
        assertTrue(sheet.getHyperlinks().isEmpty());
    }

    @Test
    public void heightFromIndexWhenDimensionsAreMissing() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("NoDims").noDimensions()
                .cell(Biff.number(0, 0, 0, 1))
                .cell(Biff.number(4, 0, 0, 1));

        WorksheetGlobals sheet = loadSheet(builder, 0);

        assertEquals(5, sheet.getMaxRow());
        assertEquals(WorksheetGlobalsLoader.DEFAULT_MAX_COL, sheet.getMaxCol());
    }

    @Test
    public void nonPositiveDimensionsWidthFallsBackToFirstRow() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Narrow").dimensions(3, 0)
                .cell(Biff.number(0, 0, 0, 1))
                .cell(Biff.number(0, 3, 0, 2))
                .cell(Biff.number(2, 5, 0, 3));

        WorksheetGlobals sheet = loadSheet(builder, 0);

        assertNotNull(sheet);
        assertEquals(3, sheet.getMaxRow());
        assertEquals(4, sheet.getMaxCol());
        assertEquals(4, sheet.getFirstRow().getLastColumn());
    }

    @Test
    public void rowBeforeDimensionsEndsTheDimensionsScan() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("LateDims").noDimensions()
                .cell(Biff.number(0, 0, 0, 1))
                .cell(Biff.number(4, 1, 0, 2))
                .trailer(Biff.dimensions(0, 99, 0, 7));

        WorksheetGlobals sheet = loadSheet(builder, 0);

        assertNotNull(sheet);
        assertEquals(0, sheet.getFirstRow().getRowIndex());
        assertEquals(5, sheet.getMaxRow());
        assertEquals(WorksheetGlobalsLoader.DEFAULT_MAX_COL, sheet.getMaxCol());
    }

    @Test
    public void skipsSheetWithEmptyIndexRange() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Empty").emptyIndexRange().cell(Biff.number(0, 0, 0, 1));
        assertNull(loadSheet(builder, 0));
    }

    @Test
    public void skipsSheetWithoutRows() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Nothing").noIndex();
        assertNull(loadSheet(builder, 0));
    }

    @Test
    public void skipsSheetWhoseOffsetIsNotABof() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Data").cell(Biff.number(0, 0, 0, 1));
        stream = new BiffRecordStream(builder.build(), ReadMode.STRICT);
        globals = new WorkbookGlobalsLoader().load(stream);

        Worksheet misplaced = new Worksheet(0, "Data", 0x10, Biff.BIFF8);
        assertNull(new WorksheetGlobalsLoader().load(stream, misplaced));
    }
}
