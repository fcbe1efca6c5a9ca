package com.catmepim.converter.xls.strategy;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.RowSink;
import com.catmepim.converter.xls.core.cell.CellValue;
import com.catmepim.converter.xls.core.cell.CellValueDecoder;
import com.catmepim.converter.xls.testing.Biff;
import com.catmepim.converter.xls.testing.WorkbookBuilder;

public class RowAssemblerTest {

    private final List<Integer> emitted = new ArrayList<>();
    private final RowSink sink = new RowSink() {
        @Override
        public void acceptRow(int rowIndex, CellValue[] values) {
            emitted.add(rowIndex);
        }
    };

    @Test
    public void rowEndsAtNextRowThenAtBlockEnd() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Data")
                .cell(Biff.rk(0, 0, 0, 1))
                .cell(Biff.rk(1, 0, 0, 2));
        TraversalFixture fixture = new TraversalFixture(builder);
        RowAssembler assembler = new RowAssembler(fixture.stream, fixture.sheet,
                new CellValueDecoder(fixture.globals, fixture.stream), sink);

        TraversalState state = TraversalState.indexed(fixture.sheet.getIndex().getBlockAddresses());
        state.setNextCellOffset(IndexedTraversalStrategy.locateFirstCell(fixture.stream, state.nextBlockAddress()));

        assertEquals(RowAssembler.RowEnd.NEXT_ROW, assembler.assembleRow(state));
        assertEquals(1, state.getDepth());
        assertEquals(RowAssembler.RowEnd.BLOCK_END, assembler.assembleRow(state));
        assertEquals(2, state.getDepth());
        assertEquals(2, emitted.size());
        assertEquals(Integer.valueOf(1), emitted.get(1));
    }

    @Test
    public void emptyEndDoesNotEmitRow() throws Exception {
        WorkbookBuilder builder = new WorkbookBuilder();
        builder.sheet("Data").cell(Biff.rk(0, 0, 0, 1));
        TraversalFixture fixture = new TraversalFixture(builder);
        RowAssembler assembler = new RowAssembler(fixture.stream, fixture.sheet,
                new CellValueDecoder(fixture.globals, fixture.stream), sink);

        TraversalState state = TraversalState.indexed(fixture.sheet.getIndex().getBlockAddresses());
        state.setNextCellOffset(IndexedTraversalStrategy.locateFirstCell(fixture.stream, state.nextBlockAddress()));
        assertEquals(RowAssembler.RowEnd.BLOCK_END, assembler.assembleRow(state));

        // past the DBCELL only WINDOW2 and EOF remain
        assertEquals(RowAssembler.RowEnd.SHEET_END, assembler.assembleRow(state));
        assertEquals(1, state.getDepth());
        assertEquals(1, emitted.size());
    }
}
