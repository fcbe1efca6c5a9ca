package com.catmepim.converter.xls.core;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.cell.CellValue;

/**
 * Collects traversal output into a {@link SheetTable}.
 */
public class SheetTableBuilder implements RowSink {

    private static final Logger logger = LoggerFactory.getLogger(SheetTableBuilder.class);

    private final String name;
    private final int sheetIndex;
    private final int columnCount;
    private final List<CellValue[]> rows = new ArrayList<>();

    public SheetTableBuilder(String name, int sheetIndex, int columnCount) {
        this.name = name;
        this.sheetIndex = sheetIndex;
        this.columnCount = columnCount;
    }

    @Override
    public void acceptRow(int rowIndex, CellValue[] values) {
        if (rowIndex != rows.size()) {
            logger.warn("Sheet '{}': row {} arrived at position {}", name, rowIndex, rows.size());
        }
        rows.add(values);
    }

    public int getRowCount() {
        return rows.size();
    }

    public SheetTable build() {
        return new SheetTable(name, sheetIndex, columnCount, rows);
    }
}
