package com.catmepim.converter.xls.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.catmepim.converter.xls.core.cell.CellValue;

/**
 * The extracted contents of one worksheet: named columns "0", "1", ... and positional rows.
 *
 * @invariant every row has exactly {@code getColumnCount()} slots
 */
public final class SheetTable {

    private final String name;
    private final int sheetIndex;
    private final List<String> columnNames;
    private final List<CellValue[]> rows;

    public SheetTable(String name, int sheetIndex, int columnCount, List<CellValue[]> rows) {
        this.name = name;
        this.sheetIndex = sheetIndex;
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            columns.add(Integer.toString(i));
        }
        this.columnNames = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getName() {
        return name;
    }

    /**
     * @return position of the worksheet among the workbook's worksheets
     */
    public int getSheetIndex() {
        return sheetIndex;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<CellValue[]> getRows() {
        return rows;
    }

    /**
     * @return the cell value, or {@code null} for an empty cell
     */
    public CellValue getValue(int row, int column) {
        return rows.get(row)[column];
    }

    @Override
    public String toString() {
        return "SheetTable{'" + name + "', " + getRowCount() + " x " + getColumnCount() + "}";
    }
}
