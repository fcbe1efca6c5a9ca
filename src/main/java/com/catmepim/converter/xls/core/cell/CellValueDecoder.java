package com.catmepim.converter.xls.core.cell;

import java.nio.charset.Charset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.CellRecordDecoder;
import com.catmepim.converter.xls.core.biff.FormulaResult;
import com.catmepim.converter.xls.core.globals.HyperlinkIndex;
import com.catmepim.converter.xls.core.globals.SharedStringTable;
import com.catmepim.converter.xls.core.globals.WorkbookGlobals;
import com.catmepim.converter.xls.exception.BiffFormatException;

/**
 * Turns one cell record into values in the row buffer.
 * <p>
 * Blank records, error values and unknown record kinds leave their column empty. Numeric
 * values go through the {@link DateReclassifier} with the XF index of the cell they come
 * from. A value whose cell lies inside a hyperlink range carries that link's target.
 */
public class CellValueDecoder {

    private static final Logger logger = LoggerFactory.getLogger(CellValueDecoder.class);

    private final BiffRecordStream stream;
    private final SharedStringTable sharedStrings;
    private final DateReclassifier reclassifier;
    private final boolean v8;
    private final Charset encoding;

    public CellValueDecoder(WorkbookGlobals globals, BiffRecordStream stream) {
        this(stream, globals.getSharedStrings(), new DateReclassifier(globals), globals.isV8(), globals.getEncoding());
    }

    public CellValueDecoder(BiffRecordStream stream, SharedStringTable sharedStrings, DateReclassifier reclassifier,
                            boolean v8, Charset encoding) {
        this.stream = stream;
        this.sharedStrings = sharedStrings;
        this.reclassifier = reclassifier;
        this.v8 = v8;
        this.encoding = encoding;
    }

    /**
     * Decodes {@code record} into {@code row}.
     *
     * @pre record.isCell()
     * @throws BiffFormatException if reading a formula's STRING record fails in strict mode
     */
    public void decode(BiffRecord record, RowBuffer row, HyperlinkIndex hyperlinks) throws BiffFormatException {
        int rowIndex = CellRecordDecoder.rowIndex(record);
        int column = CellRecordDecoder.columnIndex(record);

        switch (record.getType()) {
            case BOOLERR:
            case BOOLERR_OLD:
                if (CellRecordDecoder.isErrorValue(record)) {
                    logger.trace("Error value at ({}, {}) suppressed", rowIndex, column);
                    return;
                }
                put(row, hyperlinks, rowIndex, column, CellValue.ofBoolean(CellRecordDecoder.booleanValue(record)));
                return;
            case INTEGER:
            case INTEGER_OLD:
                put(row, hyperlinks, rowIndex, column, reclassifier.reclassify(
                        Integer.valueOf(CellRecordDecoder.integerValue(record)), CellRecordDecoder.xfIndex(record)));
                return;
            case NUMBER:
            case NUMBER_OLD:
                put(row, hyperlinks, rowIndex, column, reclassifier.reclassify(
                        Double.valueOf(CellRecordDecoder.numberValue(record)), CellRecordDecoder.xfIndex(record)));
                return;
            case LABEL:
            case LABEL_OLD:
            case RSTRING:
                put(row, hyperlinks, rowIndex, column, CellValue.ofText(CellRecordDecoder.labelText(record, v8, encoding)));
                return;
            case LABELSST: {
                int index = CellRecordDecoder.sstIndex(record);
                String text = sharedStrings.get(index);
                if (text == null) {
                    logger.trace("Shared string {} at ({}, {}) out of range ({} strings)",
                            index, rowIndex, column, sharedStrings.size());
                    return;
                }
                put(row, hyperlinks, rowIndex, column, CellValue.ofText(text));
                return;
            }
            case RK:
                put(row, hyperlinks, rowIndex, column, reclassifier.reclassify(
                        Double.valueOf(CellRecordDecoder.rkValue(record)), CellRecordDecoder.xfIndex(record)));
                return;
            case MULRK: {
                int count = CellRecordDecoder.mulRkCount(record);
                for (int i = 0; i < count && column + i < row.width(); i++) {
                    put(row, hyperlinks, rowIndex, column + i, reclassifier.reclassify(
                            Double.valueOf(CellRecordDecoder.mulRkValue(record, i)),
                            CellRecordDecoder.mulRkXfIndex(record, i)));
                }
                return;
            }
            case FORMULA:
            case FORMULA_OLD:
                decodeFormula(record, row, hyperlinks, rowIndex, column);
                return;
            case BLANK:
            case BLANK_OLD:
            case MULBLANK:
                return;
            default:
                logger.trace("No value for {} at ({}, {})", record, rowIndex, column);
        }
    }

    private void decodeFormula(BiffRecord record, RowBuffer row, HyperlinkIndex hyperlinks,
                               int rowIndex, int column) throws BiffFormatException {
        FormulaResult result = CellRecordDecoder.formulaResult(record);
        switch (result.getKind()) {
            case NUMBER:
                put(row, hyperlinks, rowIndex, column, reclassifier.reclassify(
                        Double.valueOf(result.getNumber()), CellRecordDecoder.xfIndex(record)));
                break;
            case BOOLEAN:
                put(row, hyperlinks, rowIndex, column, CellValue.ofBoolean(result.getBoolean()));
                break;
            case EMPTY_STRING:
                put(row, hyperlinks, rowIndex, column, CellValue.ofText(""));
                break;
            case STRING: {
                String text = findStringResult(record);
                if (text != null) {
                    put(row, hyperlinks, rowIndex, column, CellValue.ofText(text));
                } else {
                    logger.trace("Formula at ({}, {}) has no STRING record", rowIndex, column);
                }
                break;
            }
            default:
                logger.trace("Formula error 0x{} at ({}, {}) suppressed",
                        Integer.toHexString(result.getErrorCode()), rowIndex, column);
        }
    }

    /**
     * Peeks past the formula for the STRING record holding its text result. Shared-formula,
     * array and table records may sit in between.
     */
    private String findStringResult(BiffRecord formula) throws BiffFormatException {
        int offset = formula.getEndOffset();
        BiffRecord next;
        while ((next = stream.readAt(offset)) != null) {
            switch (next.getType()) {
                case SHRFMLA:
                case ARRAY:
                case TABLE:
                    offset = next.getEndOffset();
                    break;
                case STRING:
                case STRING_OLD:
                    return CellRecordDecoder.stringResultText(next, v8, encoding);
                default:
                    return null;
            }
        }
        return null;
    }

    private static void put(RowBuffer row, HyperlinkIndex hyperlinks, int rowIndex, int column, CellValue value) {
        String target = hyperlinks.lookup(rowIndex, column);
        row.set(column, target != null ? value.withHyperlink(target) : value);
    }
}
