package com.catmepim.converter.xls.core.globals;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.BofInfo;
import com.catmepim.converter.xls.core.biff.Dimensions;
import com.catmepim.converter.xls.core.biff.HyperlinkRange;
import com.catmepim.converter.xls.core.biff.RecordType;
import com.catmepim.converter.xls.core.biff.RowInfo;
import com.catmepim.converter.xls.core.biff.SheetIndex;
import com.catmepim.converter.xls.core.biff.SheetRecordDecoder;
import com.catmepim.converter.xls.core.biff.WorkbookRecordDecoder;
import com.catmepim.converter.xls.exception.BiffFormatException;

/**
 * Reads the header records of one worksheet: BOF, optional INDEX, DIMENSIONS, the first ROW
 * and the run of HLINK records.
 * <p>
 * Extents are resolved in this order:
 * <ol>
 *   <li>DIMENSIONS gives both bounds; a non-positive column bound is replaced by the first
 *       ROW's last column.</li>
 *   <li>Without DIMENSIONS the width is {@value #DEFAULT_MAX_COL} columns and the height comes
 *       from the INDEX, or is {@value #DEFAULT_MAX_ROW} rows when there is no INDEX either.</li>
 * </ol>
 */
public class WorksheetGlobalsLoader {

    private static final Logger logger = LoggerFactory.getLogger(WorksheetGlobalsLoader.class);

    static final int DEFAULT_MAX_COL = 256;
    static final int DEFAULT_MAX_ROW = 65536;

    /**
     * Record layouts follow the BIFF version the sheet was declared with.
     *
     * @return the sheet's globals, or {@code null} if the sheet is empty or unreadable and
     *         must be skipped
     * @throws BiffFormatException on a truncated record in strict mode
     */
    public WorksheetGlobals load(BiffRecordStream stream, Worksheet sheet) throws BiffFormatException {
        stream.seek(sheet.getDataOffset());
        boolean v8 = sheet.isV8();

        BiffRecord bofRecord = stream.readNext();
        if (bofRecord == null || !bofRecord.getType().isBof()) {
            return skip(sheet, "no BOF record at offset " + sheet.getDataOffset());
        }
        BofInfo bof = WorkbookRecordDecoder.bof(bofRecord);
        if (!bof.isWorksheet()) {
            return skip(sheet, "substream is not a worksheet (" + bof + ")");
        }

        SheetIndex index = readIndex(stream, v8);

        Dimensions dimensions = null;
        RowInfo firstRow = null;
        BiffRecord record;
        while ((record = stream.readNext()) != null && record.getType() != RecordType.EOF) {
            if (record.getType() == RecordType.DIMENSIONS) {
                dimensions = SheetRecordDecoder.dimensions(record, v8);
                break;
            }
            if (record.getType() == RecordType.ROW) {
                firstRow = SheetRecordDecoder.row(record);
                break;
            }
        }
        if (firstRow == null && dimensions != null) {
            while ((record = stream.readNext()) != null && record.getType() != RecordType.EOF) {
                if (record.getType() == RecordType.ROW) {
                    firstRow = SheetRecordDecoder.row(record);
                    break;
                }
            }
        }

        int maxCol;
        int maxRow;
        if (dimensions != null) {
            maxCol = dimensions.getLastColumn();
            if (maxCol <= 0 && firstRow != null) {
                maxCol = firstRow.getLastColumn();
            }
            maxRow = dimensions.getLastRow();
        } else {
            maxCol = DEFAULT_MAX_COL;
            maxRow = index != null ? index.getLastRow() : DEFAULT_MAX_ROW;
        }

        if (index != null && index.isEmptyRange()) {
            return skip(sheet, "index reports an empty row range " + index);
        }
        if (firstRow == null) {
            return skip(sheet, "no ROW record");
        }
        if (maxRow <= 0 || maxCol <= 0) {
            return skip(sheet, "empty extents (" + maxRow + " rows, " + maxCol + " columns)");
        }

        HyperlinkIndex hyperlinks = readHyperlinks(stream);
        logger.debug("Sheet '{}': maxRow={}, maxCol={}, index={}, first row={}, {} hyperlink(s)",
                sheet.getName(), maxRow, maxCol, index, firstRow, hyperlinks.size());
        return new WorksheetGlobals(sheet, maxRow, maxCol, index, dimensions, firstRow, hyperlinks);
    }

    /**
     * Consumes an INDEX record directly after the BOF, optionally preceded by UNCALCED.
     * Anything else is left in place.
     */
    private static SheetIndex readIndex(BiffRecordStream stream, boolean v8) throws BiffFormatException {
        BiffRecord record = stream.readNext();
        if (record == null) {
            return null;
        }
        if (record.getType() == RecordType.INDEX) {
            return SheetRecordDecoder.index(record, v8);
        }
        if (record.getType() == RecordType.UNCALCED) {
            BiffRecord next = stream.readNext();
            if (next != null && next.getType() == RecordType.INDEX) {
                return SheetRecordDecoder.index(next, v8);
            }
            if (next != null) {
                stream.seek(next.getOffset());
            }
            return null;
        }
        stream.seek(record.getOffset());
        return null;
    }

    /**
     * Collects the contiguous run of HLINK records (tooltips included) that follows the cell
     * data. Scanning stops at the first other record after the run, or at the sheet's EOF.
     */
    private HyperlinkIndex readHyperlinks(BiffRecordStream stream) throws BiffFormatException {
        List<HyperlinkRange> ranges = new ArrayList<>();
        boolean inRun = false;
        BiffRecord record;
        while ((record = stream.readNext()) != null && record.getType() != RecordType.EOF) {
            if (record.getType() == RecordType.HLINK) {
                inRun = true;
                HyperlinkRange range = SheetRecordDecoder.hyperlink(record);
                if (range.getTarget() != null) {
                    ranges.add(range);
                } else {
                    logger.debug("Ignoring {} at offset {}: no readable target", range, record.getOffset());
                }
            } else if (inRun && record.getType() != RecordType.HLINKTOOLTIP) {
                break;
            }
        }
        return ranges.isEmpty() ? HyperlinkIndex.EMPTY : new HyperlinkIndex(ranges);
    }

    private static WorksheetGlobals skip(Worksheet sheet, String reason) {
        logger.info("Skipping sheet '{}': {}", sheet.getName(), reason);
        return null;
    }
}
