package com.catmepim.converter.xls.core.cell;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.DateUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.globals.WorkbookGlobals;

/**
 * Decides whether a numeric cell value is really a date, based on the number format its
 * extended format (XF) record points to.
 * <p>
 * The format code is read from the XF record in the layout of its BIFF version. BIFF3 and
 * BIFF4 XFs, and BIFF5/8 XFs, carry a "number format is set" attribute bit; when it is clear
 * the value stays a plain number. An XF index past the end of the XF list is taken as the
 * format code itself.
 *
 * @invariant Values are never changed except into a date, or into text for the "@" format.
 */
public class DateReclassifier {

    private static final Logger logger = LoggerFactory.getLogger(DateReclassifier.class);

    /** Result of {@link #resolveFormatCode(int)} when the XF does not set a number format. */
    static final int NO_FORMAT = -1;

    private static final int ATTR_NUMBER_FORMAT = 0x04;

    private final List<BiffRecord> extendedFormats;
    private final Map<Integer, String> customFormats;
    private final boolean v8;
    private final boolean date1904;

    public DateReclassifier(WorkbookGlobals globals) {
        this(globals.getExtendedFormats(), globals.getCustomFormats(), globals.isV8(), globals.isDate1904());
    }

    public DateReclassifier(List<BiffRecord> extendedFormats, Map<Integer, String> customFormats,
                            boolean v8, boolean date1904) {
        this.extendedFormats = extendedFormats;
        this.customFormats = customFormats;
        this.v8 = v8;
        this.date1904 = date1904;
    }

    /**
     * @return the number format code for an XF index, or {@link #NO_FORMAT}
     */
    int resolveFormatCode(int xfIndex) {
        if (xfIndex < 0 || xfIndex >= extendedFormats.size()) {
            return xfIndex;
        }
        BiffRecord xf = extendedFormats.get(xfIndex);
        switch (xf.getType()) {
            case XF_V2:
                return xf.getUByte(2) & 0x3F;
            case XF_V3:
                if ((xf.getUByte(3) & ATTR_NUMBER_FORMAT) == 0) {
                    return NO_FORMAT;
                }
                return xf.getUByte(1);
            case XF_V4:
                if ((xf.getUByte(5) & ATTR_NUMBER_FORMAT) == 0) {
                    return NO_FORMAT;
                }
                return xf.getUByte(1);
            default:
                if ((xf.getUByte(v8 ? 9 : 7) & ATTR_NUMBER_FORMAT) == 0) {
                    return NO_FORMAT;
                }
                return xf.getUShort(2);
        }
    }

    /**
     * @param value the decoded number
     * @param xfIndex the cell's extended format index
     * @return a DATE value, a TEXT value for the "@" format, or the number unchanged
     */
    public CellValue reclassify(Number value, int xfIndex) {
        int code = resolveFormatCode(xfIndex);
        if (code == NO_FORMAT) {
            return CellValue.ofNumber(value);
        }
        BuiltinFormatTable.Category category = BuiltinFormatTable.lookup(code);
        if (category == null) {
            String pattern = customFormats.get(code);
            if (pattern == null) {
                logger.trace("Format code {} of XF {} is neither builtin nor declared", code, xfIndex);
                return CellValue.ofNumber(value);
            }
            category = DateUtil.isADateFormat(code, pattern)
                    ? BuiltinFormatTable.Category.DATE
                    : BuiltinFormatTable.Category.NUMERIC;
        }

        switch (category) {
            case DATE:
                return toDate(value);
            case TEXT:
                return CellValue.ofText(toPlainString(value));
            default:
                return CellValue.ofNumber(value);
        }
    }

    /**
     * Variant for values that arrive as text. Text that does not parse as a number comes
     * back unchanged.
     */
    public CellValue reclassify(String text, int xfIndex) {
        double parsed;
        try {
            parsed = Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return CellValue.ofText(text);
        }
        return reclassify(parsed, xfIndex);
    }

    private CellValue toDate(Number value) {
        LocalDateTime date = DateUtil.getLocalDateTime(value.doubleValue(), date1904);
        if (date == null) {
            logger.trace("Serial {} is outside the date range, keeping the number", value);
            return CellValue.ofNumber(value);
        }
        return CellValue.ofDate(date);
    }

    private static String toPlainString(Number value) {
        double d = value.doubleValue();
        if (value instanceof Integer || Double.isNaN(d) || Double.isInfinite(d)) {
            return value.toString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
