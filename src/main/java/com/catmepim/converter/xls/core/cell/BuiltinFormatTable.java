package com.catmepim.converter.xls.core.cell;

/**
 * Classification of the number format codes every workbook has without declaring them.
 * Codes not listed here must be resolved through the workbook's FORMAT records.
 */
public final class BuiltinFormatTable {

    public enum Category {
        /** General, fixed, currency, percent, scientific and fraction styles. */
        NUMERIC,
        /** Date, time and duration styles. */
        DATE,
        /** The "@" text style. */
        TEXT
    }

    static final int TEXT_FORMAT = 49;

    private BuiltinFormatTable() {
    }

    /**
     * @return the category of a builtin code, or {@code null} for codes that are not builtin
     */
    public static Category lookup(int code) {
        if ((code >= 0 && code <= 13) || (code >= 37 && code <= 44) || code == 48) {
            return Category.NUMERIC;
        }
        if ((code >= 14 && code <= 22) || (code >= 45 && code <= 47)) {
            return Category.DATE;
        }
        if (code == TEXT_FORMAT) {
            return Category.TEXT;
        }
        return null;
    }
}
