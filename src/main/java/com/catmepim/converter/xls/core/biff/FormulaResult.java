package com.catmepim.converter.xls.core.biff;

/**
 * Cached result of a FORMULA record.
 */
public final class FormulaResult {

    public enum Kind {
        NUMBER,
        /** Text is stored in the STRING record that follows the formula. */
        STRING,
        BOOLEAN,
        ERROR,
        EMPTY_STRING
    }

    private final Kind kind;
    private final double number;
    private final int code;

    private FormulaResult(Kind kind, double number, int code) {
        this.kind = kind;
        this.number = number;
        this.code = code;
    }

    public static FormulaResult number(double value) {
        return new FormulaResult(Kind.NUMBER, value, 0);
    }

    public static FormulaResult special(Kind kind, int code) {
        return new FormulaResult(kind, 0d, code);
    }

    public Kind getKind() {
        return kind;
    }

    public double getNumber() {
        return number;
    }

    /**
     * @return true for a boolean result of TRUE
     */
    public boolean getBoolean() {
        return code != 0;
    }

    /**
     * @return the error code of an ERROR result
     */
    public int getErrorCode() {
        return code;
    }
}
