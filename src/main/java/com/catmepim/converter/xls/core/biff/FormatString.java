package com.catmepim.converter.xls.core.biff;

/**
 * Decoded FORMAT record: a number format code and its pattern.
 */
public final class FormatString {

    private final int code;
    private final String pattern;

    public FormatString(int code, String pattern) {
        this.code = code;
        this.pattern = pattern;
    }

    public int getCode() {
        return code;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return code + "=" + pattern;
    }
}
