package com.catmepim.converter.xls.core.cell;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Typed value of one cell, with an optional hyperlink target.
 * <p>
 * Numbers keep the Java type of their source record: {@link Integer} for INTEGER records,
 * {@link Double} for everything else. {@link Kind#DATE} values are only produced by
 * {@link DateReclassifier}.
 */
public final class CellValue {

    public enum Kind {
        BOOLEAN,
        NUMBER,
        TEXT,
        DATE
    }

    private final Kind kind;
    private final Object value;
    private final String hyperlink;

    private CellValue(Kind kind, Object value, String hyperlink) {
        this.kind = kind;
        this.value = value;
        this.hyperlink = hyperlink;
    }

    public static CellValue ofBoolean(boolean value) {
        return new CellValue(Kind.BOOLEAN, value, null);
    }

    public static CellValue ofNumber(Number value) {
        return new CellValue(Kind.NUMBER, Objects.requireNonNull(value, "value"), null);
    }

    public static CellValue ofText(String value) {
        return new CellValue(Kind.TEXT, Objects.requireNonNull(value, "value"), null);
    }

    public static CellValue ofDate(LocalDateTime value) {
        return new CellValue(Kind.DATE, Objects.requireNonNull(value, "value"), null);
    }

    /**
     * @return a copy of this value carrying the given hyperlink target
     */
    public CellValue withHyperlink(String target) {
        return new CellValue(kind, value, target);
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public boolean getBoolean() {
        return (Boolean) value;
    }

    public Number getNumber() {
        return (Number) value;
    }

    public String getText() {
        return (String) value;
    }

    public LocalDateTime getDate() {
        return (LocalDateTime) value;
    }

    public String getHyperlink() {
        return hyperlink;
    }

    public boolean hasHyperlink() {
        return hyperlink != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return kind == other.kind && value.equals(other.value) && Objects.equals(hyperlink, other.hyperlink);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, hyperlink);
    }

    @Override
    public String toString() {
        return kind + ":" + value + (hyperlink != null ? " -> " + hyperlink : "");
    }
}
