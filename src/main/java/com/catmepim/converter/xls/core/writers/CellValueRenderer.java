package com.catmepim.converter.xls.core.writers;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;

import com.catmepim.converter.xls.core.cell.CellValue;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Renders cell values for the writers: as text for CSV, as JSON tokens for JSON and NDJSON.
 * Numbers are written as plain decimals without exponent or trailing zeros.
 */
public class CellValueRenderer {

    private final DateTimeFormatter dateFormatter;

    public CellValueRenderer(DateTimeFormatter dateFormatter) {
        this.dateFormatter = dateFormatter;
    }

    /**
     * @return the text form of the value, or an empty string for an empty cell
     */
    public String asText(CellValue value) {
        if (value == null) {
            return "";
        }
        switch (value.getKind()) {
            case BOOLEAN:
                return Boolean.toString(value.getBoolean());
            case NUMBER:
                return formatNumber(value.getNumber());
            case DATE:
                return dateFormatter.format(value.getDate());
            default:
                return value.getText();
        }
    }

    /**
     * Writes the value as a JSON token. A hyperlinked value becomes
     * {@code {"value": ..., "hyperlink": "..."}}.
     */
    public void writeJson(JsonGenerator generator, CellValue value) throws IOException {
        if (value == null) {
            generator.writeNull();
            return;
        }
        if (value.hasHyperlink()) {
            generator.writeStartObject();
            generator.writeFieldName("value");
            writeScalar(generator, value);
            generator.writeStringField("hyperlink", value.getHyperlink());
            generator.writeEndObject();
            return;
        }
        writeScalar(generator, value);
    }

    private void writeScalar(JsonGenerator generator, CellValue value) throws IOException {
        switch (value.getKind()) {
            case BOOLEAN:
                generator.writeBoolean(value.getBoolean());
                break;
            case NUMBER: {
                double d = value.getNumber().doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    generator.writeString(Double.toString(d));
                } else {
                    generator.writeNumber(formatNumber(value.getNumber()));
                }
                break;
            }
            case DATE:
                generator.writeString(dateFormatter.format(value.getDate()));
                break;
            default:
                generator.writeString(value.getText());
        }
    }

    static String formatNumber(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return number.toString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == 0d) {
            return "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
