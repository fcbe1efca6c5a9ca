package com.catmepim.converter.xls.core.writers;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.cell.CellValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

public class CellValueRendererTest {

    private final CellValueRenderer renderer = new CellValueRenderer(DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    @Test
    public void numbersArePlainDecimals() {
        assertEquals("0", CellValueRenderer.formatNumber(0.0));
        assertEquals("1", CellValueRenderer.formatNumber(1.0));
        assertEquals("12345678901", CellValueRenderer.formatNumber(1.2345678901E10));
        assertEquals("0.000001", CellValueRenderer.formatNumber(1.0E-6));
        assertEquals("42", CellValueRenderer.formatNumber(Integer.valueOf(42)));
    }

    @Test
    public void textForms() {
        assertEquals("", renderer.asText(null));
        assertEquals("true", renderer.asText(CellValue.ofBoolean(true)));
        assertEquals("2.5", renderer.asText(CellValue.ofNumber(2.5)));
        assertEquals("2014-01-01T08:30:00", renderer.asText(CellValue.ofDate(LocalDateTime.of(2014, 1, 1, 8, 30))));
        assertEquals("x", renderer.asText(CellValue.ofText("x").withHyperlink("http://example.com/")));
    }

    @Test
    public void jsonTokens() throws Exception {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = new JsonFactory().createGenerator(out)) {
            generator.writeStartArray();
            renderer.writeJson(generator, null);
            renderer.writeJson(generator, CellValue.ofNumber(3.0));
            renderer.writeJson(generator, CellValue.ofBoolean(false));
            renderer.writeJson(generator, CellValue.ofText("a").withHyperlink("http://example.com/"));
            generator.writeEndArray();
        }
        assertEquals("[null,3,false,{\"value\":\"a\",\"hyperlink\":\"http://example.com/\"}]", out.toString());
    }
}
