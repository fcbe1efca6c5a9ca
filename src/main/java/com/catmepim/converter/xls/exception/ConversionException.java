package com.catmepim.converter.xls.exception;

/**
 * Failure at the application boundary of the LegacyXlsConverter: the workbook could not be
 * read, the requested sheet does not exist, or an output file could not be produced.
 * <p>
 * Parse-level problems inside the reading engine are reported through
 * {@link BiffFormatException} and its subclasses; the exporter wraps them in this exception.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
