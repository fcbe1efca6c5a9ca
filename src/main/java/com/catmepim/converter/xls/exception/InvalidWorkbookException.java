package com.catmepim.converter.xls.exception;

/**
 * Thrown when the workbook cannot be read at all: the container is not OLE2, the
 * workbook stream is missing or is not a stream, the globals header is missing or of the
 * wrong kind, or the workbook is encrypted.
 * <p>
 * The reader becomes permanently invalid after this error.
 */
public class InvalidWorkbookException extends BiffFormatException {

    private static final long serialVersionUID = 1L;

    public InvalidWorkbookException(String message) {
        super(message);
    }

    public InvalidWorkbookException(String message, Throwable cause) {
        super(message, cause);
    }
}
