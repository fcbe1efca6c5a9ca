package com.catmepim.converter.xls.exception;

import java.io.IOException;

/**
 * Base class for problems found while parsing a BIFF record stream.
 * Subclasses distinguish the error kinds the reader treats differently.
 */
public class BiffFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message The detail message
     */
    public BiffFormatException(String message) {
        super(message);
    }

    /**
     * @param message The detail message
     * @param cause The cause
     */
    public BiffFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
