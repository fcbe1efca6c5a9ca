package com.catmepim.converter.xls.core.biff;

/**
 * Truncation policy of a {@link BiffRecordStream}, fixed at construction.
 */
public enum ReadMode {
    /** A record extending past the end of the stream is a fatal error. */
    STRICT,
    /**
     * A record extending past the end of the stream is cut to the remaining bytes.
     * Some report generators write such files.
     */
    LOOSE
}
