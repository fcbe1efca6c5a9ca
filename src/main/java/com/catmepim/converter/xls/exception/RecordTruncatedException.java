package com.catmepim.converter.xls.exception;

/**
 * Thrown in strict read mode when a record declares more payload bytes than the stream
 * has left.
 */
public class RecordTruncatedException extends BiffFormatException {

    private static final long serialVersionUID = 1L;

    private final int offset;
    private final int declaredLength;
    private final int availableLength;

    /**
     * @param offset stream offset of the record header
     * @param declaredLength payload length declared in the header
     * @param availableLength payload bytes actually left in the stream
     */
    public RecordTruncatedException(int offset, int declaredLength, int availableLength) {
        super(String.format("Record at offset %d declares %d payload bytes but only %d remain",
                offset, declaredLength, availableLength));
        this.offset = offset;
        this.declaredLength = declaredLength;
        this.availableLength = availableLength;
    }

    public int getOffset() {
        return offset;
    }

    public int getDeclaredLength() {
        return declaredLength;
    }

    public int getAvailableLength() {
        return availableLength;
    }
}
