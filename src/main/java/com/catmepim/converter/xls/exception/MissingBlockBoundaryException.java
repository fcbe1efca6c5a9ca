package com.catmepim.converter.xls.exception;

/**
 * Thrown when a worksheet's INDEX record lists a block address but no DBCELL record can be
 * found from that address onward.
 */
public class MissingBlockBoundaryException extends BiffFormatException {

    private static final long serialVersionUID = 1L;

    private final long blockAddress;

    public MissingBlockBoundaryException(long blockAddress) {
        super("Badly formed binary file: INDEX lists block address " + blockAddress
                + " but no DBCELL record follows it");
        this.blockAddress = blockAddress;
    }

    public long getBlockAddress() {
        return blockAddress;
    }
}
