package com.catmepim.converter.xls.strategy;

import com.catmepim.converter.xls.core.biff.RowInfo;

/**
 * Cursor of one worksheet traversal. Created fresh for every traversal and never shared.
 *
 * @invariant depth never decreases
 */
public final class TraversalState {

    public enum Mode {
        INDEXED,
        SEQUENTIAL
    }

    private final Mode mode;
    private final int[] blockAddresses;
    private int blockCursor;
    private RowInfo currentRow;
    private int depth;
    private int nextCellOffset;

    private TraversalState(Mode mode, int[] blockAddresses, RowInfo currentRow) {
        this.mode = mode;
        this.blockAddresses = blockAddresses;
        this.currentRow = currentRow;
    }

    public static TraversalState indexed(int[] blockAddresses) {
        return new TraversalState(Mode.INDEXED, blockAddresses.clone(), null);
    }

    public static TraversalState sequential(RowInfo firstRow) {
        return new TraversalState(Mode.SEQUENTIAL, new int[0], firstRow);
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * @return index of the row being assembled, which is also the number of rows emitted so far
     */
    public int getDepth() {
        return depth;
    }

    void advanceDepth() {
        depth++;
    }

    public int getNextCellOffset() {
        return nextCellOffset;
    }

    void setNextCellOffset(int nextCellOffset) {
        this.nextCellOffset = nextCellOffset;
    }

    boolean hasNextBlock() {
        return blockCursor < blockAddresses.length;
    }

    int nextBlockAddress() {
        return blockAddresses[blockCursor++];
    }

    int getBlockCursor() {
        return blockCursor;
    }

    RowInfo getCurrentRow() {
        return currentRow;
    }

    void setCurrentRow(RowInfo currentRow) {
        this.currentRow = currentRow;
    }
}
