package com.catmepim.converter.xls.core.globals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.catmepim.converter.xls.core.biff.HyperlinkRange;

/**
 * Lookup from cell position to hyperlink target for one worksheet. When ranges overlap the
 * first one recorded wins.
 */
public final class HyperlinkIndex {

    public static final HyperlinkIndex EMPTY = new HyperlinkIndex(Collections.<HyperlinkRange>emptyList());

    private final List<HyperlinkRange> ranges;

    public HyperlinkIndex(List<HyperlinkRange> ranges) {
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    /**
     * @return the target covering the cell, or {@code null}
     */
    public String lookup(int row, int column) {
        for (HyperlinkRange range : ranges) {
            if (range.contains(row, column)) {
                return range.getTarget();
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public int size() {
        return ranges.size();
    }
}
