package com.catmepim.converter.xls.core.globals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Materialized shared-string pool. Label cells refer to entries by zero-based index.
 */
public final class SharedStringTable {

    public static final SharedStringTable EMPTY = new SharedStringTable(0, Collections.<String>emptyList());

    private final long declaredTotal;
    private final List<String> strings;

    SharedStringTable(long declaredTotal, List<String> strings) {
        this.declaredTotal = declaredTotal;
        this.strings = Collections.unmodifiableList(new ArrayList<>(strings));
    }

    /**
     * @return the string at {@code index}, or {@code null} when the index is out of range
     */
    public String get(int index) {
        if (index < 0 || index >= strings.size()) {
            return null;
        }
        return strings.get(index);
    }

    public int size() {
        return strings.size();
    }

    /**
     * @return total number of label references the workbook declares (not unique strings)
     */
    public long getDeclaredTotal() {
        return declaredTotal;
    }
}
