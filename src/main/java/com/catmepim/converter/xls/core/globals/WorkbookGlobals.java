package com.catmepim.converter.xls.core.globals;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BofInfo;

/**
 * Workbook-wide metadata gathered from the globals substream.
 * <p>
 * Created by {@link WorkbookGlobalsLoader} after the globals EOF record, at which point the
 * shared-string table is complete. Read-only afterwards.
 */
public final class WorkbookGlobals {

    /** Encoding used for byte strings when the workbook has no resolvable CODEPAGE record. */
    public static final Charset DEFAULT_ENCODING = Charset.forName("windows-1252");

    private final int biffVersion;
    private final List<Worksheet> worksheets;
    private final SharedStringTable sharedStrings;
    private final List<BiffRecord> extendedFormats;
    private final Map<Integer, String> customFormats;
    private final int fontCount;
    private final Charset encoding;
    private final boolean date1904;

    WorkbookGlobals(int biffVersion, List<Worksheet> worksheets, SharedStringTable sharedStrings,
                    List<BiffRecord> extendedFormats, Map<Integer, String> customFormats,
                    int fontCount, Charset encoding, boolean date1904) {
        this.biffVersion = biffVersion;
        this.worksheets = Collections.unmodifiableList(new ArrayList<>(worksheets));
        this.sharedStrings = sharedStrings;
        this.extendedFormats = Collections.unmodifiableList(new ArrayList<>(extendedFormats));
        this.customFormats = Collections.unmodifiableMap(new HashMap<>(customFormats));
        this.fontCount = fontCount;
        this.encoding = encoding;
        this.date1904 = date1904;
    }

    public boolean isV8() {
        return biffVersion >= BofInfo.VERSION_BIFF8;
    }

    public List<Worksheet> getWorksheets() {
        return worksheets;
    }

    public SharedStringTable getSharedStrings() {
        return sharedStrings;
    }

    /**
     * @return XF records in stream order; a cell's XF index is a position in this list
     */
    public List<BiffRecord> getExtendedFormats() {
        return extendedFormats;
    }

    /**
     * @return custom number formats keyed by format code
     */
    public Map<Integer, String> getCustomFormats() {
        return customFormats;
    }

    public int getFontCount() {
        return fontCount;
    }

    public Charset getEncoding() {
        return encoding;
    }

    /**
     * @return true if date serials count from 1904-01-01 instead of 1900-01-01
     */
    public boolean isDate1904() {
        return date1904;
    }
}
