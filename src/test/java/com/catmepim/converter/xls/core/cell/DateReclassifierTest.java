package com.catmepim.converter.xls.core.cell;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.testing.Biff;

public class DateReclassifierTest {

    private static final int XF_GENERAL = 0;
    private static final int XF_DATE = 1;
    private static final int XF_CUSTOM_DATE = 2;
    private static final int XF_TEXT = 3;
    private static final int XF_DATE_ATTRIBUTE_CLEAR = 4;
    private static final int XF_FIXED = 5;
    private static final int XF_CUSTOM_NUMBER = 6;

    private List<BiffRecord> xfs;
    private Map<Integer, String> formats;

    private static BiffRecord xf(int code, boolean set) {
        Biff.Rec rec = Biff.xf(code, set);
        return BiffRecord.of(rec.sid, rec.payload);
    }

    @BeforeEach
    public void setUp() {
        xfs = new ArrayList<>();
        xfs.add(xf(0, false));
        xfs.add(xf(14, true));
        xfs.add(xf(164, true));
        xfs.add(xf(49, true));
        xfs.add(xf(14, false));
        xfs.add(xf(2, true));
        xfs.add(xf(165, true));
        formats = new HashMap<>();
        formats.put(164, "dd/mm/yyyy hh:mm");
        formats.put(165, "#,##0.000");
    }

    @Test
    public void builtinDateFormat() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        CellValue value = reclassifier.reclassify(41640.0, XF_DATE);
        assertEquals(CellValue.Kind.DATE, value.getKind());
        assertEquals(LocalDateTime.of(2014, 1, 1, 0, 0), value.getDate());

        CellValue withTime = reclassifier.reclassify(41640.5, XF_DATE);
        assertEquals(LocalDateTime.of(2014, 1, 1, 12, 0), withTime.getDate());
    }

    @Test
    public void generalFormatKeepsNumber() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(CellValue.ofNumber(41640.0), reclassifier.reclassify(41640.0, XF_GENERAL));
        assertEquals(CellValue.ofNumber(41640.0), reclassifier.reclassify(41640.0, XF_FIXED));
        assertEquals(CellValue.ofNumber(41640.0), reclassifier.reclassify(41640.0, XF_CUSTOM_NUMBER));
    }

    @Test
    public void clearedAttributeBitKeepsNumber() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(DateReclassifier.NO_FORMAT, reclassifier.resolveFormatCode(XF_DATE_ATTRIBUTE_CLEAR));
        assertEquals(CellValue.Kind.NUMBER, reclassifier.reclassify(41640.0, XF_DATE_ATTRIBUTE_CLEAR).getKind());
    }

    @Test
    public void customDateFormat() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        CellValue value = reclassifier.reclassify(41640.25, XF_CUSTOM_DATE);
        assertEquals(LocalDateTime.of(2014, 1, 1, 6, 0), value.getDate());
    }

    @Test
    public void textFormatGivesPlainString() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(CellValue.ofText("41640"), reclassifier.reclassify(41640.0, XF_TEXT));
        assertEquals(CellValue.ofText("0.125"), reclassifier.reclassify(0.125, XF_TEXT));
        assertEquals(CellValue.ofText("7"), reclassifier.reclassify(Integer.valueOf(7), XF_TEXT));
    }

    @Test
    public void indexPastXfListIsTheFormatCode() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(14, reclassifier.resolveFormatCode(14));
        assertEquals(CellValue.Kind.DATE, reclassifier.reclassify(41640.0, 14).getKind());
    }

    @Test
    public void date1904System() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, true);
        assertEquals(LocalDateTime.of(1904, 1, 1, 0, 0), reclassifier.reclassify(0.0, XF_DATE).getDate());
    }

    @Test
    public void serialOutsideDateRangeKeepsNumber() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(CellValue.ofNumber(-5.0), reclassifier.reclassify(-5.0, XF_DATE));
    }

    @Test
    public void textVariant() {
        DateReclassifier reclassifier = new DateReclassifier(xfs, formats, true, false);
        assertEquals(LocalDateTime.of(2014, 1, 1, 0, 0), reclassifier.reclassify("41640", XF_DATE).getDate());
        assertEquals(CellValue.ofText("n/a"), reclassifier.reclassify("n/a", XF_DATE));
    }

    private static BiffRecord rec(Biff.Rec rec) {
        return BiffRecord.of(rec.sid, rec.payload);
    }

    @Test
    public void biff2LayoutMasksFormatBits() {
        List<BiffRecord> v2 = new ArrayList<>();
        v2.add(rec(Biff.xfV2(0)));
        v2.add(rec(Biff.xfV2(14)));
        DateReclassifier reclassifier = new DateReclassifier(v2, formats, false, false);

        assertEquals(0, reclassifier.resolveFormatCode(0));
        assertEquals(14, reclassifier.resolveFormatCode(1));
        assertEquals(LocalDateTime.of(2014, 1, 1, 0, 0), reclassifier.reclassify(41640.0, 1).getDate());
    }

    @Test
    public void biff3LayoutChecksAttributeByteThree() {
        List<BiffRecord> v3 = new ArrayList<>();
        v3.add(rec(Biff.xfV3(14, true)));
        v3.add(rec(Biff.xfV3(14, false)));
        DateReclassifier reclassifier = new DateReclassifier(v3, formats, false, false);

        assertEquals(14, reclassifier.resolveFormatCode(0));
        assertEquals(DateReclassifier.NO_FORMAT, reclassifier.resolveFormatCode(1));
        assertEquals(CellValue.Kind.DATE, reclassifier.reclassify(41640.0, 0).getKind());
        assertEquals(CellValue.ofNumber(41640.0), reclassifier.reclassify(41640.0, 1));
    }

    @Test
    public void biff4LayoutChecksAttributeByteFive() {
        List<BiffRecord> v4 = new ArrayList<>();
        v4.add(rec(Biff.xfV4(164, true)));
        v4.add(rec(Biff.xfV4(164, false)));
        DateReclassifier reclassifier = new DateReclassifier(v4, formats, false, false);

        assertEquals(164, reclassifier.resolveFormatCode(0));
        assertEquals(DateReclassifier.NO_FORMAT, reclassifier.resolveFormatCode(1));
        assertEquals(LocalDateTime.of(2014, 1, 1, 6, 0), reclassifier.reclassify(41640.25, 0).getDate());
    }

    @Test
    public void biff5LayoutChecksAttributeByteSeven() {
        List<BiffRecord> v5 = new ArrayList<>();
        v5.add(rec(Biff.xfV5(14, true)));
        v5.add(rec(Biff.xfV5(14, false)));
        DateReclassifier reclassifier = new DateReclassifier(v5, formats, false, false);

        assertEquals(14, reclassifier.resolveFormatCode(0));
        assertEquals(DateReclassifier.NO_FORMAT, reclassifier.resolveFormatCode(1));

        // the same bytes read with the BIFF8 layout look at byte 9, which is clear
        DateReclassifier asBiff8 = new DateReclassifier(v5, formats, true, false);
        assertEquals(DateReclassifier.NO_FORMAT, asBiff8.resolveFormatCode(0));
    }
}
