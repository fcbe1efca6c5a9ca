package com.catmepim.converter.xls.core.globals;

import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.util.CodePageUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecord;
import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.BofInfo;
import com.catmepim.converter.xls.core.biff.BoundSheetInfo;
import com.catmepim.converter.xls.core.biff.FormatString;
import com.catmepim.converter.xls.core.biff.RecordType;
import com.catmepim.converter.xls.core.biff.WorkbookRecordDecoder;
import com.catmepim.converter.xls.exception.BiffFormatException;
import com.catmepim.converter.xls.exception.InvalidWorkbookException;

/**
 * Parses the workbook globals substream: everything from the first BOF up to its EOF.
 * <p>
 * Collects the worksheet directory, fonts, extended formats, custom number formats, the text
 * encoding, the date system and the shared-string table. Records that carry nothing this
 * reader needs are skipped.
 *
 * @pre The stream holds a complete workbook stream.
 * @post On success the stream cursor rests just after the globals EOF record.
 */
public class WorkbookGlobalsLoader {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookGlobalsLoader.class);

    /**
     * @throws InvalidWorkbookException if the stream does not start with a globals BOF, is
     *         encrypted, or ends before the globals EOF
     * @throws BiffFormatException on a truncated record in strict mode
     */
    public WorkbookGlobals load(BiffRecordStream stream) throws BiffFormatException {
        stream.seek(0);
        BiffRecord first = stream.readNext();
        if (first == null || !first.getType().isBof()) {
            throw new InvalidWorkbookException("Workbook stream does not start with a BOF record");
        }
        BofInfo bof = WorkbookRecordDecoder.bof(first);
        if (!bof.isWorkbookGlobals()) {
            throw new InvalidWorkbookException("First BOF is not a workbook globals header: " + bof);
        }
        boolean v8 = bof.isV8();
        logger.debug("Workbook globals {} (BIFF8: {})", bof, v8);

        List<Worksheet> worksheets = new ArrayList<>();
        List<BiffRecord> extendedFormats = new ArrayList<>();
        Map<Integer, String> customFormats = new HashMap<>();
        SharedStringAccumulator sst = new SharedStringAccumulator();
        Charset encoding = WorkbookGlobals.DEFAULT_ENCODING;
        boolean date1904 = false;
        int fontCount = 0;
        int v23FormatCount = 0;

        while (true) {
            BiffRecord record = stream.readNext();
            if (record == null) {
                throw new InvalidWorkbookException("Workbook globals end without an EOF record");
            }
            if (sst.isOpen() && record.getType() != RecordType.CONTINUE) {
                sst.close();
            }

            switch (record.getType()) {
                case BOUNDSHEET: {
                    BoundSheetInfo info = WorkbookRecordDecoder.boundSheet(record, v8, encoding);
                    if (!info.isWorksheet()) {
                        logger.debug("Skipping non-worksheet sheet '{}' (type {})", info.getName(), info.getSheetType());
                        break;
                    }
                    worksheets.add(new Worksheet(worksheets.size(), info.getName(), info.getDataOffset(), bof.getVersion()));
                    break;
                }
                case CODEPAGE:
                    encoding = resolveEncoding(WorkbookRecordDecoder.codepage(record), encoding);
                    break;
                case DATEMODE:
                    date1904 = WorkbookRecordDecoder.uses1904DateSystem(record);
                    break;
                case FILEPASS:
                    throw new InvalidWorkbookException("Workbook is encrypted (FILEPASS record present)");
                case FONT:
                case FONT_V34:
                    fontCount++;
                    break;
                case XF:
                case XF_V2:
                case XF_V3:
                case XF_V4:
                    extendedFormats.add(record);
                    break;
                case FORMAT_V23: {
                    FormatString format = WorkbookRecordDecoder.format(record, v8, encoding, v23FormatCount++);
                    customFormats.put(format.getCode(), format.getPattern());
                    break;
                }
                case FORMAT: {
                    FormatString format = WorkbookRecordDecoder.format(record, v8, encoding, -1);
                    customFormats.put(format.getCode(), format.getPattern());
                    break;
                }
                case SST:
                    sst.start(record);
                    break;
                case CONTINUE:
                    sst.append(record);
                    break;
                case EOF: {
                    WorkbookGlobals globals = new WorkbookGlobals(bof.getVersion(), worksheets, sst.materialize(),
                            extendedFormats, customFormats, fontCount, encoding, date1904);
                    logger.info("Workbook globals: {} worksheet(s), {} font(s), {} XF record(s), {} custom format(s), {} shared string(s), encoding {}",
                            globals.getWorksheets().size(), globals.getFontCount(), globals.getExtendedFormats().size(),
                            globals.getCustomFormats().size(), globals.getSharedStrings().size(), globals.getEncoding().name());
                    return globals;
                }
                default:
                    break;
            }
        }
    }

    /**
     * Maps a CODEPAGE value to a charset. Codepages Java cannot resolve keep the current encoding.
     */
    static Charset resolveEncoding(int codepage, Charset current) {
        try {
            return Charset.forName(CodePageUtil.codepageToEncoding(codepage, true));
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            logger.warn("Unresolvable codepage {}, keeping {}: {}", codepage, current.name(), e.getMessage());
            return current;
        }
    }
}
