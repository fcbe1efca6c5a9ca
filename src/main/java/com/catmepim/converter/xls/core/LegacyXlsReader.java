package com.catmepim.converter.xls.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.poi.poifs.filesystem.DirectoryNode;
import org.apache.poi.poifs.filesystem.DocumentEntry;
import org.apache.poi.poifs.filesystem.DocumentInputStream;
import org.apache.poi.poifs.filesystem.Entry;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.biff.BiffRecordStream;
import com.catmepim.converter.xls.core.biff.ReadMode;
import com.catmepim.converter.xls.core.cell.CellValueDecoder;
import com.catmepim.converter.xls.core.globals.WorkbookGlobals;
import com.catmepim.converter.xls.core.globals.WorkbookGlobalsLoader;
import com.catmepim.converter.xls.core.globals.Worksheet;
import com.catmepim.converter.xls.core.globals.WorksheetGlobals;
import com.catmepim.converter.xls.core.globals.WorksheetGlobalsLoader;
import com.catmepim.converter.xls.exception.BiffFormatException;
import com.catmepim.converter.xls.exception.InvalidWorkbookException;
import com.catmepim.converter.xls.exception.MissingBlockBoundaryException;
import com.catmepim.converter.xls.strategy.RowAssembler;
import com.catmepim.converter.xls.strategy.RowTraversalStrategy;
import com.catmepim.converter.xls.strategy.SequentialTraversalStrategy;

/**
 * Reads every worksheet of a legacy .xls workbook into {@link SheetTable}s.
 * <p>
 * {@link #open(InputStream)} locates the workbook stream in the OLE2 container and parses
 * the workbook globals; {@link #produceAll()} then traverses the worksheets in document order.
 * A fatal failure at either step leaves the reader permanently invalid: the failure is kept
 * for {@link #getFailure()}, the source is closed, and {@code produceAll()} returns an empty
 * list from then on. Nothing is thrown to the caller for malformed input.
 * <p>
 * Not thread-safe.
 *
 * @invariant The source stream is closed at most once.
 * @invariant Once invalid, the reader never becomes valid again.
 */
public class LegacyXlsReader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LegacyXlsReader.class);

    static final String WORKBOOK_STREAM = "Workbook";
    static final String BOOK_STREAM = "Book";

    private static final List<SheetTable> INVALID_RESULT = Collections.emptyList();

    private final ReadMode readMode;
    private final StrategySelector strategySelector = new StrategySelector();

    private InputStream source;
    private BiffRecordStream stream;
    private WorkbookGlobals globals;
    private List<SheetTable> result;
    private BiffFormatException failure;
    private boolean opened;
    private boolean closed;
    private boolean valid = true;
    private int currentSheetIndex = -1;

    public LegacyXlsReader(ReadMode readMode) {
        if (readMode == null) {
            throw new IllegalArgumentException("readMode must not be null");
        }
        this.readMode = readMode;
    }

    /**
     * Opens a workbook file. Malformed content does not throw; check {@link #isValid()}.
     *
     * @throws IOException if the file cannot be opened
     */
    public static LegacyXlsReader open(Path path, ReadMode readMode) throws IOException {
        LegacyXlsReader reader = new LegacyXlsReader(readMode);
        reader.open(Files.newInputStream(path));
        return reader;
    }

    /**
     * Reads the workbook stream from {@code in} and parses the workbook globals. The reader
     * takes ownership of {@code in}.
     *
     * @pre in != null
     * @post isValid() implies sheet 0 is the current sheet
     * @throws IllegalStateException if called twice
     */
    public void open(InputStream in) {
        if (opened) {
            throw new IllegalStateException("Reader is already open");
        }
        opened = true;
        source = in;
        try {
            byte[] data = readWorkbookStream(in);
            logger.debug("Workbook stream: {} bytes", data.length);
            stream = new BiffRecordStream(data, readMode);
            globals = new WorkbookGlobalsLoader().load(stream);
            currentSheetIndex = 0;
        } catch (BiffFormatException e) {
            fail(e);
        }
    }

    /**
     * Traverses every worksheet.
     *
     * @return tables of the worksheets that have rows, in document order; the same list on
     *         every call. Empty once the reader is invalid.
     * @throws IllegalStateException if {@link #open(InputStream)} was not called
     */
    public List<SheetTable> produceAll() {
        if (!opened) {
            throw new IllegalStateException("open() must be called before produceAll()");
        }
        if (!valid) {
            return INVALID_RESULT;
        }
        if (result != null) {
            return result;
        }
        if (closed) {
            logger.warn("produceAll() called on a closed reader");
            return Collections.emptyList();
        }

        List<SheetTable> tables = new ArrayList<>();
        try {
            for (Worksheet sheet : globals.getWorksheets()) {
                currentSheetIndex = sheet.getIndex();
                SheetTable table = readSheet(sheet);
                if (table != null) {
                    tables.add(table);
                }
            }
        } catch (BiffFormatException e) {
            fail(e);
            return INVALID_RESULT;
        }
        result = Collections.unmodifiableList(tables);
        logger.info("Extracted {} table(s) from {} worksheet(s)", result.size(), globals.getWorksheets().size());
        closeSource();
        return result;
    }

    private SheetTable readSheet(Worksheet sheet) throws BiffFormatException {
        WorksheetGlobals sheetGlobals = new WorksheetGlobalsLoader().load(stream, sheet);
        if (sheetGlobals == null) {
            return null;
        }
        CellValueDecoder decoder = new CellValueDecoder(globals, stream);
        RowTraversalStrategy strategy = strategySelector.selectStrategy(sheetGlobals);

        SheetTableBuilder builder = new SheetTableBuilder(sheet.getName(), sheet.getIndex(), sheetGlobals.getMaxCol());
        try {
            strategy.traverse(new RowAssembler(stream, sheetGlobals, decoder, builder));
        } catch (MissingBlockBoundaryException e) {
            logger.warn("Sheet '{}': {}; discarding {} row(s) and re-reading sequentially",
                    sheet.getName(), e.getMessage(), builder.getRowCount());
            WorksheetGlobals sequential = sheetGlobals.withoutIndex();
            builder = new SheetTableBuilder(sheet.getName(), sheet.getIndex(), sheetGlobals.getMaxCol());
            new SequentialTraversalStrategy().traverse(new RowAssembler(stream, sequential, decoder, builder));
        }

        if (builder.getRowCount() == 0) {
            logger.info("Skipping sheet '{}': no rows", sheet.getName());
            return null;
        }
        SheetTable table = builder.build();
        logger.info("Sheet '{}': {} row(s) x {} column(s)", sheet.getName(), table.getRowCount(), table.getColumnCount());
        return table;
    }

    /**
     * Pulls the "Workbook" stream (or "Book" for BIFF5 producers) out of the OLE2 container.
     */
    static byte[] readWorkbookStream(InputStream in) throws BiffFormatException {
        try (POIFSFileSystem fs = new POIFSFileSystem(in)) {
            DirectoryNode root = fs.getRoot();
            Entry entry = findEntry(root, WORKBOOK_STREAM);
            if (entry == null) {
                entry = findEntry(root, BOOK_STREAM);
            }
            if (entry == null) {
                throw new InvalidWorkbookException("No Workbook or Book stream in the OLE2 container");
            }
            if (!entry.isDocumentEntry()) {
                throw new InvalidWorkbookException("'" + entry.getName() + "' is not a stream");
            }
            try (DocumentInputStream dis = new DocumentInputStream((DocumentEntry) entry)) {
                return IOUtils.toByteArray(dis);
            }
        } catch (BiffFormatException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidWorkbookException("Cannot read OLE2 container: " + e.getMessage(), e);
        }
    }

    private static Entry findEntry(DirectoryNode root, String name) {
        for (Entry entry : root) {
            if (entry.getName().equalsIgnoreCase(name)) {
                return entry;
            }
        }
        return null;
    }

    private void fail(BiffFormatException e) {
        logger.error("Workbook is unreadable: {}", e.getMessage());
        logger.debug("Failure detail", e);
        valid = false;
        failure = e;
        closeSource();
    }

    private void closeSource() {
        if (source == null) {
            return;
        }
        InputStream toClose = source;
        source = null;
        try {
            toClose.close();
        } catch (IOException e) {
            logger.warn("Failed to close workbook source: {}", e.getMessage());
        }
    }

    /**
     * Releases the source. Safe to call any number of times, before or after reading.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeSource();
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the error that invalidated the reader, or {@code null}
     */
    public BiffFormatException getFailure() {
        return failure;
    }

    public ReadMode getReadMode() {
        return readMode;
    }

    public List<Worksheet> getWorksheets() {
        return globals != null ? globals.getWorksheets() : Collections.<Worksheet>emptyList();
    }

    /**
     * @return index of the worksheet being (or last) read, or -1 before a successful open
     */
    public int getCurrentSheetIndex() {
        return currentSheetIndex;
    }

    public String getCurrentSheetName() {
        List<Worksheet> sheets = getWorksheets();
        if (currentSheetIndex < 0 || currentSheetIndex >= sheets.size()) {
            return null;
        }
        return sheets.get(currentSheetIndex).getName();
    }

    /**
     * @return workbook globals, or {@code null} if the reader is not open or invalid
     */
    public WorkbookGlobals getGlobals() {
        return globals;
    }
}
