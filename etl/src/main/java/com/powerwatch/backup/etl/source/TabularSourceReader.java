package com.powerwatch.backup.etl.source;

import com.powerwatch.backup.exception.SourceUnreadableException;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks a reader for a single-table source from its file extension: {@code .csv} and {@code .tsv}
 * are delimited text, {@code .xlsx}, {@code .xlsm} and {@code .xls} are workbooks (first sheet used).
 */
public class TabularSourceReader {

    private final WorkbookReader workbookReader;
    private final DelimitedTableReader delimitedTableReader;

    public TabularSourceReader() {
        this(new WorkbookReader(), new DelimitedTableReader());
    }

    public TabularSourceReader(WorkbookReader workbookReader, DelimitedTableReader delimitedTableReader) {
        this.workbookReader = workbookReader;
        this.delimitedTableReader = delimitedTableReader;
    }

    public TabularTable readSingleTable(Path path) throws SourceUnreadableException {
        String extension = FilenameUtils.getExtension(path.getFileName().toString()).toLowerCase(Locale.ROOT);
        switch (extension) {
            case "csv":
                return delimitedTableReader.read(path, ',');
            case "tsv":
                return delimitedTableReader.read(path, '\t');
            case "xlsx":
            case "xlsm":
            case "xls":
                List<TabularTable> sheets = workbookReader.readSheets(path);
                if (sheets.isEmpty()) {
                    throw new SourceUnreadableException(path, "Workbook has no sheets: " + path);
                }
                return sheets.get(0);
            default:
                throw new SourceUnreadableException(path, "Unsupported file extension '" + extension + "' for " + path);
        }
    }

    public List<TabularTable> readAllSheets(Path path) throws SourceUnreadableException {
        return workbookReader.readSheets(path);
    }
}
