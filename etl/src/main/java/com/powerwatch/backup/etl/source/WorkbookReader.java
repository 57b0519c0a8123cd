package com.powerwatch.backup.etl.source;

import com.powerwatch.backup.exception.SourceUnreadableException;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.util.RecordFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every sheet of an {@code .xlsx} or {@code .xls} workbook into {@link TabularTable}s, in sheet order.
 *
 * The first physical row of a sheet is its header. Rows that are missing or entirely blank are dropped.
 * Date-formatted numeric cells are returned as {@code LocalDateTime}, other numeric cells as {@code Double}.
 * Any structural damage POI reports while opening or reading is raised as {@link SourceUnreadableException}.
 */
public class WorkbookReader {
    private static final Logger log = LoggerFactory.getLogger(WorkbookReader.class);

    private final DataFormatter headerFormatter = new DataFormatter();

    public List<TabularTable> readSheets(Path path) throws SourceUnreadableException {
        if (!Files.isRegularFile(path)) {
            throw new SourceUnreadableException(path, "Workbook not found: " + path);
        }
        log.info("Reading workbook {}", path);
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            List<TabularTable> tables = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                TabularTable table = readSheet(sheet);
                log.debug("Sheet '{}' has {} columns and {} data rows", table.name(), table.header().size(), table.rows().size());
                tables.add(table);
            }
            return tables;
        } catch (IOException | IllegalArgumentException | EncryptedDocumentException
                 | POIXMLException | OpenXML4JRuntimeException | RecordFormatException e) {
            throw new SourceUnreadableException(path, "Could not open workbook " + path + ": " + e.getMessage(), e);
        }
    }

    private TabularTable readSheet(Sheet sheet) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return new TabularTable(sheet.getSheetName(), List.of(), List.of());
        }

        int headerRowNum = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(headerRowNum);
        List<String> header = new ArrayList<>();
        for (int c = 0; c < headerRow.getLastCellNum(); c++) {
            Cell cell = headerRow.getCell(c);
            header.add(cell == null ? "" : headerFormatter.formatCellValue(cell));
        }

        List<TabularRow> rows = new ArrayList<>();
        for (int r = headerRowNum + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            List<Object> values = new ArrayList<>(header.size());
            boolean blank = true;
            for (int c = 0; c < header.size(); c++) {
                Object value = cellValue(row.getCell(c));
                blank &= value == null;
                values.add(value);
            }
            if (!blank) {
                rows.add(new TabularRow(r + 1, values));
            }
        }
        return new TabularTable(sheet.getSheetName(), header, rows);
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell) ? cell.getLocalDateTimeCellValue() : cell.getNumericCellValue();
            case STRING -> cell.getStringCellValue().isEmpty() ? null : cell.getStringCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}
