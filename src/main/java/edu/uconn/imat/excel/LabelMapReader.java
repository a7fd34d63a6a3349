package edu.uconn.imat.excel;

import edu.uconn.imat.common.exception.MalformedRecordException;
import edu.uconn.imat.common.exception.MissingFileException;
import edu.uconn.imat.common.exception.SourceParseException;
import edu.uconn.imat.copy.LabelMapRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the label map workbook into memory.
 *
 * <p>The first sheet's first row is the header; the columns {@code labelId},
 * {@code taskId}, {@code labelName} and {@code taskName} are located by name,
 * in any order. Other columns are ignored and blank rows skipped. A
 * {@code labelId} may appear only once.
 */
@Slf4j
@Component
public class LabelMapReader {

    static final String LABEL_ID = "labelId";
    static final String TASK_ID = "taskId";
    static final String LABEL_NAME = "labelName";
    static final String TASK_NAME = "taskName";

    // nine digits at most, so parsing cannot overflow
    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d{1,9}");

    private static final List<String> REQUIRED_COLUMNS = List.of(LABEL_ID, TASK_ID, LABEL_NAME, TASK_NAME);

    private final DataFormatter formatter = new DataFormatter();

    public List<LabelMapRow> read(Path file) {
        MissingFileException.requireFile(file);
        try (InputStream is = Files.newInputStream(file);
             Workbook workbook = open(is, file)) {
            return readSheet(workbook.getSheetAt(0), file);
        } catch (IOException e) {
            throw new SourceParseException("Cannot read workbook " + file + ": " + e.getMessage(), e);
        }
    }

    private Workbook open(InputStream is, Path file) {
        try {
            return WorkbookFactory.create(is);
        } catch (IOException | IllegalArgumentException | EncryptedDocumentException e) {
            throw new SourceParseException("Cannot open workbook " + file + ": " + e.getMessage(), e);
        }
    }

    private List<LabelMapRow> readSheet(Sheet sheet, Path file) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            throw new SourceParseException("Workbook " + file + " has no header row", null);
        }
        Map<String, Integer> columns = locateColumns(headerRow, file);

        List<LabelMapRow> rows = new ArrayList<>();
        // labelId -> 1-based row number of its first occurrence
        Map<Integer, Integer> seen = new HashMap<>();
        for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (isBlank(row)) {
                continue;
            }
            int labelId = intCell(row, columns.get(LABEL_ID), LABEL_ID);
            Integer first = seen.putIfAbsent(labelId, row.getRowNum() + 1);
            if (first != null) {
                throw malformed(row, "labelId " + labelId + " already used in row " + first);
            }
            rows.add(new LabelMapRow(
                labelId,
                intCell(row, columns.get(TASK_ID), TASK_ID),
                textCell(row, columns.get(LABEL_NAME), LABEL_NAME),
                textCell(row, columns.get(TASK_NAME), TASK_NAME)));
        }
        log.debug("Read {} label map rows from sheet '{}'", rows.size(), sheet.getSheetName());
        return rows;
    }

    private Map<String, Integer> locateColumns(Row headerRow, Path file) {
        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : headerRow) {
            String name = formatter.formatCellValue(cell).trim();
            if (REQUIRED_COLUMNS.contains(name)) {
                columns.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new SourceParseException("Workbook " + file + " is missing column '" + required + "'", null);
            }
        }
        return columns;
    }

    private int intCell(Row row, int column, String name) {
        Cell cell = row.getCell(column);
        CellType type = cell == null ? CellType.BLANK : effectiveType(cell);
        if (type == CellType.NUMERIC) {
            double value = cell.getNumericCellValue();
            if (value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
        } else if (type == CellType.STRING) {
            String text = cell.getStringCellValue().trim();
            if (INTEGER_TEXT.matcher(text).matches()) {
                return Integer.parseInt(text);
            }
        }
        throw malformed(row, name + " is not an integer");
    }

    private String textCell(Row row, int column, String name) {
        Cell cell = row.getCell(column);
        String text = cell == null ? "" : formatter.formatCellValue(cell);
        if (text.isBlank()) {
            throw malformed(row, name + " is blank");
        }
        return text;
    }

    private CellType effectiveType(Cell cell) {
        return cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
    }

    private boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (!formatter.formatCellValue(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }

    private MalformedRecordException malformed(Row row, String problem) {
        List<String> values = new ArrayList<>();
        for (Cell cell : row) {
            values.add(formatter.formatCellValue(cell));
        }
        return new MalformedRecordException("Label map row " + (row.getRowNum() + 1) + ": " + problem,
            values.toString());
    }
}
