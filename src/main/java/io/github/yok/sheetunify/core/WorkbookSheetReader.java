package io.github.yok.sheetunify.core;

import io.github.yok.sheetunify.exception.InputFileNotFoundException;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import io.github.yok.sheetunify.exception.UnreadableFileException;
import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Sheet;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Reads the sheets of an Excel workbook ({@code .xlsx} or {@code .xls}) into untyped
 * {@link Sheet}s.
 *
 * <p>
 * <strong>Cell mapping:</strong>
 * </p>
 * <ul>
 * <li>numeric cells become numbers; date-formatted numeric cells become
 * {@code yyyy-MM-dd HH:mm:ss} text</li>
 * <li>string, boolean ({@code TRUE}/{@code FALSE}) and error ({@code #DIV/0!}, ...) cells become
 * text</li>
 * <li>blank cells, empty strings and configured NA markers become null</li>
 * <li>formula cells use their cached result</li>
 * </ul>
 *
 * <p>
 * The first non-blank row of a sheet is its header row; blank header cells are named
 * {@code Unnamed: <index>}. Fully blank rows are skipped.
 * </p>
 */
@Slf4j
public class WorkbookSheetReader {

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Set<String> naValues;

    /**
     * Creates a reader.
     *
     * @param naValues text cell contents read as null
     */
    public WorkbookSheetReader(Collection<String> naValues) {
        this.naValues = new HashSet<>(naValues);
    }

    /**
     * Reads the selected sheets of a workbook.
     *
     * @param path workbook file
     * @param which sheets to read
     * @return sheets keyed by sheet name, in read order
     * @throws InvalidConfigException if {@code which} is {@code null} or names a missing sheet
     * @throws InputFileNotFoundException if {@code path} does not exist
     * @throws UnreadableFileException if {@code path} is not a readable workbook
     */
    public Map<String, Sheet> readAllSheets(Path path, SheetSelection which) {
        if (which == null) {
            throw new InvalidConfigException(
                    "Sheet selection must be 'all' or a non-empty list of sheet names.");
        }
        if (!Files.isRegularFile(path)) {
            throw new InputFileNotFoundException(path);
        }

        Workbook opened;
        try {
            opened = WorkbookFactory.create(path.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new UnreadableFileException("Cannot read spreadsheet: " + path, e);
        }

        Map<String, Sheet> sheets = new LinkedHashMap<>();
        try (Workbook workbook = opened) {
            List<String> names = which.isAll() ? sheetNames(workbook) : which.getSheetNames();
            for (String name : names) {
                org.apache.poi.ss.usermodel.Sheet source = workbook.getSheet(name);
                if (source == null) {
                    throw new InvalidConfigException(
                            "Sheet [" + name + "] not found in " + path.getFileName());
                }
                Sheet sheet = readSheet(source);
                log.debug("Sheet[{}] rows={}, columns={}", name, sheet.getRowCount(),
                        sheet.getColumnCount());
                sheets.put(name, sheet);
            }
        } catch (IOException e) {
            throw new UnreadableFileException("Cannot read spreadsheet: " + path, e);
        }
        return sheets;
    }

    private static List<String> sheetNames(Workbook workbook) {
        List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return names;
    }

    /**
     * Converts one worksheet.
     *
     * @param source POI sheet
     * @return untyped sheet
     */
    Sheet readSheet(org.apache.poi.ss.usermodel.Sheet source) {
        // --- 1) Collect non-blank rows and the widest row ---
        List<Row> rows = new ArrayList<>();
        int width = 0;
        for (Row row : source) {
            if (isBlank(row)) {
                continue;
            }
            rows.add(row);
            width = Math.max(width, row.getLastCellNum());
        }
        if (rows.isEmpty()) {
            return new Sheet(source.getSheetName(), List.of(), List.of());
        }

        // --- 2) Header row ---
        Row headerRow = rows.get(0);
        List<String> headers = new ArrayList<>(width);
        List<List<CellValue>> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            String header = readCell(headerRow.getCell(c)).asText();
            headers.add(header == null ? UNNAMED_PREFIX + c : header);
            columns.add(new ArrayList<>(rows.size() - 1));
        }

        // --- 3) Data rows ---
        for (Row row : rows.subList(1, rows.size())) {
            for (int c = 0; c < width; c++) {
                columns.get(c).add(applyNaValues(readCell(row.getCell(c))));
            }
        }
        return new Sheet(source.getSheetName(), headers, columns);
    }

    private boolean isBlank(Row row) {
        for (Cell cell : row) {
            if (!readCell(cell).isNull()) {
                return false;
            }
        }
        return true;
    }

    private CellValue applyNaValues(CellValue value) {
        if (value.isText() && naValues.contains(value.getText())) {
            return CellValue.nullValue();
        }
        return value;
    }

    /**
     * Reads a cell without coercing it to a column type.
     *
     * @param cell POI cell; may be {@code null}
     * @return cell value
     */
    static CellValue readCell(Cell cell) {
        if (cell == null) {
            return CellValue.nullValue();
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return CellValue.text(cell.getLocalDateTimeCellValue().format(DATE_TIME));
                }
                return CellValue.number(BigDecimal.valueOf(cell.getNumericCellValue()));
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? CellValue.nullValue()
                        : CellValue.text(text);
            case BOOLEAN:
                return CellValue.text(cell.getBooleanCellValue() ? "TRUE" : "FALSE");
            case ERROR:
                return CellValue.text(FormulaError.forInt(cell.getErrorCellValue()).getString());
            default:
                return CellValue.nullValue();
        }
    }
}
