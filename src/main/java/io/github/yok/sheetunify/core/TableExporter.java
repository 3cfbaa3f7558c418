package io.github.yok.sheetunify.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Column;
import io.github.yok.sheetunify.table.ColumnType;
import io.github.yok.sheetunify.table.ColumnTypeMap;
import io.github.yok.sheetunify.table.MasterTable;
import io.github.yok.sheetunify.util.ColumnNameNormalizer;
import io.github.yok.sheetunify.util.CsvUtils;
import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Writes a typed master table to an output directory.
 *
 * <p>
 * <strong>Layout:</strong>
 * </p>
 *
 * <pre>
 * &lt;outdir&gt;/master.csv
 * &lt;outdir&gt;/columns/&lt;safe_column_name&gt;.csv   (one per column)
 * &lt;outdir&gt;/inferred_dtypes.json
 * </pre>
 *
 * <p>
 * CSV files are UTF-8 with a byte-order mark, comma-delimited, with a header row; null cells are
 * empty fields. Per-column files hold {@code row_index} and the column's values. A per-column file
 * name that is already used in this run, or that already exists in {@code columns/}, gets a
 * {@code _2}, {@code _3}, ... suffix.
 * </p>
 */
@Slf4j
public class TableExporter {

    public static final String MASTER_FILE = "master.csv";
    public static final String COLUMNS_DIR = "columns";
    public static final String TYPE_MAP_FILE = "inferred_dtypes.json";
    public static final String ROW_INDEX_HEADER = "row_index";

    private static final String CSV_EXTENSION = ".csv";

    private final int maxFilenameLength;
    private final ObjectMapper mapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Creates an exporter.
     *
     * @param maxFilenameLength upper bound for per-column base file names
     */
    public TableExporter(int maxFilenameLength) {
        this.maxFilenameLength = maxFilenameLength;
    }

    /**
     * Writes all outputs.
     *
     * @param table typed master table
     * @param types column type map written as the JSON sidecar
     * @param outDir output directory; created with its parents if absent
     * @return written files
     * @throws IOException on file I/O error
     */
    public ExportResult export(MasterTable table, ColumnTypeMap types, File outDir)
            throws IOException {
        FileUtils.forceMkdir(outDir);
        File master = exportMaster(table, outDir);
        List<File> columnFiles = exportColumns(table, new File(outDir, COLUMNS_DIR));
        File typeMap = exportTypeMap(types, outDir);
        return new ExportResult(master, columnFiles, typeMap);
    }

    /**
     * Writes {@value #MASTER_FILE}.
     *
     * @param table master table
     * @param outDir existing output directory
     * @return written file
     * @throws IOException on file I/O error
     */
    File exportMaster(MasterTable table, File outDir) throws IOException {
        File file = new File(outDir, MASTER_FILE);
        List<List<String>> rows = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            List<String> record = new ArrayList<>(table.getColumnCount());
            for (Column column : table.getColumns()) {
                record.add(render(column.get(row), column.getType()));
            }
            rows.add(record);
        }
        CsvUtils.writeCsvUtf8(file, table.getColumnNames().toArray(new String[0]), rows, true);
        log.info("Master table written: {} ({} rows, {} columns)", file, table.getRowCount(),
                table.getColumnCount());
        return file;
    }

    /**
     * Writes one CSV file per column under {@code columnsDir}.
     *
     * @param table master table
     * @param columnsDir directory for the per-column files; created if absent
     * @return written files, in column order
     * @throws IOException on file I/O error
     */
    List<File> exportColumns(MasterTable table, File columnsDir) throws IOException {
        FileUtils.forceMkdir(columnsDir);
        Set<String> used = new HashSet<>();
        List<File> files = new ArrayList<>(table.getColumnCount());
        for (Column column : table.getColumns()) {
            File file = new File(columnsDir, freeName(column.getName(), columnsDir, used));
            List<List<String>> rows = new ArrayList<>(column.size());
            for (int row = 0; row < column.size(); row++) {
                List<String> record = new ArrayList<>(2);
                record.add(Integer.toString(row));
                record.add(render(column.get(row), column.getType()));
                rows.add(record);
            }
            CsvUtils.writeCsvUtf8(file, new String[] {ROW_INDEX_HEADER, column.getName()}, rows,
                    true);
            log.debug("Column[{}] written: {}", column.getName(), file.getName());
            files.add(file);
        }
        log.info("Per-column files written: {} files in {}", files.size(), columnsDir);
        return files;
    }

    /**
     * Writes {@value #TYPE_MAP_FILE}.
     *
     * @param types column type map
     * @param outDir existing output directory
     * @return written file
     * @throws IOException on file I/O error
     */
    File exportTypeMap(ColumnTypeMap types, File outDir) throws IOException {
        File file = new File(outDir, TYPE_MAP_FILE);
        mapper.writeValue(file, types.toTagMap());
        log.info("Type map written: {}", file);
        return file;
    }

    /**
     * Resolves a per-column file name that is neither used in this run nor present on disk.
     *
     * @param column column name
     * @param dir target directory
     * @param used names already used in this run; the chosen name is added
     * @return file name including extension
     */
    String freeName(String column, File dir, Set<String> used) {
        String base = ColumnNameNormalizer.safeFilename(column, maxFilenameLength);
        String candidate = base;
        int i = 1;
        while (used.contains(candidate) || new File(dir, candidate + CSV_EXTENSION).exists()) {
            i++;
            candidate = base + "_" + i;
        }
        used.add(candidate);
        return candidate + CSV_EXTENSION;
    }

    /**
     * Renders a cell for CSV output according to its column type.
     *
     * @param value cell
     * @param type applied column type, if any
     * @return CSV field text, or {@code null} for a null cell
     */
    static String render(CellValue value, Optional<ColumnType> type) {
        if (value.isNull()) {
            return null;
        }
        if (value.isNumber() && type.isPresent()) {
            if (type.get() == ColumnType.INT) {
                return value.getNumber().toBigInteger().toString();
            }
            if (type.get() == ColumnType.FLOAT) {
                String s = BigDecimal.valueOf(value.getNumber().doubleValue()).toPlainString();
                return s.indexOf('.') < 0 ? s + ".0" : s;
            }
        }
        return value.asText();
    }
}
