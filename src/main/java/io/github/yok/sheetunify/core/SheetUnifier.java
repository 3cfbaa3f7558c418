package io.github.yok.sheetunify.core;

import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Column;
import io.github.yok.sheetunify.table.MasterTable;
import io.github.yok.sheetunify.table.Sheet;
import io.github.yok.sheetunify.util.ColumnNameNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds the sheets of a workbook into one {@link MasterTable}.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Normalize every sheet's headers; duplicates are resolved within each sheet.</li>
 * <li>Build the union of normalized names in first-seen order (sheet order, then header
 * order).</li>
 * <li>Align each sheet to the union, filling absent columns with nulls.</li>
 * <li>Concatenate the rows in sheet order and add {@value MasterTable#SHEET_COLUMN} with the origin
 * sheet name.</li>
 * </ol>
 */
@Slf4j
public class SheetUnifier {

    /**
     * Unifies the given sheets.
     *
     * @param sheets sheets keyed by sheet name, in the order their rows are concatenated
     * @return master table
     */
    public MasterTable unify(Map<String, Sheet> sheets) {
        // --- 1) Normalize headers per sheet ---
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Sheet> entry : sheets.entrySet()) {
            List<String> names =
                    ColumnNameNormalizer.normalizeHeaders(entry.getValue().getHeaders());
            log.debug("Sheet[{}] headers {} -> {}", entry.getKey(),
                    entry.getValue().getHeaders(), names);
            normalized.put(entry.getKey(), names);
        }

        // --- 2) Ordered union of column names ---
        Set<String> allColumns = new LinkedHashSet<>();
        normalized.values().forEach(allColumns::addAll);

        // --- 3) Align and concatenate ---
        Map<String, List<CellValue>> data = new LinkedHashMap<>();
        for (String name : allColumns) {
            data.put(name, new ArrayList<>());
        }
        List<CellValue> origin = new ArrayList<>();
        int rowCount = 0;
        for (Map.Entry<String, Sheet> entry : sheets.entrySet()) {
            Sheet sheet = entry.getValue();
            List<String> names = normalized.get(entry.getKey());
            int rows = sheet.getRowCount();
            for (String name : allColumns) {
                int idx = names.indexOf(name);
                List<CellValue> target = data.get(name);
                if (idx < 0) {
                    target.addAll(Collections.nCopies(rows, CellValue.nullValue()));
                } else {
                    target.addAll(sheet.getColumns().get(idx));
                }
            }
            origin.addAll(Collections.nCopies(rows, CellValue.text(entry.getKey())));
            rowCount += rows;
            log.debug("Sheet[{}] appended {} rows", entry.getKey(), rows);
        }

        List<Column> columns = new ArrayList<>(allColumns.size() + 1);
        data.forEach((name, values) -> columns.add(new Column(name, values)));
        columns.add(new Column(MasterTable.SHEET_COLUMN, origin));
        return new MasterTable(columns, rowCount);
    }
}
