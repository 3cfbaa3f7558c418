package io.github.yok.sheetunify.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * One worksheet as read from the workbook: raw header strings and one list of cells per header.
 *
 * <p>
 * Headers are kept exactly as they appear in the file (they may be duplicated or empty); the
 * unifier normalizes them.
 * </p>
 */
@Getter
@ToString
public final class Sheet {

    private final String name;
    private final List<String> headers;
    private final List<List<CellValue>> columns;
    private final int rowCount;

    /**
     * Creates a sheet.
     *
     * @param name sheet name
     * @param headers raw header strings
     * @param columns one list of cells per header, all of the same length
     * @throws IllegalArgumentException if the shapes disagree
     */
    public Sheet(String name, List<String> headers, List<List<CellValue>> columns) {
        Preconditions.checkArgument(headers.size() == columns.size(),
                "sheet [%s]: %s headers but %s columns", name, headers.size(), columns.size());
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        for (List<CellValue> column : columns) {
            Preconditions.checkArgument(column.size() == rows,
                    "sheet [%s]: columns have different lengths", name);
        }
        this.name = name;
        this.headers = ImmutableList.copyOf(headers);
        ImmutableList.Builder<List<CellValue>> builder = ImmutableList.builder();
        for (List<CellValue> column : columns) {
            builder.add(ImmutableList.copyOf(column));
        }
        this.columns = builder.build();
        this.rowCount = rows;
    }

    public int getColumnCount() {
        return headers.size();
    }
}
