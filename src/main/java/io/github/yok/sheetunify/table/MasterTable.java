package io.github.yok.sheetunify.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * The unified table: every sheet's rows under one ordered set of normalized column names, plus the
 * {@value #SHEET_COLUMN} column naming each row's origin sheet.
 *
 * <p>
 * Instances are immutable. Row indices run contiguously from {@code 0} to
 * {@code getRowCount() - 1}.
 * </p>
 */
public final class MasterTable {

    /** Name of the column that records each row's origin sheet. */
    public static final String SHEET_COLUMN = "_sheet";

    @Getter
    private final List<Column> columns;

    @Getter
    private final int rowCount;

    private final Map<String, Column> byName;

    /**
     * Creates a table from columns of equal length.
     *
     * @param columns columns in display order; names must be unique
     * @param rowCount number of rows; used when {@code columns} is empty
     * @throws IllegalArgumentException if a column has a different length or a name repeats
     */
    public MasterTable(List<Column> columns, int rowCount) {
        Map<String, Column> index = new LinkedHashMap<>();
        for (Column column : columns) {
            Preconditions.checkArgument(column.size() == rowCount,
                    "column [%s] has %s rows, expected %s", column.getName(), column.size(),
                    rowCount);
            Preconditions.checkArgument(index.put(column.getName(), column) == null,
                    "duplicate column [%s]", column.getName());
        }
        this.columns = ImmutableList.copyOf(columns);
        this.rowCount = rowCount;
        this.byName = index;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public int getColumnCount() {
        return columns.size();
    }

    public Optional<Column> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }
}
