package io.github.yok.sheetunify.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named column of the master table.
 *
 * <p>
 * {@code type} is empty until the type applier has coerced the column; an untyped column holds the
 * cells exactly as they were read.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Column {

    private final String name;
    private final ColumnType type;
    private final List<CellValue> values;

    /**
     * Creates an untyped column.
     *
     * @param name column name
     * @param values cell values in row order
     */
    public Column(String name, List<CellValue> values) {
        this(name, null, values);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param type applied type, or {@code null} for an untyped column
     * @param values cell values in row order
     */
    public Column(String name, ColumnType type, List<CellValue> values) {
        this.name = Preconditions.checkNotNull(name, "name must not be null");
        this.type = type;
        this.values = ImmutableList.copyOf(Preconditions.checkNotNull(values, "values"));
    }

    /**
     * Returns the applied type.
     *
     * @return applied type, or empty if the column is untyped
     */
    public Optional<ColumnType> getType() {
        return Optional.ofNullable(type);
    }

    public int size() {
        return values.size();
    }

    public CellValue get(int row) {
        return values.get(row);
    }
}
