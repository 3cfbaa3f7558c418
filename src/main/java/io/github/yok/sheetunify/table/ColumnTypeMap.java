package io.github.yok.sheetunify.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Insertion-ordered mapping from normalized column name to {@link ColumnType}.
 */
@EqualsAndHashCode
@ToString
public final class ColumnTypeMap {

    private final Map<String, ColumnType> types = new LinkedHashMap<>();

    /**
     * Sets the type of a column, keeping the column's original position when it is already
     * present.
     *
     * @param column column name
     * @param type column type
     */
    public void put(String column, ColumnType type) {
        types.put(column, type);
    }

    public Optional<ColumnType> get(String column) {
        return Optional.ofNullable(types.get(column));
    }

    public boolean contains(String column) {
        return types.containsKey(column);
    }

    public int size() {
        return types.size();
    }

    /**
     * Returns an unmodifiable view of the mapping, in insertion order.
     *
     * @return column to type map
     */
    public Map<String, ColumnType> asMap() {
        return Collections.unmodifiableMap(types);
    }

    /**
     * Returns the mapping as tag strings ({@code "int"}, {@code "float"}, {@code "string"}), in
     * insertion order.
     *
     * @return column to tag map
     */
    public Map<String, String> toTagMap() {
        Map<String, String> tags = new LinkedHashMap<>();
        types.forEach((column, type) -> tags.put(column, type.getTag()));
        return tags;
    }
}
