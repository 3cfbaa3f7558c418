package io.github.yok.sheetunify.core;

import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Column;
import io.github.yok.sheetunify.table.ColumnType;
import io.github.yok.sheetunify.table.ColumnTypeMap;
import io.github.yok.sheetunify.table.MasterTable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Coerces the columns of a master table to the types of a {@link ColumnTypeMap}.
 *
 * <p>
 * <strong>Coercion rules:</strong>
 * </p>
 * <ul>
 * <li>{@code string}: every cell becomes its text form; nulls stay null.</li>
 * <li>{@code int}: cells that do not parse as numbers become null; the rest must be whole numbers
 * within the 64-bit range.</li>
 * <li>{@code float}: cells that do not parse as numbers become null; the rest are rounded to the
 * nearest double and must be finite.</li>
 * </ul>
 *
 * <p>
 * A column that cannot be coerced falls back to {@code string}; the run never stops because of a
 * single column. Columns the map does not mention are copied unchanged.
 * </p>
 */
@Slf4j
public class TypeApplier {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    /**
     * Returns a new table whose columns are coerced to the given types.
     *
     * @param table source table; not modified
     * @param types column types
     * @return coerced table
     */
    public MasterTable apply(MasterTable table, ColumnTypeMap types) {
        List<Column> columns = new ArrayList<>(table.getColumnCount());
        for (Column column : table.getColumns()) {
            Optional<ColumnType> type = types.get(column.getName());
            if (type.isEmpty()) {
                columns.add(column);
                continue;
            }
            CoercionResult result = coerce(column, type.get());
            if (result.isSuccess()) {
                columns.add(result.getColumn().get());
            } else {
                log.debug("Column[{}] cannot be coerced to {} ({}); falling back to string",
                        column.getName(), type.get().getTag(), result.getFailureReason().get());
                columns.add(toStringColumn(column));
            }
        }
        return new MasterTable(columns, table.getRowCount());
    }

    /**
     * Coerces one column.
     *
     * @param column column to coerce
     * @param type target type
     * @return coerced column or failure
     */
    public CoercionResult coerce(Column column, ColumnType type) {
        switch (type) {
            case INT:
                return toIntColumn(column);
            case FLOAT:
                return toFloatColumn(column);
            default:
                return CoercionResult.success(toStringColumn(column));
        }
    }

    private static Column toStringColumn(Column column) {
        List<CellValue> values = new ArrayList<>(column.size());
        for (CellValue value : column.getValues()) {
            values.add(CellValue.text(value.asText()));
        }
        return new Column(column.getName(), ColumnType.STRING, values);
    }

    private static CoercionResult toIntColumn(Column column) {
        List<CellValue> values = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            Optional<BigDecimal> number = column.get(row).toNumber();
            if (number.isEmpty()) {
                values.add(CellValue.nullValue());
                continue;
            }
            BigDecimal n = number.get();
            if (!TypeInferencer.isIntegral(n)) {
                return CoercionResult.failure("row " + row + ": " + n
                        + " has a fractional part");
            }
            if (n.compareTo(LONG_MIN) < 0 || n.compareTo(LONG_MAX) > 0) {
                return CoercionResult.failure("row " + row + ": " + n
                        + " is outside the 64-bit integer range");
            }
            values.add(CellValue.number(BigDecimal.valueOf(n.longValueExact())));
        }
        return CoercionResult.success(new Column(column.getName(), ColumnType.INT, values));
    }

    private static CoercionResult toFloatColumn(Column column) {
        List<CellValue> values = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            Optional<BigDecimal> number = column.get(row).toNumber();
            if (number.isEmpty()) {
                values.add(CellValue.nullValue());
                continue;
            }
            double d = number.get().doubleValue();
            if (Double.isInfinite(d)) {
                return CoercionResult.failure("row " + row + ": "
                        + number.get() + " is outside the double range");
            }
            values.add(CellValue.number(BigDecimal.valueOf(d)));
        }
        return CoercionResult.success(new Column(column.getName(), ColumnType.FLOAT, values));
    }
}
