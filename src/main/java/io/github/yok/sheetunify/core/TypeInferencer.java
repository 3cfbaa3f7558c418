package io.github.yok.sheetunify.core;

import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Column;
import io.github.yok.sheetunify.table.ColumnType;
import io.github.yok.sheetunify.table.ColumnTypeMap;
import io.github.yok.sheetunify.table.MasterTable;
import java.math.BigDecimal;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides a {@link ColumnType} for every column of a master table.
 *
 * <p>
 * Null cells are ignored. A column whose non-null cells all parse as numbers is {@code int} when
 * none has a fractional part and {@code float} otherwise; a single non-numeric cell makes it
 * {@code string}, as does having no non-null cell at all. {@value MasterTable#SHEET_COLUMN} is
 * always {@code string}.
 * </p>
 */
@Slf4j
public class TypeInferencer {

    /**
     * Infers column types.
     *
     * @param table master table
     * @return type of every column, in column order
     */
    public ColumnTypeMap infer(MasterTable table) {
        ColumnTypeMap types = new ColumnTypeMap();
        for (Column column : table.getColumns()) {
            ColumnType type = MasterTable.SHEET_COLUMN.equals(column.getName())
                    ? ColumnType.STRING
                    : inferColumn(column);
            log.debug("Column[{}] inferred as {}", column.getName(), type.getTag());
            types.put(column.getName(), type);
        }
        return types;
    }

    /**
     * Infers the type of one column.
     *
     * @param column column
     * @return inferred type
     */
    ColumnType inferColumn(Column column) {
        boolean seen = false;
        boolean fractional = false;
        for (CellValue value : column.getValues()) {
            if (value.isNull()) {
                continue;
            }
            seen = true;
            Optional<BigDecimal> number = value.toNumber();
            if (number.isEmpty()) {
                return ColumnType.STRING;
            }
            if (!fractional && !isIntegral(number.get())) {
                fractional = true;
            }
        }
        if (!seen) {
            return ColumnType.STRING;
        }
        return fractional ? ColumnType.FLOAT : ColumnType.INT;
    }

    static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
