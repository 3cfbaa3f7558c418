package io.github.yok.sheetunify.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.sheetunify.table.CellValue;
import io.github.yok.sheetunify.table.Column;
import io.github.yok.sheetunify.table.ColumnType;
import io.github.yok.sheetunify.table.ColumnTypeMap;
import io.github.yok.sheetunify.table.MasterTable;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeInferencerTest {

    private final TypeInferencer inferencer = new TypeInferencer();

    private static CellValue num(String v) {
        return CellValue.number(new BigDecimal(v));
    }

    private static Column column(CellValue... values) {
        return new Column("c", Arrays.asList(values));
    }

    @Test
    void inferColumn_正常ケース_整数のみ_intが返ること() {
        assertEquals(ColumnType.INT, inferencer.inferColumn(column(num("1"), num("2"), num("3"))));
    }

    @Test
    void inferColumn_正常ケース_小数を含む_floatが返ること() {
        assertEquals(ColumnType.FLOAT,
                inferencer.inferColumn(column(num("1"), num("2.5"), num("3"))));
    }

    @Test
    void inferColumn_正常ケース_文字列を1つ含む_stringが返ること() {
        assertEquals(ColumnType.STRING,
                inferencer.inferColumn(column(num("1"), CellValue.text("a"), num("3"))));
    }

    @Test
    void inferColumn_正常ケース_全てnull_stringが返ること() {
        assertEquals(ColumnType.STRING, inferencer
                .inferColumn(column(CellValue.nullValue(), CellValue.nullValue())));
        assertEquals(ColumnType.STRING, inferencer.inferColumn(column()));
    }

    @Test
    void inferColumn_正常ケース_nullは無視される_数値のみで判定されること() {
        assertEquals(ColumnType.INT, inferencer
                .inferColumn(column(CellValue.nullValue(), num("4"), CellValue.nullValue())));
    }

    @Test
    void inferColumn_正常ケース_数値文字列_数値として判定されること() {
        assertEquals(ColumnType.INT,
                inferencer.inferColumn(column(CellValue.text("10"), CellValue.text(" 20 "))));
        assertEquals(ColumnType.FLOAT,
                inferencer.inferColumn(column(CellValue.text("1.5"), num("2"))));
        // 小数部がゼロならint
        assertEquals(ColumnType.INT,
                inferencer.inferColumn(column(CellValue.text("1.0"), num("2.000"))));
    }

    @Test
    void inferColumn_正常ケース_double範囲外の指数表記_数値として扱われないこと() {
        assertEquals(ColumnType.STRING, inferencer
                .inferColumn(column(CellValue.text("1"), CellValue.text("1e999999999"))));
        assertEquals(ColumnType.FLOAT, inferencer
                .inferColumn(column(CellValue.text("1"), CellValue.text("1e-999999999"))));
    }

    @Test
    void infer_正常ケース_sheet列_常にstringであること() {
        MasterTable table = new MasterTable(List.of(new Column("id", List.of(num("1"))),
                new Column(MasterTable.SHEET_COLUMN, List.of(CellValue.text("123")))), 1);

        ColumnTypeMap types = inferencer.infer(table);

        assertEquals(List.of("id", "_sheet"), List.copyOf(types.asMap().keySet()));
        assertEquals(ColumnType.INT, types.get("id").get());
        assertEquals(ColumnType.STRING, types.get(MasterTable.SHEET_COLUMN).get());
    }
}
