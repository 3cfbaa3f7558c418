package io.github.yok.sheetunify.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SheetSelectionTest {

    @Test
    void fromConfig_正常ケース_allのみを指定する_全シート選択が返ること() {
        SheetSelection selection = SheetSelection.fromConfig(List.of("all"));
        assertTrue(selection.isAll());
        assertTrue(selection.getSheetNames().isEmpty());
    }

    @Test
    void fromConfig_正常ケース_シート名リストを指定する_指定順の明示選択が返ること() {
        SheetSelection selection = SheetSelection.fromConfig(List.of("Hoja2", "Hoja1"));
        assertFalse(selection.isAll());
        assertEquals(List.of("Hoja2", "Hoja1"), selection.getSheetNames());
    }

    @Test
    void fromConfig_異常ケース_nullまたは空リスト_InvalidConfigExceptionが送出されること() {
        assertThrows(InvalidConfigException.class, () -> SheetSelection.fromConfig(null));
        assertThrows(InvalidConfigException.class, () -> SheetSelection.fromConfig(List.of()));
    }

    @Test
    void of_異常ケース_空白のシート名を含む_InvalidConfigExceptionが送出されること() {
        assertThrows(InvalidConfigException.class,
                () -> SheetSelection.of(Arrays.asList("Hoja1", " ")));
        assertThrows(InvalidConfigException.class,
                () -> SheetSelection.of(Arrays.asList("Hoja1", null)));
    }

    @Test
    void of_異常ケース_シート名が重複する_InvalidConfigExceptionが送出されること() {
        assertThrows(InvalidConfigException.class,
                () -> SheetSelection.of(List.of("Hoja1", "Hoja1")));
    }
}
