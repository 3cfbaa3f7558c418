package io.github.yok.sheetunify.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvUtilsTest {

    @Test
    void writeCsvUtf8_正常ケース_BOM付きを指定する_先頭にBOMが書き込まれること(@TempDir File tmpDir)
            throws Exception {
        File csvFile = new File(tmpDir, "out.csv");
        String[] headers = {"id", "nombre"};
        List<List<String>> rows = List.of(Arrays.asList("1", "Peña"));

        CsvUtils.writeCsvUtf8(csvFile, headers, rows, true);

        byte[] bytes = Files.readAllBytes(csvFile.toPath());
        assertEquals((byte) 0xEF, bytes[0]);
        assertEquals((byte) 0xBB, bytes[1]);
        assertEquals((byte) 0xBF, bytes[2]);
        String content = new String(bytes, StandardCharsets.UTF_8);
        assertTrue(content.contains("id,nombre"));
        assertTrue(content.contains("1,Peña"));
    }

    @Test
    void writeCsvUtf8_正常ケース_BOMなしを指定する_ヘッダから始まること(@TempDir File tmpDir) throws Exception {
        File csvFile = new File(tmpDir, "out.csv");

        CsvUtils.writeCsvUtf8(csvFile, new String[] {"h1"}, List.of(List.of("x")), false);

        String content = Files.readString(csvFile.toPath());
        assertTrue(content.startsWith("h1"));
    }

    @Test
    void writeCsvUtf8_正常ケース_特殊文字とnullを含む_最小限の引用符で書き込まれること(@TempDir File tmpDir)
            throws Exception {
        File csvFile = new File(tmpDir, "out.csv");
        String[] headers = {"id", "note"};
        List<List<String>> rows = Arrays.asList(Arrays.asList("1", "Hola,Mundo"), // カンマを含む
                Arrays.asList("2", "dijo \"sí\""), // 引用符を含む
                Arrays.asList("3", "C:\\datos"), // バックスラッシュを含む
                Arrays.asList("4", null) // null
        );

        CsvUtils.writeCsvUtf8(csvFile, headers, rows, false);

        String content = Files.readString(csvFile.toPath());
        String nl = System.lineSeparator();
        assertTrue(content.contains("\"Hola,Mundo\""));
        assertTrue(content.contains("\"dijo \"\"sí\"\"\""));
        // バックスラッシュはエスケープされない
        assertTrue(content.contains("3,C:\\datos" + nl));
        assertTrue(content.contains("4," + nl));
        assertFalse(content.contains("null"));
    }

    @Test
    void writeCsvUtf8_異常ケース_ディレクトリ指定でIOExceptionが送出されること(@TempDir File tmpDir) {
        List<List<String>> rows = List.of(List.of("x"));

        assertThrows(IOException.class,
                () -> CsvUtils.writeCsvUtf8(tmpDir, new String[] {"h1"}, rows, true));
    }

    @Test
    void constructor_正常ケース_privateコンストラクタが存在しインスタンス化できること() throws Exception {
        Constructor<CsvUtils> cons = CsvUtils.class.getDeclaredConstructor();
        assertTrue((cons.getModifiers() & java.lang.reflect.Modifier.PRIVATE) != 0,
                "constructor must be private");
        cons.setAccessible(true);
        Object instance = cons.newInstance();
        assertNotNull(instance);
    }
}
