package io.github.yok.sheetunify.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetunify.exception.InputFileNotFoundException;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import io.github.yok.sheetunify.exception.UnreadableFileException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void report_異常ケース_入力ファイルなし_所定の形式で出力され終了コード1が返ること() {
        AtomicInteger status = new AtomicInteger();
        String err = captureStderr(() -> status.set(ErrorHandler
                .report(new InputFileNotFoundException(Paths.get("data", "2025A.xlsx")))));

        assertEquals(ErrorHandler.EXIT_FAILURE, status.get());
        assertEquals("ERROR: Input spreadsheet not found: " + Paths.get("data", "2025A.xlsx")
                + System.lineSeparator(), err);
    }

    @Test
    void report_異常ケース_設定不正_Invalid_configurationとして出力されること() {
        AtomicInteger status = new AtomicInteger();
        String err = captureStderr(() -> status
                .set(ErrorHandler.report(new InvalidConfigException("Sheet not found: X"))));

        assertEquals(1, status.get());
        assertTrue(err.startsWith("ERROR: Invalid configuration: Sheet not found: X"));
        // 原因例外がなければ1行のみ
        assertEquals(1, err.split(System.lineSeparator()).length);
    }

    @Test
    void report_異常ケース_読み込み不可_メッセージと根本原因が出力されること() {
        String err = captureStderr(() -> ErrorHandler.report(new UnreadableFileException(
                "Cannot read spreadsheet: a.xlsx", new IOException("not a zip"))));

        assertTrue(err.startsWith("ERROR: Cannot read spreadsheet: a.xlsx"));
        assertTrue(err.contains("IOException: not a zip"));
    }

    @Test
    void report_異常ケース_想定外の例外_Fatal_errorとして出力されること() {
        String err = captureStderr(() -> ErrorHandler.report(
                new IllegalStateException("wrapper", new RuntimeException("root"))));

        assertTrue(err.startsWith("ERROR: Fatal error: wrapper"));
        assertTrue(err.contains("RuntimeException: root"));
    }

    @Test
    void describe_正常ケース_例外種別ごとの文言が返ること() {
        assertEquals("Input spreadsheet not found: x.xlsx",
                ErrorHandler.describe(new InputFileNotFoundException(Paths.get("x.xlsx"))));
        assertEquals("Invalid configuration: bad",
                ErrorHandler.describe(new InvalidConfigException("bad")));
        assertEquals("Fatal error: disk", ErrorHandler.describe(new IOException("disk")));
        assertFalse(ErrorHandler.describe(new UnreadableFileException("u", null))
                .startsWith("Fatal"));
    }

    private static String captureStderr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString(StandardCharsets.UTF_8);
    }
}
