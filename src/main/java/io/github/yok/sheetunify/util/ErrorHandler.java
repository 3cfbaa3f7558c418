package io.github.yok.sheetunify.util;

import io.github.yok.sheetunify.exception.InputFileNotFoundException;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import io.github.yok.sheetunify.exception.UnreadableFileException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Turns a failed run into an exit status and a concise {@code ERROR: ...} line on
 * {@code System.err}.
 *
 * <p>
 * <strong>Messages:</strong>
 * </p>
 * <ul>
 * <li>{@link InputFileNotFoundException}: {@code Input spreadsheet not found: <path>}, logged
 * without a stack trace.</li>
 * <li>{@link InvalidConfigException}: {@code Invalid configuration: <detail>}.</li>
 * <li>{@link UnreadableFileException}: its own message.</li>
 * <li>Anything else: {@code Fatal error: <detail>}.</li>
 * </ul>
 *
 * <p>
 * Except for the missing input, the error is logged with its stack trace and the root cause is
 * echoed on a second line when there is one. The JVM is never terminated here; the caller reports
 * the returned status.
 * </p>
 */
@Slf4j
public final class ErrorHandler {

    /** Exit status of a failed run. */
    public static final int EXIT_FAILURE = 1;

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Logs and prints the given failure.
     *
     * @param error failure that ended the run
     * @return {@link #EXIT_FAILURE}
     */
    public static int report(Throwable error) {
        String message = describe(error);
        if (error instanceof InputFileNotFoundException) {
            log.error(message);
            System.err.println("ERROR: " + message);
            return EXIT_FAILURE;
        }
        log.error(message, error);
        System.err.println("ERROR: " + message);
        if (error.getCause() != null) {
            System.err.println(ExceptionUtils.getRootCauseMessage(error));
        }
        return EXIT_FAILURE;
    }

    /**
     * Builds the one-line description of a failure.
     *
     * @param error failure
     * @return message without the {@code ERROR:} prefix
     */
    static String describe(Throwable error) {
        if (error instanceof InputFileNotFoundException
                || error instanceof UnreadableFileException) {
            return error.getMessage();
        }
        if (error instanceof InvalidConfigException) {
            return "Invalid configuration: " + error.getMessage();
        }
        return "Fatal error: " + error.getMessage();
    }
}
