package io.github.yok.sheetunify.exception;

/**
 * Base class of the fatal errors raised while unifying a workbook.
 *
 * <p>
 * All subclasses are unchecked; {@link io.github.yok.sheetunify.Main} catches them at the top
 * level and ends the process with a non-zero exit status.
 * </p>
 */
public class SheetUnifyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SheetUnifyException(String message) {
        super(message);
    }

    public SheetUnifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
