package io.github.yok.sheetunify.exception;

/**
 * Thrown when the run configuration is unusable, e.g. a sheet selection that is neither
 * {@code all} nor a list of sheet names, or a sheet name that the workbook does not contain.
 */
public class InvalidConfigException extends SheetUnifyException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super(message);
    }
}
