package io.github.yok.sheetunify.exception;

/**
 * Thrown when the input file exists but cannot be opened as a spreadsheet workbook.
 */
public class UnreadableFileException extends SheetUnifyException {

    private static final long serialVersionUID = 1L;

    public UnreadableFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
