package io.github.yok.sheetunify.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when the input spreadsheet does not exist.
 */
@Getter
public class InputFileNotFoundException extends SheetUnifyException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public InputFileNotFoundException(Path path) {
        super("Input spreadsheet not found: " + path);
        this.path = path;
    }
}
