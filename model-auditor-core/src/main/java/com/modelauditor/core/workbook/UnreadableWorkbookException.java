package com.modelauditor.core.workbook;

import java.nio.file.Path;

/**
 * The file is missing, corrupt, encrypted, or not a supported container format.
 */
public class UnreadableWorkbookException extends WorkbookLoadException {

    public UnreadableWorkbookException(Path source, String message) {
        super(source, message);
    }

    public UnreadableWorkbookException(Path source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
