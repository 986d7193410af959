package com.modelauditor.core.workbook;

import java.nio.file.Path;

/**
 * Fatal failure to load a workbook. No report is produced when this is thrown.
 */
public class WorkbookLoadException extends RuntimeException {

    private final transient Path source;

    public WorkbookLoadException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public WorkbookLoadException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Returns the file that failed to load.
     *
     * @return source path
     */
    public Path getSource() {
        return source;
    }
}
