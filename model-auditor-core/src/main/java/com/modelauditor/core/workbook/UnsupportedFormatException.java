package com.modelauditor.core.workbook;

import java.nio.file.Path;

/**
 * Formula analysis was requested for an input that can only carry values.
 */
public class UnsupportedFormatException extends WorkbookLoadException {

    public UnsupportedFormatException(Path source, String message) {
        super(source, message);
    }
}
