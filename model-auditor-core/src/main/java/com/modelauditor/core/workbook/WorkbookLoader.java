package com.modelauditor.core.workbook;

import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a workbook file into a {@link WorkbookSnapshot}.
 *
 * <p>Implementations only read: the source file is never modified.
 *
 * @see WorkbookLoaders
 */
public interface WorkbookLoader {

    /**
     * Returns the lowercase file extensions this loader reads, without dot.
     *
     * @return supported extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Returns true when the format stores formula text next to values.
     *
     * @return true for spreadsheet containers, false for value-only tables
     */
    boolean carriesFormulas();

    /**
     * Loads the workbook.
     *
     * @param file workbook path
     * @return immutable snapshot of all non-empty cells
     * @throws UnreadableWorkbookException if the file is missing, corrupt or not in this format
     * @throws UnsupportedFormatException if formulas were required but the format has none
     */
    WorkbookSnapshot load(Path file);
}
