package com.modelauditor.core.workbook;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks a {@link WorkbookLoader} by file extension.
 */
public final class WorkbookLoaders {

    private WorkbookLoaders() {
        // Utility class
    }

    /**
     * Returns a loader for the given file.
     *
     * @param file workbook path
     * @param formulaAnalysis true if the caller needs formula text; value-only
     *                        loaders then reject the file at load time
     * @return loader able to read the file
     * @throws UnreadableWorkbookException if no loader handles the extension
     */
    public static WorkbookLoader forPath(Path file, boolean formulaAnalysis) {
        String extension = extensionOf(file);
        for (WorkbookLoader loader : all(formulaAnalysis)) {
            if (loader.getSupportedExtensions().contains(extension)) {
                return loader;
            }
        }
        throw new UnreadableWorkbookException(file,
            "Unsupported file type '." + extension + "'. Expected .xlsx, .xlsm, .xls, .csv or .tsv");
    }

    /**
     * Returns every available loader.
     *
     * @param formulaAnalysis whether formula text is required
     * @return loaders
     */
    public static List<WorkbookLoader> all(boolean formulaAnalysis) {
        return List.of(new PoiWorkbookLoader(), new CsvWorkbookLoader(formulaAnalysis));
    }

    static String extensionOf(Path file) {
        Path name = file.getFileName();
        String text = name == null ? "" : name.toString();
        int dot = text.lastIndexOf('.');
        return dot < 0 ? "" : text.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
