package com.modelauditor.core.workbook;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.model.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads {@code .csv} and {@code .tsv} tables as a single-sheet, value-only workbook.
 *
 * <p>The sheet is named after the file without its extension. Text that looks like a
 * number, a boolean or an error token is stored as that type.
 */
public class CsvWorkbookLoader implements WorkbookLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvWorkbookLoader.class);

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d{1,3}(,\\d{3})+|\\d+)?(\\.\\d+)?([eE][-+]?\\d+)?%?");

    private final boolean formulaAnalysis;
    private final CsvMapper mapper;

    /**
     * Creates a loader for value-only analysis.
     */
    public CsvWorkbookLoader() {
        this(false);
    }

    /**
     * Creates a loader.
     *
     * @param formulaAnalysis true if the caller requires formula text, in which
     *                        case every load fails with {@link UnsupportedFormatException}
     */
    public CsvWorkbookLoader(boolean formulaAnalysis) {
        this.formulaAnalysis = formulaAnalysis;
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("csv", "tsv");
    }

    @Override
    public boolean carriesFormulas() {
        return false;
    }

    @Override
    public WorkbookSnapshot load(Path file) {
        if (formulaAnalysis) {
            throw new UnsupportedFormatException(file,
                "Formula analysis requires a spreadsheet file; " + file.getFileName() + " only stores values");
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new UnreadableWorkbookException(file, "File not found or not readable: " + file);
        }

        String workbookName = String.valueOf(file.getFileName());
        String sheet = sheetName(workbookName);
        char separator = "tsv".equals(WorkbookLoaders.extensionOf(file)) ? '\t' : ',';
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);

        WorkbookSnapshot.Builder builder = WorkbookSnapshot.builder(workbookName)
            .sheet(sheet)
            .formulasAvailable(false);

        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).with(schema).readValues(file.toFile())) {
            int row = 0;
            while (rows.hasNextValue()) {
                String[] fields = rows.nextValue();
                row++;
                for (int column = 0; column < fields.length; column++) {
                    builder.value(new CellRef(sheet, row, column + 1), parse(fields[column]));
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new UnreadableWorkbookException(file, "Could not read " + workbookName + ": " + e.getMessage(), e);
        }

        WorkbookSnapshot snapshot = builder.build();
        log.info("Loaded {} as value-only table: {} populated cells", workbookName, snapshot.cells().size());
        return snapshot;
    }

    /**
     * Converts one field to a typed value.
     *
     * @param raw field text, may be null
     * @return typed value, {@link TypedValue#EMPTY} for blank fields
     */
    static TypedValue parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return TypedValue.EMPTY;
        }
        String text = raw.trim();
        if ("TRUE".equalsIgnoreCase(text) || "FALSE".equalsIgnoreCase(text)) {
            return TypedValue.bool(Boolean.parseBoolean(text.toLowerCase(Locale.ROOT)));
        }
        Optional<SpreadsheetError> error = SpreadsheetError.fromToken(text);
        if (error.isPresent()) {
            return TypedValue.error(error.get());
        }
        if (NUMBER.matcher(text).matches() && text.chars().anyMatch(Character::isDigit)) {
            boolean percent = text.endsWith("%");
            String digits = text.replace(",", "").replace("%", "");
            try {
                double value = Double.parseDouble(digits);
                return TypedValue.number(percent ? value / 100.0 : value);
            } catch (NumberFormatException e) {
                return TypedValue.text(raw);
            }
        }
        return TypedValue.text(raw);
    }

    private static String sheetName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
