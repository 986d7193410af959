package com.modelauditor.core.workbook;

import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.model.TypedValue;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.model.ExternalLinksTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads {@code .xlsx}, {@code .xlsm} and {@code .xls} workbooks with Apache POI.
 *
 * <p>Each formula cell contributes its formula text, prefixed with {@code =}, and the
 * cached result stored by the application that last saved the file. Nothing is
 * recalculated. The workbook is opened read-only.
 *
 * <p>A sheet or cell that POI cannot decode is recorded as a {@link Diagnostic} and
 * skipped; only container-level failures are fatal.
 */
public class PoiWorkbookLoader implements WorkbookLoader {

    private static final Logger log = LoggerFactory.getLogger(PoiWorkbookLoader.class);
    private static final String SOURCE = "loader";

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("xlsx", "xlsm", "xls", "xltx", "xltm");
    }

    @Override
    public boolean carriesFormulas() {
        return true;
    }

    @Override
    public WorkbookSnapshot load(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new UnreadableWorkbookException(file, "File not found or not readable: " + file);
        }

        String workbookName = String.valueOf(file.getFileName());
        log.debug("Opening workbook {}", file);

        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            WorkbookSnapshot.Builder builder = WorkbookSnapshot.builder(workbookName);

            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                builder.sheet(workbook.getSheetName(i));
            }
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                try {
                    readSheet(sheet, builder);
                } catch (RuntimeException e) {
                    log.warn("Failed to read sheet '{}' of {}: {}", sheet.getSheetName(), workbookName, e.getMessage());
                    builder.diagnostic(Diagnostic.warning(SOURCE,
                        "Sheet '" + sheet.getSheetName() + "' could not be read: " + e.getMessage()));
                }
            }

            readDefinedNames(workbook, builder);
            readExternalLinks(workbook, builder);

            WorkbookSnapshot snapshot = builder.build();
            log.info("Loaded {}: {} sheets, {} populated cells", workbookName,
                snapshot.sheetNames().size(), snapshot.cells().size());
            return snapshot;
        } catch (EncryptedDocumentException e) {
            throw new UnreadableWorkbookException(file, "Workbook is password protected: " + workbookName, e);
        } catch (IOException e) {
            throw new UnreadableWorkbookException(file, "Could not read workbook " + workbookName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI reports corrupt or foreign containers with a family of unchecked exceptions
            throw new UnreadableWorkbookException(file, "Not a readable workbook: " + workbookName + " (" + e.getMessage() + ")", e);
        }
    }

    private void readSheet(Sheet sheet, WorkbookSnapshot.Builder builder) {
        String sheetName = sheet.getSheetName();
        for (Row row : sheet) {
            for (Cell cell : row) {
                CellRef ref = new CellRef(sheetName, cell.getRowIndex() + 1, cell.getColumnIndex() + 1);
                try {
                    readCell(cell, ref, builder);
                } catch (RuntimeException e) {
                    log.debug("Skipping cell {}: {}", ref, e.getMessage());
                    builder.diagnostic(Diagnostic.warning(SOURCE, "Cell " + ref.toA1() + " could not be read: " + e.getMessage()));
                }
            }
        }
    }

    private void readCell(Cell cell, CellRef ref, WorkbookSnapshot.Builder builder) {
        if (cell.getCellType() == CellType.FORMULA) {
            builder.formula(ref, "=" + cell.getCellFormula(), valueOf(cell, cell.getCachedFormulaResultType()));
        } else {
            builder.value(ref, valueOf(cell, cell.getCellType()));
        }
    }

    private TypedValue valueOf(Cell cell, CellType type) {
        return switch (type) {
            case NUMERIC -> TypedValue.number(cell.getNumericCellValue());
            case STRING -> {
                String text = cell.getStringCellValue();
                yield text == null || text.isEmpty() ? TypedValue.EMPTY : TypedValue.text(text);
            }
            case BOOLEAN -> TypedValue.bool(cell.getBooleanCellValue());
            case ERROR -> errorValue(cell.getErrorCellValue());
            default -> TypedValue.EMPTY;
        };
    }

    private TypedValue errorValue(byte code) {
        try {
            String token = FormulaError.forInt(code).getString();
            return SpreadsheetError.fromToken(token)
                .<TypedValue>map(TypedValue::error)
                .orElse(TypedValue.error(SpreadsheetError.VALUE));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown error code {}, recording as #VALUE!", code);
            return TypedValue.error(SpreadsheetError.VALUE);
        }
    }

    private void readDefinedNames(Workbook workbook, WorkbookSnapshot.Builder builder) {
        for (Name name : workbook.getAllNames()) {
            if (name.isFunctionName()) {
                continue;
            }
            try {
                String refersTo = name.getRefersToFormula();
                if (refersTo == null || refersTo.isBlank()) {
                    continue;
                }
                String scope = name.getSheetIndex() < 0 ? null : workbook.getSheetName(name.getSheetIndex());
                builder.definedName(scope, name.getNameName(), refersTo);
            } catch (RuntimeException e) {
                log.debug("Skipping defined name {}: {}", name.getNameName(), e.getMessage());
            }
        }
    }

    private void readExternalLinks(Workbook workbook, WorkbookSnapshot.Builder builder) {
        if (!(workbook instanceof XSSFWorkbook xssf)) {
            return;
        }
        for (ExternalLinksTable link : xssf.getExternalLinksTable()) {
            String fileName = link.getLinkedFileName();
            builder.externalWorkbook(fileName == null ? "" : fileName);
        }
    }
}
