package com.modelauditor.core.workbook;

import com.modelauditor.core.model.CellKind;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.model.TypedValue;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PoiWorkbookLoader}.
 */
class PoiWorkbookLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeModel() throws IOException {
        Path file = tempDir.resolve("model.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet inputs = workbook.createSheet("Inputs");
            Row rate = inputs.createRow(1);
            rate.createCell(0).setCellValue("Growth");
            rate.createCell(1).setCellValue(0.05);

            Sheet model = workbook.createSheet("Model");
            Row first = model.createRow(0);
            first.createCell(0).setCellValue(100);
            first.createCell(1).setCellFormula("A1*(1+Inputs!B2)");
            first.createCell(2).setCellFormula("A1/0");
            first.createCell(3).setCellValue("");

            Name name = workbook.createName();
            name.setNameName("Growth");
            name.setRefersToFormula("Inputs!$B$2");

            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }
        return file;
    }

    @Test
    void load_xlsx_readsValuesFormulasAndCachedResults() throws IOException {
        // Given
        Path file = writeModel();

        // When
        WorkbookSnapshot snapshot = new PoiWorkbookLoader().load(file);

        // Then
        assertThat(snapshot.workbookName()).isEqualTo("model.xlsx");
        assertThat(snapshot.sheetNames()).containsExactly("Inputs", "Model");
        assertThat(snapshot.formulasAvailable()).isTrue();
        assertThat(snapshot.valueAt(CellRef.of("Inputs", "B2")).asNumber()).hasValue(0.05);
        assertThat(snapshot.cell(CellRef.of("Model", "B1"))).hasValueSatisfying(record -> {
            assertThat(record.formula()).contains("=A1*(1+Inputs!B2)");
            assertThat(record.value().asNumber().getAsDouble()).isCloseTo(105.0, within(1e-9));
            assertThat(record.kind()).isEqualTo(CellKind.FORMULA);
        });
        assertThat(snapshot.cell(CellRef.of("Model", "C1"))).hasValueSatisfying(record -> {
            assertThat(record.value()).isEqualTo(TypedValue.error(SpreadsheetError.DIV_ZERO));
            assertThat(record.kind()).isEqualTo(CellKind.ERROR);
        });
        assertThat(snapshot.contains(CellRef.of("Model", "D1"))).isFalse();
        assertThat(snapshot.definedName("Model", "growth")).contains("Inputs!$B$2");
        assertThat(snapshot.usedRange("Model")).hasValueSatisfying(range -> {
            assertThat(range.lastColumn()).isEqualTo(3);
            assertThat(range.rowCount()).isEqualTo(1);
        });
    }

    @Test
    void load_leavesSourceFileUnchanged() throws IOException {
        Path file = writeModel();
        byte[] before = Files.readAllBytes(file);

        new PoiWorkbookLoader().load(file);

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void load_corruptFile_throwsUnreadable() throws IOException {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "this is not a spreadsheet");

        assertThatThrownBy(() -> new PoiWorkbookLoader().load(file))
            .isInstanceOf(UnreadableWorkbookException.class)
            .hasMessageContaining("broken.xlsx");
    }

    @Test
    void load_missingFile_throwsUnreadable() {
        assertThatThrownBy(() -> new PoiWorkbookLoader().load(tempDir.resolve("absent.xlsx")))
            .isInstanceOf(UnreadableWorkbookException.class)
            .hasMessageContaining("File not found");
    }

    @Test
    void forPath_picksLoaderByExtension() {
        assertThat(WorkbookLoaders.forPath(Path.of("model.XLSX"), true)).isInstanceOf(PoiWorkbookLoader.class);
        assertThat(WorkbookLoaders.forPath(Path.of("legacy.xls"), true)).isInstanceOf(PoiWorkbookLoader.class);
        assertThat(WorkbookLoaders.forPath(Path.of("data.csv"), false)).isInstanceOf(CsvWorkbookLoader.class);
        assertThatThrownBy(() -> WorkbookLoaders.forPath(Path.of("notes.txt"), false))
            .isInstanceOf(UnreadableWorkbookException.class)
            .hasMessageContaining("Unsupported file type '.txt'");
    }
}
