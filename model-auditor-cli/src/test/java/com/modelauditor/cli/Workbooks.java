package com.modelauditor.cli;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small workbooks for command tests.
 */
final class Workbooks {

    private Workbooks() {
    }

    /**
     * Writes a workbook whose A1 and B1 on sheet Model depend on each other.
     */
    static Path circular(Path directory) throws IOException {
        Path file = directory.resolve("loop.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Model");
            Row row = sheet.createRow(0);
            row.createCell(0).setCellFormula("B1+1");
            row.createCell(1).setCellFormula("A1*2");
            row.createCell(2).setCellValue(10);
            workbook.write(out);
        }
        return file;
    }

    static Path values(Path directory) throws IOException {
        Path file = directory.resolve("export.csv");
        Files.writeString(file, "Item,2024\nRevenue,100\nCosts,40\n");
        return file;
    }
}
