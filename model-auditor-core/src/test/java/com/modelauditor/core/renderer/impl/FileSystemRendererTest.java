package com.modelauditor.core.renderer.impl;

import com.modelauditor.core.renderer.RenderContext;
import com.modelauditor.core.report.GeneratedReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withSingleReport_writesFileToOutputDirectory() throws IOException {
        // Given
        String content = "# Model Audit: model.xlsx";
        GeneratedReport report = new GeneratedReport("audit-report", content, "md", "text/markdown");

        // When
        renderer.render(List.of(report), RenderContext.of(tempDir.toString()));

        // Then
        Path expectedFile = tempDir.resolve("audit-report.md");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo(content);
    }

    @Test
    void render_withMultipleReports_writesEachFormat() throws IOException {
        // Given
        GeneratedReport markdown = new GeneratedReport("audit-report", "# memo", "md", "text/markdown");
        GeneratedReport json = new GeneratedReport("audit-report", "{}", "json", "application/json");

        // When
        renderer.render(List.of(markdown, json), RenderContext.of(tempDir.toString()));

        // Then
        assertThat(Files.readString(tempDir.resolve("audit-report.md"))).isEqualTo("# memo");
        assertThat(Files.readString(tempDir.resolve("audit-report.json"))).isEqualTo("{}");
    }

    @Test
    void render_withExistingFile_overwritesFile() throws IOException {
        // Given
        Path existingFile = tempDir.resolve("audit-report.md");
        Files.writeString(existingFile, "Old content");
        GeneratedReport report = new GeneratedReport("audit-report", "New content", "md", "text/markdown");

        // When
        renderer.render(List.of(report), RenderContext.of(tempDir.toString()));

        // Then
        assertThat(Files.readString(existingFile)).isEqualTo("New content");
    }

    @Test
    void render_withNonExistentOutputDirectory_createsDirectory() {
        // Given
        Path newDir = tempDir.resolve("new/nested/directory");
        GeneratedReport report = new GeneratedReport("audit-report", "Content", "md", "text/markdown");

        // When
        renderer.render(List.of(report), RenderContext.of(newDir.toString()));

        // Then
        assertThat(newDir.resolve("audit-report.md")).exists();
    }

    @Test
    void render_withEmptyList_createsOutputDirectoryOnly() {
        Path newDir = tempDir.resolve("empty");

        renderer.render(List.of(), RenderContext.of(newDir.toString()));

        assertThat(newDir).isDirectory().isEmptyDirectory();
    }

    @Test
    void render_whenOutputPathIsAFile_throwsIllegalState() throws IOException {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        GeneratedReport report = new GeneratedReport("audit-report", "Content", "md", "text/markdown");

        // When / Then
        assertThatThrownBy(() -> renderer.render(List.of(report), RenderContext.of(blocker.toString())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }

    @Test
    void render_withUnicodeContent_writesUtf8() throws IOException {
        String content = "Équité ≠ Passif";
        GeneratedReport report = new GeneratedReport("audit-report", content, "md", "text/markdown");

        renderer.render(List.of(report), RenderContext.of(tempDir.toString()));

        assertThat(Files.readString(tempDir.resolve("audit-report.md"))).isEqualTo(content);
    }

    @Test
    void render_binaryReport_writesBytesUnchanged() throws IOException {
        byte[] bytes = {0x50, 0x4B, 0x03, 0x04, (byte) 0xFF, 0x00};
        GeneratedReport report = GeneratedReport.binary("audit-datatape", bytes, "xlsx",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

        renderer.render(List.of(report), RenderContext.of(tempDir));

        assertThat(Files.readAllBytes(tempDir.resolve("audit-datatape.xlsx"))).isEqualTo(bytes);
    }
}
