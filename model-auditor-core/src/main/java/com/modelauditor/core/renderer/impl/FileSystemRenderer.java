package com.modelauditor.core.renderer.impl;

import com.modelauditor.core.renderer.OutputRenderer;
import com.modelauditor.core.renderer.RenderContext;
import com.modelauditor.core.report.GeneratedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renderer that writes reports into the output directory, creating it if needed.
 * Existing files are overwritten.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(List<GeneratedReport> reports, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.info("Writing {} report(s) to: {}", reports.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedReport report : reports) {
            writeFile(outputDir, report);
        }
    }

    private void writeFile(Path outputDir, GeneratedReport report) {
        Path targetPath = outputDir.resolve(report.fileName());
        try {
            byte[] bytes = report.bytes();
            Files.write(targetPath, bytes);
            logger.debug("Wrote file: {} ({} bytes)", targetPath, bytes.length);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
