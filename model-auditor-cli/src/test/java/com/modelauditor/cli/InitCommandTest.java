package com.modelauditor.cli;

import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.config.ConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link InitCommand}.
 */
class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void init_writesTemplateThatParsesToDefaults() throws IOException {
        int exitCode = new CommandLine(new InitCommand()).execute(tempDir.toString());

        Path written = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        assertThat(exitCode).isZero();
        assertThat(written).exists();
        AuditConfig config = ConfigLoader.parse(written);
        assertThat(config.parser().maxRangeCells()).isEqualTo(100000);
        assertThat(config.output().formats()).containsExactly("markdown", "json");
    }

    @Test
    void init_existingFile_refusesWithoutForce() throws IOException {
        Path existing = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(existing, "audit:\n  parallel: true\n");

        int exitCode = new CommandLine(new InitCommand()).execute(tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(existing)).isEqualTo("audit:\n  parallel: true\n");
    }

    @Test
    void init_existingFileWithForce_overwrites() throws IOException {
        Path existing = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(existing, "audit:\n  parallel: true\n");

        int exitCode = new CommandLine(new InitCommand()).execute(tempDir.toString(), "--force");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(existing)).contains("maxRangeCells: 100000");
    }
}
