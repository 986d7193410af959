package com.modelauditor;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class ModelAuditorCLITest {

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void resetLevel() {
        root.setLevel(Level.INFO);
    }

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = ModelAuditorCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("audit", "list", "validate", "init", "diff");
    }

    @Test
    void quietFlag_setsRootLevelToError() {
        int exitCode = ModelAuditorCLI.commandLine().execute("-q", "list", "formats");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void verboseFlag_setsRootLevelToDebug() {
        int exitCode = ModelAuditorCLI.commandLine().execute("-v", "list", "detectors");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void unknownSubcommand_returnsUsageError() {
        assertThat(ModelAuditorCLI.commandLine().execute("explode")).isEqualTo(2);
    }
}
