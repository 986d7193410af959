package com.modelauditor.cli;

import com.modelauditor.core.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Callable;

/**
 * Command to write a default {@code modelauditor.yaml}.
 */
@Command(
    name = "init",
    description = "Write a default configuration file",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String TEMPLATE = "/modelauditor-default.yaml";

    @Parameters(index = "0", description = "Directory to write the configuration into", defaultValue = ".")
    private Path directory;

    @Option(names = {"--force"}, description = "Overwrite an existing configuration file")
    private boolean force;

    @Override
    public Integer call() {
        Path target = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(target) && !force) {
            System.err.println("✗ " + target + " already exists (use --force to overwrite)");
            return 1;
        }
        try (InputStream template = InitCommand.class.getResourceAsStream(TEMPLATE)) {
            if (template == null) {
                throw new IllegalStateException("Configuration template missing from class path: " + TEMPLATE);
            }
            Files.createDirectories(directory);
            Files.copy(template, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote configuration template to {}", target);
            System.out.println("✓ Created " + target);
            return 0;
        } catch (IOException e) {
            log.error("Failed to write configuration", e);
            System.err.println("✗ Failed to write " + target + ": " + e.getMessage());
            return 1;
        }
    }
}
