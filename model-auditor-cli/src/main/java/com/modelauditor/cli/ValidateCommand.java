package com.modelauditor.cli;

import com.modelauditor.core.audit.AuditDetector;
import com.modelauditor.core.audit.AuditEngine;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.config.ConfigLoader;
import com.modelauditor.core.report.ReportGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to validate a configuration file.
 *
 * <p>Unlike {@code audit}, which falls back to defaults, validation parses the file
 * strictly and reports unknown detector ids and report formats.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        if (!Files.isRegularFile(configFile)) {
            System.err.println("✗ Configuration file not found: " + configFile);
            return 1;
        }

        AuditConfig config;
        try {
            config = ConfigLoader.parse(configFile);
        } catch (IOException e) {
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        }

        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            problems.forEach(p -> System.err.println("✗ " + p));
            return 1;
        }
        System.out.println("✓ Configuration is valid: " + configFile);
        return 0;
    }

    static List<String> validate(AuditConfig config) {
        List<String> problems = new ArrayList<>();
        Set<String> detectorIds = AuditEngine.discoverDetectors().stream()
            .map(AuditDetector::getId)
            .collect(Collectors.toSet());
        List<String> named = new ArrayList<>(config.detectors().enabled());
        named.addAll(config.detectors().disabled());
        for (String id : named) {
            if (!detectorIds.contains(id)) {
                problems.add("Unknown detector: " + id);
            }
        }
        for (String format : config.output().formats()) {
            if (ReportGenerators.find(format).isEmpty()) {
                problems.add("Unknown report format: " + format);
            }
        }
        if (config.detectors().getEffectiveMode() == AuditConfig.DetectorMode.EXPLICIT
            && config.detectors().enabled().isEmpty()) {
            problems.add("detectors.mode is EXPLICIT but no detector is enabled");
        }
        return problems;
    }
}
