package com.modelauditor.cli;

import com.modelauditor.core.audit.AuditDetector;
import com.modelauditor.core.audit.AuditEngine;
import com.modelauditor.core.renderer.OutputRenderer;
import com.modelauditor.core.report.ReportGenerator;
import com.modelauditor.core.report.ReportGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available detectors, report formats or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * modelauditor list detectors
 * modelauditor list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available detectors, formats, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: detectors, formats, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "detectors", "detector" -> listDetectors();
            case "formats", "format" -> listFormats();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: detectors, formats, or renderers", type);
                yield 1;
            }
        };
    }

    private int listDetectors() {
        System.out.println("Available Detectors:");
        System.out.println();

        List<AuditDetector> detectors = AuditEngine.discoverDetectors();
        for (AuditDetector detector : detectors) {
            System.out.printf("  • %s (ID: %s)%n", detector.getDisplayName(), detector.getId());
            System.out.printf("    Priority: %d%n", detector.getPriority());
            System.out.println();
        }
        if (detectors.isEmpty()) {
            System.out.println("  No detectors found.");
        }
        return 0;
    }

    private int listFormats() {
        System.out.println("Available Report Formats:");
        System.out.println();

        List<ReportGenerator> generators = ReportGenerators.discover();
        for (ReportGenerator generator : generators) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }
        if (generators.isEmpty()) {
            System.out.println("  No report formats found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
