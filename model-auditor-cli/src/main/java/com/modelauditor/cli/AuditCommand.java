package com.modelauditor.cli;

import com.modelauditor.core.AuditPipeline;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.config.ConfigLoader;
import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.renderer.OutputRenderer;
import com.modelauditor.core.renderer.RenderContext;
import com.modelauditor.core.renderer.impl.ConsoleRenderer;
import com.modelauditor.core.renderer.impl.FileSystemRenderer;
import com.modelauditor.core.report.AuditHistoryLog;
import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportGenerator;
import com.modelauditor.core.report.ReportGenerators;
import com.modelauditor.core.workbook.WorkbookLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to audit a workbook and write reports.
 *
 * <p>Orchestrates the audit:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Run the audit pipeline over the workbook</li>
 *   <li>Generate the requested report formats</li>
 *   <li>Write them to the output directory, and optionally the console</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> 0 on success, 1 when the workbook or configuration cannot be
 * read, 2 when {@code --fail-on} is set and an issue at or above that severity was found.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * modelauditor audit model.xlsx
 * modelauditor audit model.xlsx -o reports -f markdown,json,csv
 * modelauditor audit model.xlsx --fail-on HIGH
 * modelauditor audit model.xlsx --history audit_history.csv
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Audit a workbook and write reports",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    static final int EXIT_THRESHOLD_REACHED = 2;

    @Parameters(index = "0", description = "Workbook to audit (.xlsx, .xlsm, .xls, .csv, .tsv)")
    private Path workbook;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: modelauditor.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-f", "--format"},
        split = ",",
        description = "Report formats, comma separated (overrides config): markdown, json, csv, xlsx"
    )
    private List<String> formats;

    @Option(names = {"--console"}, description = "Also print the reports to the console")
    private boolean console;

    @Option(names = {"--no-color"}, description = "Disable ANSI colors in console output")
    private boolean noColor;

    @Option(
        names = {"--fail-on"},
        description = "Exit with code 2 when an issue at or above this severity is found: ${COMPLETION-CANDIDATES}"
    )
    private Severity failOn;

    @Option(
        names = {"--require-formulas"},
        description = "Reject value-only inputs such as CSV instead of auditing their values"
    )
    private boolean requireFormulas;

    @Option(
        names = {"--history"},
        description = "CSV file to append a summary row of this run to (overrides config)"
    )
    private Path historyFile;

    @Override
    public Integer call() {
        try {
            AuditConfig config = ConfigLoader.load(configPath);
            System.out.println("Auditing workbook: " + workbook.toAbsolutePath());
            System.out.println();

            AuditPipeline pipeline = new AuditPipeline(config);
            System.out.println("✓ Loaded " + pipeline.getEngine().getDetectors().size() + " detectors");

            AuditReport report;
            try {
                report = pipeline.audit(workbook, requireFormulas);
            } catch (WorkbookLoadException e) {
                log.debug("Load failure", e);
                System.err.println("✗ Could not read file: " + e.getMessage());
                return 1;
            }
            System.out.println("✓ Audited " + report.sheets().size() + " sheet(s), "
                + report.stats().formulaCells() + " formula(s)");
            System.out.println("✓ " + report.summaryLine());
            System.out.println("✓ Complexity " + report.score().value() + "/5: " + report.score().rationale());

            List<GeneratedReport> documents = generateReports(report, config);
            Path target = outputDir != null ? outputDir : Paths.get(config.output().directory());
            render(new FileSystemRenderer(), documents, target);
            System.out.println("✓ Wrote " + documents.size() + " report(s) to: " + target);

            if (console) {
                System.out.println();
                render(new ConsoleRenderer(), documents, target);
            }

            recordHistory(report, config);

            if (failOn != null && !report.issuesAtLeast(failOn).isEmpty()) {
                System.out.println();
                System.out.println("✗ Found " + report.issuesAtLeast(failOn).size() + " issue(s) at or above " + failOn);
                return EXIT_THRESHOLD_REACHED;
            }
            return 0;

        } catch (Exception e) {
            log.error("Audit failed", e);
            System.err.println("✗ Audit failed: " + e.getMessage());
            return 1;
        }
    }

    private List<GeneratedReport> generateReports(AuditReport report, AuditConfig config) {
        List<String> wanted = formats != null && !formats.isEmpty() ? formats : config.output().formats();
        List<GeneratedReport> documents = new ArrayList<>();
        for (String format : wanted) {
            Optional<ReportGenerator> generator = ReportGenerators.find(format);
            if (generator.isEmpty()) {
                log.warn("Unknown report format: {}. Use 'modelauditor list formats' to see available formats.", format);
                continue;
            }
            documents.add(generator.get().generate(report));
        }
        return documents;
    }

    private void recordHistory(AuditReport report, AuditConfig config) {
        Path history = historyFile != null ? historyFile
            : config.output().historyFile() != null ? Paths.get(config.output().historyFile()) : null;
        if (history == null) {
            return;
        }
        try {
            new AuditHistoryLog(history).append(report);
            System.out.println("✓ Appended run to history: " + history);
        } catch (IOException e) {
            log.warn("Could not update audit history {}", history, e);
            System.err.println("✗ Could not update history " + history + ": " + e.getMessage());
        }
    }

    private void render(OutputRenderer renderer, List<GeneratedReport> documents, Path target) {
        RenderContext context = RenderContext.of(target).withColors(!noColor);
        renderer.render(documents, context);
    }
}
