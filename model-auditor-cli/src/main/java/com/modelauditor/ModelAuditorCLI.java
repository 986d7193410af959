package com.modelauditor;

import ch.qos.logback.classic.Level;
import com.modelauditor.cli.AuditCommand;
import com.modelauditor.cli.DiffCommand;
import com.modelauditor.cli.InitCommand;
import com.modelauditor.cli.ListCommand;
import com.modelauditor.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the model auditor.
 *
 * <p>Audits spreadsheet financial models for structural defects: hard-coded plugs,
 * balance sheet imbalances, broken and external references, circular references
 * and orphaned calculations.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code audit} - Audit a workbook and write reports</li>
 *   <li>{@code list} - List available detectors or report formats</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 *   <li>{@code init} - Write a default configuration file</li>
 *   <li>{@code diff} - Compare two JSON reports</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * modelauditor audit model.xlsx -f markdown,json
 * modelauditor -v audit model.xlsx --console
 * modelauditor diff --baseline old/audit-report.json --current new/audit-report.json
 * }</pre>
 */
@Command(
    name = "modelauditor",
    mixinStandardHelpOptions = true,
    version = "Model Auditor 1.0.0-SNAPSHOT",
    description = "Structural auditor for spreadsheet financial models",
    subcommands = {
        AuditCommand.class,
        ListCommand.class,
        ValidateCommand.class,
        InitCommand.class,
        DiffCommand.class
    }
)
public class ModelAuditorCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Model Auditor - Structural auditor for spreadsheet financial models");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'modelauditor --help' to see available commands");
        System.out.println("Use 'modelauditor <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before execution.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        ModelAuditorCLI cli = new ModelAuditorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
