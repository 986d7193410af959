package com.modelauditor.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to compare two JSON audit reports for CI/CD integration.
 *
 * <p>Issues are matched by id. Ids depend only on issue kind and cell, so an
 * unchanged defect keeps its id across runs.
 */
@Command(
    name = "diff",
    description = "Compare a JSON audit report against a baseline",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Option(names = {"-b", "--baseline"}, description = "Baseline JSON report", required = true)
    private Path baselineFile;

    @Option(names = {"--current"}, description = "Current JSON report", required = true)
    private Path currentFile;

    @Option(names = {"--fail-on-new"}, description = "Exit with code 2 when new issues are found")
    private boolean failOnNew;

    @Override
    public Integer call() {
        log.info("Diff - baseline: {}, current: {}", baselineFile, currentFile);
        Map<String, String> baseline;
        Map<String, String> current;
        try {
            baseline = readIssues(baselineFile);
            current = readIssues(currentFile);
        } catch (IOException e) {
            System.err.println("✗ Could not read report: " + e.getMessage());
            return 1;
        }

        Map<String, String> added = new LinkedHashMap<>(current);
        added.keySet().removeAll(baseline.keySet());
        Map<String, String> resolved = new LinkedHashMap<>(baseline);
        resolved.keySet().removeAll(current.keySet());

        System.out.println("New issues: " + added.size());
        added.forEach((id, summary) -> System.out.println("  + " + id + "  " + summary));
        System.out.println("Resolved issues: " + resolved.size());
        resolved.forEach((id, summary) -> System.out.println("  - " + id + "  " + summary));
        System.out.println("Unchanged issues: " + (current.size() - added.size()));

        return failOnNew && !added.isEmpty() ? AuditCommand.EXIT_THRESHOLD_REACHED : 0;
    }

    /**
     * Reads issue ids and one-line summaries from a JSON report.
     *
     * @param file JSON report
     * @return id to summary, in report order
     * @throws IOException if the file is unreadable or is not an audit report
     */
    Map<String, String> readIssues(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode issues = root == null ? null : root.get("issues");
        if (issues == null || !issues.isArray()) {
            throw new IOException("Not an audit report (no issues array): " + file);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (JsonNode issue : issues) {
            result.put(issue.path("id").asText(),
                issue.path("severity").asText() + " " + issue.path("kind").asText() + " " + issue.path("cell").asText());
        }
        return result;
    }
}
