package com.modelauditor.core.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.GraphStats;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.ParseWarning;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportGenerator;

import java.util.Map;

/**
 * Exports the audit result as JSON.
 *
 * <p>This is the structured document handed to downstream consumers such as the
 * narrative layer and the {@code diff} command, which compares {@code issues[].id}
 * between two exports.
 */
public class JsonReportGenerator implements ReportGenerator {

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Export";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public GeneratedReport generate(AuditReport report) {
        try {
            return new GeneratedReport("audit-report", mapper.writeValueAsString(toTree(report)),
                getFileExtension(), "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit report", e);
        }
    }

    /**
     * Builds the JSON tree of a report.
     *
     * @param report audit result
     * @return root node
     */
    public ObjectNode toTree(AuditReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("workbook", report.workbookName());
        root.put("formulasAvailable", report.formulasAvailable());
        root.put("summary", report.summaryLine());
        ArrayNode sheets = root.putArray("sheets");
        report.sheets().forEach(sheets::add);

        ObjectNode score = root.putObject("complexity");
        score.put("score", report.score().value());
        ArrayNode drivers = score.putArray("drivers");
        report.score().drivers().forEach(drivers::add);

        ObjectNode counts = root.putObject("counts");
        for (Map.Entry<Severity, Long> entry : report.countBySeverity().entrySet()) {
            counts.put(entry.getKey().name(), entry.getValue());
        }

        ArrayNode issues = root.putArray("issues");
        report.issues().forEach(issue -> issues.add(issueNode(issue)));

        root.set("stats", statsNode(report.stats()));

        ArrayNode warnings = root.putArray("parseWarnings");
        for (ParseWarning warning : report.parseWarnings()) {
            ObjectNode node = warnings.addObject();
            node.put("cell", warning.cell().toA1());
            node.put("formula", warning.formula());
            node.put("message", warning.message());
        }

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic diagnostic : report.diagnostics()) {
            ObjectNode node = diagnostics.addObject();
            node.put("level", diagnostic.level().name());
            node.put("source", diagnostic.source());
            node.put("message", diagnostic.message());
        }
        return root;
    }

    private ObjectNode issueNode(Issue issue) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", issue.id());
        node.put("kind", issue.kind().name());
        node.put("severity", issue.severity().name());
        node.put("confidence", issue.confidence().name());
        node.put("cell", issue.primaryCell().toA1());
        node.put("message", issue.message());
        ArrayNode evidence = node.putArray("evidence");
        for (Evidence e : issue.evidence()) {
            ObjectNode cell = evidence.addObject();
            cell.put("sheet", e.cell().sheet());
            cell.put("cell", e.cell().address());
            cell.put("value", e.value());
            if (e.formula() != null) {
                cell.put("formula", e.formula());
            }
        }
        ObjectNode explanation = node.putObject("explanation");
        explanation.put("why", issue.explanation().why());
        explanation.put("cause", issue.explanation().cause());
        explanation.put("fix", issue.explanation().fix());
        return node;
    }

    private ObjectNode statsNode(GraphStats stats) {
        ObjectNode node = mapper.valueToTree(stats);
        node.put("formulaDensity", stats.formulaDensity());
        node.put("crossSheetEdgeRatio", stats.crossSheetEdgeRatio());
        return node;
    }
}
