package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.audit.HeaderLabelProjectionPolicy;
import com.modelauditor.core.audit.ProjectionRegion;
import com.modelauditor.core.audit.ProjectionRegionPolicy;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.model.ValueType;
import com.modelauditor.core.workbook.UsedRange;
import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Finds numbers typed into rows of projection formulas.
 *
 * <p>A row of the projection region qualifies when formulas outnumber literals and
 * there are at least {@code minFormulaCells} formulas. Each numeric literal in such a
 * row is compared against the trend of the neighbouring formula values; a literal
 * that continues the trend (same growth rate or same step) is a plausible input and
 * is left alone.
 */
public class HardCodedPlugDetector extends AbstractDetector {

    private static final int CONTEXT_CELLS = 2;

    private final ProjectionRegionPolicy policy;

    public HardCodedPlugDetector() {
        this.policy = null;
    }

    /**
     * Creates a detector with a custom way of locating forecast columns.
     *
     * @param policy projection region policy
     */
    public HardCodedPlugDetector(ProjectionRegionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public String getId() {
        return "hard-coded-plug";
    }

    @Override
    public String getDisplayName() {
        return "Hard-coded Plug Detector";
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public boolean appliesTo(AuditContext context) {
        return context.workbook().formulasAvailable();
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        AuditConfig.PlugConfig config = context.config().plugs();
        ProjectionRegionPolicy regions = policy != null ? policy : new HeaderLabelProjectionPolicy(config);
        WorkbookSnapshot workbook = context.workbook();

        List<Issue> issues = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String sheet : workbook.sheetNames()) {
            if (isExcluded(sheet, config)) {
                log.debug("Skipping sheet '{}'", sheet);
                continue;
            }
            Optional<UsedRange> used = workbook.usedRange(sheet);
            if (used.isEmpty()) {
                continue;
            }
            Optional<ProjectionRegion> region = regions.locate(workbook, sheet);
            if (region.isEmpty()) {
                diagnostics.add(info("No projection columns recognised on sheet '" + sheet + "'"));
                continue;
            }
            if (!region.get().spansMultipleColumns()) {
                continue;
            }
            for (int row = region.get().headerRow() + 1; row <= used.get().lastRow(); row++) {
                scanRow(context, region.get(), row, config, issues);
            }
        }
        return result(issues, diagnostics);
    }

    private void scanRow(AuditContext context, ProjectionRegion region, int row,
                         AuditConfig.PlugConfig config, List<Issue> issues) {
        List<CellRecord> cells = new ArrayList<>();
        int formulas = 0;
        int literals = 0;
        for (int column : region.columns()) {
            Optional<CellRecord> record = context.cell(new CellRef(region.sheet(), row, column));
            if (record.isEmpty()) {
                continue;
            }
            cells.add(record.get());
            if (record.get().hasFormula()) {
                formulas++;
            } else if (record.get().value().type() == ValueType.NUMBER) {
                literals++;
            }
        }
        if (formulas < config.minFormulaCells() || literals == 0 || formulas <= literals) {
            return;
        }

        for (int i = 0; i < cells.size(); i++) {
            CellRecord cell = cells.get(i);
            if (cell.hasFormula() || cell.value().type() != ValueType.NUMBER) {
                continue;
            }
            double value = cell.value().asNumber().getAsDouble();
            List<Double> predictions = predictions(cells, i);
            if (predictions.stream().anyMatch(p -> matches(value, p, config.patternTolerance()))) {
                continue;
            }

            List<Evidence> evidence = new ArrayList<>();
            evidence.add(Evidence.of(cell));
            neighbours(cells, i).forEach(n -> evidence.add(Evidence.of(n)));
            ConfidenceLevel confidence = predictions.isEmpty() ? ConfidenceLevel.MEDIUM : ConfidenceLevel.HIGH;
            String message = String.format(Locale.ROOT,
                "Hard-coded value %s at %s in a row of %d projection formulas",
                cell.value().display(), cell.ref().toA1(), formulas);
            issues.add(issue(IssueKind.HARD_CODED_PLUG, Severity.HIGH, confidence, message, evidence, null));
        }
    }

    /**
     * Values the literal at {@code index} would have if it continued the trend of
     * the two formulas before it, or of the two formulas after it.
     */
    static List<Double> predictions(List<CellRecord> cells, int index) {
        List<Double> predictions = new ArrayList<>();
        if (index >= 2) {
            OptionalDouble v0 = formulaValue(cells.get(index - 2));
            OptionalDouble v1 = formulaValue(cells.get(index - 1));
            if (v0.isPresent() && v1.isPresent()) {
                addTrend(predictions, v0.getAsDouble(), v1.getAsDouble());
            }
        }
        if (index + 2 < cells.size()) {
            OptionalDouble v1 = formulaValue(cells.get(index + 1));
            OptionalDouble v2 = formulaValue(cells.get(index + 2));
            if (v1.isPresent() && v2.isPresent()) {
                addTrend(predictions, v2.getAsDouble(), v1.getAsDouble());
            }
        }
        return predictions;
    }

    private static void addTrend(List<Double> predictions, double far, double near) {
        if (far != 0) {
            predictions.add(near * (near / far));
        }
        predictions.add(near + (near - far));
    }

    private static OptionalDouble formulaValue(CellRecord cell) {
        return cell.hasFormula() ? cell.value().asNumber() : OptionalDouble.empty();
    }

    static boolean matches(double value, double prediction, double tolerance) {
        double scale = Math.max(Math.abs(value), Math.abs(prediction));
        if (scale == 0) {
            return true;
        }
        return Math.abs(value - prediction) / scale <= tolerance;
    }

    private static List<CellRecord> neighbours(List<CellRecord> cells, int index) {
        List<CellRecord> result = new ArrayList<>();
        for (int i = Math.max(0, index - CONTEXT_CELLS); i <= Math.min(cells.size() - 1, index + CONTEXT_CELLS); i++) {
            if (i != index && cells.get(i).hasFormula()) {
                result.add(cells.get(i));
            }
        }
        return result;
    }

    private static boolean isExcluded(String sheet, AuditConfig.PlugConfig config) {
        String name = sheet.toLowerCase(Locale.ROOT);
        return config.excludedSheetKeywords().stream().anyMatch(name::contains);
    }
}
