package com.modelauditor.core.audit;

import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the enabled {@link AuditDetector}s and merges their output.
 *
 * <p>Merging is deterministic: results are concatenated in detector priority order,
 * issues with the same id are collapsed to the first, issues citing a cell whose
 * formula could not be fully parsed get their confidence lowered one level, and the
 * list is sorted by {@link Issue#REPORT_ORDER}. A detector that throws is recorded
 * as an ERROR diagnostic and the run continues.
 */
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    private static final Comparator<AuditDetector> PRIORITY_ORDER = Comparator
        .comparingInt(AuditDetector::getPriority).reversed()
        .thenComparing(AuditDetector::getId);

    private final List<AuditDetector> detectors;
    private final AuditConfig config;

    /**
     * Creates an engine over the given detectors; disabled ones are dropped.
     *
     * @param detectors candidate detectors
     * @param config configuration deciding which detectors run
     */
    public AuditEngine(List<AuditDetector> detectors, AuditConfig config) {
        this.config = config == null ? AuditConfig.defaults() : config;
        this.detectors = detectors.stream()
            .filter(d -> this.config.detectors().isEnabled(d.getId()))
            .sorted(PRIORITY_ORDER)
            .toList();
    }

    /**
     * Creates an engine over the detectors registered through {@link ServiceLoader}.
     *
     * @param config configuration
     * @return engine
     */
    public static AuditEngine withDiscoveredDetectors(AuditConfig config) {
        return new AuditEngine(discoverDetectors(), config);
    }

    /**
     * Discovers all registered detectors, highest priority first.
     *
     * @return detectors
     */
    public static List<AuditDetector> discoverDetectors() {
        log.debug("Discovering audit detectors via ServiceLoader");
        List<AuditDetector> found = new ArrayList<>();
        ServiceLoader.load(AuditDetector.class).forEach(found::add);
        found.sort(PRIORITY_ORDER);
        if (log.isDebugEnabled()) {
            found.forEach(d -> log.debug("  - {} ({})", d.getId(), d.getDisplayName()));
        }
        return found;
    }

    public List<AuditDetector> getDetectors() {
        return detectors;
    }

    /**
     * Runs every enabled detector that applies.
     *
     * @param context audit context
     * @return merged findings
     */
    public AuditFindings run(AuditContext context) {
        List<AuditDetector> applicable = new ArrayList<>();
        for (AuditDetector detector : detectors) {
            if (detector.appliesTo(context)) {
                applicable.add(detector);
            } else {
                log.debug("Detector {} does not apply to {}", detector.getId(), context.workbook().workbookName());
            }
        }

        List<DetectorResult> results = config.audit().parallel() && applicable.size() > 1
            ? runParallel(applicable, context)
            : runSequential(applicable, context);

        return merge(results, context.build().warnedCells());
    }

    private List<DetectorResult> runSequential(List<AuditDetector> applicable, AuditContext context) {
        List<DetectorResult> results = new ArrayList<>();
        for (AuditDetector detector : applicable) {
            results.add(runOne(detector, context));
        }
        return results;
    }

    private List<DetectorResult> runParallel(List<AuditDetector> applicable, AuditContext context) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(applicable.size(),
            Runtime.getRuntime().availableProcessors()));
        try {
            List<Future<DetectorResult>> futures = new ArrayList<>();
            for (AuditDetector detector : applicable) {
                futures.add(executor.submit(() -> runOne(detector, context)));
            }
            List<DetectorResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    String id = applicable.get(i).getId();
                    log.error("Detector {} failed: {}", id, e.getCause().getMessage(), e.getCause());
                    results.add(DetectorResult.failed(id, String.valueOf(e.getCause().getMessage())));
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running detectors", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private DetectorResult runOne(AuditDetector detector, AuditContext context) {
        try {
            log.info("Running detector: {} ({})", detector.getDisplayName(), detector.getId());
            DetectorResult result = detector.detect(context);
            log.debug("Detector {} reported {} issues", detector.getId(), result.issues().size());
            return result;
        } catch (RuntimeException e) {
            log.error("Detector {} failed: {}", detector.getId(), e.getMessage(), e);
            return DetectorResult.failed(detector.getId(), String.valueOf(e.getMessage()));
        }
    }

    private AuditFindings merge(List<DetectorResult> results, Set<CellRef> warnedCells) {
        Map<String, Issue> byId = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<String> executed = new ArrayList<>();

        for (DetectorResult result : results) {
            executed.add(result.detectorId());
            diagnostics.addAll(result.diagnostics());
            for (Issue issue : result.issues()) {
                Issue previous = byId.putIfAbsent(issue.id(), issue);
                if (previous != null) {
                    log.debug("Dropping duplicate issue {} from {}", issue.id(), result.detectorId());
                }
            }
        }

        List<Issue> issues = new ArrayList<>(byId.size());
        for (Issue issue : byId.values()) {
            boolean touchesWarning = issue.evidence().stream().map(Evidence::cell).anyMatch(warnedCells::contains);
            issues.add(touchesWarning ? issue.withConfidence(issue.confidence().downgrade()) : issue);
        }
        issues.sort(Issue.REPORT_ORDER);
        return new AuditFindings(issues, diagnostics, executed);
    }
}
