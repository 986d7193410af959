package com.modelauditor.core.audit;

import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueExplanation;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base class for detectors.
 *
 * <p>Provides a logger named after the concrete class and helpers that build
 * issues with deterministic ids and the standard explanation for their kind.
 *
 * @see AuditDetector
 */
public abstract class AbstractDetector implements AuditDetector {

    /**
     * Logger for this detector, named after the concrete class.
     */
    protected final Logger log;

    protected AbstractDetector() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Applies to every workbook unless overridden.
     */
    @Override
    public boolean appliesTo(AuditContext context) {
        return true;
    }

    /**
     * Creates an issue whose id is derived from its kind, primary cell and discriminator.
     *
     * @param kind issue kind
     * @param severity severity
     * @param confidence confidence
     * @param message message
     * @param evidence evidence, primary cell first
     * @param discriminator distinguishes several issues of one kind at the same
     *                      cell; null when there can be only one
     * @return issue
     */
    protected Issue issue(IssueKind kind, Severity severity, ConfidenceLevel confidence,
                          String message, List<Evidence> evidence, String discriminator) {
        return issue(kind, severity, confidence, message, evidence, discriminator, IssueExplanations.forKind(kind));
    }

    /**
     * Creates an issue with an explanation other than the standard one for its kind.
     */
    protected Issue issue(IssueKind kind, Severity severity, ConfidenceLevel confidence, String message,
                          List<Evidence> evidence, String discriminator, IssueExplanation explanation) {
        return new Issue(Issues.idFor(kind, evidence.get(0).cell(), discriminator),
            kind, severity, confidence, message, evidence, explanation);
    }

    protected DetectorResult emptyResult() {
        return DetectorResult.empty(getId());
    }

    protected DetectorResult result(List<Issue> issues, List<Diagnostic> diagnostics) {
        return DetectorResult.of(getId(), issues, diagnostics);
    }

    protected Diagnostic info(String message) {
        return Diagnostic.info(getId(), message);
    }
}
