package com.modelauditor.core.narrative;

import com.modelauditor.core.model.AuditReport;

/**
 * Default generator used when no narrative backend is configured.
 */
public class UnavailableNarrativeGenerator implements NarrativeGenerator {

    @Override
    public String summarize(AuditReport report) throws NarrativeUnavailableException {
        throw new NarrativeUnavailableException("No narrative generator is configured");
    }
}
