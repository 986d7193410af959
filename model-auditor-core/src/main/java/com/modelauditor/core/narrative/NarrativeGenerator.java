package com.modelauditor.core.narrative;

import com.modelauditor.core.model.AuditReport;

/**
 * Produces a prose summary of an audit for readers who will not open the findings table.
 *
 * <p>Implementations may call out to a language model; the core never depends on
 * their output, and nothing they return is fed back into the audit.
 */
public interface NarrativeGenerator {

    /**
     * Summarizes an audit.
     *
     * @param report audit result
     * @return summary text
     * @throws NarrativeUnavailableException if no summary can be produced
     */
    String summarize(AuditReport report) throws NarrativeUnavailableException;
}
