package com.modelauditor.core.narrative;

/**
 * Thrown when a narrative summary cannot be produced.
 */
public class NarrativeUnavailableException extends Exception {

    public NarrativeUnavailableException(String message) {
        super(message);
    }

    public NarrativeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
