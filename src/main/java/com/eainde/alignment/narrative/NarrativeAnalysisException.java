package com.eainde.alignment.narrative;

/**
 * Narrative analysis could not produce a verdict: the model call failed or its reply was unusable.
 */
public class NarrativeAnalysisException extends Exception {

    public NarrativeAnalysisException(String message) {
        super(message);
    }

    public NarrativeAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
