package com.eainde.alignment.narrative;

/**
 * Comprehensive, non-deterministic scoring of one company for one persona.
 * Implementations are expected to be slow; callers decide how to degrade on failure.
 */
public interface NarrativeScorer {

    NarrativeVerdict analyze(NarrativeRequest request) throws NarrativeAnalysisException;
}
