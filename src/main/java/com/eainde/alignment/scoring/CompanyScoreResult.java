package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.source.CompanyProfile;

import java.io.Serializable;

/**
 * Everything computed for one company under one persona. Built once and never modified.
 *
 * @param company            identity of the scored company
 * @param persona            persona the score is relative to
 * @param sourceScores       per-source results, absent where there was no data
 * @param availability       which sources produced a score
 * @param weights            redistributed weights actually applied
 * @param numericalScore     weighted sum, or 50 with no data
 * @param narrativeScore     narrative verdict, {@code null} when narrative analysis is disabled
 * @param narrativeRationale short rationale from the narrative verdict
 * @param finalScore         blended score in [0,100]
 * @param reasoning          consumer-facing explanation, tagged evidence- or inference-based
 * @param dataSourceCount    number of sources with data, 0-4
 */
public record CompanyScoreResult(
        CompanyProfile company,
        PersonaArchetype persona,
        SourceScores sourceScores,
        DataAvailability availability,
        ScoringWeights weights,
        double numericalScore,
        Double narrativeScore,
        String narrativeRationale,
        double finalScore,
        String reasoning,
        int dataSourceCount
) implements Serializable {

    public String symbol() {
        return company.symbol();
    }
}
