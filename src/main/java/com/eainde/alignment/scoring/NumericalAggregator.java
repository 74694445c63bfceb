package com.eainde.alignment.scoring;

import org.springframework.stereotype.Component;

/**
 * Weighted sum of the available source scores.
 */
@Component
public class NumericalAggregator {

    /**
     * @return the weighted score in [0,100], or exactly 50 when no source produced a score
     */
    public double aggregate(SourceScores scores, ScoringWeights weights) {
        if (scores.availability().isEmpty()) {
            return Scores.NEUTRAL;
        }
        double total = scores.donation().weighted(weights.donation())
                + scores.sustainability().weighted(weights.sustainability())
                + scores.leadership().weighted(weights.leadership())
                + scores.news().weighted(weights.news());
        return Scores.clamp(total);
    }
}
