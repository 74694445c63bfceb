package com.eainde.alignment.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Per-source weights actually applied to one company. Sums to 1 over the available
 * sources, or is all zero when nothing is available.
 */
public record ScoringWeights(
        double donation,
        double sustainability,
        double leadership,
        double news
) implements Serializable {

    public static final ScoringWeights ZERO = new ScoringWeights(0, 0, 0, 0);

    @JsonIgnore
    public double sum() {
        return donation + sustainability + leadership + news;
    }
}
