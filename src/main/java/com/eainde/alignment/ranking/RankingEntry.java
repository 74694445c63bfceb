package com.eainde.alignment.ranking;

import com.eainde.alignment.scoring.CompanyScoreResult;
import com.eainde.alignment.scoring.Scores;
import com.eainde.alignment.source.CompanyProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One company in a published ranking, stripped of internal scoring detail.
 */
public record RankingEntry(
        @JsonProperty("symbol")    String symbol,
        @JsonProperty("name")      String name,
        @JsonProperty("sector")    String sector,
        @JsonProperty("score")     int score,
        @JsonProperty("reasoning") String reasoning
) implements Serializable {

    public static RankingEntry from(CompanyScoreResult result) {
        return of(result.company(), result.finalScore(), result.reasoning());
    }

    public static RankingEntry of(CompanyProfile company, double score, String reasoning) {
        return new RankingEntry(company.symbol(), company.name(), company.sector(),
                (int) Math.round(Scores.clamp(score)), reasoning);
    }
}
