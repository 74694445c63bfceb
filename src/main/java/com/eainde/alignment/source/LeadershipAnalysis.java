package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Analysis of public statements made by a company's executives.
 *
 * @param hasStatements         false when the collector found nothing to analyse
 * @param politicalStance       stance classification and its confidence
 * @param recommendationScore   analyst base score 0-100, 50 when absent
 * @param sentiment             controversy and sentiment readings
 * @param socialResponsibility  labor / community / diversity sub-scores
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LeadershipAnalysis(
        @JsonProperty("hasStatements")        boolean hasStatements,
        @JsonProperty("politicalStance")      PoliticalStance politicalStance,
        @JsonProperty("recommendationScore")  Double recommendationScore,
        @JsonProperty("sentiment")            Sentiment sentiment,
        @JsonProperty("socialResponsibility") SocialResponsibility socialResponsibility
) implements Serializable {

    /**
     * @param overallLeaning e.g. "progressive", "conservative", "moderate"
     * @param confidence     classifier confidence 0-100
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PoliticalStance(
            @JsonProperty("overallLeaning") String overallLeaning,
            @JsonProperty("confidence")     Double confidence
    ) implements Serializable {}

    /**
     * @param controversyLevel     0-10
     * @param publicPerceptionRisk low / medium / high
     * @param overallSentiment     positive / neutral / negative
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Sentiment(
            @JsonProperty("controversyLevel")     Double controversyLevel,
            @JsonProperty("publicPerceptionRisk") String publicPerceptionRisk,
            @JsonProperty("overallSentiment")     String overallSentiment
    ) implements Serializable {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SocialResponsibility(
            @JsonProperty("laborPracticesScore")      Double laborPracticesScore,
            @JsonProperty("communityEngagementScore") Double communityEngagementScore,
            @JsonProperty("diversityInclusionScore")  Double diversityInclusionScore
    ) implements Serializable {}
}
