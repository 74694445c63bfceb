package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Environmental / social / governance ratings (0-100 each) for one company.
 *
 * @param environmentalScore    environmental sub-score, may be absent
 * @param socialScore           social sub-score, may be absent
 * @param governanceScore       governance sub-score, may be absent
 * @param overallScore          provider's combined rating, used for the industry comparison
 * @param industryAverageScore  sector average of {@code overallScore}, if the provider publishes one
 * @param progressiveLeanScore  optional 0-100 reading of how progressive the rated practices are
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SustainabilityRatings(
        @JsonProperty("environmentalScore")   Double environmentalScore,
        @JsonProperty("socialScore")          Double socialScore,
        @JsonProperty("governanceScore")      Double governanceScore,
        @JsonProperty("overallScore")         Double overallScore,
        @JsonProperty("industryAverageScore") Double industryAverageScore,
        @JsonProperty("progressiveLeanScore") Double progressiveLeanScore
) implements Serializable {

    public static SustainabilityRatings of(double environmental, double social, double governance) {
        return new SustainabilityRatings(environmental, social, governance, null, null, null);
    }

    @JsonIgnore
    public boolean hasAnySubScore() {
        return environmentalScore != null || socialScore != null || governanceScore != null;
    }

    @JsonIgnore
    public boolean hasIndustryBenchmark() {
        return overallScore != null && overallScore != 0
                && industryAverageScore != null && industryAverageScore != 0;
    }
}
