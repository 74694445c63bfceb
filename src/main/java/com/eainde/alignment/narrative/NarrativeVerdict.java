package com.eainde.alignment.narrative;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Score and one-sentence rationale returned by narrative analysis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeVerdict(
        @JsonProperty("score")     double score,
        @JsonProperty("rationale") String rationale
) implements Serializable {

    public static final String FAILED_RATIONALE = "Narrative analysis failed";

    /**
     * Neutral verdict substituted when the analysis call fails.
     */
    public static NarrativeVerdict failed() {
        return new NarrativeVerdict(50.0, FAILED_RATIONALE);
    }
}
