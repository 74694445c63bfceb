package com.eainde.alignment.scoring;

import com.eainde.alignment.narrative.NarrativeVerdict;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Blends the deterministic numerical score with the narrative verdict.
 * <p>
 * With structured data the two halves are averaged with equal weight. Without any, the
 * numerical half is only the neutral placeholder, so the narrative verdict is used alone
 * and the reasoning is tagged as general-knowledge inference. A {@code null} verdict means
 * narrative analysis is switched off.
 * </p>
 */
@Component
public class ScoreCombiner {

    static final String EVIDENCE_TAG = "[AI-Data]";
    static final String INFERENCE_TAG = "[General-Knowledge]";
    static final String NUMERICAL_TAG = "[Numerical]";
    static final String NEUTRAL_TAG = "[Neutral]";

    public CombinedScore combine(double numericalScore, @Nullable NarrativeVerdict verdict, int dataSourceCount) {
        if (verdict == null) {
            if (dataSourceCount > 0) {
                return new CombinedScore(numericalScore, NUMERICAL_TAG
                        + " Narrative analysis disabled; score from " + dataSourceCount
                        + " structured source(s) | Numerical=" + Scores.format(numericalScore));
            }
            return new CombinedScore(Scores.NEUTRAL, NEUTRAL_TAG
                    + " Narrative analysis disabled and no structured data available");
        }

        if (dataSourceCount == 0) {
            return new CombinedScore(verdict.score(), INFERENCE_TAG
                    + " No structured data available; score inferred from general knowledge | "
                    + verdict.rationale());
        }

        double blended = (numericalScore + verdict.score()) / 2;
        return new CombinedScore(blended, EVIDENCE_TAG
                + " Numerical=" + Scores.format(numericalScore)
                + ", Narrative=" + Scores.format(verdict.score())
                + " | " + verdict.rationale());
    }
}
