package com.eainde.alignment.scoring;

import org.springframework.stereotype.Component;

/**
 * Renormalizes the fixed target weighting over whichever sources are available.
 * <p>
 * Target weights reflect how much each source is trusted when everything is present:
 * donations 0.4, sustainability 0.3, leadership 0.2, news 0.1. A missing source gives
 * its share to the others in proportion to their targets, so a company with only one
 * source is scored entirely on it instead of being dragged toward zero.
 * </p>
 * When no source is available every weight is 0; the caller is responsible for the
 * neutral fallback.
 */
@Component
public class WeightRedistributionCalculator {

    public static final double DONATION_TARGET = 0.4;
    public static final double SUSTAINABILITY_TARGET = 0.3;
    public static final double LEADERSHIP_TARGET = 0.2;
    public static final double NEWS_TARGET = 0.1;

    public ScoringWeights calculate(DataAvailability availability) {
        double total = (availability.donation() ? DONATION_TARGET : 0)
                + (availability.sustainability() ? SUSTAINABILITY_TARGET : 0)
                + (availability.leadership() ? LEADERSHIP_TARGET : 0)
                + (availability.news() ? NEWS_TARGET : 0);

        if (total == 0) {
            return ScoringWeights.ZERO;
        }

        return new ScoringWeights(
                availability.donation() ? DONATION_TARGET / total : 0,
                availability.sustainability() ? SUSTAINABILITY_TARGET / total : 0,
                availability.leadership() ? LEADERSHIP_TARGET / total : 0,
                availability.news() ? NEWS_TARGET / total : 0);
    }
}
