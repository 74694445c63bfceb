package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.source.SustainabilityRatings;
import org.springframework.stereotype.Component;

/**
 * Scores environmental / social / governance ratings through the persona's sub-weights.
 * Personas that dislike high ratings see the blend inverted; importance then pulls the
 * result toward 50. Progressive and socialist personas also take 30% from the document's
 * progressive-lean reading, and a sector benchmark moves the score by at most 5 points.
 */
@Component
public class SustainabilityAlignmentScorer implements SourceScorer<SustainabilityRatings> {

    static final double PROGRESSIVE_LEAN_WEIGHT = 0.3;
    static final double MAX_INDUSTRY_ADJUSTMENT = 5;

    @Override
    public Double score(SustainabilityRatings data, PersonaConfig config) {
        if (data == null || !data.hasAnySubScore()) {
            return null;
        }
        PersonaConfig.Sustainability prefs = config.sustainability();

        double weighted = (orNeutral(data.environmentalScore()) * prefs.environmentalWeight()
                + orNeutral(data.socialScore()) * prefs.socialWeight()
                + orNeutral(data.governanceScore()) * prefs.governanceWeight())
                / prefs.totalWeight();

        double directional = prefs.preferHighScore() ? weighted : 100 - weighted;
        double score = Scores.blendTowardNeutral(directional, prefs.importance());

        if (data.progressiveLeanScore() != null
                && (config.archetype().isProgressive() || config.archetype().isSocialist())) {
            score = score * (1 - PROGRESSIVE_LEAN_WEIGHT) + data.progressiveLeanScore() * PROGRESSIVE_LEAN_WEIGHT;
        }

        if (data.hasIndustryBenchmark()) {
            double average = data.industryAverageScore();
            double relative = (data.overallScore() - average) / average * 100;
            double bonus = Math.max(-MAX_INDUSTRY_ADJUSTMENT, Math.min(MAX_INDUSTRY_ADJUSTMENT, relative / 4));
            score += prefs.preferHighScore() ? bonus : -bonus;
        }

        return Scores.clamp(score);
    }

    private static double orNeutral(Double subScore) {
        return subScore != null ? subScore : Scores.NEUTRAL;
    }
}
