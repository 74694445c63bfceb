package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.source.LeadershipAnalysis;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Scores executive public statements.
 * <p>
 * A stance classified below the persona's confidence threshold is not trusted and yields a
 * flat 50. Otherwise the analyst recommendation (default 50) moves 15 points toward or away
 * from the persona depending on whether the stated leaning is one it prefers; a moderate or
 * unknown leaning is never penalized. Smaller persona-conditional adjustments follow for
 * controversy, perception risk, sentiment and the social-responsibility sub-scores.
 * </p>
 */
@Component
public class LeadershipStatementScorer implements SourceScorer<LeadershipAnalysis> {

    static final double LEANING_ADJUSTMENT = 15;
    static final String MODERATE = "moderate";

    @Override
    public Double score(LeadershipAnalysis data, PersonaConfig config) {
        if (data == null || !data.hasStatements()) {
            return null;
        }
        PersonaConfig.Leadership prefs = config.leadership();
        PersonaArchetype persona = config.archetype();

        LeadershipAnalysis.PoliticalStance stance = data.politicalStance();
        double confidence = stance != null && stance.confidence() != null ? stance.confidence() : 0;
        if (confidence < prefs.confidenceThreshold()) {
            return Scores.NEUTRAL;
        }

        String leaning = stance.overallLeaning() != null
                ? stance.overallLeaning().toLowerCase(Locale.ROOT) : "";
        boolean matches = prefs.preferredLeanings().stream()
                .anyMatch(preferred -> leaning.contains(preferred.toLowerCase(Locale.ROOT)));

        double score = data.recommendationScore() != null ? data.recommendationScore() : Scores.NEUTRAL;
        if (matches) {
            score = Math.min(100, score + LEANING_ADJUSTMENT);
        } else if (!leaning.isEmpty() && !MODERATE.equals(leaning)) {
            score = Math.max(0, score - LEANING_ADJUSTMENT);
        }

        score += sentimentAdjustment(data.sentiment(), persona);
        score += socialResponsibilityAdjustment(data.socialResponsibility(), persona);

        return Scores.clamp(score);
    }

    private double sentimentAdjustment(LeadershipAnalysis.Sentiment sentiment, PersonaArchetype persona) {
        if (sentiment == null) {
            return 0;
        }
        double adjustment = 0;

        Double controversy = sentiment.controversyLevel();
        if (controversy != null) {
            // anti-establishment personas read controversy as a signal, globalist capital as a risk
            if (persona.isSocialist() || persona.isNationalist()) {
                adjustment += Math.min(5, controversy * 0.5);
            } else if (persona == PersonaArchetype.CAPITALIST_GLOBALIST) {
                adjustment -= Math.min(8, controversy * 0.8);
            }
        }

        String risk = lower(sentiment.publicPerceptionRisk());
        if ("high".equals(risk)) {
            adjustment -= 5;
        } else if ("medium".equals(risk)) {
            adjustment -= 2;
        }

        String overall = lower(sentiment.overallSentiment());
        if ("positive".equals(overall)) {
            adjustment += 3;
        } else if ("negative".equals(overall)) {
            adjustment -= 3;
        }
        return adjustment;
    }

    private double socialResponsibilityAdjustment(LeadershipAnalysis.SocialResponsibility social,
                                                  PersonaArchetype persona) {
        if (social == null) {
            return 0;
        }
        double adjustment = 0;

        if (social.laborPracticesScore() != null && (persona.isProgressive() || persona.isSocialist())) {
            adjustment += centred(social.laborPracticesScore()) * 8;
        }
        if (social.communityEngagementScore() != null && persona.isNationalist()) {
            adjustment += centred(social.communityEngagementScore()) * 5;
        }
        Double diversity = social.diversityInclusionScore();
        if (diversity != null) {
            if (persona.isProgressive()) {
                adjustment += centred(diversity) * 10;
            } else if (persona.isConservative()) {
                adjustment += centred(diversity) * -2;
            }
        }
        return adjustment;
    }

    /** Maps 0..100 to -1..1. */
    private static double centred(double subScore) {
        return (subScore - 50) / 50;
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }
}
