package com.eainde.alignment.persona;

import java.util.List;
import java.util.Objects;

/**
 * Per-archetype scoring preferences for the four data sources.
 *
 * <p>Every bound is checked on construction. A config that violates one is a
 * programming error and fails fast when the {@link PersonaConfigTable} loads.</p>
 *
 * @param archetype      the archetype these preferences belong to; scorers use it
 *                       for the bloc/orientation-conditional adjustments
 * @param donation       political-donation preferences
 * @param sustainability sustainability-rating preferences
 * @param leadership     leadership-statement preferences
 * @param news           news-sentiment preferences
 */
public record PersonaConfig(
        PersonaArchetype archetype,
        Donation donation,
        Sustainability sustainability,
        Leadership leadership,
        News news
) {

    public PersonaConfig {
        Objects.requireNonNull(archetype, "archetype");
        Objects.requireNonNull(donation, "donation");
        Objects.requireNonNull(sustainability, "sustainability");
        Objects.requireNonNull(leadership, "leadership");
        Objects.requireNonNull(news, "news");
    }

    /**
     * @param partyPreference   -1 = Republican, 0 = neutral, +1 = Democratic; magnitude is strength
     * @param amountSensitivity how strongly large total donations are penalised
     */
    public record Donation(double partyPreference, double amountSensitivity) {
        public Donation {
            requireRange("partyPreference", partyPreference, -1, 1);
            requireRange("amountSensitivity", amountSensitivity, 0, 1);
        }

        public boolean prefersDemocratic()  { return partyPreference > 0; }
        public boolean prefersRepublican()  { return partyPreference < 0; }
    }

    /**
     * @param environmentalWeight weight of the environmental sub-score
     * @param socialWeight        weight of the social sub-score
     * @param governanceWeight    weight of the governance sub-score
     * @param preferHighScore     false inverts the blended rating (high rating reads as bad)
     * @param importance          blend factor against the neutral 50 baseline
     */
    public record Sustainability(double environmentalWeight,
                                 double socialWeight,
                                 double governanceWeight,
                                 boolean preferHighScore,
                                 double importance) {
        public Sustainability {
            requireRange("environmentalWeight", environmentalWeight, 0, 1);
            requireRange("socialWeight", socialWeight, 0, 1);
            requireRange("governanceWeight", governanceWeight, 0, 1);
            requireRange("importance", importance, 0, 1);
            if (environmentalWeight + socialWeight + governanceWeight <= 0) {
                throw new IllegalArgumentException("Sustainability sub-weights must not all be zero");
            }
        }

        public double totalWeight() {
            return environmentalWeight + socialWeight + governanceWeight;
        }
    }

    /**
     * @param preferredLeanings   rhetorical leanings this persona rewards (lower-case)
     * @param confidenceThreshold stance classifications below this confidence are ignored
     */
    public record Leadership(List<String> preferredLeanings, double confidenceThreshold) {
        public Leadership {
            preferredLeanings = List.copyOf(Objects.requireNonNull(preferredLeanings, "preferredLeanings"));
            requireRange("confidenceThreshold", confidenceThreshold, 0, 100);
        }
    }

    /**
     * @param sentimentPreference -1 rewards critical coverage, +1 rewards positive coverage
     * @param importance          blend factor against the neutral 50 baseline
     */
    public record News(double sentimentPreference, double importance) {
        public News {
            requireRange("sentimentPreference", sentimentPreference, -1, 1);
            requireRange("importance", importance, 0, 1);
        }
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(
                    String.format("%s must be within [%s, %s] but was %s", name, min, max, value));
        }
    }
}
