package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.persona.PersonaConfigTable;
import com.eainde.alignment.source.LeadershipAnalysis;
import com.eainde.alignment.source.LeadershipAnalysis.PoliticalStance;
import com.eainde.alignment.source.LeadershipAnalysis.Sentiment;
import com.eainde.alignment.source.LeadershipAnalysis.SocialResponsibility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LeadershipStatementScorerTest {

    private final LeadershipStatementScorer scorer = new LeadershipStatementScorer();
    private final PersonaConfigTable table = new PersonaConfigTable();

    private static LeadershipAnalysis statements(String leaning, double confidence, Double recommendation) {
        return new LeadershipAnalysis(true, new PoliticalStance(leaning, confidence), recommendation, null, null);
    }

    @Nested
    @DisplayName("Gating")
    class Gating {

        @Test
        @DisplayName("should return null without a document or without statements")
        void noStatements() {
            PersonaConfig config = table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST);

            assertThat(scorer.score(null, config)).isNull();
            assertThat(scorer.score(new LeadershipAnalysis(false, new PoliticalStance("progressive", 90.0),
                    80.0, null, null), config)).isNull();
        }

        @Test
        @DisplayName("should return exactly 50 below the confidence threshold, even on a match")
        void lowConfidence() {
            PersonaConfig config = table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST);
            LeadershipAnalysis lowConfidence = new LeadershipAnalysis(true,
                    new PoliticalStance("progressive", 59.0), 95.0,
                    new Sentiment(2.0, "low", "positive"), new SocialResponsibility(100.0, 100.0, 100.0));

            assertThat(scorer.score(lowConfidence, config)).isEqualTo(50.0);
        }

        @Test
        @DisplayName("should treat a missing stance as zero confidence")
        void missingStance() {
            LeadershipAnalysis noStance = new LeadershipAnalysis(true, null, 90.0, null, null);

            assertThat(scorer.score(noStance, table.get(PersonaArchetype.CAPITALIST_GLOBALIST))).isEqualTo(50.0);
        }
    }

    @Nested
    @DisplayName("Leaning match")
    class LeaningMatch {

        @Test
        @DisplayName("adds 15 for a preferred leaning, matching case-insensitively by containment")
        void match() {
            Double score = scorer.score(statements("Strongly Progressive", 80, 60.0),
                    table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            assertThat(score).isCloseTo(75.0, within(1e-9));
        }

        @Test
        @DisplayName("subtracts 15 for a clear opposing leaning")
        void mismatch() {
            Double score = scorer.score(statements("conservative", 80, 60.0),
                    table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            assertThat(score).isCloseTo(45.0, within(1e-9));
        }

        @Test
        @DisplayName("never penalizes a moderate or empty leaning")
        void moderateOrEmpty() {
            PersonaConfig base = table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST);
            PersonaConfig onlyProgressive = new PersonaConfig(base.archetype(), base.donation(),
                    base.sustainability(), new PersonaConfig.Leadership(List.of("progressive"), 50), base.news());

            assertThat(scorer.score(statements("moderate", 80, 60.0), onlyProgressive)).isCloseTo(60.0, within(1e-9));
            assertThat(scorer.score(statements("", 80, 60.0), onlyProgressive)).isCloseTo(60.0, within(1e-9));
        }

        @Test
        @DisplayName("defaults the base recommendation to 50 and caps the match bonus at 100")
        void baseAndCap() {
            PersonaConfig config = table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST);

            assertThat(scorer.score(statements("liberal", 80, null), config)).isCloseTo(65.0, within(1e-9));
            assertThat(scorer.score(statements("liberal", 80, 95.0), config)).isCloseTo(100.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Persona-conditional adjustments")
    class Adjustments {

        @Test
        @DisplayName("capitalist-globalist is penalized for controversy, risk and negative sentiment")
        void capitalistGlobalist() {
            LeadershipAnalysis data = new LeadershipAnalysis(true, new PoliticalStance("moderate", 70.0), 50.0,
                    new Sentiment(10.0, "High", "negative"), null);

            // 50 + 15 - min(8, 8) - 5 - 3
            assertThat(scorer.score(data, table.get(PersonaArchetype.CAPITALIST_GLOBALIST)))
                    .isCloseTo(49.0, within(1e-9));
        }

        @Test
        @DisplayName("socialist-nationalist reads controversy as a plus and values labor and community")
        void socialistNationalist() {
            LeadershipAnalysis data = new LeadershipAnalysis(true, new PoliticalStance("conservative", 70.0), 50.0,
                    new Sentiment(6.0, "low", "neutral"), new SocialResponsibility(100.0, 100.0, 100.0));

            // 50 + 15 + 3 (controversy) + 8 (labor) + 5 (community); diversity ignored
            assertThat(scorer.score(data, table.get(PersonaArchetype.SOCIALIST_NATIONALIST)))
                    .isCloseTo(81.0, within(1e-9));
        }

        @Test
        @DisplayName("progressive personas are penalized for poor labor and diversity records")
        void progressive() {
            LeadershipAnalysis data = new LeadershipAnalysis(true, new PoliticalStance("progressive", 70.0), 50.0,
                    null, new SocialResponsibility(0.0, null, 0.0));

            // 50 + 15 - 8 - 10
            assertThat(scorer.score(data, table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST)))
                    .isCloseTo(47.0, within(1e-9));
        }

        @Test
        @DisplayName("conservative personas take a small penalty for a high diversity focus")
        void conservative() {
            LeadershipAnalysis data = new LeadershipAnalysis(true, new PoliticalStance("conservative", 70.0), 50.0,
                    new Sentiment(null, "medium", null), new SocialResponsibility(null, 50.0, 100.0));

            // 50 + 15 - 2 (medium risk) - 2 (diversity); community at 50 is neutral
            assertThat(scorer.score(data, table.get(PersonaArchetype.CONSERVATIVE_NATIONALIST)))
                    .isCloseTo(61.0, within(1e-9));
        }

        @Test
        @DisplayName("result is clamped to [0,100]")
        void clamped() {
            LeadershipAnalysis data = new LeadershipAnalysis(true, new PoliticalStance("liberal", 90.0), 5.0,
                    new Sentiment(10.0, "high", "negative"), new SocialResponsibility(0.0, 0.0, 0.0));

            assertThat(scorer.score(data, table.get(PersonaArchetype.CONSERVATIVE_GLOBALIST))).isEqualTo(0.0);
        }
    }
}
