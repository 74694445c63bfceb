package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.persona.PersonaConfigTable;
import com.eainde.alignment.source.DonationSummary;
import com.eainde.alignment.source.PartyTotal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DonationAlignmentScorerTest {

    private final DonationAlignmentScorer scorer = new DonationAlignmentScorer();
    private final PersonaConfigTable table = new PersonaConfigTable();

    private static DonationSummary split(double total, double dem, double rep) {
        return new DonationSummary(total,
                Map.of("DEM", new PartyTotal(dem), "REP", new PartyTotal(rep)), null);
    }

    private static PersonaConfig withDonation(double preference, double sensitivity) {
        PersonaConfig base = new PersonaConfigTable().get(PersonaArchetype.PROGRESSIVE_GLOBALIST);
        return new PersonaConfig(base.archetype(), new PersonaConfig.Donation(preference, sensitivity),
                base.sustainability(), base.leadership(), base.news());
    }

    @Nested
    @DisplayName("Missing data")
    class MissingData {

        @Test
        @DisplayName("should return null for no document, zero total or no party breakdown")
        void noData() {
            PersonaConfig config = table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST);

            assertThat(scorer.score(null, config)).isNull();
            assertThat(scorer.score(split(0, 0, 0), config)).isNull();
            assertThat(scorer.score(new DonationSummary(1000.0, Map.of(), null), config)).isNull();
            assertThat(scorer.score(new DonationSummary(null, Map.of("DEM", new PartyTotal(5)), null), config)).isNull();
        }
    }

    @Nested
    @DisplayName("Partisan personas")
    class Partisan {

        @Test
        @DisplayName("progressive-globalist on a 70/30 Democratic split of $500k scores 80.5")
        void progressiveGlobalist() {
            Double score = scorer.score(split(500_000, 350_000, 150_000),
                    table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            // 0.7 * 100 * 0.9 - min(20, 0.5 * 0.5 * 10) + 20
            assertThat(score).isCloseTo(80.5, within(1e-9));
        }

        @Test
        @DisplayName("conservative-nationalist on the same data scores 45")
        void conservativeNationalist() {
            Double score = scorer.score(split(500_000, 350_000, 150_000),
                    table.get(PersonaArchetype.CONSERVATIVE_NATIONALIST));

            assertThat(score).isCloseTo(45.0, within(1e-9));
        }

        @Test
        @DisplayName("full Democratic preference outscores full Republican preference on a Democratic split")
        void preferenceDirection() {
            DonationSummary data = split(500_000, 350_000, 150_000);

            Double democratic = scorer.score(data, withDonation(1.0, 0.5));
            Double republican = scorer.score(data, withDonation(-1.0, 0.5));

            assertThat(democratic).isCloseTo(87.5, within(1e-9));
            assertThat(republican).isCloseTo(47.5, within(1e-9));
            assertThat(democratic).isGreaterThan(republican);
        }

        @Test
        @DisplayName("amount penalty is capped at 20 points")
        void penaltyCap() {
            Double score = scorer.score(split(10_000_000, 7_000_000, 3_000_000),
                    table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            assertThat(score).isCloseTo(63.0, within(1e-9));
        }

        @Test
        @DisplayName("lean indicator is blended in 80/20")
        void leanBlend() {
            DonationSummary data = new DonationSummary(500_000.0,
                    Map.of("DEM", new PartyTotal(350_000), "REP", new PartyTotal(150_000)), 40.0);

            Double score = scorer.score(data, table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            // 80.5 * 0.8 + ((40 + 100) / 2) * 0.2
            assertThat(score).isCloseTo(78.4, within(1e-9));
        }

        @Test
        @DisplayName("donating to more than two parties costs 3 points")
        void multiPartyPenalty() {
            DonationSummary data = new DonationSummary(500_000.0, Map.of(
                    "DEM", new PartyTotal(350_000),
                    "REP", new PartyTotal(100_000),
                    "LIB", new PartyTotal(50_000)), null);

            Double score = scorer.score(data, table.get(PersonaArchetype.PROGRESSIVE_GLOBALIST));

            assertThat(score).isCloseTo(77.5, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Neutral personas")
    class Neutral {

        @Test
        @DisplayName("reward distance from an even split and donation diversity, ignoring lean")
        void neutralPreference() {
            DonationSummary data = new DonationSummary(500_000.0,
                    Map.of("DEM", new PartyTotal(350_000), "REP", new PartyTotal(150_000)), 90.0);

            Double score = scorer.score(data, withDonation(0.0, 0.0));

            // 50 + |0.7 - 0.5| * 100 + 20 + min(5, 2 * 2)
            assertThat(score).isCloseTo(94.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("scores stay within [0,100] for every persona")
    void bounded() {
        List<DonationSummary> samples = List.of(
                split(100, 100, 0), split(100, 0, 100), split(50_000_000, 25_000_000, 25_000_000));
        for (PersonaConfig config : table.all().values()) {
            for (DonationSummary sample : samples) {
                assertThat(scorer.score(sample, config)).isBetween(0.0, 100.0);
            }
        }
    }
}
