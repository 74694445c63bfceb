package com.eainde.alignment.ranking;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.store.InMemoryCompanySourceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StaticFallbackRankingsTest {

    private final StaticFallbackRankings rankings = new StaticFallbackRankings(
            new InMemoryCompanySourceRepository(RankingFixtures.emptyUniverse("XOM", "CVX")));

    @Test
    @DisplayName("every persona has five support and five oppose entries")
    void everyPersona() {
        for (PersonaArchetype persona : PersonaArchetype.values()) {
            RankingLists lists = rankings.forPersona(persona, 5);

            assertThat(lists.support()).hasSize(5)
                    .allSatisfy(entry -> assertThat(entry.score()).isEqualTo(StaticFallbackRankings.SUPPORT_SCORE));
            assertThat(lists.oppose()).hasSize(5)
                    .allSatisfy(entry -> assertThat(entry.score()).isEqualTo(StaticFallbackRankings.OPPOSE_SCORE));
        }
    }

    @Test
    @DisplayName("uses universe profiles where known and the symbol otherwise")
    void profiles() {
        RankingLists lists = rankings.forPersona(PersonaArchetype.CONSERVATIVE_NATIONALIST, 2);

        assertThat(lists.support()).isEqualTo(List.of(
                new RankingEntry("XOM", "XOM Inc", "Unknown", 85, StaticFallbackRankings.REASONING),
                new RankingEntry("CVX", "CVX Inc", "Unknown", 85, StaticFallbackRankings.REASONING)));
        assertThat(lists.oppose()).extracting(RankingEntry::name).containsExactly("META", "DIS");
    }
}
