package com.eainde.alignment.store;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.CachedRanking;
import com.eainde.alignment.ranking.RankingLists;
import com.eainde.alignment.ranking.RankingMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRankingCacheStoreTest {

    private static final Instant T0 = Instant.parse("2026-10-19T00:00:00Z");
    private static final RankingLists EMPTY = new RankingLists(List.of(), List.of());

    private final InMemoryRankingCacheStore store = new InMemoryRankingCacheStore();

    private static CachedRanking generation(PersonaArchetype persona, Instant generatedAt) {
        return CachedRanking.of(persona, EMPTY, RankingMethod.SCORED, generatedAt, Duration.ofHours(12));
    }

    @Test
    @DisplayName("returns empty for a persona that was never ranked")
    void missing() {
        assertThat(store.find(PersonaArchetype.CAPITALIST_GLOBALIST)).isEmpty();
        assertThat(store.history(PersonaArchetype.CAPITALIST_GLOBALIST)).isEmpty();
    }

    @Test
    @DisplayName("the latest save replaces the current ranking and is kept in history")
    void replaceAndHistory() {
        CachedRanking first = generation(PersonaArchetype.PROGRESSIVE_GLOBALIST, T0);
        CachedRanking second = generation(PersonaArchetype.PROGRESSIVE_GLOBALIST, T0.plus(Duration.ofHours(12)));

        store.save(first);
        store.save(second);

        assertThat(store.find(PersonaArchetype.PROGRESSIVE_GLOBALIST)).contains(second);
        assertThat(store.history(PersonaArchetype.PROGRESSIVE_GLOBALIST)).containsExactly(second, first);
    }

    @Test
    @DisplayName("keeps personas independent")
    void perPersona() {
        CachedRanking progressive = generation(PersonaArchetype.PROGRESSIVE_GLOBALIST, T0);
        CachedRanking conservative = generation(PersonaArchetype.CONSERVATIVE_NATIONALIST, T0);

        store.save(progressive);
        store.save(conservative);

        assertThat(store.find(PersonaArchetype.PROGRESSIVE_GLOBALIST)).contains(progressive);
        assertThat(store.history(PersonaArchetype.CONSERVATIVE_NATIONALIST)).containsExactly(conservative);
    }

    @Test
    @DisplayName("keeps every save in history even with the same generation time")
    void sameGenerationTime() {
        CachedRanking first = generation(PersonaArchetype.CAPITALIST_NATIONALIST, T0);
        CachedRanking second = CachedRanking.of(PersonaArchetype.CAPITALIST_NATIONALIST, EMPTY,
                RankingMethod.NARRATIVE_UNIVERSE, T0, Duration.ofHours(12));

        store.save(first);
        store.save(second);

        assertThat(store.find(PersonaArchetype.CAPITALIST_NATIONALIST)).contains(second);
        assertThat(store.history(PersonaArchetype.CAPITALIST_NATIONALIST)).containsExactly(second, first);
    }
}
