package com.eainde.alignment.ranking;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.narrative.NarrativeAnalysisException;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.edges.CandidateSufficiencyEdge;
import com.eainde.alignment.ranking.nodes.CacheWriteNode;
import com.eainde.alignment.ranking.nodes.FetchSourcesNode;
import com.eainde.alignment.ranking.nodes.NarrativeFallbackNode;
import com.eainde.alignment.ranking.nodes.ScoreCandidatesNode;
import com.eainde.alignment.ranking.nodes.SelectRankingNode;
import com.eainde.alignment.ranking.nodes.SortCandidatesNode;
import com.eainde.alignment.scoring.TestScorers;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySourceFetcher;
import com.eainde.alignment.store.CompanyDocument;
import com.eainde.alignment.store.InMemoryCompanySourceRepository;
import com.eainde.alignment.store.InMemoryRankingCacheStore;
import org.bsc.langgraph4j.GraphStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the compiled ranking graph end to end over in-memory stores, with narrative
 * analysis switched off unless a universe ranker is supplied.
 */
class RankingOrchestratorTest {

    private static final PersonaArchetype PERSONA = PersonaArchetype.PROGRESSIVE_GLOBALIST;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T00:00:00Z"));
    private final InMemoryRankingCacheStore cacheStore = new InMemoryRankingCacheStore();
    private final RankingProperties properties = RankingProperties.DEFAULTS;

    private RankingOrchestrator orchestrator(InMemoryCompanySourceRepository repository, UniverseRanker universeRanker)
            throws GraphStateException {
        CompanySourceFetcher fetcher = new CompanySourceFetcher(repository, Runnable::run);
        StaticFallbackRankings staticRankings = new StaticFallbackRankings(repository);

        DefaultListableBeanFactory factory = new DefaultListableBeanFactory();
        if (universeRanker != null) {
            factory.registerSingleton("universeRanker", universeRanker);
        }
        ObjectProvider<UniverseRanker> rankerProvider = factory.getBeanProvider(UniverseRanker.class);

        RankingWorkflowGraph graph = new RankingWorkflowGraph(
                new FetchSourcesNode(repository, fetcher),
                new ScoreCandidatesNode(TestScorers.numericalOnly(clock), Runnable::run),
                new SortCandidatesNode(),
                new SelectRankingNode(properties),
                new NarrativeFallbackNode(rankerProvider, staticRankings, properties),
                new CacheWriteNode(cacheStore, clock, properties),
                new CandidateSufficiencyEdge(properties));

        return new RankingOrchestrator(graph.build(), cacheStore, staticRankings, properties, clock);
    }

    private RankingOrchestrator orchestrator(List<CompanyDocument> documents) throws GraphStateException {
        return orchestrator(new InMemoryCompanySourceRepository(documents), null);
    }

    @Nested
    @DisplayName("Scored rankings")
    class Scored {

        @Test
        @DisplayName("support is the top five descending, oppose the bottom five worst first")
        void topAndBottom() throws GraphStateException {
            CachedRanking ranking = orchestrator(RankingFixtures.donationUniverse(10)).rankForPersona(PERSONA, false);

            assertThat(ranking.method()).isEqualTo(RankingMethod.SCORED);
            assertThat(ranking.support()).extracting(RankingEntry::symbol)
                    .containsExactly("A10", "A09", "A08", "A07", "A06");
            assertThat(ranking.oppose()).extracting(RankingEntry::symbol)
                    .containsExactly("A01", "A02", "A03", "A04", "A05");
            assertThat(ranking.support()).extracting(RankingEntry::score).isSortedAccordingTo((a, b) -> b - a);
            assertThat(ranking.oppose()).extracting(RankingEntry::score).isSorted();
            assertThat(ranking.expiresAt()).isEqualTo(ranking.generatedAt().plus(Duration.ofHours(12)));
        }

        @Test
        @DisplayName("serves a fresh cached ranking without regenerating")
        void cacheHit() throws GraphStateException {
            RankingOrchestrator orchestrator = orchestrator(RankingFixtures.donationUniverse(10));

            CachedRanking first = orchestrator.rankForPersona(PERSONA, false);
            clock.advance(Duration.ofHours(1));
            CachedRanking second = orchestrator.rankForPersona(PERSONA, false);

            assertThat(second).isSameAs(first);
            assertThat(orchestrator.history(PERSONA)).hasSize(1);
        }

        @Test
        @DisplayName("regenerates on forced refresh")
        void forcedRefresh() throws GraphStateException {
            RankingOrchestrator orchestrator = orchestrator(RankingFixtures.donationUniverse(10));

            CachedRanking first = orchestrator.rankForPersona(PERSONA, false);
            clock.advance(Duration.ofMinutes(5));
            CachedRanking refreshed = orchestrator.rankForPersona(PERSONA, true);

            assertThat(refreshed.generatedAt()).isAfter(first.generatedAt());
            assertThat(cacheStore.find(PERSONA)).contains(refreshed);
            assertThat(orchestrator.history(PERSONA)).containsExactly(refreshed, first);
        }

        @Test
        @DisplayName("regenerates once the cached ranking has expired")
        void expiry() throws GraphStateException {
            RankingOrchestrator orchestrator = orchestrator(RankingFixtures.donationUniverse(10));

            CachedRanking first = orchestrator.rankForPersona(PERSONA, false);
            clock.advance(Duration.ofHours(13));
            CachedRanking second = orchestrator.rankForPersona(PERSONA, false);

            assertThat(second.generatedAt()).isEqualTo(first.generatedAt().plus(Duration.ofHours(13)));
        }

        @Test
        @DisplayName("caches each persona separately")
        void perPersona() throws GraphStateException {
            RankingOrchestrator orchestrator = orchestrator(RankingFixtures.donationUniverse(10));

            CachedRanking progressive = orchestrator.rankForPersona(PERSONA, false);
            CachedRanking conservative = orchestrator.rankForPersona(PersonaArchetype.CONSERVATIVE_NATIONALIST, false);

            assertThat(conservative.support()).extracting(RankingEntry::symbol)
                    .containsExactly("A01", "A02", "A03", "A04", "A05");
            assertThat(cacheStore.find(PERSONA)).contains(progressive);
        }
    }

    @Nested
    @DisplayName("Insufficient candidates")
    class Insufficient {

        private List<CompanyDocument> sparseUniverse() {
            List<CompanyDocument> documents = new ArrayList<>(RankingFixtures.donationUniverse(3));
            documents.addAll(RankingFixtures.emptyUniverse("XOM", "TSLA", "NKE", "LMT"));
            return documents;
        }

        @Test
        @DisplayName("uses the static lists without caching them when narrative analysis is off")
        void staticFallback() throws GraphStateException {
            CachedRanking ranking = orchestrator(sparseUniverse()).rankForPersona(PERSONA, false);

            assertThat(ranking.method()).isEqualTo(RankingMethod.STATIC_FALLBACK);
            assertThat(ranking.support()).hasSize(5).allSatisfy(entry -> assertThat(entry.score()).isEqualTo(85));
            assertThat(ranking.support().get(0)).isEqualTo(new RankingEntry(
                    "TSLA", "TSLA Inc", "Unknown", 85, StaticFallbackRankings.REASONING));
            assertThat(ranking.oppose()).extracting(RankingEntry::symbol).startsWith("XOM");
            assertThat(cacheStore.find(PERSONA)).isEmpty();
        }

        @Test
        @DisplayName("uses and caches the universe ranking when available")
        void universeRanking() throws GraphStateException, NarrativeAnalysisException {
            UniverseRanker ranker = mock(UniverseRanker.class);
            RankingLists lists = new RankingLists(
                    List.of(RankingEntry.of(new CompanyProfile("A03", "Company 3", "Sector 3"), 71, "ok")),
                    List.of(RankingEntry.of(new CompanyProfile("XOM", "XOM Inc", "Unknown"), 12, "fossil")));
            when(ranker.rank(eq(PERSONA), anyList(), anyInt())).thenReturn(lists);

            RankingOrchestrator orchestrator = orchestrator(new InMemoryCompanySourceRepository(sparseUniverse()), ranker);
            CachedRanking ranking = orchestrator.rankForPersona(PERSONA, false);

            assertThat(ranking.method()).isEqualTo(RankingMethod.NARRATIVE_UNIVERSE);
            assertThat(ranking.support()).isEqualTo(lists.support());
            assertThat(cacheStore.find(PERSONA)).contains(ranking);
        }

        @Test
        @DisplayName("falls back to the static lists when the universe ranking fails")
        void universeRankingFails() throws GraphStateException, NarrativeAnalysisException {
            UniverseRanker ranker = mock(UniverseRanker.class);
            when(ranker.rank(eq(PERSONA), anyList(), anyInt()))
                    .thenThrow(new NarrativeAnalysisException("no reply"));

            CachedRanking ranking = orchestrator(new InMemoryCompanySourceRepository(sparseUniverse()), ranker)
                    .rankForPersona(PERSONA, false);

            assertThat(ranking.method()).isEqualTo(RankingMethod.STATIC_FALLBACK);
            assertThat(cacheStore.find(PERSONA)).isEmpty();
        }
    }

    @Test
    @DisplayName("returns the static lists when the workflow itself fails")
    void workflowFailure() throws GraphStateException {
        InMemoryCompanySourceRepository broken = new InMemoryCompanySourceRepository(List.of()) {
            @Override
            public List<CompanyProfile> listCompanies() {
                throw new IllegalStateException("store offline");
            }
        };

        CachedRanking ranking = orchestrator(broken, null).rankForPersona(PERSONA, false);

        assertThat(ranking.method()).isEqualTo(RankingMethod.STATIC_FALLBACK);
        assertThat(ranking.support()).extracting(RankingEntry::symbol)
                .containsExactly("TSLA", "CRM", "NFLX", "NKE", "SBUX");
        assertThat(cacheStore.find(PERSONA)).isEmpty();
    }
}
