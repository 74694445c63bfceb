package com.eainde.alignment.ranking;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.store.RankingCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Cache-aware entry point for persona rankings.
 * <p>
 * A fresh cached ranking is returned as is unless a refresh is forced; otherwise the ranking
 * graph runs end to end and overwrites the cache. Concurrent refreshes of one persona may
 * duplicate work, and the last write wins. If the graph itself fails the static fallback is
 * returned, uncached.
 * </p>
 */
@Slf4j
@Service
public class RankingOrchestrator {

    private final CompiledGraph<RankingState> rankingWorkflow;
    private final RankingCacheStore cacheStore;
    private final StaticFallbackRankings staticRankings;
    private final RankingProperties properties;
    private final Clock clock;

    public RankingOrchestrator(CompiledGraph<RankingState> rankingWorkflow,
                               RankingCacheStore cacheStore,
                               StaticFallbackRankings staticRankings,
                               RankingProperties properties,
                               Clock clock) {
        this.rankingWorkflow = rankingWorkflow;
        this.cacheStore = cacheStore;
        this.staticRankings = staticRankings;
        this.properties = properties;
        this.clock = clock;
    }

    public CachedRanking rankForPersona(PersonaArchetype persona, boolean forceRefresh) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("persona", persona.key())) {
            if (!forceRefresh) {
                Instant now = clock.instant();
                Optional<CachedRanking> cached = cacheStore.find(persona).filter(r -> r.isFreshAt(now));
                if (cached.isPresent()) {
                    log.info("Cache hit for {}, generated at {}", persona, cached.get().generatedAt());
                    return cached.get();
                }
                log.info("Cache miss for {}", persona);
            } else {
                log.info("Forced refresh for {}", persona);
            }
            return generate(persona);
        }
    }

    /**
     * @return every ranking generated for the persona, newest first
     */
    public List<CachedRanking> history(PersonaArchetype persona) {
        return cacheStore.history(persona);
    }

    private CachedRanking generate(PersonaArchetype persona) {
        String flowId = persona.key() + "-" + UUID.randomUUID();
        RunnableConfig config = RunnableConfig.builder()
                .threadId(flowId)
                .build();

        log.info("Generating ranking for {} ({})", persona, flowId);
        try {
            Optional<RankingState> finalState = rankingWorkflow.invoke(Map.of(RankingState.PERSONA, persona), config);
            if (finalState.isPresent()) {
                CachedRanking ranking = finalState.get().getResult();
                logLists(ranking);
                return ranking;
            }
            log.error("Ranking workflow for {} produced no state, using static fallback", persona);
        } catch (Exception e) {
            log.error("Ranking workflow for {} failed, using static fallback", persona, e);
        }
        return CachedRanking.of(persona, staticRankings.forPersona(persona, properties.listSize()),
                RankingMethod.STATIC_FALLBACK, clock.instant(), properties.cacheTtl());
    }

    private static void logLists(CachedRanking ranking) {
        log.info("{} support: {}", ranking.persona(),
                ranking.support().stream().map(e -> e.symbol() + "=" + e.score()).toList());
        log.info("{} oppose: {}", ranking.persona(),
                ranking.oppose().stream().map(e -> e.symbol() + "=" + e.score()).toList());
    }
}
