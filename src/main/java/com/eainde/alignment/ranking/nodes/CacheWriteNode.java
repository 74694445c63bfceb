package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.ranking.CachedRanking;
import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.store.RankingCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stamps the ranking with its generation and expiry times and stores it.
 * Static fallback rankings are returned but not stored, so the next request tries again.
 */
@Slf4j
@Component
public class CacheWriteNode implements AsyncNodeAction<RankingState> {

    private final RankingCacheStore cacheStore;
    private final Clock clock;
    private final Duration ttl;

    public CacheWriteNode(RankingCacheStore cacheStore, Clock clock, RankingProperties properties) {
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.ttl = properties.cacheTtl();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        CachedRanking ranking = CachedRanking.of(
                state.getPersona(), state.getRanking(), state.getMethod(), clock.instant(), ttl);

        if (ranking.method().isCacheable()) {
            cacheStore.save(ranking);
            log.info("Cached {} ranking for {} until {}", ranking.method(), ranking.persona(), ranking.expiresAt());
        } else {
            log.info("Not caching {} ranking for {}", ranking.method(), ranking.persona());
        }
        return CompletableFuture.completedFuture(Map.of(RankingState.RESULT, ranking));
    }
}
