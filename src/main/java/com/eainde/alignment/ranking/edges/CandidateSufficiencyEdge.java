package com.eainde.alignment.ranking.edges;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.ranking.RankingState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes to the universe fallback unless at least N scored candidates carry structured data.
 * Candidates scored purely from general knowledge do not count.
 */
@Slf4j
@Component
public class CandidateSufficiencyEdge implements AsyncEdgeAction<RankingState> {

    public static final String SUFFICIENT = "sufficient";
    public static final String INSUFFICIENT = "insufficient";

    private final int listSize;

    public CandidateSufficiencyEdge(RankingProperties properties) {
        this.listSize = properties.listSize();
    }

    @Override
    public CompletableFuture<String> apply(RankingState state) {
        long withData = state.getScored().stream()
                .filter(result -> result.dataSourceCount() > 0)
                .count();

        String next;
        if (withData >= listSize) {
            next = SUFFICIENT;
        } else {
            log.info("Only {} of {} candidates have structured data for {}, need {}",
                    withData, state.getScored().size(), state.getPersona(), listSize);
            next = INSUFFICIENT;
        }
        return CompletableFuture.completedFuture(next);
    }
}
