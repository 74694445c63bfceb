package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.scoring.CompanyScoreResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Orders candidates by final score, highest first. Ties break on symbol so the order is stable.
 */
@Component
public class SortCandidatesNode implements AsyncNodeAction<RankingState> {

    static final Comparator<CompanyScoreResult> BY_SCORE_DESC =
            Comparator.comparingDouble(CompanyScoreResult::finalScore).reversed()
                    .thenComparing(CompanyScoreResult::symbol);

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        List<CompanyScoreResult> sorted = new ArrayList<>(state.getScored());
        sorted.sort(BY_SCORE_DESC);
        return CompletableFuture.completedFuture(Map.of(RankingState.SCORED, sorted));
    }
}
