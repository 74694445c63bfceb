package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.ranking.RankingEntry;
import com.eainde.alignment.ranking.RankingLists;
import com.eainde.alignment.ranking.RankingMethod;
import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.scoring.CompanyScoreResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Takes the top N of the sorted candidates as the support list and the bottom N, worst
 * first, as the oppose list.
 */
@Component
public class SelectRankingNode implements AsyncNodeAction<RankingState> {

    private final int listSize;

    public SelectRankingNode(RankingProperties properties) {
        this.listSize = properties.listSize();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        return CompletableFuture.completedFuture(Map.of(
                RankingState.RANKING, select(state.getScored(), listSize),
                RankingState.METHOD, RankingMethod.SCORED));
    }

    static RankingLists select(List<CompanyScoreResult> sorted, int listSize) {
        int n = Math.min(listSize, sorted.size());

        List<RankingEntry> support = sorted.subList(0, n).stream()
                .map(RankingEntry::from)
                .toList();

        List<RankingEntry> oppose = new ArrayList<>(sorted.subList(sorted.size() - n, sorted.size()).stream()
                .map(RankingEntry::from)
                .toList());
        Collections.reverse(oppose);

        return new RankingLists(support, oppose);
    }
}
