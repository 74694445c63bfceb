package com.eainde.alignment.ranking;

import com.eainde.alignment.ranking.edges.CandidateSufficiencyEdge;
import com.eainde.alignment.ranking.nodes.CacheWriteNode;
import com.eainde.alignment.ranking.nodes.FetchSourcesNode;
import com.eainde.alignment.ranking.nodes.NarrativeFallbackNode;
import com.eainde.alignment.ranking.nodes.ScoreCandidatesNode;
import com.eainde.alignment.ranking.nodes.SelectRankingNode;
import com.eainde.alignment.ranking.nodes.SortCandidatesNode;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Ranking generation as a state machine:
 * <pre>
 * fetch_sources -> score_candidates -> sort -> select --sufficient--> cache_write -> END
 *                                                    \--insufficient--> narrative_fallback -> cache_write
 * </pre>
 */
@Component
public class RankingWorkflowGraph {

    public static final String FETCH_SOURCES = "fetch_sources";
    public static final String SCORE_CANDIDATES = "score_candidates";
    public static final String SORT = "sort";
    public static final String SELECT = "select";
    public static final String NARRATIVE_FALLBACK = "narrative_fallback";
    public static final String CACHE_WRITE = "cache_write";

    private final FetchSourcesNode fetchSourcesNode;
    private final ScoreCandidatesNode scoreCandidatesNode;
    private final SortCandidatesNode sortNode;
    private final SelectRankingNode selectNode;
    private final NarrativeFallbackNode narrativeFallbackNode;
    private final CacheWriteNode cacheWriteNode;
    private final CandidateSufficiencyEdge sufficiencyEdge;

    public RankingWorkflowGraph(FetchSourcesNode fetchSourcesNode,
                                ScoreCandidatesNode scoreCandidatesNode,
                                SortCandidatesNode sortNode,
                                SelectRankingNode selectNode,
                                NarrativeFallbackNode narrativeFallbackNode,
                                CacheWriteNode cacheWriteNode,
                                CandidateSufficiencyEdge sufficiencyEdge) {
        this.fetchSourcesNode = fetchSourcesNode;
        this.scoreCandidatesNode = scoreCandidatesNode;
        this.sortNode = sortNode;
        this.selectNode = selectNode;
        this.narrativeFallbackNode = narrativeFallbackNode;
        this.cacheWriteNode = cacheWriteNode;
        this.sufficiencyEdge = sufficiencyEdge;
    }

    @Bean("rankingWorkflow")
    public CompiledGraph<RankingState> build() throws GraphStateException {

        StateGraph<RankingState> workflow = new StateGraph<>(RankingState::new);

        workflow.addNode(FETCH_SOURCES, fetchSourcesNode);
        workflow.addNode(SCORE_CANDIDATES, scoreCandidatesNode);
        workflow.addNode(SORT, sortNode);
        workflow.addNode(SELECT, selectNode);
        workflow.addNode(NARRATIVE_FALLBACK, narrativeFallbackNode);
        workflow.addNode(CACHE_WRITE, cacheWriteNode);

        workflow.addEdge(START, FETCH_SOURCES);
        workflow.addEdge(FETCH_SOURCES, SCORE_CANDIDATES);
        workflow.addEdge(SCORE_CANDIDATES, SORT);
        workflow.addEdge(SORT, SELECT);

        workflow.addConditionalEdges(
                SELECT,
                sufficiencyEdge,
                Map.of(
                        CandidateSufficiencyEdge.SUFFICIENT, CACHE_WRITE,
                        CandidateSufficiencyEdge.INSUFFICIENT, NARRATIVE_FALLBACK
                )
        );

        workflow.addEdge(NARRATIVE_FALLBACK, CACHE_WRITE);
        workflow.addEdge(CACHE_WRITE, END);

        return workflow.compile();
    }
}
