package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.narrative.NarrativeAnalysisException;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.RankingLists;
import com.eainde.alignment.ranking.RankingMethod;
import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.ranking.StaticFallbackRankings;
import com.eainde.alignment.ranking.UniverseRanker;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces a short scored ranking with a single narrative ranking of the whole universe,
 * or with the static lists if that is unavailable or fails.
 */
@Slf4j
@Component
public class NarrativeFallbackNode implements AsyncNodeAction<RankingState> {

    private final ObjectProvider<UniverseRanker> universeRanker;
    private final StaticFallbackRankings staticRankings;
    private final int listSize;

    public NarrativeFallbackNode(ObjectProvider<UniverseRanker> universeRanker,
                                 StaticFallbackRankings staticRankings,
                                 RankingProperties properties) {
        this.universeRanker = universeRanker;
        this.staticRankings = staticRankings;
        this.listSize = properties.listSize();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        PersonaArchetype persona = state.getPersona();
        UniverseRanker ranker = universeRanker.getIfAvailable();

        if (ranker != null) {
            try {
                RankingLists lists = ranker.rank(persona, state.getCompanies(), listSize);
                return CompletableFuture.completedFuture(Map.of(
                        RankingState.RANKING, lists,
                        RankingState.METHOD, RankingMethod.NARRATIVE_UNIVERSE));
            } catch (NarrativeAnalysisException e) {
                log.warn("Universe ranking failed for {}, using static fallback: {}", persona, e.getMessage());
            }
        } else {
            log.warn("Narrative analysis disabled, using static fallback for {}", persona);
        }

        return CompletableFuture.completedFuture(Map.of(
                RankingState.RANKING, staticRankings.forPersona(persona, listSize),
                RankingState.METHOD, RankingMethod.STATIC_FALLBACK));
    }
}
