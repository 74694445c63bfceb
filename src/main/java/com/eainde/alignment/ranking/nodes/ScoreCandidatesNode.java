package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.scoring.CompanyScoreResult;
import com.eainde.alignment.scoring.CompanyScorer;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySources;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Scores every candidate concurrently on the scoring pool.
 * A company whose scoring throws is logged and left out; the rest of the batch continues.
 */
@Slf4j
@Component
public class ScoreCandidatesNode implements AsyncNodeAction<RankingState> {

    private final CompanyScorer scorer;
    private final Executor executor;

    public ScoreCandidatesNode(CompanyScorer scorer, @Qualifier("scoringExecutor") Executor executor) {
        this.scorer = scorer;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        PersonaArchetype persona = state.getPersona();
        Map<String, CompanySources> sources = state.getSources();

        List<CompletableFuture<CompanyScoreResult>> pending = new ArrayList<>();
        for (CompanyProfile company : state.getCompanies()) {
            CompanySources companySources = sources.getOrDefault(company.symbol(), CompanySources.empty());
            pending.add(CompletableFuture
                    .supplyAsync(() -> scoreOne(company, companySources, persona), executor)
                    .exceptionally(e -> {
                        log.warn("Skipping {} for {}: scoring failed: {}", company.symbol(), persona, e.getMessage());
                        return null;
                    }));
        }

        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<CompanyScoreResult> scored = new ArrayList<>(pending.stream()
                            .map(CompletableFuture::join)
                            .filter(Objects::nonNull)
                            .toList());
                    log.info("Scored {}/{} companies for {}", scored.size(), pending.size(), persona);
                    return Map.of(RankingState.SCORED, scored);
                });
    }

    private CompanyScoreResult scoreOne(CompanyProfile company, CompanySources sources, PersonaArchetype persona) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("symbol", company.symbol())) {
            return scorer.score(company, sources, persona);
        }
    }
}
