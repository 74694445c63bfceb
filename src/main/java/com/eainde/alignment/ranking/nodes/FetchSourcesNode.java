package com.eainde.alignment.ranking.nodes;

import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySourceFetcher;
import com.eainde.alignment.source.CompanySources;
import com.eainde.alignment.store.CompanySourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Loads the universe and fetches every company's source documents in parallel.
 */
@Slf4j
@Component
public class FetchSourcesNode implements AsyncNodeAction<RankingState> {

    private final CompanySourceRepository repository;
    private final CompanySourceFetcher fetcher;

    public FetchSourcesNode(CompanySourceRepository repository, CompanySourceFetcher fetcher) {
        this.repository = repository;
        this.fetcher = fetcher;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RankingState state) {
        List<CompanyProfile> companies = new ArrayList<>(repository.listCompanies());
        log.info("Fetching sources for {} companies [{}]", companies.size(), state.getPersona());

        Map<String, CompletableFuture<CompanySources>> pending = new LinkedHashMap<>();
        for (CompanyProfile company : companies) {
            pending.put(company.symbol(), fetcher.fetch(company.symbol()));
        }

        return CompletableFuture.allOf(pending.values().toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    LinkedHashMap<String, CompanySources> sources = new LinkedHashMap<>();
                    pending.forEach((symbol, future) -> sources.put(symbol, future.join()));
                    return Map.of(
                            RankingState.COMPANIES, companies,
                            RankingState.SOURCES, sources);
                });
    }
}
