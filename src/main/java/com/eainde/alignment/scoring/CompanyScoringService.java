package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySourceFetcher;
import com.eainde.alignment.source.CompanySources;
import com.eainde.alignment.store.CompanySourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * On-demand scoring of a single company. Never reads or writes the ranking cache.
 */
@Slf4j
@Service
public class CompanyScoringService {

    private final CompanySourceRepository repository;
    private final CompanySourceFetcher fetcher;
    private final CompanyScorer scorer;

    public CompanyScoringService(CompanySourceRepository repository,
                                 CompanySourceFetcher fetcher,
                                 CompanyScorer scorer) {
        this.repository = repository;
        this.fetcher = fetcher;
        this.scorer = scorer;
    }

    /**
     * Scores any identifier, including companies outside the ranking universe; those are
     * profiled with the identifier as name and an unknown sector.
     */
    public CompanyScoreResult scoreCompany(String companyId, PersonaArchetype persona) {
        if (companyId == null || companyId.isBlank()) {
            throw new IllegalArgumentException("Company identifier is mandatory");
        }
        String symbol = companyId.trim();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("persona", persona.key());
             MDC.MDCCloseable ignoredSymbol = MDC.putCloseable("symbol", symbol)) {

            CompanyProfile profile = repository.findProfile(symbol)
                    .orElseGet(() -> CompanyProfile.unknown(symbol));
            CompanySources sources = fetcher.fetch(profile.symbol()).join();

            CompanyScoreResult result = scorer.score(profile, sources, persona);
            log.info("Scored {} for {}: {} from {} source(s)",
                    profile.symbol(), persona, Scores.format(result.finalScore()), result.dataSourceCount());
            return result;
        }
    }
}
