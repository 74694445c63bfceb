package com.eainde.alignment.store;

import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.DonationSummary;
import com.eainde.alignment.source.LeadershipAnalysis;
import com.eainde.alignment.source.NewsArticle;
import com.eainde.alignment.source.SustainabilityRatings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Document store held in memory and seeded from a JSON file.
 * Symbols are matched case-insensitively.
 */
@Slf4j
public class InMemoryCompanySourceRepository implements CompanySourceRepository {

    private final Map<String, CompanyDocument> documents;

    public InMemoryCompanySourceRepository(List<CompanyDocument> documents) {
        Map<String, CompanyDocument> bySymbol = new LinkedHashMap<>();
        for (CompanyDocument document : documents) {
            if (document.symbol() == null || document.symbol().isBlank()) {
                throw new IllegalArgumentException("Company document without symbol");
            }
            bySymbol.put(normalize(document.symbol()), document);
        }
        this.documents = Collections.unmodifiableMap(bySymbol);
    }

    /**
     * Loads the seed file.
     *
     * @throws UncheckedIOException if the resource cannot be read or parsed
     */
    public static InMemoryCompanySourceRepository fromResource(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            CompanyDocument.SeedFile seed = objectMapper.readValue(in, CompanyDocument.SeedFile.class);
            List<CompanyDocument> companies = seed.companies() != null ? seed.companies() : List.of();
            log.info("Loaded {} companies from {}", companies.size(), resource.getDescription());
            return new InMemoryCompanySourceRepository(companies);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load company sources from " + resource.getDescription(), e);
        }
    }

    @Override
    public List<CompanyProfile> listCompanies() {
        return documents.values().stream().map(CompanyDocument::profile).toList();
    }

    @Override
    public Optional<CompanyProfile> findProfile(String symbol) {
        return document(symbol).map(CompanyDocument::profile);
    }

    @Override
    public Optional<DonationSummary> findDonationSummary(String symbol) {
        return document(symbol).map(CompanyDocument::donation);
    }

    @Override
    public Optional<SustainabilityRatings> findSustainabilityRatings(String symbol) {
        return document(symbol).map(CompanyDocument::sustainability);
    }

    @Override
    public Optional<LeadershipAnalysis> findLeadershipAnalysis(String symbol) {
        return document(symbol).map(CompanyDocument::leadership);
    }

    @Override
    public List<NewsArticle> findRecentNews(String symbol) {
        return document(symbol)
                .map(CompanyDocument::news)
                .orElse(List.of());
    }

    private Optional<CompanyDocument> document(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(normalize(symbol)));
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
