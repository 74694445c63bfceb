package com.eainde.alignment.source;

import com.eainde.alignment.store.CompanySourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Fetches the four source documents of a company concurrently.
 * <p>
 * Each read is independent: one that fails is logged and treated as absent, and never
 * fails the others. The returned future completes once all four reads have settled and
 * never completes exceptionally.
 * </p>
 */
@Slf4j
@Component
public class CompanySourceFetcher {

    private final CompanySourceRepository repository;
    private final Executor executor;

    public CompanySourceFetcher(CompanySourceRepository repository,
                                @Qualifier("sourceFetchExecutor") Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public CompletableFuture<CompanySources> fetch(String symbol) {
        CompletableFuture<DonationSummary> donation = read(symbol, "donation",
                () -> repository.findDonationSummary(symbol).orElse(null));
        CompletableFuture<SustainabilityRatings> sustainability = read(symbol, "sustainability",
                () -> repository.findSustainabilityRatings(symbol).orElse(null));
        CompletableFuture<LeadershipAnalysis> leadership = read(symbol, "leadership",
                () -> repository.findLeadershipAnalysis(symbol).orElse(null));
        CompletableFuture<List<NewsArticle>> news = read(symbol, "news",
                () -> repository.findRecentNews(symbol));

        return CompletableFuture.allOf(donation, sustainability, leadership, news)
                .thenApply(ignored -> new CompanySources(
                        donation.join(), sustainability.join(), leadership.join(), news.join()))
                .exceptionally(e -> {
                    log.warn("Failed to assemble sources for {}, treating all as absent: {}", symbol, e.getMessage());
                    return CompanySources.empty();
                });
    }

    private <T> CompletableFuture<T> read(String symbol, String source, Supplier<T> reader) {
        return CompletableFuture.supplyAsync(reader, executor)
                .exceptionally(e -> {
                    log.warn("Failed to read {} for {}, treating as absent: {}", source, symbol, e.getMessage());
                    return null;
                });
    }
}
