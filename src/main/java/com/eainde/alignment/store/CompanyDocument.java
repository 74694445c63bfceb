package com.eainde.alignment.store;

import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.DonationSummary;
import com.eainde.alignment.source.LeadershipAnalysis;
import com.eainde.alignment.source.NewsArticle;
import com.eainde.alignment.source.SustainabilityRatings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One company entry of the seed file: profile plus whichever source documents exist.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompanyDocument(
        @JsonProperty("symbol")         String symbol,
        @JsonProperty("name")           String name,
        @JsonProperty("sector")         String sector,
        @JsonProperty("donation")       DonationSummary donation,
        @JsonProperty("sustainability") SustainabilityRatings sustainability,
        @JsonProperty("leadership")     LeadershipAnalysis leadership,
        @JsonProperty("news")           List<NewsArticle> news
) {

    public CompanyDocument {
        news = news != null ? news.stream().filter(Objects::nonNull).toList() : null;
    }

    public CompanyProfile profile() {
        return new CompanyProfile(symbol, name != null ? name : symbol,
                sector != null ? sector : CompanyProfile.UNKNOWN_SECTOR);
    }

    /**
     * Wrapper matching the top level of the seed file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeedFile(@JsonProperty("companies") List<CompanyDocument> companies) {}
}
