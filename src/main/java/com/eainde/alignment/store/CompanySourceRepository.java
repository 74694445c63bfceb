package com.eainde.alignment.store;

import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.DonationSummary;
import com.eainde.alignment.source.LeadershipAnalysis;
import com.eainde.alignment.source.NewsArticle;
import com.eainde.alignment.source.SustainabilityRatings;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the company universe and the four per-company source documents.
 * Each document is looked up independently; any of them may be missing, and any read may fail.
 */
public interface CompanySourceRepository {

    /**
     * @return the ranking universe, in a stable order
     */
    List<CompanyProfile> listCompanies();

    Optional<CompanyProfile> findProfile(String symbol);

    Optional<DonationSummary> findDonationSummary(String symbol);

    Optional<SustainabilityRatings> findSustainabilityRatings(String symbol);

    Optional<LeadershipAnalysis> findLeadershipAnalysis(String symbol);

    /**
     * @return recent articles, empty when there are none
     */
    List<NewsArticle> findRecentNews(String symbol);
}
