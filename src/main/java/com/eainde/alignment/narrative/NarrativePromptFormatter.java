package com.eainde.alignment.narrative;

import com.eainde.alignment.source.DonationSummary;
import com.eainde.alignment.source.LeadershipAnalysis;
import com.eainde.alignment.source.NewsArticle;
import com.eainde.alignment.source.SustainabilityRatings;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * One-line summaries of the raw source documents, as shown to the narrative model.
 */
@Component
public class NarrativePromptFormatter {

    private static final String NOT_AVAILABLE = "N/A";

    public String donationSummary(DonationSummary donation) {
        if (donation == null || !donation.hasDonations()) {
            return "Political donations: No data";
        }
        return "Political donations: Total " + usd(donation.totalUsd())
                + ", Democratic: " + usd(donation.amountFor(DonationSummary.DEMOCRATIC))
                + ", Republican: " + usd(donation.amountFor(DonationSummary.REPUBLICAN));
    }

    public String sustainabilitySummary(SustainabilityRatings ratings) {
        if (ratings == null || !ratings.hasAnySubScore()) {
            return "Sustainability ratings: No data";
        }
        return "Sustainability ratings: Environmental: " + number(ratings.environmentalScore())
                + ", Social: " + number(ratings.socialScore())
                + ", Governance: " + number(ratings.governanceScore());
    }

    public String leadershipSummary(LeadershipAnalysis leadership) {
        if (leadership == null || !leadership.hasStatements()) {
            return "Executive statements: No statements";
        }
        LeadershipAnalysis.PoliticalStance stance = leadership.politicalStance();
        String leaning = stance != null && stance.overallLeaning() != null ? stance.overallLeaning() : "unknown";
        double confidence = stance != null && stance.confidence() != null ? stance.confidence() : 0;
        return "Executive statements: Political stance: " + leaning
                + ", Confidence: " + String.format(Locale.ROOT, "%.0f", confidence) + "%";
    }

    public String newsSummary(List<NewsArticle> news) {
        if (news == null || news.isEmpty()) {
            return "Recent news: No data";
        }
        return "Recent news: " + news.size() + " articles available";
    }

    private static String usd(double amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }

    private static String number(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.1f", value) : NOT_AVAILABLE;
    }
}
