package com.eainde.alignment.source;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * The four independently-nullable raw documents fetched for one company.
 * A {@code null} component means the store had no document (or the read failed).
 * Null articles are dropped.
 */
public record CompanySources(
        DonationSummary donation,
        SustainabilityRatings sustainability,
        LeadershipAnalysis leadership,
        List<NewsArticle> news
) implements Serializable {

    public CompanySources {
        news = news != null ? news.stream().filter(Objects::nonNull).toList() : null;
    }

    public static CompanySources empty() {
        return new CompanySources(null, null, null, null);
    }
}
