package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.source.NewsArticle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Scores recent news coverage from recency, keyword sentiment and volume
 * (weighted 0.4 / 0.4 / 0.2), then pulls the result toward 50 by the persona's news importance.
 */
@Component
public class NewsSentimentScorer implements SourceScorer<List<NewsArticle>> {

    static final List<String> CONTROVERSIAL_KEYWORDS = List.of(
            "lawsuit", "investigation", "scandal", "controversy", "violation",
            "fraud", "breach", "crisis", "protest", "strike", "layoff",
            "regulatory", "fine", "penalty", "allegation");

    static final List<String> POSITIVE_KEYWORDS = List.of(
            "innovation", "growth", "expansion", "profit", "success",
            "award", "breakthrough", "partnership", "achievement", "milestone",
            "sustainable", "ethical", "responsible");

    static final List<String> NEGATIVE_KEYWORDS = List.of(
            "decline", "loss", "failure", "downgrade", "bankruptcy",
            "misconduct", "corruption", "harm", "damage", "risk");

    private static final Duration WEEK = Duration.ofDays(7);
    private static final Duration MONTH = Duration.ofDays(30);

    private final Clock clock;

    public NewsSentimentScorer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Double score(List<NewsArticle> articles, PersonaConfig config) {
        if (articles == null || articles.isEmpty()) {
            return null;
        }
        PersonaConfig.News prefs = config.news();

        Instant now = clock.instant();
        Instant weekAgo = now.minus(WEEK);
        Instant monthAgo = now.minus(MONTH);

        int recent = 0, month = 0, older = 0;
        int controversial = 0, positive = 0, negative = 0;

        for (NewsArticle article : articles) {
            Instant published = article.publishedAt();
            if (published != null && published.isAfter(weekAgo)) {
                recent++;
            } else if (published != null && published.isAfter(monthAgo)) {
                month++;
            } else {
                older++;
            }

            String text = article.searchableText();
            controversial += countMatches(text, CONTROVERSIAL_KEYWORDS);
            positive += countMatches(text, POSITIVE_KEYWORDS);
            negative += countMatches(text, NEGATIVE_KEYWORDS);
        }

        int total = articles.size();
        double recency = (recent * 100.0 + month * 60.0 + older * 30.0) / total;
        double sentiment = sentimentScore(controversial, positive, negative, prefs.sentimentPreference());
        double volume = volumeScore(total, config.archetype());

        double score = recency * 0.4 + sentiment * 0.4 + volume * 0.2;
        return Scores.clamp(Scores.blendTowardNeutral(score, prefs.importance()));
    }

    private static double sentimentScore(int controversial, int positive, int negative, double preference) {
        int keywordHits = controversial + positive + negative;
        if (keywordHits == 0) {
            return Scores.NEUTRAL;
        }
        double positiveRatio = (double) positive / keywordHits;
        double negativeRatio = (double) negative / keywordHits;
        double controversialRatio = (double) controversial / keywordHits;

        double score = 50 + (positiveRatio - negativeRatio) * 50;
        if (preference > 0) {
            score += positiveRatio * 20 - controversialRatio * 10;
        } else if (preference < 0) {
            score += controversialRatio * 15 - positiveRatio * 5;
        } else {
            score += (1 - Math.abs(positiveRatio - negativeRatio)) * 10;
        }
        return score;
    }

    private static double volumeScore(int articleCount, PersonaArchetype persona) {
        double volume;
        if (articleCount < 5) {
            volume = 30;
        } else if (articleCount < 10) {
            volume = 50;
        } else if (articleCount < 20) {
            volume = 70;
        } else {
            volume = 85;
        }
        if (persona.isGlobalist()) {
            volume *= 1.1;
        } else if (persona.isNationalist()) {
            volume *= 0.95;
        }
        return volume;
    }

    private static int countMatches(String text, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }
}
