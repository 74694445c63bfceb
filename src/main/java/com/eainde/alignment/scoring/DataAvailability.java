package com.eainde.alignment.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Which of the four sources produced a score for one company under one persona.
 * Computed per scoring call and never persisted on its own.
 */
public record DataAvailability(
        boolean donation,
        boolean sustainability,
        boolean leadership,
        boolean news
) implements Serializable {

    public static DataAvailability of(SourceScores scores) {
        return new DataAvailability(
                scores.donation().isPresent(),
                scores.sustainability().isPresent(),
                scores.leadership().isPresent(),
                scores.news().isPresent());
    }

    @JsonIgnore
    public int count() {
        int count = 0;
        if (donation) count++;
        if (sustainability) count++;
        if (leadership) count++;
        if (news) count++;
        return count;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return count() == 0;
    }
}
