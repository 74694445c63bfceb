package com.eainde.alignment.ranking;

import com.eainde.alignment.persona.PersonaArchetype;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A generated ranking for one persona. Valid until {@code expiresAt}, then superseded by
 * the next generation rather than modified.
 */
public record CachedRanking(
        @JsonProperty("persona")     PersonaArchetype persona,
        @JsonProperty("support")     List<RankingEntry> support,
        @JsonProperty("oppose")      List<RankingEntry> oppose,
        @JsonProperty("generatedAt") Instant generatedAt,
        @JsonProperty("expiresAt")   Instant expiresAt,
        @JsonProperty("method")      RankingMethod method
) implements Serializable {

    public CachedRanking {
        support = List.copyOf(support);
        oppose = List.copyOf(oppose);
    }

    public static CachedRanking of(PersonaArchetype persona, RankingLists lists, RankingMethod method,
                                   Instant generatedAt, Duration ttl) {
        return new CachedRanking(persona, lists.support(), lists.oppose(),
                generatedAt, generatedAt.plus(ttl), method);
    }

    public boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
