package com.eainde.alignment.store;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.CachedRanking;

import java.util.List;
import java.util.Optional;

/**
 * One ranking per persona, plus an append-only history of every ranking ever written.
 * Expiry is the reader's concern; the store returns whatever was written last.
 */
public interface RankingCacheStore {

    Optional<CachedRanking> find(PersonaArchetype persona);

    /**
     * Replaces the persona's current ranking and appends it to the history.
     */
    void save(CachedRanking ranking);

    /**
     * @return prior generations for the persona, newest first
     */
    List<CachedRanking> history(PersonaArchetype persona);
}
