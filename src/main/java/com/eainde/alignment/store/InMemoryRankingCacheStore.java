package com.eainde.alignment.store;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.CachedRanking;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * {@link RankingCacheStore} backed by concurrent maps. Writes are whole-value replacements,
 * so concurrent refreshes of the same persona end with the last writer's ranking.
 * History is append-only: every save is kept, newest first, even when two share a generation time.
 */
@Component
public class InMemoryRankingCacheStore implements RankingCacheStore {

    private final Map<PersonaArchetype, CachedRanking> current = new ConcurrentHashMap<>();
    private final Map<PersonaArchetype, Deque<CachedRanking>> history = new ConcurrentHashMap<>();

    @Override
    public Optional<CachedRanking> find(PersonaArchetype persona) {
        return Optional.ofNullable(current.get(persona));
    }

    @Override
    public void save(CachedRanking ranking) {
        current.put(ranking.persona(), ranking);
        history.computeIfAbsent(ranking.persona(), k -> new ConcurrentLinkedDeque<>())
                .addFirst(ranking);
    }

    @Override
    public List<CachedRanking> history(PersonaArchetype persona) {
        Deque<CachedRanking> generations = history.get(persona);
        if (generations == null) {
            return List.of();
        }
        return new ArrayList<>(generations);
    }
}
