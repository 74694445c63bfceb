package com.eainde.alignment.ranking;

/**
 * How a ranking was produced.
 */
public enum RankingMethod {
    /** Per-company hybrid scoring of the whole universe. */
    SCORED,
    /** One narrative pass over the universe, used when too few companies have data. */
    NARRATIVE_UNIVERSE,
    /** Fixed per-persona lists, used when everything else failed. Never cached. */
    STATIC_FALLBACK;

    public boolean isCacheable() {
        return this != STATIC_FALLBACK;
    }
}
