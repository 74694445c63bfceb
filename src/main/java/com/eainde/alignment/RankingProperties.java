package com.eainde.alignment;

import java.time.Duration;
import java.util.Objects;

/**
 * Ranking settings, bound from {@code alignment.ranking.*}.
 *
 * @param listSize           entries in each of the support and oppose lists
 * @param cacheTtl           how long a generated ranking is served from cache
 * @param fetchParallelism   threads for source-document reads
 * @param scoringParallelism threads for per-company scoring; caps concurrent narrative calls
 */
public record RankingProperties(int listSize, Duration cacheTtl, int fetchParallelism, int scoringParallelism) {

    public static final RankingProperties DEFAULTS = new RankingProperties(5, Duration.ofHours(12), 16, 8);

    public RankingProperties {
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        if (listSize < 1) {
            throw new IllegalArgumentException("listSize must be positive: " + listSize);
        }
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive: " + cacheTtl);
        }
        if (fetchParallelism < 1 || scoringParallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
    }
}
