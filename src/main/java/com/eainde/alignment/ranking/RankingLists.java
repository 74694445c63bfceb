package com.eainde.alignment.ranking;

import java.io.Serializable;
import java.util.List;

/**
 * Support and oppose lists, each ordered strongest first.
 */
public record RankingLists(List<RankingEntry> support, List<RankingEntry> oppose) implements Serializable {

    public RankingLists {
        support = List.copyOf(support);
        oppose = List.copyOf(oppose);
    }
}
