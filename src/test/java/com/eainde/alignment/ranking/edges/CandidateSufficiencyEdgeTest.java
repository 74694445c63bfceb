package com.eainde.alignment.ranking.edges;

import com.eainde.alignment.RankingProperties;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.RankingState;
import com.eainde.alignment.scoring.CompanyScoreResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.eainde.alignment.ranking.RankingFixtures.scored;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateSufficiencyEdgeTest {

    private final CandidateSufficiencyEdge edge = new CandidateSufficiencyEdge(RankingProperties.DEFAULTS);

    private String route(List<CompanyScoreResult> scored) {
        return edge.apply(new RankingState(Map.of(
                RankingState.PERSONA, PersonaArchetype.SOCIALIST_NATIONALIST,
                RankingState.SCORED, scored))).join();
    }

    private static List<CompanyScoreResult> candidates(int withData, int withoutData) {
        List<CompanyScoreResult> list = new ArrayList<>();
        for (int i = 0; i < withData; i++) {
            list.add(scored("D" + i, 60, 2));
        }
        for (int i = 0; i < withoutData; i++) {
            list.add(scored("N" + i, 50, 0));
        }
        return list;
    }

    @Test
    @DisplayName("continues to caching with at least five candidates carrying data")
    void sufficient() {
        assertThat(route(candidates(5, 0))).isEqualTo(CandidateSufficiencyEdge.SUFFICIENT);
        assertThat(route(candidates(8, 4))).isEqualTo(CandidateSufficiencyEdge.SUFFICIENT);
    }

    @Test
    @DisplayName("candidates scored without data do not count")
    void insufficient() {
        assertThat(route(candidates(4, 20))).isEqualTo(CandidateSufficiencyEdge.INSUFFICIENT);
        assertThat(route(List.of())).isEqualTo(CandidateSufficiencyEdge.INSUFFICIENT);
    }
}
