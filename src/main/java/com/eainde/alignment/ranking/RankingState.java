package com.eainde.alignment.ranking;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.scoring.CompanyScoreResult;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySources;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * Graph state of one ranking generation. Every value stored here must be serializable.
 */
public class RankingState extends AgentState {

    public static final String PERSONA = "persona";
    public static final String COMPANIES = "companies";
    public static final String SOURCES = "sources";
    public static final String SCORED = "scored";
    public static final String RANKING = "ranking";
    public static final String METHOD = "method";
    public static final String RESULT = "result";

    public RankingState(Map<String, Object> initData) {
        super(initData);
    }

    public PersonaArchetype getPersona() {
        return this.<PersonaArchetype>value(PERSONA)
                .orElseThrow(() -> new IllegalStateException("Ranking state has no persona"));
    }

    public List<CompanyProfile> getCompanies() {
        return this.<List<CompanyProfile>>value(COMPANIES).orElse(List.of());
    }

    public Map<String, CompanySources> getSources() {
        return this.<Map<String, CompanySources>>value(SOURCES).orElse(Map.of());
    }

    public List<CompanyScoreResult> getScored() {
        return this.<List<CompanyScoreResult>>value(SCORED).orElse(List.of());
    }

    public RankingLists getRanking() {
        return this.<RankingLists>value(RANKING)
                .orElseThrow(() -> new IllegalStateException("Ranking state has no ranking"));
    }

    public RankingMethod getMethod() {
        return this.<RankingMethod>value(METHOD).orElse(RankingMethod.SCORED);
    }

    public CachedRanking getResult() {
        return this.<CachedRanking>value(RESULT)
                .orElseThrow(() -> new IllegalStateException("Ranking state has no result"));
    }
}
