package com.eainde.alignment.ranking;

import com.eainde.alignment.narrative.NarrativeAnalysisException;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.source.CompanyProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Narrative-only ranking of the whole universe, used when too few companies carry
 * structured data for the per-company pipeline to fill both lists.
 * <p>
 * Scores are clamped to [0,100] and each list is cut to the requested size. Known symbols
 * take name and sector from the universe; anything else keeps what the model returned.
 * </p>
 */
@Slf4j
public class UniverseRanker {

    private final UniverseRankingAgent agent;
    private final ObjectMapper objectMapper;

    public UniverseRanker(UniverseRankingAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    public RankingLists rank(PersonaArchetype persona, List<CompanyProfile> universe, int listSize)
            throws NarrativeAnalysisException {
        String companyList = universe.stream()
                .map(c -> c.symbol() + ": " + c.name() + " (" + c.sector() + ")")
                .collect(Collectors.joining("\n"));

        String reply;
        try {
            reply = agent.rank(persona.description(), companyList, listSize);
        } catch (RuntimeException e) {
            throw new NarrativeAnalysisException("Universe ranking call failed for " + persona, e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(reply));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new NarrativeAnalysisException("Unparseable universe ranking for " + persona, e);
        }

        Map<String, CompanyProfile> bySymbol = universe.stream()
                .collect(Collectors.toMap(c -> c.symbol().toUpperCase(Locale.ROOT), Function.identity(), (a, b) -> a));

        List<RankingEntry> support = entries(root.get("supportCompanies"), bySymbol, listSize);
        List<RankingEntry> oppose = entries(root.get("opposeCompanies"), bySymbol, listSize);
        if (support.isEmpty() && oppose.isEmpty()) {
            throw new NarrativeAnalysisException("Universe ranking for " + persona + " returned no companies");
        }
        log.info("Universe ranking for {} returned {} support / {} oppose", persona, support.size(), oppose.size());
        return new RankingLists(support, oppose);
    }

    private static List<RankingEntry> entries(JsonNode array, Map<String, CompanyProfile> universe, int listSize) {
        List<RankingEntry> entries = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return entries;
        }
        for (JsonNode node : array) {
            if (entries.size() >= listSize) {
                break;
            }
            String symbol = node.path("symbol").asText("").trim();
            if (symbol.isEmpty()) {
                continue;
            }
            CompanyProfile profile = universe.getOrDefault(symbol.toUpperCase(Locale.ROOT),
                    new CompanyProfile(symbol,
                            node.path("name").asText(symbol),
                            node.path("sector").asText(CompanyProfile.UNKNOWN_SECTOR)));
            entries.add(RankingEntry.of(profile, node.path("score").asDouble(50.0),
                    node.path("reasoning").asText("")));
        }
        return entries;
    }

    private static String cleanJson(String json) {
        if (json == null) {
            throw new IllegalArgumentException("empty reply");
        }
        return json.replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
