package com.eainde.alignment.ranking;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.store.CompanySourceRepository;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.eainde.alignment.persona.PersonaArchetype.*;

/**
 * Last-resort rankings: fixed symbol lists per persona reflecting broad political alignment.
 */
@Component
public class StaticFallbackRankings {

    static final int SUPPORT_SCORE = 85;
    static final int OPPOSE_SCORE = 15;
    static final String REASONING = "Based on general political alignment";

    private static final Map<PersonaArchetype, List<String>> SUPPORT = new EnumMap<>(PersonaArchetype.class);
    private static final Map<PersonaArchetype, List<String>> OPPOSE = new EnumMap<>(PersonaArchetype.class);

    static {
        register(PROGRESSIVE_GLOBALIST,
                List.of("TSLA", "CRM", "NFLX", "NKE", "SBUX"), List.of("XOM", "CVX", "LMT", "RTX", "NOC"));
        register(PROGRESSIVE_NATIONALIST,
                List.of("COST", "HD", "CAT", "DE", "GE"), List.of("XOM", "CVX", "BA", "LMT", "RTX"));
        register(SOCIALIST_LIBERTARIAN,
                List.of("JNJ", "PG", "KO", "WMT", "CVS"), List.of("GS", "JPM", "BLK", "MS", "C"));
        register(SOCIALIST_NATIONALIST,
                List.of("CAT", "DE", "GE", "HD", "LOW"), List.of("AAPL", "NVDA", "AMZN", "META", "GOOGL"));
        register(CAPITALIST_GLOBALIST,
                List.of("AAPL", "MSFT", "GOOGL", "AMZN", "V"), List.of("GD", "NOC", "RTX", "LMT", "BA"));
        register(CAPITALIST_NATIONALIST,
                List.of("XOM", "CVX", "LMT", "RTX", "CAT"), List.of("DIS", "NFLX", "META", "NKE", "SBUX"));
        register(CONSERVATIVE_GLOBALIST,
                List.of("JPM", "GS", "BLK", "V", "MA"), List.of("TSLA", "NFLX", "DIS", "NKE", "SBUX"));
        register(CONSERVATIVE_NATIONALIST,
                List.of("XOM", "CVX", "LMT", "CAT", "DE"), List.of("META", "DIS", "NFLX", "NKE", "SBUX"));
    }

    private final CompanySourceRepository repository;

    public StaticFallbackRankings(CompanySourceRepository repository) {
        this.repository = repository;
    }

    /**
     * @param listSize maximum entries per list
     */
    public RankingLists forPersona(PersonaArchetype persona, int listSize) {
        return new RankingLists(
                entries(SUPPORT.get(persona), SUPPORT_SCORE, listSize),
                entries(OPPOSE.get(persona), OPPOSE_SCORE, listSize));
    }

    private List<RankingEntry> entries(List<String> symbols, int score, int listSize) {
        return symbols.stream()
                .limit(listSize)
                .map(symbol -> repository.findProfile(symbol).orElseGet(() -> CompanyProfile.unknown(symbol)))
                .map(profile -> RankingEntry.of(profile, score, REASONING))
                .toList();
    }

    private static void register(PersonaArchetype persona, List<String> support, List<String> oppose) {
        SUPPORT.put(persona, support);
        OPPOSE.put(persona, oppose);
    }
}
