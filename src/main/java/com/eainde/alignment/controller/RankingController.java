package com.eainde.alignment.controller;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.ranking.CachedRanking;
import com.eainde.alignment.ranking.RankingOrchestrator;
import com.eainde.alignment.scoring.CompanyScoreResult;
import com.eainde.alignment.scoring.CompanyScoringService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class RankingController {

    private final RankingOrchestrator orchestrator;
    private final CompanyScoringService scoringService;

    public RankingController(RankingOrchestrator orchestrator, CompanyScoringService scoringService) {
        this.orchestrator = orchestrator;
        this.scoringService = scoringService;
    }

    @GetMapping("/rankings/{persona}")
    public CachedRanking ranking(@PathVariable String persona,
                                 @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return orchestrator.rankForPersona(PersonaArchetype.fromKey(persona), forceRefresh);
    }

    @GetMapping("/rankings/{persona}/history")
    public List<CachedRanking> history(@PathVariable String persona) {
        return orchestrator.history(PersonaArchetype.fromKey(persona));
    }

    @GetMapping("/companies/{companyId}/score")
    public CompanyScoreResult score(@PathVariable String companyId, @RequestParam String persona) {
        return scoringService.scoreCompany(companyId, PersonaArchetype.fromKey(persona));
    }

    @GetMapping("/personas/resolve")
    public Map<String, String> resolvePersona(@RequestParam double economic,
                                              @RequestParam double social,
                                              @RequestParam double diplomatic) {
        PersonaArchetype persona = PersonaArchetype.fromCoordinates(economic, social, diplomatic);
        return Map.of("persona", persona.key(), "description", persona.description());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        return Map.of("error", e.getMessage());
    }
}
