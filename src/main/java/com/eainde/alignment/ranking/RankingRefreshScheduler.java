package com.eainde.alignment.ranking;

import com.eainde.alignment.persona.PersonaArchetype;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Regenerates all persona rankings on a schedule. Off unless
 * {@code alignment.ranking.refresh.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "alignment.ranking.refresh.enabled", havingValue = "true")
public class RankingRefreshScheduler {
    private final RankingOrchestrator orchestrator;

    public RankingRefreshScheduler(RankingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(cron = "${alignment.ranking.refresh.cron:0 0 */12 * * *}")
    public void refreshAll() {
        log.info("Starting scheduled ranking refresh...");
        int refreshed = 0;
        for (PersonaArchetype persona : PersonaArchetype.values()) {
            try {
                orchestrator.rankForPersona(persona, true);
                refreshed++;
            } catch (RuntimeException e) {
                log.error("Scheduled refresh failed for {}", persona, e);
            }
        }
        log.info("Scheduled ranking refresh done: {}/{} personas", refreshed, PersonaArchetype.values().length);
    }
}
