package com.eainde.alignment.narrative;

import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySources;

/**
 * Input to one narrative analysis.
 *
 * @param company          company under analysis
 * @param persona          persona whose description frames the analysis
 * @param sources          the same raw documents the numerical scorers saw
 * @param generalKnowledge true when no structured source produced a score and the model
 *                         has to rely on what it already knows about the company
 */
public record NarrativeRequest(
        CompanyProfile company,
        PersonaArchetype persona,
        CompanySources sources,
        boolean generalKnowledge
) {}
