package com.eainde.alignment.scoring;

import com.eainde.alignment.narrative.NarrativeAnalysisException;
import com.eainde.alignment.narrative.NarrativeRequest;
import com.eainde.alignment.narrative.NarrativeScorer;
import com.eainde.alignment.narrative.NarrativeVerdict;
import com.eainde.alignment.persona.PersonaArchetype;
import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.persona.PersonaConfigTable;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Runs the full per-company pipeline on already-fetched sources: source scorers,
 * weight redistribution, numerical aggregation, narrative analysis and combination.
 * <p>
 * Narrative analysis runs in evidence mode when any structured source scored, otherwise in
 * general-knowledge mode. A failed analysis is replaced by a neutral verdict. When no
 * {@link NarrativeScorer} is configured the combiner works from the numerical score alone.
 * </p>
 */
@Slf4j
@Component
public class CompanyScorer {

    private final PersonaConfigTable personaConfigs;
    private final DonationAlignmentScorer donationScorer;
    private final SustainabilityAlignmentScorer sustainabilityScorer;
    private final LeadershipStatementScorer leadershipScorer;
    private final NewsSentimentScorer newsScorer;
    private final WeightRedistributionCalculator weightCalculator;
    private final NumericalAggregator aggregator;
    private final ScoreCombiner combiner;
    private final ObjectProvider<NarrativeScorer> narrativeScorer;

    public CompanyScorer(PersonaConfigTable personaConfigs,
                         DonationAlignmentScorer donationScorer,
                         SustainabilityAlignmentScorer sustainabilityScorer,
                         LeadershipStatementScorer leadershipScorer,
                         NewsSentimentScorer newsScorer,
                         WeightRedistributionCalculator weightCalculator,
                         NumericalAggregator aggregator,
                         ScoreCombiner combiner,
                         ObjectProvider<NarrativeScorer> narrativeScorer) {
        this.personaConfigs = personaConfigs;
        this.donationScorer = donationScorer;
        this.sustainabilityScorer = sustainabilityScorer;
        this.leadershipScorer = leadershipScorer;
        this.newsScorer = newsScorer;
        this.weightCalculator = weightCalculator;
        this.aggregator = aggregator;
        this.combiner = combiner;
        this.narrativeScorer = narrativeScorer;
    }

    public CompanyScoreResult score(CompanyProfile company, CompanySources sources, PersonaArchetype persona) {
        PersonaConfig config = personaConfigs.get(persona);

        SourceScores sourceScores = new SourceScores(
                SourceScoreResult.ofNullable(donationScorer.score(sources.donation(), config)),
                SourceScoreResult.ofNullable(sustainabilityScorer.score(sources.sustainability(), config)),
                SourceScoreResult.ofNullable(leadershipScorer.score(sources.leadership(), config)),
                SourceScoreResult.ofNullable(newsScorer.score(sources.news(), config)));

        DataAvailability availability = sourceScores.availability();
        ScoringWeights weights = weightCalculator.calculate(availability);
        double numerical = aggregator.aggregate(sourceScores, weights);
        int dataSourceCount = availability.count();

        NarrativeVerdict verdict = narrate(company, sources, persona, dataSourceCount == 0);
        CombinedScore combined = combiner.combine(numerical, verdict, dataSourceCount);

        log.debug("{} [{}] donation={} sustainability={} leadership={} news={} weights={} numerical={} narrative={} final={}",
                company.symbol(), persona,
                sourceScores.donation().value(), sourceScores.sustainability().value(),
                sourceScores.leadership().value(), sourceScores.news().value(),
                weights, Scores.format(numerical),
                verdict != null ? Scores.format(verdict.score()) : "disabled",
                Scores.format(combined.finalScore()));

        return new CompanyScoreResult(
                company,
                persona,
                sourceScores,
                availability,
                weights,
                numerical,
                verdict != null ? verdict.score() : null,
                verdict != null ? verdict.rationale() : null,
                combined.finalScore(),
                combined.reasoning(),
                dataSourceCount);
    }

    private NarrativeVerdict narrate(CompanyProfile company, CompanySources sources,
                                     PersonaArchetype persona, boolean generalKnowledge) {
        NarrativeScorer scorer = narrativeScorer.getIfAvailable();
        if (scorer == null) {
            return null;
        }
        try {
            return scorer.analyze(new NarrativeRequest(company, persona, sources, generalKnowledge));
        } catch (NarrativeAnalysisException | RuntimeException e) {
            log.warn("Narrative analysis failed for {} [{}], using neutral score: {}",
                    company.symbol(), persona, e.getMessage());
            return NarrativeVerdict.failed();
        }
    }
}
