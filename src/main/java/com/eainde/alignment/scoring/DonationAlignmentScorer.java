package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaConfig;
import com.eainde.alignment.source.DonationSummary;
import org.springframework.stereotype.Component;

/**
 * Scores a company's political-donation split against the persona's party preference.
 * <ul>
 *     <li>Partisan personas score the share going to their side, scaled by preference strength.</li>
 *     <li>Neutral personas score {@code 50 + |demShare - 0.5| * 100}.</li>
 *     <li>Large totals are penalized by {@code min(20, totalMillions * sensitivity * 10)}, then a +20 baseline is added.</li>
 *     <li>A precomputed lean indicator is blended in 80/20 for partisan personas.</li>
 *     <li>Neutral personas get up to +5 for donating to several parties; partisan ones lose 3 above two parties.</li>
 * </ul>
 */
@Component
public class DonationAlignmentScorer implements SourceScorer<DonationSummary> {

    static final double MAX_AMOUNT_PENALTY = 20;
    static final double BASELINE = 20;
    static final double LEAN_WEIGHT = 0.2;
    static final double NEUTRAL_PREFERENCE_BAND = 0.3;

    @Override
    public Double score(DonationSummary data, PersonaConfig config) {
        if (data == null || !data.hasDonations()) {
            return null;
        }
        PersonaConfig.Donation prefs = config.donation();
        double preference = prefs.partyPreference();

        double total = data.totalUsd();
        double demRatio = data.amountFor(DonationSummary.DEMOCRATIC) / total;
        double repRatio = data.amountFor(DonationSummary.REPUBLICAN) / total;

        double alignment;
        if (prefs.prefersDemocratic()) {
            alignment = demRatio * 100 * preference;
        } else if (prefs.prefersRepublican()) {
            alignment = repRatio * 100 * Math.abs(preference);
        } else {
            alignment = 50 + Math.abs(demRatio - 0.5) * 100;
        }

        double amountPenalty = Math.min(MAX_AMOUNT_PENALTY,
                (total / 1_000_000) * prefs.amountSensitivity() * 10);
        double score = alignment - amountPenalty + BASELINE;

        Double lean = data.politicalLeanScore();
        if (lean != null) {
            if (prefs.prefersDemocratic()) {
                score = score * (1 - LEAN_WEIGHT) + ((lean + 100) / 2) * LEAN_WEIGHT;
            } else if (prefs.prefersRepublican()) {
                score = score * (1 - LEAN_WEIGHT) + ((100 - lean) / 2) * LEAN_WEIGHT;
            }
        }

        int partyCount = data.partyCount();
        if (Math.abs(preference) < NEUTRAL_PREFERENCE_BAND) {
            score += Math.min(5, partyCount * 2);
        } else if (partyCount > 2) {
            score -= 3;
        }

        return Scores.clamp(score);
    }
}
