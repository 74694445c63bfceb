package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Political-donation summary for one company, aggregated from campaign-finance filings.
 *
 * @param totalUsd           total donated value across all recipients, whole USD
 * @param partyTotals        per-party totals keyed by party code ({@code DEM}, {@code REP}, ...)
 * @param politicalLeanScore optional precomputed lean, -100 (Republican) to +100 (Democratic)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DonationSummary(
        @JsonProperty("totalUsd")           Double totalUsd,
        @JsonProperty("partyTotals")        Map<String, PartyTotal> partyTotals,
        @JsonProperty("politicalLeanScore") Double politicalLeanScore
) implements Serializable {

    public static final String DEMOCRATIC = "DEM";
    public static final String REPUBLICAN = "REP";

    public DonationSummary {
        partyTotals = partyTotals != null ? withoutNulls(partyTotals) : Map.of();
    }

    /**
     * @return true when there is a positive total and at least one party breakdown
     */
    @JsonIgnore
    public boolean hasDonations() {
        return !partyTotals.isEmpty() && totalUsd != null && totalUsd > 0;
    }

    public double amountFor(String partyCode) {
        PartyTotal total = partyTotals.get(partyCode);
        return total != null ? total.totalAmountUsd() : 0.0;
    }

    @JsonIgnore
    public int partyCount() {
        return partyTotals.size();
    }

    private static Map<String, PartyTotal> withoutNulls(Map<String, PartyTotal> totals) {
        Map<String, PartyTotal> copy = new LinkedHashMap<>();
        totals.forEach((party, total) -> {
            if (party != null && total != null) {
                copy.put(party, total);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
