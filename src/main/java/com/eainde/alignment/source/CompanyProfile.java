package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Identity of a ranked company.
 *
 * @param symbol ticker symbol, also the document-store key
 * @param name   display name
 * @param sector industry sector
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompanyProfile(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("name")   String name,
        @JsonProperty("sector") String sector
) implements Serializable {

    public static final String UNKNOWN_SECTOR = "Unknown";

    /**
     * Profile for an identifier outside the known universe.
     */
    public static CompanyProfile unknown(String companyId) {
        return new CompanyProfile(companyId, companyId, UNKNOWN_SECTOR);
    }
}
