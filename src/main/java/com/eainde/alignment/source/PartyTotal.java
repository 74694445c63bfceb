package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Donations received by one party, in whole USD.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PartyTotal(
        @JsonProperty("totalAmountUsd") double totalAmountUsd
) implements Serializable {}
