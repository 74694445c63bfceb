package com.eainde.alignment.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One recent article about a company. A missing publication time is treated as old.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsArticle(
        @JsonProperty("title")       String title,
        @JsonProperty("description") String description,
        @JsonProperty("publishedAt") Instant publishedAt
) implements Serializable {

    /**
     * @return lower-cased title and description, used for keyword matching
     */
    public String searchableText() {
        return ((title != null ? title : "") + " " + (description != null ? description : ""))
                .toLowerCase(java.util.Locale.ROOT);
    }
}
