package com.eainde.alignment;

import java.time.Duration;

/**
 * Narrative model settings, bound from {@code alignment.narrative.*}.
 */
public record NarrativeProperties(String apiKey, String modelName, double temperature, Duration timeout) {

    public NarrativeProperties {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName is mandatory");
        }
        if (temperature < 0 || temperature > 2) {
            throw new IllegalArgumentException("temperature must be within [0,2]: " + temperature);
        }
    }
}
