package com.eainde.alignment.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Output of one source scorer: a score in [0,100], or absent.
 * Absence is never replaced by a default here; defaults belong to aggregation.
 */
public record SourceScoreResult(@JsonValue Double value) implements Serializable {

    private static final SourceScoreResult ABSENT = new SourceScoreResult(null);

    public static SourceScoreResult absent() {
        return ABSENT;
    }

    public static SourceScoreResult ofNullable(Double value) {
        return value == null ? ABSENT : new SourceScoreResult(value);
    }

    @JsonIgnore
    public boolean isPresent() {
        return value != null;
    }

    public double weighted(double weight) {
        return value != null ? value * weight : 0;
    }
}
