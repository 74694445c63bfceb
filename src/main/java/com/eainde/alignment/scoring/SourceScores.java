package com.eainde.alignment.scoring;

import java.io.Serializable;

/**
 * The four per-source results for one company.
 */
public record SourceScores(
        SourceScoreResult donation,
        SourceScoreResult sustainability,
        SourceScoreResult leadership,
        SourceScoreResult news
) implements Serializable {

    public static final SourceScores ABSENT = new SourceScores(
            SourceScoreResult.absent(), SourceScoreResult.absent(),
            SourceScoreResult.absent(), SourceScoreResult.absent());

    public DataAvailability availability() {
        return DataAvailability.of(this);
    }
}
