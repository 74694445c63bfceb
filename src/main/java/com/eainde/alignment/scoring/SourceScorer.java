package com.eainde.alignment.scoring;

import com.eainde.alignment.persona.PersonaConfig;
import org.springframework.lang.Nullable;

/**
 * Maps one raw source document to a persona-relative score.
 *
 * @param <T> raw document type
 */
public interface SourceScorer<T> {

    /**
     * @param data   raw document, {@code null} when the source has nothing for this company
     * @param config persona preferences
     * @return a score in [0,100], or {@code null} when there is nothing to score
     */
    @Nullable
    Double score(@Nullable T data, PersonaConfig config);
}
