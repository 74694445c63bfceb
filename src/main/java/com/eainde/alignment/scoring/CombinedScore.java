package com.eainde.alignment.scoring;

import java.io.Serializable;

/**
 * Final blended score and the reasoning shown to consumers.
 */
public record CombinedScore(double finalScore, String reasoning) implements Serializable {}
