package com.eainde.alignment.scoring;

import java.util.Locale;

/**
 * Shared score constants and helpers.
 */
public final class Scores {

    public static final double NEUTRAL = 50.0;
    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private Scores() {}

    public static double clamp(double score) {
        return Math.min(MAX, Math.max(MIN, score));
    }

    /**
     * Pulls a score toward neutral: {@code importance = 1} keeps it, {@code 0} yields exactly 50.
     */
    public static double blendTowardNeutral(double score, double importance) {
        return score * importance + NEUTRAL * (1 - importance);
    }

    public static String format(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
