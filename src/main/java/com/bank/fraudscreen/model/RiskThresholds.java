package com.bank.fraudscreen.model;

/**
 * Score boundaries shared by every classification derived from a risk score.
 * Level and recommendation both read {@link #HIGH} and {@link #MEDIUM}, so they cannot disagree.
 */
public final class RiskThresholds {

    /** score >= HIGH: level HIGH, recommendation BLOCK. */
    public static final double HIGH = 75.0;

    /** MEDIUM <= score < HIGH: level MEDIUM, recommendation INVESTIGATE. */
    public static final double MEDIUM = 45.0;

    public static final double AUDIT_NON_COMPLIANT = 75.0;
    public static final double AUDIT_CONDITIONAL = 50.0;

    public static final double SEVERITY_CRITICAL = 90.0;
    public static final double SEVERITY_HIGH = 75.0;
    public static final double SEVERITY_MEDIUM = 50.0;

    /** Score at or above which an alert is raised regardless of factors. */
    public static final double ALERT = HIGH;

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private RiskThresholds() {}

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
