package com.bank.fraudscreen.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(double score) {
        if (score >= RiskThresholds.HIGH) return HIGH;
        if (score >= RiskThresholds.MEDIUM) return MEDIUM;
        return LOW;
    }
}
