package com.bank.fraudscreen.model;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static AlertSeverity fromScore(double score) {
        if (score >= RiskThresholds.SEVERITY_CRITICAL) return CRITICAL;
        if (score >= RiskThresholds.SEVERITY_HIGH) return HIGH;
        if (score >= RiskThresholds.SEVERITY_MEDIUM) return MEDIUM;
        return LOW;
    }
}
