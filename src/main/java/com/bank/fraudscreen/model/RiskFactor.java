package com.bank.fraudscreen.model;

/**
 * Closed vocabulary of fraud and compliance concerns attached to an assessment.
 */
public enum RiskFactor {
    HIGH_RISK_JURISDICTION,
    SANCTIONS_CONCERN,
    UNUSUAL_AMOUNT,
    HIGH_TRANSACTION_AMOUNT,
    CROSS_BORDER_TRANSFER,
    SUSPICIOUS_PATTERN,
    FREQUENCY_ANOMALY,
    PREVIOUS_FRAUD_HISTORY,
    NEW_ACCOUNT_RISK,
    LOW_DEVICE_TRUST,
    REGULATORY_COMPLIANCE_VIOLATION,
    /** Narrative analysis was unavailable; the assessment is based on rules only. */
    DEGRADED_ANALYSIS
}
