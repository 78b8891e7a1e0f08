package com.bank.fraudscreen.model;

/**
 * Deterministic scoring rules. Each type is weighted through {@code risk.weights}.
 */
public enum RuleType {
    HIGH_RISK_COUNTRY(RiskFactor.HIGH_RISK_JURISDICTION),
    SANCTIONED_COUNTRY(RiskFactor.SANCTIONS_CONCERN),
    CROSS_BORDER(RiskFactor.CROSS_BORDER_TRANSFER),
    HIGH_AMOUNT(RiskFactor.HIGH_TRANSACTION_AMOUNT),
    AMOUNT_DEVIATION(RiskFactor.UNUSUAL_AMOUNT),
    NEW_ACCOUNT(RiskFactor.NEW_ACCOUNT_RISK),
    LOW_DEVICE_TRUST(RiskFactor.LOW_DEVICE_TRUST),
    PAST_FRAUD(RiskFactor.PREVIOUS_FRAUD_HISTORY);

    private final RiskFactor factor;

    RuleType(RiskFactor factor) {
        this.factor = factor;
    }

    public RiskFactor getFactor() {
        return factor;
    }
}
