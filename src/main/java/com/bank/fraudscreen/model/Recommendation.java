package com.bank.fraudscreen.model;

public enum Recommendation {
    APPROVE,
    INVESTIGATE,
    BLOCK;

    public static Recommendation fromScore(double score) {
        if (score >= RiskThresholds.HIGH) return BLOCK;
        if (score >= RiskThresholds.MEDIUM) return INVESTIGATE;
        return APPROVE;
    }

    public DecisionAction toDecisionAction() {
        switch (this) {
            case BLOCK:
                return DecisionAction.BLOCK;
            case INVESTIGATE:
                return DecisionAction.INVESTIGATE;
            default:
                return DecisionAction.ALLOW;
        }
    }
}
