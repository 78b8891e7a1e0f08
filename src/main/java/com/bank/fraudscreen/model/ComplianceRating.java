package com.bank.fraudscreen.model;

public enum ComplianceRating {
    COMPLIANT,
    CONDITIONAL_COMPLIANCE,
    NON_COMPLIANT,
    REVIEW_REQUIRED
}
