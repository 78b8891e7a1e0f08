package com.bank.fraudscreen.model;

public enum AlertStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE
}
