package com.bank.fraudscreen.model;

public enum AlertOutcomeType {
    /** Assessment did not meet the alert criteria; nothing was sent. */
    NO_ACTION_REQUIRED,
    ALERT_DISPATCHED,
    /** An alert was built but the channel rejected it or timed out. */
    DISPATCH_FAILED
}
