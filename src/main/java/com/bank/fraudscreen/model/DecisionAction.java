package com.bank.fraudscreen.model;

public enum DecisionAction {
    ALLOW,
    BLOCK,
    MONITOR,
    INVESTIGATE
}
