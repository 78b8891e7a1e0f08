package com.bank.fraudscreen.model;

public enum BranchStatus {
    SUCCEEDED,
    FAILED
}
