package com.bank.fraudscreen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Transaction plus everything the enrichment stage gathered about it.
 * Built once per workflow run and never modified afterwards.
 */
@Value
@Builder
public class EnrichedContext {
    Transaction transaction;
    CustomerProfile customer;

    @Singular("historyEntry")
    List<Transaction> transactionHistory;

    @Singular("destinationEntry")
    List<Transaction> destinationHistory;

    DerivedFlags flags;

    /** True when the customer record could not be found and a placeholder profile is used. */
    boolean customerMissing;

    public String getTransactionId() {
        return transaction.getTransactionId();
    }
}
