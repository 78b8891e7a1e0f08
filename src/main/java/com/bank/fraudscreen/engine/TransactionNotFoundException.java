package com.bank.fraudscreen.engine;

/**
 * Thrown when the transaction to screen does not exist. Aborts the run before any branch starts.
 */
public class TransactionNotFoundException extends WorkflowException {

    private final String transactionId;

    public TransactionNotFoundException(String stage, String transactionId) {
        super(stage, "Transaction " + transactionId + " not found");
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
