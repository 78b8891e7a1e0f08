package com.bank.fraudscreen.repository;

import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Read access to transaction and customer records.
 */
public interface TransactionDataStore {

    Optional<Transaction> getTransaction(String transactionId);

    Optional<CustomerProfile> getCustomer(String customerId);

    /** All transactions of a customer, oldest first. */
    List<Transaction> getTransactionsByCustomer(String customerId);

    /** All transactions sent to a destination country, oldest first. */
    List<Transaction> getTransactionsByDestination(String country);
}
