package com.bank.fraudscreen.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.fraudscreen.config.AerospikeConfig;
import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.Transaction;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

@Repository
public class AerospikeTransactionDataStore implements TransactionDataStore {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;

    public AerospikeTransactionDataStore(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultReadPolicy") Policy readPolicy,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
    }

    @Override
    public Optional<Transaction> getTransaction(String transactionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, transactionId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapTransaction(transactionId, record));
    }

    @Override
    public Optional<CustomerProfile> getCustomer(String customerId) {
        if (customerId == null) {
            return Optional.empty();
        }
        Key key = new Key(namespace, AerospikeConfig.SET_CUSTOMERS, customerId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapCustomer(customerId, record));
    }

    @Override
    public List<Transaction> getTransactionsByCustomer(String customerId) {
        return scanTransactions(record -> customerId.equals(record.getString("customerId")));
    }

    @Override
    public List<Transaction> getTransactionsByDestination(String country) {
        return scanTransactions(record -> country.equalsIgnoreCase(record.getString("destCountry")));
    }

    public void saveTransaction(Transaction txn) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txn.getTransactionId());
        client.put(writePolicy, key,
                new Bin("txnId", txn.getTransactionId()),
                new Bin("customerId", txn.getCustomerId()),
                new Bin("amount", txn.getAmount()),
                new Bin("currency", txn.getCurrency()),
                new Bin("destCountry", txn.getDestinationCountry()),
                new Bin("timestamp", txn.getTimestamp()));
    }

    public void saveCustomer(CustomerProfile customer) {
        Key key = new Key(namespace, AerospikeConfig.SET_CUSTOMERS, customer.getCustomerId());
        client.put(writePolicy, key,
                new Bin("customerId", customer.getCustomerId()),
                new Bin("name", customer.getName()),
                new Bin("country", customer.getCountry()),
                new Bin("accountAgeDays", customer.getAccountAgeDays()),
                new Bin("deviceTrust", customer.getDeviceTrustScore()),
                new Bin("pastFraud", customer.isPastFraud() ? 1 : 0));
    }

    private List<Transaction> scanTransactions(Predicate<Record> filter) {
        List<Transaction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTIONS,
                (key, record) -> {
                    if (filter.test(record)) {
                        synchronized (results) {
                            results.add(mapTransaction(null, record));
                        }
                    }
                });

        results.sort(Comparator.comparingLong(Transaction::getTimestamp));
        return results;
    }

    private Transaction mapTransaction(String txnId, Record record) {
        return Transaction.builder()
                .transactionId(txnId != null ? txnId : record.getString("txnId"))
                .customerId(record.getString("customerId"))
                .amount(record.getDouble("amount"))
                .currency(record.getString("currency"))
                .destinationCountry(record.getString("destCountry"))
                .timestamp(record.getLong("timestamp"))
                .build();
    }

    private CustomerProfile mapCustomer(String customerId, Record record) {
        return CustomerProfile.builder()
                .customerId(customerId)
                .name(record.getString("name"))
                .country(record.getString("country"))
                .accountAgeDays(record.getInt("accountAgeDays"))
                .deviceTrustScore(record.getDouble("deviceTrust"))
                .pastFraud(record.getInt("pastFraud") == 1)
                .build();
    }
}
