package com.bank.fraudscreen.service;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.TransactionNotFoundException;
import com.bank.fraudscreen.engine.WorkflowStage;
import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.DerivedFlags;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.Transaction;
import com.bank.fraudscreen.repository.TransactionDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * First stage of the workflow. Loads the transaction and everything known about its customer,
 * then derives the comparison flags the scoring rules read.
 *
 * Only a missing transaction is fatal. A missing customer or a failed history lookup
 * degrades to neutral defaults so scoring can still run on what is known.
 */
@Service
public class DataEnrichmentStage implements WorkflowStage<String, EnrichedContext> {

    private static final Logger log = LoggerFactory.getLogger(DataEnrichmentStage.class);

    public static final String NAME = "data-enrichment";

    private final TransactionDataStore dataStore;
    private final RiskScoringConfig config;

    public DataEnrichmentStage(TransactionDataStore dataStore, RiskScoringConfig config) {
        this.dataStore = dataStore;
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Class<String> inputType() {
        return String.class;
    }

    @Override
    public Class<EnrichedContext> outputType() {
        return EnrichedContext.class;
    }

    @Override
    public EnrichedContext execute(String transactionId) {
        Transaction txn = dataStore.getTransaction(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(NAME, transactionId));

        Optional<CustomerProfile> found = lookupCustomer(txn.getCustomerId());
        CustomerProfile customer = found.orElseGet(() -> CustomerProfile.empty(txn.getCustomerId()));

        List<Transaction> history = degradeToEmpty("customer history",
                () -> dataStore.getTransactionsByCustomer(txn.getCustomerId()));
        List<Transaction> destinationHistory = config.isFetchDestinationHistory()
                ? degradeToEmpty("destination history",
                        () -> dataStore.getTransactionsByDestination(txn.getDestinationCountry()))
                : Collections.emptyList();

        DerivedFlags flags = deriveFlags(txn, customer, history);

        log.debug("Enriched txn {}: customerFound={}, history={}, destinationHistory={}, flags={}",
                transactionId, found.isPresent(), history.size(), destinationHistory.size(), flags);

        return EnrichedContext.builder()
                .transaction(txn)
                .customer(customer)
                .transactionHistory(history)
                .destinationHistory(destinationHistory)
                .flags(flags)
                .customerMissing(found.isEmpty())
                .build();
    }

    DerivedFlags deriveFlags(Transaction txn, CustomerProfile customer, List<Transaction> history) {
        String destination = txn.getDestinationCountry();
        boolean crossBorder = customer.getCountry() != null && destination != null
                && !customer.getCountry().equalsIgnoreCase(destination);

        return DerivedFlags.builder()
                .highAmount(txn.getAmount() > config.getHighAmountThreshold())
                .highRiskCountry(config.isHighRisk(destination))
                .newAccount(customer.getAccountAgeDays() < config.getNewAccountDays())
                .lowDeviceTrust(customer.getDeviceTrustScore() < config.getLowDeviceTrustThreshold())
                .pastFraud(customer.isPastFraud())
                .crossBorder(crossBorder)
                .amountVsAverage(amountVsAverage(txn, history))
                .build();
    }

    /**
     * Current amount divided by the customer's average amount over earlier transactions.
     * The transaction under review is excluded from the average. Returns 0 without history.
     */
    static double amountVsAverage(Transaction txn, List<Transaction> history) {
        double total = 0.0;
        int count = 0;
        for (Transaction past : history) {
            if (past.getTransactionId() != null && past.getTransactionId().equals(txn.getTransactionId())) {
                continue;
            }
            total += past.getAmount();
            count++;
        }
        if (count == 0 || total <= 0.0) {
            return 0.0;
        }
        return txn.getAmount() / (total / count);
    }

    private Optional<CustomerProfile> lookupCustomer(String customerId) {
        try {
            Optional<CustomerProfile> customer = dataStore.getCustomer(customerId);
            if (customer.isEmpty()) {
                log.warn("Customer {} not found, continuing with an empty profile", customerId);
            }
            return customer;
        } catch (RuntimeException e) {
            log.warn("Customer lookup failed for {}, continuing with an empty profile: {}", customerId, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Transaction> degradeToEmpty(String what, Supplier<List<Transaction>> lookup) {
        try {
            List<Transaction> result = lookup.get();
            return result != null ? result : Collections.emptyList();
        } catch (RuntimeException e) {
            log.warn("Lookup of {} failed, continuing without it: {}", what, e.getMessage());
            return Collections.emptyList();
        }
    }
}
