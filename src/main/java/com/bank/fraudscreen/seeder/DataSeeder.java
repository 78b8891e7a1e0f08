package com.bank.fraudscreen.seeder;

import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.Transaction;
import com.bank.fraudscreen.repository.AerospikeTransactionDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Random;

/**
 * Seeds Aerospike with demo customers and transactions for local screening runs.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Screening candidates are TX1001 to TX1015. Each customer also gets a block of older
 * transactions (HIST-*) so the amount-vs-average comparison has something to work with.
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final int HISTORY_PER_CUSTOMER = 20;

    private final AerospikeTransactionDataStore dataStore;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(AerospikeTransactionDataStore dataStore) {
        this.dataStore = dataStore;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        List<CustomerProfile> customers = List.of(
                customer("CUST1001", "Alice Johnson", "US", 1200, 0.95, false),
                customer("CUST1002", "Bob Smith", "GB", 640, 0.88, false),
                customer("CUST1003", "Carlos Mendes", "BR", 20, 0.42, false),
                customer("CUST1004", "Dana Whitfield", "US", 15, 0.30, true),
                customer("CUST1005", "Emeka Obi", "DE", 365, 0.75, false),
                customer("CUST1006", "Fatima Khan", "AE", 90, 0.61, true));
        customers.forEach(dataStore::saveCustomer);

        Instant now = Instant.now();
        for (CustomerProfile c : customers) {
            seedHistory(c, now);
        }

        List<Transaction> candidates = List.of(
                txn("TX1001", "CUST1001", 250.00, "USD", "US", now),
                txn("TX1002", "CUST1001", 1800.00, "USD", "CA", now),
                txn("TX1003", "CUST1002", 500.00, "GBP", "DE", now),
                txn("TX1004", "CUST1002", 12500.00, "GBP", "NG", now),
                txn("TX1005", "CUST1003", 3200.00, "BRL", "BR", now),
                txn("TX1006", "CUST1003", 9800.00, "BRL", "AF", now),
                txn("TX1007", "CUST1004", 15000.00, "USD", "IR", now),
                txn("TX1008", "CUST1004", 700.00, "USD", "US", now),
                txn("TX1009", "CUST1005", 45000.00, "EUR", "RU", now),
                txn("TX1010", "CUST1005", 120.00, "EUR", "FR", now),
                txn("TX1011", "CUST1006", 8000.00, "AED", "YE", now),
                txn("TX1012", "CUST1006", 22000.00, "AED", "KP", now),
                txn("TX1013", "CUST1001", 60.00, "USD", "US", now),
                txn("TX1014", "CUST1002", 2400.00, "GBP", "MM", now),
                // customer without a profile on record
                txn("TX1015", "CUST9999", 950.00, "USD", "SY", now));
        candidates.forEach(dataStore::saveTransaction);

        log.info("=== Data seeding complete: {} customers, {} screening candidates ===",
                customers.size(), candidates.size());
    }

    private void seedHistory(CustomerProfile customer, Instant now) {
        double typical = 100 + random.nextInt(900);
        for (int i = 0; i < HISTORY_PER_CUSTOMER; i++) {
            double amount = Math.round(typical * (0.5 + random.nextDouble()) * 100.0) / 100.0;
            Instant at = now.minus(HISTORY_PER_CUSTOMER - i, ChronoUnit.DAYS);
            dataStore.saveTransaction(txn(String.format("HIST-%s-%03d", customer.getCustomerId(), i),
                    customer.getCustomerId(), amount, "USD", customer.getCountry(), at));
        }
        log.info("Seeded {} historical transactions for {}", HISTORY_PER_CUSTOMER, customer.getCustomerId());
    }

    private static CustomerProfile customer(String id, String name, String country, int ageDays,
                                            double deviceTrust, boolean pastFraud) {
        return CustomerProfile.builder()
                .customerId(id)
                .name(name)
                .country(country)
                .accountAgeDays(ageDays)
                .deviceTrustScore(deviceTrust)
                .pastFraud(pastFraud)
                .build();
    }

    private static Transaction txn(String id, String customerId, double amount, String currency,
                                   String destination, Instant at) {
        return Transaction.builder()
                .transactionId(id)
                .customerId(customerId)
                .amount(amount)
                .currency(currency)
                .destinationCountry(destination)
                .timestamp(at.toEpochMilli())
                .build();
    }
}
