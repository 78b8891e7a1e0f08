package com.bank.fraudscreen.service;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.TransactionNotFoundException;
import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.DerivedFlags;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.Transaction;
import com.bank.fraudscreen.repository.TransactionDataStore;
import com.bank.fraudscreen.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataEnrichmentStageTest {

    @Mock private TransactionDataStore dataStore;

    private RiskScoringConfig config;
    private DataEnrichmentStage stage;

    @BeforeEach
    void setUp() {
        config = new RiskScoringConfig();
        stage = new DataEnrichmentStage(dataStore, config);
    }

    @Test
    void execute_transactionNotFound_failsWithoutFurtherLookups() {
        when(dataStore.getTransaction("TX-404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> stage.execute("TX-404"))
                .isInstanceOf(TransactionNotFoundException.class)
                .hasMessageContaining("TX-404");

        verify(dataStore, never()).getCustomer(anyString());
        verify(dataStore, never()).getTransactionsByCustomer(anyString());
    }

    @Test
    void execute_riskyTransaction_derivesAllFlags() {
        Transaction txn = TestDataFactory.scenarioATransaction();
        when(dataStore.getTransaction("TX-A")).thenReturn(Optional.of(txn));
        when(dataStore.getCustomer("CUST-A")).thenReturn(Optional.of(TestDataFactory.scenarioACustomer()));
        when(dataStore.getTransactionsByCustomer("CUST-A")).thenReturn(List.of());
        when(dataStore.getTransactionsByDestination("IR")).thenReturn(List.of(txn));

        EnrichedContext context = stage.execute("TX-A");
        DerivedFlags flags = context.getFlags();

        assertThat(context.isCustomerMissing()).isFalse();
        assertThat(context.getDestinationHistory()).hasSize(1);
        assertThat(flags.isHighAmount()).isTrue();
        assertThat(flags.isHighRiskCountry()).isTrue();
        assertThat(flags.isNewAccount()).isTrue();
        assertThat(flags.isLowDeviceTrust()).isTrue();
        assertThat(flags.isPastFraud()).isTrue();
        assertThat(flags.isCrossBorder()).isTrue();
        assertThat(flags.getAmountVsAverage()).isEqualTo(0.0);
    }

    @Test
    void execute_cleanTransaction_raisesNoFlags() {
        when(dataStore.getTransaction("TX-B")).thenReturn(Optional.of(TestDataFactory.scenarioBTransaction()));
        when(dataStore.getCustomer("CUST-B")).thenReturn(Optional.of(TestDataFactory.scenarioBCustomer()));
        when(dataStore.getTransactionsByCustomer("CUST-B")).thenReturn(List.of());
        when(dataStore.getTransactionsByDestination("DE")).thenReturn(List.of());

        DerivedFlags flags = stage.execute("TX-B").getFlags();

        assertThat(flags.isHighAmount()).isFalse();
        assertThat(flags.isHighRiskCountry()).isFalse();
        assertThat(flags.isNewAccount()).isFalse();
        assertThat(flags.isLowDeviceTrust()).isFalse();
        assertThat(flags.isPastFraud()).isFalse();
        assertThat(flags.isCrossBorder()).isFalse();
    }

    @Test
    void execute_missingCustomer_continuesWithEmptyProfile() {
        Transaction txn = TestDataFactory.createTransaction("TX-1", "C-GONE", 900.0, "SY");
        when(dataStore.getTransaction("TX-1")).thenReturn(Optional.of(txn));
        when(dataStore.getCustomer("C-GONE")).thenReturn(Optional.empty());
        when(dataStore.getTransactionsByCustomer("C-GONE")).thenReturn(List.of());
        when(dataStore.getTransactionsByDestination("SY")).thenReturn(List.of());

        EnrichedContext context = stage.execute("TX-1");

        assertThat(context.isCustomerMissing()).isTrue();
        assertThat(context.getCustomer().isEmpty()).isTrue();
        assertThat(context.getFlags().isHighRiskCountry()).isTrue();
        assertThat(context.getFlags().isCrossBorder()).isFalse();
        assertThat(context.getFlags().isNewAccount()).isFalse();
        assertThat(context.getFlags().isLowDeviceTrust()).isFalse();
    }

    @Test
    void execute_customerLookupThrows_continuesWithEmptyProfile() {
        when(dataStore.getTransaction("TX-B")).thenReturn(Optional.of(TestDataFactory.scenarioBTransaction()));
        when(dataStore.getCustomer("CUST-B")).thenThrow(new IllegalStateException("store down"));
        when(dataStore.getTransactionsByCustomer("CUST-B")).thenReturn(List.of());
        when(dataStore.getTransactionsByDestination("DE")).thenReturn(List.of());

        EnrichedContext context = stage.execute("TX-B");

        assertThat(context.isCustomerMissing()).isTrue();
        assertThat(context.getCustomer().getCustomerId()).isEqualTo("CUST-B");
    }

    @Test
    void execute_historyLookupsFail_degradeToEmpty() {
        when(dataStore.getTransaction("TX-B")).thenReturn(Optional.of(TestDataFactory.scenarioBTransaction()));
        when(dataStore.getCustomer("CUST-B")).thenReturn(Optional.of(TestDataFactory.scenarioBCustomer()));
        when(dataStore.getTransactionsByCustomer("CUST-B")).thenThrow(new IllegalStateException("scan failed"));
        when(dataStore.getTransactionsByDestination("DE")).thenThrow(new IllegalStateException("scan failed"));

        EnrichedContext context = stage.execute("TX-B");

        assertThat(context.getTransactionHistory()).isEmpty();
        assertThat(context.getDestinationHistory()).isEmpty();
        assertThat(context.getFlags().getAmountVsAverage()).isEqualTo(0.0);
    }

    @Test
    void execute_destinationHistoryDisabled_skipsLookup() {
        config.setFetchDestinationHistory(false);
        when(dataStore.getTransaction("TX-B")).thenReturn(Optional.of(TestDataFactory.scenarioBTransaction()));
        when(dataStore.getCustomer("CUST-B")).thenReturn(Optional.of(TestDataFactory.scenarioBCustomer()));
        when(dataStore.getTransactionsByCustomer("CUST-B")).thenReturn(List.of());

        stage.execute("TX-B");

        verify(dataStore, never()).getTransactionsByDestination(anyString());
    }

    @Test
    void amountVsAverage_excludesCurrentTransaction() {
        Transaction current = TestDataFactory.createTransaction("TX-NOW", "C-1", 3000.0, "US");
        List<Transaction> history = List.of(
                TestDataFactory.createTransaction("TX-OLD-1", "C-1", 100.0, "US"),
                TestDataFactory.createTransaction("TX-OLD-2", "C-1", 200.0, "US"),
                current);

        assertThat(DataEnrichmentStage.amountVsAverage(current, history)).isCloseTo(20.0, within(0.0001));
        assertThat(DataEnrichmentStage.amountVsAverage(current, List.of(current))).isEqualTo(0.0);
    }

    @Test
    void deriveFlags_thresholdsAreStrict() {
        Transaction atThreshold = TestDataFactory.createTransaction("TX-1", "C-1", 10_000.0, "US");
        CustomerProfile borderline = TestDataFactory.createCustomer("C-1", "US", 30, 0.5, false);

        DerivedFlags flags = stage.deriveFlags(atThreshold, borderline, List.of());

        assertThat(flags.isHighAmount()).isFalse();
        assertThat(flags.isNewAccount()).isFalse();
        assertThat(flags.isLowDeviceTrust()).isFalse();
    }
}
