package com.bank.fraudscreen.service;

import com.bank.fraudscreen.client.AlertDispatcher;
import com.bank.fraudscreen.client.RemoteCallException;
import com.bank.fraudscreen.client.RemoteCallGuard;
import com.bank.fraudscreen.config.AlertDispatchConfig;
import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.model.AlertOutcome;
import com.bank.fraudscreen.model.AlertOutcomeType;
import com.bank.fraudscreen.model.AlertRecord;
import com.bank.fraudscreen.model.AlertSeverity;
import com.bank.fraudscreen.model.AlertStatus;
import com.bank.fraudscreen.model.DecisionAction;
import com.bank.fraudscreen.model.DispatchReceipt;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FraudAlertStageTest {

    @Mock private AlertDispatcher alertDispatcher;

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private WorkflowConfig workflowConfig;
    private FraudAlertStage stage;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        workflowConfig = new WorkflowConfig();

        stage = new FraudAlertStage(
                alertDispatcher,
                new RemoteCallGuard(executor),
                new AlertDispatchConfig(),
                workflowConfig,
                new MetricsConfig(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void execute_lowScoreWithoutAlertingFactors_neverDispatches() {
        AlertOutcome outcome = stage.execute(
                TestDataFactory.createAssessment("TX-1", 60.0, Set.of(RiskFactor.UNUSUAL_AMOUNT)));

        assertThat(outcome.getType()).isEqualTo(AlertOutcomeType.NO_ACTION_REQUIRED);
        assertThat(outcome.getAlert()).isNull();
        verifyNoInteractions(alertDispatcher);
    }

    @Test
    void execute_criticalScore_dispatchesBlockAlert() {
        when(alertDispatcher.send(any())).thenReturn(new DispatchReceipt("log", "ALERT-1"));

        AlertOutcome outcome = stage.execute(
                TestDataFactory.createAssessment("TX-1", 95.0, Set.of(RiskFactor.PREVIOUS_FRAUD_HISTORY)));

        assertThat(outcome.getType()).isEqualTo(AlertOutcomeType.ALERT_DISPATCHED);
        assertThat(outcome.getReceipt().channel()).isEqualTo("log");

        AlertRecord alert = outcome.getAlert();
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getDecisionAction()).isEqualTo(DecisionAction.BLOCK);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(alert.getAssignedTo()).isEqualTo("fraud_monitoring_team");
        assertThat(alert.getReasoning()).contains("BLOCK", "PREVIOUS_FRAUD_HISTORY");
        verify(alertDispatcher, times(1)).send(alert);
    }

    @Test
    void execute_scoreAtAlertThreshold_isHighSeverity() {
        when(alertDispatcher.send(any())).thenReturn(new DispatchReceipt("sms", "SM123"));

        AlertOutcome outcome = stage.execute(TestDataFactory.createAssessment("TX-1", 75.0, Set.of()));

        assertThat(outcome.getAlert().getSeverity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(outcome.getAlert().getDecisionAction()).isEqualTo(DecisionAction.BLOCK);
    }

    @Test
    void execute_alertingFactorAtLowScore_stillAlerts() {
        when(alertDispatcher.send(any())).thenReturn(new DispatchReceipt("log", "ALERT-2"));

        AlertOutcome outcome = stage.execute(
                TestDataFactory.createAssessment("TX-1", 20.0, Set.of(RiskFactor.SUSPICIOUS_PATTERN)));

        ArgumentCaptor<AlertRecord> captor = ArgumentCaptor.forClass(AlertRecord.class);
        verify(alertDispatcher).send(captor.capture());
        assertThat(outcome.getType()).isEqualTo(AlertOutcomeType.ALERT_DISPATCHED);
        assertThat(captor.getValue().getSeverity()).isEqualTo(AlertSeverity.LOW);
        assertThat(captor.getValue().getDecisionAction()).isEqualTo(DecisionAction.ALLOW);
    }

    @Test
    void isEligible_eachAlertingFactorAloneQualifies() {
        for (RiskFactor factor : FraudAlertStage.ALERTING_FACTORS) {
            assertThat(FraudAlertStage.isEligible(TestDataFactory.createAssessment("TX-1", 0.0, Set.of(factor))))
                    .as(factor.name())
                    .isTrue();
        }
        assertThat(FraudAlertStage.isEligible(TestDataFactory.createAssessment("TX-1", 74.9, Set.of()))).isFalse();
    }

    @Test
    void execute_dispatcherFails_reportsDispatchFailureNotException() {
        when(alertDispatcher.send(any())).thenThrow(new RemoteCallException("alert-dispatch", "Twilio rejected message"));

        AlertOutcome outcome = stage.execute(
                TestDataFactory.createAssessment("TX-1", 88.0, Set.of(RiskFactor.SANCTIONS_CONCERN)));

        assertThat(outcome.getType()).isEqualTo(AlertOutcomeType.DISPATCH_FAILED);
        assertThat(outcome.getAlert()).isNotNull();
        assertThat(outcome.getFailureReason()).contains("Twilio rejected message");
        assertThat(registry.get("alert.outcome.count").tag("outcome", "DISPATCH_FAILED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_dispatcherTimesOut_reportsDispatchFailure() {
        workflowConfig.setAlertDispatchTimeout(Duration.ofMillis(100));
        when(alertDispatcher.send(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return new DispatchReceipt("sms", "late");
        });

        AlertOutcome outcome = stage.execute(TestDataFactory.createAssessment("TX-1", 80.0, Set.of()));

        assertThat(outcome.getType()).isEqualTo(AlertOutcomeType.DISPATCH_FAILED);
        assertThat(outcome.getFailureReason()).contains("timed out");
    }
}
