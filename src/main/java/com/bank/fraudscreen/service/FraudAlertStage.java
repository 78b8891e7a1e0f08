package com.bank.fraudscreen.service;

import com.bank.fraudscreen.client.AlertDispatcher;
import com.bank.fraudscreen.client.RemoteCallException;
import com.bank.fraudscreen.client.RemoteCallGuard;
import com.bank.fraudscreen.config.AlertDispatchConfig;
import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.engine.WorkflowStage;
import com.bank.fraudscreen.model.AlertOutcome;
import com.bank.fraudscreen.model.AlertRecord;
import com.bank.fraudscreen.model.AlertSeverity;
import com.bank.fraudscreen.model.AlertStatus;
import com.bank.fraudscreen.model.DispatchReceipt;
import com.bank.fraudscreen.model.RiskAssessment;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Sink stage that decides whether a risk assessment warrants a fraud alert and dispatches it.
 * Ineligible assessments never reach the dispatcher. A failed dispatch is reported in the
 * {@link AlertOutcome}; it does not fail the branch.
 */
@Service
public class FraudAlertStage implements WorkflowStage<RiskAssessment, AlertOutcome> {

    private static final Logger log = LoggerFactory.getLogger(FraudAlertStage.class);

    public static final String NAME = "fraud-alert";

    // Any one of these raises an alert whatever the score
    static final Set<RiskFactor> ALERTING_FACTORS = EnumSet.of(
            RiskFactor.SANCTIONS_CONCERN,
            RiskFactor.HIGH_RISK_JURISDICTION,
            RiskFactor.SUSPICIOUS_PATTERN,
            RiskFactor.REGULATORY_COMPLIANCE_VIOLATION);

    private static final int MAX_NARRATIVE_IN_REASONING = 500;

    private final AlertDispatcher alertDispatcher;
    private final RemoteCallGuard remoteCallGuard;
    private final AlertDispatchConfig alertConfig;
    private final WorkflowConfig workflowConfig;
    private final MetricsConfig metricsConfig;

    public FraudAlertStage(AlertDispatcher alertDispatcher,
                           RemoteCallGuard remoteCallGuard,
                           AlertDispatchConfig alertConfig,
                           WorkflowConfig workflowConfig,
                           MetricsConfig metricsConfig) {
        this.alertDispatcher = alertDispatcher;
        this.remoteCallGuard = remoteCallGuard;
        this.alertConfig = alertConfig;
        this.workflowConfig = workflowConfig;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Class<RiskAssessment> inputType() {
        return RiskAssessment.class;
    }

    @Override
    public Class<AlertOutcome> outputType() {
        return AlertOutcome.class;
    }

    @Override
    public AlertOutcome execute(RiskAssessment assessment) {
        if (!isEligible(assessment)) {
            log.debug("No alert for txn {}: score={}, factors={}",
                    assessment.getTransactionId(), assessment.getScore(), assessment.getFactors());
            metricsConfig.recordAlertOutcome("NO_ACTION_REQUIRED", "NONE");
            return AlertOutcome.noAction();
        }

        AlertRecord alert = buildAlert(assessment);
        try {
            DispatchReceipt receipt = remoteCallGuard.call("alert-dispatch", workflowConfig.getAlertDispatchTimeout(),
                    () -> alertDispatcher.send(alert));
            metricsConfig.recordAlertOutcome("ALERT_DISPATCHED", alert.getSeverity().name());
            log.warn("Fraud alert {} raised for txn {}: severity={}, action={}, channel={}",
                    alert.getAlertId(), alert.getTransactionId(), alert.getSeverity(),
                    alert.getDecisionAction(), receipt.channel());
            return AlertOutcome.dispatched(alert, receipt);
        } catch (RemoteCallException e) {
            metricsConfig.recordAlertOutcome("DISPATCH_FAILED", alert.getSeverity().name());
            log.error("Dispatch of alert {} for txn {} failed{}: {}", alert.getAlertId(), alert.getTransactionId(),
                    e.isTimedOut() ? " (timeout)" : "", e.getMessage());
            return AlertOutcome.dispatchFailed(alert, e.getMessage());
        }
    }

    public static boolean isEligible(RiskAssessment assessment) {
        if (assessment.getScore() >= RiskThresholds.ALERT) {
            return true;
        }
        for (RiskFactor factor : ALERTING_FACTORS) {
            if (assessment.hasFactor(factor)) {
                return true;
            }
        }
        return false;
    }

    AlertRecord buildAlert(RiskAssessment assessment) {
        return AlertRecord.builder()
                .alertId("ALERT-" + assessment.getTransactionId() + "-" + UUID.randomUUID().toString().substring(0, 8))
                .transactionId(assessment.getTransactionId())
                .customerId(assessment.getCustomerId())
                .severity(AlertSeverity.fromScore(assessment.getScore()))
                .status(AlertStatus.OPEN)
                .decisionAction(assessment.getRecommendation().toDecisionAction())
                .riskScore(assessment.getScore())
                .riskFactors(assessment.getFactors())
                .reasoning(reasoning(assessment))
                .assignedTo(alertConfig.getAssignedTo())
                .createdAt(Instant.now())
                .build();
    }

    private static String reasoning(RiskAssessment assessment) {
        StringBuilder sb = new StringBuilder(String.format("Risk score %.1f (%s), recommendation %s.",
                assessment.getScore(), assessment.getLevel(), assessment.getRecommendation()));
        if (!assessment.getFactors().isEmpty()) {
            sb.append(" Factors: ").append(assessment.getFactors()).append('.');
        }
        String narrative = assessment.getNarrative();
        if (!narrative.isBlank()) {
            sb.append(' ').append(narrative.length() > MAX_NARRATIVE_IN_REASONING
                    ? narrative.substring(0, MAX_NARRATIVE_IN_REASONING) + "..."
                    : narrative);
        }
        return sb.toString();
    }
}
