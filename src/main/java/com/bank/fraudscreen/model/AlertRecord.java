package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
@Schema(description = "Fraud alert raised for a transaction")
public class AlertRecord {

    @Schema(example = "ALERT-TX1012-3b8e1f40")
    String alertId;

    String transactionId;
    String customerId;

    @Schema(description = "CRITICAL (>=90), HIGH (>=75), MEDIUM (>=50), LOW", example = "CRITICAL")
    AlertSeverity severity;

    AlertStatus status;
    DecisionAction decisionAction;
    double riskScore;
    Set<RiskFactor> riskFactors;
    String reasoning;

    @Schema(example = "fraud_monitoring_team")
    String assignedTo;

    Instant createdAt;
}
