package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Result of screening one transaction: the shared risk assessment and both branch outcomes")
public class WorkflowResult {

    @Schema(example = "TX1012")
    String transactionId;

    RiskAssessment riskAssessment;

    BranchResult<AuditReport> audit;

    BranchResult<AlertOutcome> alert;

    @Schema(description = "Wall-clock duration of the run in milliseconds", example = "1840")
    long durationMs;

    public boolean isComplete() {
        return audit.isSucceeded() && alert.isSucceeded();
    }
}
