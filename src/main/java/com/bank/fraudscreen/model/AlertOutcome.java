package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Result of the fraud alert branch")
public class AlertOutcome {

    AlertOutcomeType type;

    @Schema(description = "The alert; null when no action was required")
    AlertRecord alert;

    DispatchReceipt receipt;

    @Schema(description = "Why dispatch failed, when it did")
    String failureReason;

    public static AlertOutcome noAction() {
        return AlertOutcome.builder().type(AlertOutcomeType.NO_ACTION_REQUIRED).build();
    }

    public static AlertOutcome dispatched(AlertRecord alert, DispatchReceipt receipt) {
        return AlertOutcome.builder()
                .type(AlertOutcomeType.ALERT_DISPATCHED)
                .alert(alert)
                .receipt(receipt)
                .build();
    }

    public static AlertOutcome dispatchFailed(AlertRecord alert, String reason) {
        return AlertOutcome.builder()
                .type(AlertOutcomeType.DISPATCH_FAILED)
                .alert(alert)
                .failureReason(reason)
                .build();
    }
}
