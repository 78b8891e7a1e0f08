package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Summary of a batch screening run")
public class BatchScreeningSummary {

    int processed;
    int completed;
    int partial;
    int failed;
    int alertsDispatched;
    List<Entry> results;

    @Value
    @Builder
    public static class Entry {
        String transactionId;
        @Schema(allowableValues = {"COMPLETED", "PARTIAL", "FAILED"})
        String status;
        Double riskScore;
        Recommendation recommendation;
        ComplianceRating complianceRating;
        AlertOutcomeType alertOutcome;
        String error;
        long durationMs;
    }
}
