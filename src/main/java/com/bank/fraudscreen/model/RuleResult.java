package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of a single deterministic scoring rule")
public class RuleResult {

    @Schema(description = "Rule that was evaluated", example = "HIGH_AMOUNT")
    RuleType ruleType;

    @Schema(description = "Whether the rule fired", example = "true")
    boolean triggered;

    @Schema(description = "Points added to the base score when triggered", example = "20.0")
    double weight;

    @Schema(description = "Human-readable explanation",
            example = "Amount 15000.00 exceeds high-amount threshold 10000.00")
    String reason;
}
