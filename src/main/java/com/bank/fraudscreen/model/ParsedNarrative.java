package com.bank.fraudscreen.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Structured reading of a free-text risk narrative.
 */
@Value
@Builder
public class ParsedNarrative {

    /** Explicit or inferred score, always within [min, 100]. */
    double score;

    /** True when the score was read from a "risk score: N" statement rather than inferred. */
    boolean scoreExplicit;

    /** Upper-cased token after "risk level:", or null. */
    String statedRiskLevel;

    String transactionId;
    String customerId;

    Set<RiskFactor> factors;
}
