package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Final risk verdict for one transaction. Level and recommendation are always derived from
 * the (clamped) score inside the constructor, so an instance can never carry a score that
 * disagrees with its level.
 */
@Value
@Schema(description = "Risk assessment produced by the scoring stage")
public class RiskAssessment {

    @Schema(example = "TX1012")
    String transactionId;

    @Schema(example = "CUST1005")
    String customerId;

    @Schema(description = "Final risk score (0-100)", example = "82.0")
    double score;

    @Schema(description = "Score from deterministic rules alone", example = "75.0")
    double baseScore;

    @Schema(description = "Score read from or inferred from the narrative; null when no narrative was obtained")
    Double narrativeScore;

    @Schema(description = "HIGH (>=75), MEDIUM (45-75), LOW (<45)", example = "HIGH")
    RiskLevel level;

    @Schema(description = "BLOCK (>=75), INVESTIGATE (45-75), APPROVE (<45)", example = "BLOCK")
    Recommendation recommendation;

    Set<RiskFactor> factors;

    @Schema(description = "Free-text opinion returned by the reasoning service")
    String narrative;

    @Schema(description = "True when the narrative could not be obtained and only rules were applied")
    boolean degraded;

    List<RuleResult> ruleResults;

    long assessedAt;

    @Builder
    private RiskAssessment(String transactionId, String customerId, double score, double baseScore,
                           Double narrativeScore, Collection<RiskFactor> factors, String narrative,
                           boolean degraded, List<RuleResult> ruleResults, long assessedAt) {
        this.transactionId = transactionId;
        this.customerId = customerId;
        this.score = RiskThresholds.clamp(score);
        this.baseScore = RiskThresholds.clamp(baseScore);
        this.narrativeScore = narrativeScore;
        this.level = RiskLevel.fromScore(this.score);
        this.recommendation = Recommendation.fromScore(this.score);
        this.factors = (factors == null || factors.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(factors));
        this.narrative = narrative == null ? "" : narrative;
        this.degraded = degraded;
        this.ruleResults = ruleResults == null ? List.of() : List.copyOf(ruleResults);
        this.assessedAt = assessedAt;
    }

    public boolean hasFactor(RiskFactor factor) {
        return factors.contains(factor);
    }
}
