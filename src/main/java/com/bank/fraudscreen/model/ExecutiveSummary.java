package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Condensed view of an audit report for decision makers.
 */
@Value
@Builder
@Schema(description = "Critical flags and the top priority actions of an audit report")
public class ExecutiveSummary {

    boolean immediateActionRequired;
    boolean regulatoryFilingRequired;
    boolean enhancedMonitoringRequired;

    @Schema(example = "HIGH RISK - Immediate review and action required")
    String primaryRecommendation;

    Set<RiskFactor> keyRiskFactors;

    @Schema(description = "First recommendations of the report, at most three")
    List<String> priorityActions;
}
