package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Value
@Builder
@Schema(description = "Compliance audit report derived from a risk assessment")
public class AuditReport {

    @Schema(example = "AUDIT-3f6c1a52-9d7e-4b1a-8c2f-6f1c2a9e0b47")
    String reportId;

    @Schema(example = "TX1012")
    String transactionId;

    String customerId;
    double riskScore;
    RiskLevel riskLevel;

    @Schema(description = "NON_COMPLIANT (>=75), CONDITIONAL_COMPLIANCE (50-75), COMPLIANT (<50)", example = "NON_COMPLIANT")
    ComplianceRating complianceRating;

    @Schema(example = "HIGH RISK - Immediate review and action required")
    String auditConclusion;

    boolean requiresImmediateAction;
    boolean requiresEnhancedMonitoring;
    boolean requiresRegulatoryFiling;

    Set<RiskFactor> riskFactorsIdentified;
    List<String> complianceConcerns;

    @Schema(description = "Regulatory consequences of the identified risk factors")
    List<String> regulatoryImplications;

    List<String> recommendations;

    ExecutiveSummary executiveSummary;

    AuditTrail auditTrail;

    @Schema(description = "Risk level as stated in the narrative, if any", example = "HIGH")
    String narrativeRiskLevel;

    @Schema(description = "Advisory prose from the reasoning service; never affects the rating")
    String supplementaryNarrative;

    @Schema(description = "Plain-text rendering of the report")
    String formattedReport;

    Instant generatedAt;
}
