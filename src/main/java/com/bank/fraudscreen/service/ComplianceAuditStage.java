package com.bank.fraudscreen.service;

import com.bank.fraudscreen.client.ReasoningClient;
import com.bank.fraudscreen.client.RemoteCallException;
import com.bank.fraudscreen.client.RemoteCallGuard;
import com.bank.fraudscreen.config.AuditConfig;
import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.engine.WorkflowStage;
import com.bank.fraudscreen.engine.narrative.NarrativeParser;
import com.bank.fraudscreen.model.AuditReport;
import com.bank.fraudscreen.model.AuditTrail;
import com.bank.fraudscreen.model.ComplianceRating;
import com.bank.fraudscreen.model.ExecutiveSummary;
import com.bank.fraudscreen.model.ParsedNarrative;
import com.bank.fraudscreen.model.RiskAssessment;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Sink stage producing the compliance audit report for a risk assessment.
 *
 * The rating and every flag are a pure function of the assessment, so auditing the same
 * assessment twice gives the same verdict. Supplementary prose from the reasoning service,
 * when enabled, is appended to the report text only.
 */
@Service
public class ComplianceAuditStage implements WorkflowStage<RiskAssessment, AuditReport> {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAuditStage.class);

    public static final String NAME = "compliance-audit";

    static final List<String> IMMEDIATE_ACTION_RECOMMENDATIONS = List.of(
            "Freeze transaction pending investigation",
            "Conduct enhanced customer due diligence",
            "File suspicious activity report with regulators",
            "Document all investigation steps for audit trail");

    static final List<String> ENHANCED_MONITORING_RECOMMENDATIONS = List.of(
            "Place customer on enhanced monitoring list",
            "Review transaction against internal risk policies",
            "Consider additional identity verification",
            "Monitor future transactions closely");

    static final List<String> REGULATORY_FILING_RECOMMENDATIONS = List.of(
            "Prepare regulatory filing documentation");

    static final List<String> DEFAULT_RECOMMENDATIONS = List.of(
            "Continue standard monitoring procedures",
            "File transaction record in compliance database",
            "No immediate action required");

    static final List<String> DATA_SOURCES = List.of("Transaction Data", "Customer Profile", "Regulatory Database");

    private static final int PRIORITY_ACTIONS = 3;

    private static final Map<RiskFactor, String> CONCERNS = new EnumMap<>(RiskFactor.class);
    private static final Map<RiskFactor, String> IMPLICATIONS = new EnumMap<>(RiskFactor.class);

    static {
        CONCERNS.put(RiskFactor.HIGH_RISK_JURISDICTION,
                "Transaction involves high-risk jurisdiction requiring enhanced monitoring");
        CONCERNS.put(RiskFactor.SANCTIONS_CONCERN,
                "Potential sanctions-related issues identified in risk analysis");
        CONCERNS.put(RiskFactor.UNUSUAL_AMOUNT,
                "Transaction amount exceeds normal patterns for customer profile");
        CONCERNS.put(RiskFactor.HIGH_TRANSACTION_AMOUNT,
                "Transaction amount exceeds the high-value reporting threshold");
        CONCERNS.put(RiskFactor.SUSPICIOUS_PATTERN,
                "Suspicious transaction pattern detected requiring investigation");
        CONCERNS.put(RiskFactor.FREQUENCY_ANOMALY,
                "Transaction frequency deviates from customer behaviour");
        CONCERNS.put(RiskFactor.PREVIOUS_FRAUD_HISTORY,
                "Customer has previous fraud on record");
        CONCERNS.put(RiskFactor.REGULATORY_COMPLIANCE_VIOLATION,
                "Possible regulatory compliance violation identified");
        CONCERNS.put(RiskFactor.DEGRADED_ANALYSIS,
                "Risk analysis completed without automated reasoning; rule-based score only");

        IMPLICATIONS.put(RiskFactor.HIGH_RISK_JURISDICTION,
                "Enhanced due diligence procedures required as identified by risk analysis");
        IMPLICATIONS.put(RiskFactor.SANCTIONS_CONCERN,
                "Immediate review required based on sanctions risk indicators");
        IMPLICATIONS.put(RiskFactor.UNUSUAL_AMOUNT,
                "Additional transaction verification recommended based on risk assessment");
        IMPLICATIONS.put(RiskFactor.HIGH_TRANSACTION_AMOUNT,
                "Large-value transaction reporting obligations may apply");
        IMPLICATIONS.put(RiskFactor.SUSPICIOUS_PATTERN,
                "Pattern analysis indicates potential compliance concerns");
        IMPLICATIONS.put(RiskFactor.REGULATORY_COMPLIANCE_VIOLATION,
                "Violation must be documented and escalated to the compliance officer");
    }

    private final NarrativeParser narrativeParser;
    private final ReasoningClient reasoningClient;
    private final RemoteCallGuard remoteCallGuard;
    private final AuditConfig auditConfig;
    private final WorkflowConfig workflowConfig;
    private final MetricsConfig metricsConfig;

    public ComplianceAuditStage(NarrativeParser narrativeParser,
                                ReasoningClient reasoningClient,
                                RemoteCallGuard remoteCallGuard,
                                AuditConfig auditConfig,
                                WorkflowConfig workflowConfig,
                                MetricsConfig metricsConfig) {
        this.narrativeParser = narrativeParser;
        this.reasoningClient = reasoningClient;
        this.remoteCallGuard = remoteCallGuard;
        this.auditConfig = auditConfig;
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
    public Class<AuditReport> outputType() {
        return AuditReport.class;
    }

    @Override
    public AuditReport execute(RiskAssessment assessment) {
        double score = assessment.getScore();
        ParsedNarrative parsed = narrativeParser.parse(assessment.getNarrative());
        Set<RiskFactor> factors = mergeFactors(assessment, parsed);

        ComplianceRating rating = rate(score);
        boolean immediateAction = rating == ComplianceRating.NON_COMPLIANT;
        boolean enhancedMonitoring = rating == ComplianceRating.CONDITIONAL_COMPLIANCE;
        boolean regulatoryFiling = factors.contains(RiskFactor.HIGH_RISK_JURISDICTION)
                || factors.contains(RiskFactor.SANCTIONS_CONCERN);

        List<String> recommendations = recommendations(immediateAction, enhancedMonitoring, regulatoryFiling);
        List<String> concerns = describe(factors, CONCERNS);
        List<String> implications = describe(factors, IMPLICATIONS);
        String conclusion = conclusion(rating);
        String supplementary = supplementaryNarrative(assessment);

        String reportId = "AUDIT-" + UUID.randomUUID();
        Instant generatedAt = Instant.now();

        AuditReport report = AuditReport.builder()
                .reportId(reportId)
                .transactionId(assessment.getTransactionId())
                .customerId(assessment.getCustomerId())
                .riskScore(score)
                .riskLevel(assessment.getLevel())
                .complianceRating(rating)
                .auditConclusion(conclusion)
                .requiresImmediateAction(immediateAction)
                .requiresEnhancedMonitoring(enhancedMonitoring)
                .requiresRegulatoryFiling(regulatoryFiling)
                .riskFactorsIdentified(Collections.unmodifiableSet(factors))
                .complianceConcerns(concerns)
                .regulatoryImplications(implications)
                .recommendations(recommendations)
                .executiveSummary(ExecutiveSummary.builder()
                        .immediateActionRequired(immediateAction)
                        .regulatoryFilingRequired(regulatoryFiling)
                        .enhancedMonitoringRequired(enhancedMonitoring)
                        .primaryRecommendation(conclusion)
                        .keyRiskFactors(Collections.unmodifiableSet(factors))
                        .priorityActions(recommendations.subList(0, Math.min(PRIORITY_ACTIONS, recommendations.size())))
                        .build())
                .auditTrail(AuditTrail.builder()
                        .analysisMethod(assessment.isDegraded()
                                ? "Rule-based risk assessment (automated reasoning unavailable)"
                                : "Automated risk assessment")
                        .dataSources(DATA_SOURCES)
                        .sourceAssessedAt(Instant.ofEpochMilli(assessment.getAssessedAt()))
                        .build())
                .narrativeRiskLevel(parsed.getStatedRiskLevel())
                .supplementaryNarrative(supplementary)
                .formattedReport(format(reportId, generatedAt, assessment, rating, conclusion, factors,
                        concerns, implications, recommendations, regulatoryFiling, supplementary))
                .generatedAt(generatedAt)
                .build();

        metricsConfig.recordComplianceDecision(rating.name());
        log.info("[AUDIT] report={} txn={} rating={} score={} immediateAction={} enhancedMonitoring={} filing={}",
                reportId, assessment.getTransactionId(), rating, score,
                immediateAction, enhancedMonitoring, regulatoryFiling);
        return report;
    }

    static ComplianceRating rate(double score) {
        if (score >= RiskThresholds.AUDIT_NON_COMPLIANT) {
            return ComplianceRating.NON_COMPLIANT;
        }
        if (score >= RiskThresholds.AUDIT_CONDITIONAL) {
            return ComplianceRating.CONDITIONAL_COMPLIANCE;
        }
        return ComplianceRating.COMPLIANT;
    }

    private Set<RiskFactor> mergeFactors(RiskAssessment assessment, ParsedNarrative parsed) {
        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);
        factors.addAll(assessment.getFactors());
        if (!factors.containsAll(parsed.getFactors())) {
            Set<RiskFactor> extra = EnumSet.noneOf(RiskFactor.class);
            extra.addAll(parsed.getFactors());
            extra.removeAll(factors);
            log.warn("Narrative for txn {} carries factors {} missing from its assessment",
                    assessment.getTransactionId(), extra);
        }
        factors.addAll(parsed.getFactors());
        return factors;
    }

    private static List<String> recommendations(boolean immediateAction, boolean enhancedMonitoring,
                                                boolean regulatoryFiling) {
        List<String> recommendations = new ArrayList<>();
        if (immediateAction) {
            recommendations.addAll(IMMEDIATE_ACTION_RECOMMENDATIONS);
        }
        if (enhancedMonitoring) {
            recommendations.addAll(ENHANCED_MONITORING_RECOMMENDATIONS);
        }
        if (regulatoryFiling) {
            recommendations.addAll(REGULATORY_FILING_RECOMMENDATIONS);
        }
        if (!immediateAction && !enhancedMonitoring) {
            recommendations.addAll(DEFAULT_RECOMMENDATIONS);
        }
        return List.copyOf(recommendations);
    }

    private static List<String> describe(Set<RiskFactor> factors, Map<RiskFactor, String> texts) {
        List<String> lines = new ArrayList<>();
        for (RiskFactor factor : factors) {
            String line = texts.get(factor);
            if (line != null) {
                lines.add(line);
            }
        }
        return List.copyOf(lines);
    }

    private static String conclusion(ComplianceRating rating) {
        return switch (rating) {
            case NON_COMPLIANT -> "HIGH RISK - Immediate review and action required";
            case CONDITIONAL_COMPLIANCE -> "MEDIUM RISK - Enhanced monitoring and review recommended";
            default -> "LOW RISK - Standard monitoring procedures sufficient";
        };
    }

    private String supplementaryNarrative(RiskAssessment assessment) {
        if (!auditConfig.isSupplementaryNarrativeEnabled()) {
            return null;
        }
        String prompt = "Write a short compliance audit note for transaction " + assessment.getTransactionId()
                + " with risk score " + String.format("%.0f", assessment.getScore())
                + " and risk factors " + assessment.getFactors() + ".";
        try {
            String prose = remoteCallGuard.call("audit-narrative", workflowConfig.getReasoningTimeout(),
                    () -> reasoningClient.run(prompt));
            if (prose == null || prose.isBlank()) {
                log.warn("Supplementary audit narrative empty for txn {}", assessment.getTransactionId());
                return null;
            }
            if (prose.length() > auditConfig.getMaxSupplementaryLength()) {
                prose = prose.substring(0, auditConfig.getMaxSupplementaryLength());
            }
            return prose.trim();
        } catch (RemoteCallException e) {
            log.warn("Supplementary audit narrative unavailable for txn {}: {}",
                    assessment.getTransactionId(), e.getMessage());
            return null;
        }
    }

    private static String format(String reportId, Instant generatedAt, RiskAssessment assessment,
                                 ComplianceRating rating, String conclusion, Set<RiskFactor> factors,
                                 List<String> concerns, List<String> implications, List<String> recommendations,
                                 boolean regulatoryFiling, String supplementary) {
        StringBuilder sb = new StringBuilder();
        sb.append("COMPLIANCE AUDIT REPORT ").append(reportId).append('\n');
        sb.append("Generated: ").append(generatedAt).append('\n');
        sb.append("Transaction: ").append(assessment.getTransactionId())
                .append("  Customer: ").append(assessment.getCustomerId()).append('\n');
        sb.append(String.format("Risk score: %.1f (%s)  Recommendation: %s%n",
                assessment.getScore(), assessment.getLevel(), assessment.getRecommendation()));
        sb.append("Compliance rating: ").append(rating).append('\n');
        sb.append("Conclusion: ").append(conclusion).append('\n');
        sb.append("Regulatory filing required: ").append(regulatoryFiling ? "YES" : "NO").append('\n');
        sb.append("Risk factors: ").append(factors.isEmpty() ? "none" : factors).append('\n');

        if (!concerns.isEmpty()) {
            sb.append("Concerns:\n");
            concerns.forEach(c -> sb.append("  - ").append(c).append('\n'));
        }
        if (!implications.isEmpty()) {
            sb.append("Regulatory implications:\n");
            implications.forEach(i -> sb.append("  - ").append(i).append('\n'));
        }
        sb.append("Recommendations:\n");
        recommendations.forEach(r -> sb.append("  - ").append(r).append('\n'));

        if (supplementary != null && !supplementary.isEmpty()) {
            sb.append("Analyst note (advisory):\n  ").append(supplementary).append('\n');
        }
        return sb.toString();
    }
}
