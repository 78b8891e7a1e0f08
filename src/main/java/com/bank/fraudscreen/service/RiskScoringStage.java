package com.bank.fraudscreen.service;

import com.bank.fraudscreen.client.ReasoningClient;
import com.bank.fraudscreen.client.RemoteCallException;
import com.bank.fraudscreen.client.RemoteCallGuard;
import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.engine.RuleEngine;
import com.bank.fraudscreen.engine.RuleEvaluation;
import com.bank.fraudscreen.engine.WorkflowStage;
import com.bank.fraudscreen.engine.narrative.NarrativeParser;
import com.bank.fraudscreen.model.CustomerProfile;
import com.bank.fraudscreen.model.DerivedFlags;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.ParsedNarrative;
import com.bank.fraudscreen.model.RiskAssessment;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskLevel;
import com.bank.fraudscreen.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Scores an enriched transaction.
 *
 * The rule engine gives a deterministic base score. The reasoning service is then asked for a
 * narrative which is read by {@link NarrativeParser}. An explicit score stated in the narrative
 * is authoritative; otherwise the base score stands. Factors from both sources are merged.
 * When the reasoning call fails or times out the assessment is rules-only and marked degraded.
 */
@Service
public class RiskScoringStage implements WorkflowStage<EnrichedContext, RiskAssessment> {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringStage.class);

    public static final String NAME = "risk-scoring";

    private final RuleEngine ruleEngine;
    private final NarrativeParser narrativeParser;
    private final ReasoningClient reasoningClient;
    private final RemoteCallGuard remoteCallGuard;
    private final WorkflowConfig workflowConfig;
    private final MetricsConfig metricsConfig;

    public RiskScoringStage(RuleEngine ruleEngine,
                            NarrativeParser narrativeParser,
                            ReasoningClient reasoningClient,
                            RemoteCallGuard remoteCallGuard,
                            WorkflowConfig workflowConfig,
                            MetricsConfig metricsConfig) {
        this.ruleEngine = ruleEngine;
        this.narrativeParser = narrativeParser;
        this.reasoningClient = reasoningClient;
        this.remoteCallGuard = remoteCallGuard;
        this.workflowConfig = workflowConfig;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Class<EnrichedContext> inputType() {
        return EnrichedContext.class;
    }

    @Override
    public Class<RiskAssessment> outputType() {
        return RiskAssessment.class;
    }

    @Override
    public RiskAssessment execute(EnrichedContext context) {
        RuleEvaluation rules = ruleEngine.evaluateAll(context);
        String prompt = buildPrompt(context, rules);

        RiskAssessment assessment;
        try {
            String narrative = remoteCallGuard.call("reasoning", workflowConfig.getReasoningTimeout(),
                    () -> reasoningClient.run(prompt));
            assessment = reconcile(context, rules, narrative);
        } catch (RemoteCallException e) {
            String reason = e.isTimedOut() ? "timeout" : "unavailable";
            log.warn("Reasoning {} for txn {}, scoring on rules only: {}",
                    reason, context.getTransactionId(), e.getMessage());
            metricsConfig.recordDegradedAnalysis(reason);
            assessment = degraded(context, rules, reason);
        }

        metricsConfig.recordRiskScore(assessment.getRecommendation().name(), assessment.getScore());
        log.info("Risk assessment for txn {}: score={}, level={}, recommendation={}, factors={}, degraded={}",
                assessment.getTransactionId(), assessment.getScore(), assessment.getLevel(),
                assessment.getRecommendation(), assessment.getFactors(), assessment.isDegraded());
        return assessment;
    }

    RiskAssessment reconcile(EnrichedContext context, RuleEvaluation rules, String narrative) {
        ParsedNarrative parsed = narrativeParser.parse(narrative);

        // An explicit narrative score replaces the rule score; an inferred one is informational only
        double score = parsed.isScoreExplicit() ? parsed.getScore() : rules.baseScore();

        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);
        factors.addAll(rules.factors());
        factors.addAll(parsed.getFactors());

        RiskAssessment assessment = RiskAssessment.builder()
                .transactionId(context.getTransactionId())
                .customerId(context.getTransaction().getCustomerId())
                .score(score)
                .baseScore(rules.baseScore())
                .narrativeScore(parsed.getScore())
                .factors(factors)
                .narrative(narrative)
                .degraded(false)
                .ruleResults(rules.ruleResults())
                .assessedAt(System.currentTimeMillis())
                .build();

        if (parsed.getStatedRiskLevel() != null
                && !parsed.getStatedRiskLevel().equals(assessment.getLevel().name())) {
            log.debug("Narrative for txn {} states level {} but score {} maps to {}",
                    context.getTransactionId(), parsed.getStatedRiskLevel(),
                    assessment.getScore(), assessment.getLevel());
        }
        return assessment;
    }

    private RiskAssessment degraded(EnrichedContext context, RuleEvaluation rules, String reason) {
        Set<RiskFactor> factors = EnumSet.of(RiskFactor.DEGRADED_ANALYSIS);
        factors.addAll(rules.factors());

        return RiskAssessment.builder()
                .transactionId(context.getTransactionId())
                .customerId(context.getTransaction().getCustomerId())
                .score(rules.baseScore())
                .baseScore(rules.baseScore())
                .narrativeScore(null)
                .factors(factors)
                .narrative("Automated reasoning " + reason + "; assessment based on rules only.")
                .degraded(true)
                .ruleResults(rules.ruleResults())
                .assessedAt(System.currentTimeMillis())
                .build();
    }

    String buildPrompt(EnrichedContext context, RuleEvaluation rules) {
        Transaction txn = context.getTransaction();
        CustomerProfile customer = context.getCustomer();
        DerivedFlags flags = context.getFlags();

        StringBuilder sb = new StringBuilder();
        sb.append("Assess the fraud and compliance risk of this transaction.\n\n");
        sb.append("Transaction ID: ").append(txn.getTransactionId()).append('\n');
        sb.append("Amount: ").append(String.format("%.2f %s", txn.getAmount(), txn.getCurrency())).append('\n');
        sb.append("Destination country: ").append(txn.getDestinationCountry()).append('\n');

        if (context.isCustomerMissing()) {
            sb.append("Customer: ").append(txn.getCustomerId()).append(" (no profile on record)\n");
        } else {
            sb.append("Customer: ").append(customer.getCustomerId())
                    .append(", resident in ").append(customer.getCountry())
                    .append(", account age ").append(customer.getAccountAgeDays()).append(" days")
                    .append(", device trust ").append(String.format("%.2f", customer.getDeviceTrustScore()))
                    .append(", past fraud ").append(customer.isPastFraud() ? "yes" : "no").append('\n');
        }

        sb.append("Customer history: ").append(context.getTransactionHistory().size()).append(" transactions");
        if (flags.getAmountVsAverage() > 0) {
            sb.append(String.format(", this amount is %.1fx the average", flags.getAmountVsAverage()));
        }
        sb.append('\n');
        sb.append("Transactions to this destination on record: ")
                .append(context.getDestinationHistory().size()).append('\n');

        sb.append("\nRule-based score: ").append(String.format("%.0f", rules.baseScore()))
                .append(" (").append(RiskLevel.fromScore(rules.baseScore())).append(")\n");
        sb.append("Rule-based factors: ").append(rules.factors().isEmpty() ? "none" : rules.factors()).append('\n');
        return sb.toString();
    }
}
