package com.bank.fraudscreen.engine;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskThresholds;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates every registered {@link RiskRule} against an enriched transaction and adds up the
 * weights of those that fire. Rules are additive and not mutually exclusive.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleType, RiskRule> rules;
    private final RiskScoringConfig config;
    private final Tracer tracer;

    public RuleEngine(List<RiskRule> rules, RiskScoringConfig config, Tracer tracer) {
        this.rules = new EnumMap<>(RuleType.class);
        this.config = config;
        this.tracer = tracer;

        for (RiskRule rule : rules) {
            this.rules.put(rule.getSupportedRuleType(), rule);
            log.info("Registered risk rule: {} -> {}", rule.getSupportedRuleType(), rule.getClass().getSimpleName());
        }
    }

    public RuleEvaluation evaluateAll(EnrichedContext context) {
        List<RuleResult> results = new ArrayList<>();
        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);
        double score = 0.0;

        for (RiskRule rule : rules.values()) {
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getSupportedRuleType())
                    .tag("rule.type", rule.getSupportedRuleType().name())
                    .tag("txn.id", String.valueOf(context.getTransactionId()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleResult result = rule.evaluate(context, config);
                results.add(result);

                ruleSpan.tag("rule.triggered", String.valueOf(result.isTriggered()));
                if (result.isTriggered()) {
                    score += result.getWeight();
                    factors.add(rule.getSupportedRuleType().getFactor());
                    log.debug("Rule {} triggered for txn {}: +{} ({})", rule.getSupportedRuleType(),
                            context.getTransactionId(), result.getWeight(), result.getReason());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for txn {}: {}",
                        rule.getSupportedRuleType(), context.getTransactionId(), e.getMessage(), e);
                // Don't let one bad rule block the rest of the evaluation
            } finally {
                ruleSpan.end();
            }
        }

        return new RuleEvaluation(RiskThresholds.clamp(score), factors, results);
    }
}
