package com.bank.fraudscreen.engine;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;

/**
 * A single deterministic scoring rule. Each implementation handles one {@link RuleType};
 * its weight comes from {@link RiskScoringConfig#getWeights()}.
 */
public interface RiskRule {

    RuleType getSupportedRuleType();

    RuleResult evaluate(EnrichedContext context, RiskScoringConfig config);

    default RuleResult triggered(RiskScoringConfig config, String reason) {
        return RuleResult.builder()
                .ruleType(getSupportedRuleType())
                .triggered(true)
                .weight(config.weightOf(getSupportedRuleType()))
                .reason(reason)
                .build();
    }

    default RuleResult notTriggered(String reason) {
        return RuleResult.builder()
                .ruleType(getSupportedRuleType())
                .triggered(false)
                .weight(0.0)
                .reason(reason)
                .build();
    }
}
