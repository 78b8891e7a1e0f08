package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class PastFraudRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.PAST_FRAUD;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        if (!context.getFlags().isPastFraud()) {
            return notTriggered("No fraud history");
        }
        return triggered(config, "Customer has previous fraud on record");
    }
}
