package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class HighAmountRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.HIGH_AMOUNT;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        double amount = context.getTransaction().getAmount();
        if (!context.getFlags().isHighAmount()) {
            return notTriggered("Amount within normal range");
        }
        return triggered(config, String.format("Amount %.2f exceeds high-amount threshold %.2f",
                amount, config.getHighAmountThreshold()));
    }
}
