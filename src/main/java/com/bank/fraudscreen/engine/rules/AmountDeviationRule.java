package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Compares the amount with the customer's historical average. A ratio of 0 means no history
 * and never fires.
 */
@Component
public class AmountDeviationRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.AMOUNT_DEVIATION;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        double ratio = context.getFlags().getAmountVsAverage();
        if (ratio <= config.getAmountVsAverageMultiple()) {
            return notTriggered(String.format("Amount is %.1fx the historical average", ratio));
        }
        return triggered(config, String.format("Amount is %.1fx the historical average (limit %.1fx)",
                ratio, config.getAmountVsAverageMultiple()));
    }
}
