package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class CrossBorderRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.CROSS_BORDER;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        if (!context.getFlags().isCrossBorder()) {
            return notTriggered("Domestic transfer");
        }
        return triggered(config, String.format("Cross-border transfer %s -> %s",
                context.getCustomer().getCountry(), context.getTransaction().getDestinationCountry()));
    }
}
