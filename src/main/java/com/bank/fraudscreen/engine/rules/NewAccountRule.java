package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class NewAccountRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.NEW_ACCOUNT;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        if (!context.getFlags().isNewAccount()) {
            return notTriggered("Established account");
        }
        return triggered(config, String.format("Account is %d days old (minimum %d)",
                context.getCustomer().getAccountAgeDays(), config.getNewAccountDays()));
    }
}
