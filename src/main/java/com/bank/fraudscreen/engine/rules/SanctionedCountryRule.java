package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Fires when the destination is in the sanctions subset. Scored on top of
 * {@link HighRiskCountryRule}, not instead of it.
 */
@Component
public class SanctionedCountryRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.SANCTIONED_COUNTRY;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        String destination = context.getTransaction().getDestinationCountry();
        if (!config.isSanctioned(destination)) {
            return notTriggered("Destination " + destination + " is not under sanctions");
        }
        return triggered(config, "Destination " + destination + " is a sanctioned jurisdiction");
    }
}
