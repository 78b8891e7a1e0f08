package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Fires when the destination country is on the configured high-risk list.
 */
@Component
public class HighRiskCountryRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.HIGH_RISK_COUNTRY;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        String destination = context.getTransaction().getDestinationCountry();
        if (!context.getFlags().isHighRiskCountry()) {
            return notTriggered("Destination " + destination + " is not a high-risk jurisdiction");
        }
        return triggered(config, "Destination " + destination + " is a high-risk jurisdiction");
    }
}
