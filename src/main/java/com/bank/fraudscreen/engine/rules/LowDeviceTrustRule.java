package com.bank.fraudscreen.engine.rules;

import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.engine.RiskRule;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RuleResult;
import com.bank.fraudscreen.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class LowDeviceTrustRule implements RiskRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LOW_DEVICE_TRUST;
    }

    @Override
    public RuleResult evaluate(EnrichedContext context, RiskScoringConfig config) {
        if (!context.getFlags().isLowDeviceTrust()) {
            return notTriggered("Device trust acceptable");
        }
        return triggered(config, String.format("Device trust %.2f below %.2f",
                context.getCustomer().getDeviceTrustScore(), config.getLowDeviceTrustThreshold()));
    }
}
