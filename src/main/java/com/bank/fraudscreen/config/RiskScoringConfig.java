package com.bank.fraudscreen.config;

import com.bank.fraudscreen.model.RuleType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskScoringConfig {

    // Destinations that add jurisdiction risk
    private Set<String> highRiskCountries = Set.of("NG", "IR", "RU", "KP", "SY", "AF", "MM", "YE");

    // Stricter subset; scored in addition to the high-risk weight
    private Set<String> sanctionedCountries = Set.of("IR", "KP", "SY", "RU");

    private double highAmountThreshold = 10_000.0;

    private int newAccountDays = 30;

    private double lowDeviceTrustThreshold = 0.5;

    // amount / historical average above which AMOUNT_DEVIATION fires
    private double amountVsAverageMultiple = 5.0;

    // Destination history is pattern context only; it can be switched off to save a store scan.
    private boolean fetchDestinationHistory = true;

    // Points added per triggered rule. Business-tunable.
    private Map<RuleType, Double> weights = defaultWeights();

    public double weightOf(RuleType ruleType) {
        return weights.getOrDefault(ruleType, 0.0);
    }

    public boolean isHighRisk(String country) {
        return country != null && highRiskCountries.contains(country.toUpperCase());
    }

    public boolean isSanctioned(String country) {
        return country != null && sanctionedCountries.contains(country.toUpperCase());
    }

    private static Map<RuleType, Double> defaultWeights() {
        Map<RuleType, Double> w = new EnumMap<>(RuleType.class);
        w.put(RuleType.HIGH_RISK_COUNTRY, 30.0);
        w.put(RuleType.SANCTIONED_COUNTRY, 40.0);
        w.put(RuleType.CROSS_BORDER, 10.0);
        w.put(RuleType.HIGH_AMOUNT, 20.0);
        w.put(RuleType.AMOUNT_DEVIATION, 25.0);
        w.put(RuleType.NEW_ACCOUNT, 15.0);
        w.put(RuleType.LOW_DEVICE_TRUST, 20.0);
        w.put(RuleType.PAST_FRAUD, 30.0);
        return w;
    }
}
