package com.bank.fraudscreen.config;

import com.bank.fraudscreen.model.RiskFactor;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Vocabulary and scoring constants for reading free-text risk narratives.
 * All phrases are matched lower-case.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "narrative")
public class NarrativeConfig {

    private Map<RiskFactor, Cue> cues = defaultCues();

    // Country names that raise an inferred score when mentioned
    private List<String> highRiskCountryTerms = new ArrayList<>(List.of(
            "iran", "russia", "north korea", "syria", "yemen", "afghanistan", "myanmar", "nigeria"));

    // bare "high risk" is left out: it also occurs in "high risk country" and "not a high risk ..."
    private List<String> blockPhrases = new ArrayList<>(List.of(
            "block", "reject", "decline", "high risk transaction", "high-risk transaction"));
    private List<String> blockNegations = new ArrayList<>(List.of(
            "not block", "no need to block", "not reject", "not a high risk", "not a high-risk",
            "not high risk", "not high-risk", "no high risk", "no high-risk"));

    private List<String> mediumPhrases = new ArrayList<>(List.of("medium risk", "investigate"));

    private List<String> approvePhrases = new ArrayList<>(List.of("approve", "low risk"));
    private List<String> approveNegations = new ArrayList<>(List.of("not approve", "disapprove", "not low risk"));

    private double baselineScore = 15.0;
    private double countryIncrement = 25.0;
    private double factorIncrement = 15.0;
    private double blockFloor = 80.0;
    private double mediumFloor = 50.0;
    private double approveCeiling = 30.0;
    private double minScore = 0.0;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Cue {
        private List<String> keywords = new ArrayList<>();
        private List<String> negations = new ArrayList<>();
    }

    private static Map<RiskFactor, Cue> defaultCues() {
        Map<RiskFactor, Cue> cues = new EnumMap<>(RiskFactor.class);
        cues.put(RiskFactor.HIGH_RISK_JURISDICTION, new Cue(
                List.of("high-risk country", "high risk country", "high-risk jurisdiction", "high risk jurisdiction"),
                List.of("not high-risk", "not high risk", "not a high-risk", "not a high risk", "no high-risk",
                        "no high risk", "not in a high", "low-risk country", "low risk country")));
        cues.put(RiskFactor.SANCTIONS_CONCERN, new Cue(
                List.of("sanction"),
                List.of("no sanction", "not sanction", "not subject to sanction", "sanctions check clear",
                        "sanctions screening clear", "sanctions-free")));
        cues.put(RiskFactor.UNUSUAL_AMOUNT, new Cue(
                List.of("large amount", "high amount", "unusual amount", "unusually large"),
                List.of("below", "not large", "not high", "not unusual", "within normal")));
        cues.put(RiskFactor.SUSPICIOUS_PATTERN, new Cue(
                List.of("suspicious"),
                List.of("not suspicious", "no suspicious", "nothing suspicious", "no triggering")));
        cues.put(RiskFactor.FREQUENCY_ANOMALY, new Cue(
                List.of("frequent", "unusual frequency", "high velocity"),
                List.of("not frequent", "infrequent", "normal frequency", "normal velocity")));
        cues.put(RiskFactor.PREVIOUS_FRAUD_HISTORY, new Cue(
                List.of("fraud history", "previous fraud", "prior fraud", "past fraud"),
                List.of("no fraud history", "no previous fraud", "no prior fraud", "no past fraud",
                        "clean fraud history")));
        cues.put(RiskFactor.NEW_ACCOUNT_RISK, new Cue(
                List.of("new account", "recently opened"),
                List.of("not a new account", "not new account", "established account")));
        cues.put(RiskFactor.LOW_DEVICE_TRUST, new Cue(
                List.of("low device trust", "untrusted device"),
                List.of("high device trust", "device is trusted")));
        cues.put(RiskFactor.REGULATORY_COMPLIANCE_VIOLATION, new Cue(
                List.of("compliance violation", "regulatory violation", "aml violation"),
                List.of("no compliance violation", "no regulatory violation", "no aml violation",
                        "without violation")));
        return cues;
    }
}
