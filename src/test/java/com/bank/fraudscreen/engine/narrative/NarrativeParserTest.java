package com.bank.fraudscreen.engine.narrative;

import com.bank.fraudscreen.config.NarrativeConfig;
import com.bank.fraudscreen.model.ParsedNarrative;
import com.bank.fraudscreen.model.RiskFactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NarrativeParserTest {

    private NarrativeConfig config;
    private NarrativeParser parser;

    @BeforeEach
    void setUp() {
        config = new NarrativeConfig();
        parser = new NarrativeParser(config);
    }

    @Test
    void parse_explicitScore_readRegardlessOfSurroundingText() {
        ParsedNarrative parsed = parser.parse(
                "Transfer to Iran with sanctions exposure, suspicious routing. Risk Score: 42. Recommend block.");

        assertThat(parsed.getScore()).isEqualTo(42.0);
        assertThat(parsed.isScoreExplicit()).isTrue();
    }

    @Test
    void parse_explicitScoreLowerCaseWithDecimals() {
        ParsedNarrative parsed = parser.parse("overall risk score = 67.5 after review");

        assertThat(parsed.getScore()).isCloseTo(67.5, within(0.001));
        assertThat(parsed.isScoreExplicit()).isTrue();
    }

    @Test
    void parse_scoreMentionedWithoutSeparator_statedScoreWins() {
        ParsedNarrative parsed = parser.parse(
                "The rule-based risk score 30 understates exposure. Final risk score: 42");

        assertThat(parsed.getScore()).isEqualTo(42.0);
        assertThat(parsed.isScoreExplicit()).isTrue();
    }

    @Test
    void parse_scoreMentionedOnlyInPassing_isInferred() {
        ParsedNarrative parsed = parser.parse("The risk score 90 from last week no longer applies; approve.");

        assertThat(parsed.isScoreExplicit()).isFalse();
        assertThat(parsed.getScore()).isEqualTo(15.0);
    }

    @Test
    void parse_explicitScoreAboveRange_clampedTo100() {
        assertThat(parser.parse("Risk score: 140").getScore()).isEqualTo(100.0);
    }

    @Test
    void parse_statedLevelAndIds() {
        ParsedNarrative parsed = parser.parse(
                "Transaction TX1012 for customer CUST1005 reviewed. Risk Level: high");

        assertThat(parsed.getStatedRiskLevel()).isEqualTo("HIGH");
        assertThat(parsed.getTransactionId()).isEqualTo("TX1012");
        assertThat(parsed.getCustomerId()).isEqualTo("CUST1005");
    }

    @Test
    void parse_everyKeywordAloneSetsItsFactor() {
        for (Map.Entry<RiskFactor, NarrativeConfig.Cue> entry : config.getCues().entrySet()) {
            for (String keyword : entry.getValue().getKeywords()) {
                assertThat(parser.parse("Reviewer comment: " + keyword + ".").getFactors())
                        .as("keyword '%s'", keyword)
                        .contains(entry.getKey());
            }
        }
    }

    @Test
    void parse_everyKeywordWithAnyNegation_doesNotSetFactor() {
        for (Map.Entry<RiskFactor, NarrativeConfig.Cue> entry : config.getCues().entrySet()) {
            for (String keyword : entry.getValue().getKeywords()) {
                for (String negation : entry.getValue().getNegations()) {
                    String text = "Mentions " + keyword + " but states " + negation + " overall.";
                    assertThat(parser.parse(text).getFactors())
                            .as("'%s' negated by '%s'", keyword, negation)
                            .doesNotContain(entry.getKey());
                }
            }
        }
    }

    @Test
    void parse_allClearNarrative_extractsNoFactors() {
        ParsedNarrative parsed = parser.parse(
                "No sanctions concern; transaction is not suspicious and amount is below the reporting threshold.");

        assertThat(parsed.getFactors()).isEmpty();
        assertThat(parsed.isScoreExplicit()).isFalse();
        assertThat(parsed.getScore()).isEqualTo(config.getBaselineScore());
    }

    @Test
    void parse_noExplicitScore_infersFromTermsAndBlockFloor() {
        // 15 baseline + 25 country + 15 suspicious = 55, raised to the block floor
        ParsedNarrative parsed = parser.parse("Transfer to Iran flagged as suspicious; recommend we block it.");

        assertThat(parsed.isScoreExplicit()).isFalse();
        assertThat(parsed.getFactors()).containsExactly(RiskFactor.SUSPICIOUS_PATTERN);
        assertThat(parsed.getScore()).isEqualTo(80.0);
    }

    @Test
    void parse_blockFloorNeverLowersHigherScore() {
        // 15 + 25 country + 3 x 15 factors = 85
        ParsedNarrative parsed = parser.parse(
                "Suspicious transfer to Syria with a sanctions hit and prior fraud on file. Block.");

        assertThat(parsed.getFactors()).containsExactlyInAnyOrder(
                RiskFactor.SUSPICIOUS_PATTERN, RiskFactor.SANCTIONS_CONCERN, RiskFactor.PREVIOUS_FRAUD_HISTORY);
        assertThat(parsed.getScore()).isEqualTo(85.0);
    }

    @Test
    void parse_approvePhraseCapsScore() {
        // 15 + 25 country + 15 new account = 55, capped at the approve ceiling
        ParsedNarrative parsed = parser.parse("Payment to Nigeria from a new account, overall low risk; approve.");

        assertThat(parsed.getScore()).isEqualTo(30.0);
    }

    @Test
    void parse_approveCeilingNeverRaisesLowerScore() {
        assertThat(parser.parse("Routine payment, approve.").getScore()).isEqualTo(15.0);
    }

    @Test
    void parse_blockAndApproveBothPresent_floorWins() {
        ParsedNarrative parsed = parser.parse("The first reviewer would approve, the second would block.");

        assertThat(parsed.getScore()).isEqualTo(80.0);
    }

    @Test
    void parse_negatedBlockPhrase_doesNotApplyFloor() {
        ParsedNarrative parsed = parser.parse("There is no need to block this payment.");

        assertThat(parsed.getScore()).isEqualTo(15.0);
    }

    @Test
    void parse_notAHighRiskCountry_approvedNarrativeStaysLow() {
        ParsedNarrative parsed = parser.parse("Destination is not a high risk country; low risk, approve.");

        assertThat(parsed.getFactors()).doesNotContain(RiskFactor.HIGH_RISK_JURISDICTION);
        assertThat(parsed.getScore()).isEqualTo(15.0);
    }

    @Test
    void parse_highRiskCountryMention_doesNotApplyBlockFloor() {
        // 15 baseline + 15 jurisdiction factor
        ParsedNarrative parsed = parser.parse("Beneficiary bank sits in a high risk country.");

        assertThat(parsed.getFactors()).containsExactly(RiskFactor.HIGH_RISK_JURISDICTION);
        assertThat(parsed.getScore()).isEqualTo(30.0);
    }

    @Test
    void parse_highRiskTransactionPhrase_appliesBlockFloor() {
        assertThat(parser.parse("HIGH RISK transaction requiring immediate attention.").getScore())
                .isEqualTo(80.0);
    }

    @Test
    void parse_mediumPhraseAppliesMediumFloor() {
        assertThat(parser.parse("Medium risk, investigate the counterparty.").getScore()).isEqualTo(50.0);
    }

    @Test
    void parse_blankOrNull_returnsBaselineWithoutFactors() {
        assertThat(parser.parse(null).getScore()).isEqualTo(15.0);
        assertThat(parser.parse("   ").getFactors()).isEmpty();
        assertThat(parser.parse("").isScoreExplicit()).isFalse();
    }
}
