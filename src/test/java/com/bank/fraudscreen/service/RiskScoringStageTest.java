package com.bank.fraudscreen.service;

import com.bank.fraudscreen.client.ReasoningClient;
import com.bank.fraudscreen.client.RemoteCallException;
import com.bank.fraudscreen.client.RemoteCallGuard;
import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.NarrativeConfig;
import com.bank.fraudscreen.config.RiskScoringConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.engine.narrative.NarrativeParser;
import com.bank.fraudscreen.model.DerivedFlags;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.Recommendation;
import com.bank.fraudscreen.model.RiskAssessment;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskLevel;
import com.bank.fraudscreen.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskScoringStageTest {

    @Mock private ReasoningClient reasoningClient;

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private WorkflowConfig workflowConfig;
    private RiskScoringStage stage;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        workflowConfig = new WorkflowConfig();
        workflowConfig.setReasoningTimeout(Duration.ofSeconds(2));

        stage = new RiskScoringStage(
                TestDataFactory.createRuleEngine(new RiskScoringConfig()),
                new NarrativeParser(new NarrativeConfig()),
                reasoningClient,
                new RemoteCallGuard(executor),
                workflowConfig,
                new MetricsConfig(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void execute_reasoningUnavailable_fallsBackToRuleScore() {
        when(reasoningClient.run(anyString()))
                .thenThrow(new RemoteCallException("reasoning", "Reasoning service is disabled"));

        RiskAssessment assessment = stage.execute(scenarioAContext());

        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getScore()).isEqualTo(100.0);
        assertThat(assessment.getBaseScore()).isEqualTo(100.0);
        assertThat(assessment.getNarrativeScore()).isNull();
        assertThat(assessment.getLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(assessment.getRecommendation()).isEqualTo(Recommendation.BLOCK);
        assertThat(assessment.getFactors()).contains(
                RiskFactor.DEGRADED_ANALYSIS, RiskFactor.SANCTIONS_CONCERN, RiskFactor.HIGH_RISK_JURISDICTION);
        assertThat(registry.get("risk.degraded.count").tag("reason", "unavailable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_reasoningThrowsUnexpectedly_isDegradedNotFatal() {
        when(reasoningClient.run(anyString())).thenThrow(new IllegalStateException("connection reset"));

        RiskAssessment assessment = stage.execute(scenarioBContext());

        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getScore()).isEqualTo(0.0);
        assertThat(assessment.getRecommendation()).isEqualTo(Recommendation.APPROVE);
    }

    @Test
    void execute_reasoningTimesOut_isDegraded() {
        workflowConfig.setReasoningTimeout(Duration.ofMillis(100));
        when(reasoningClient.run(anyString())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return "Risk Score: 5";
        });

        RiskAssessment assessment = stage.execute(scenarioBContext());

        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getScore()).isEqualTo(0.0);
        assertThat(registry.get("risk.degraded.count").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_explicitNarrativeScore_isAuthoritative() {
        when(reasoningClient.run(anyString())).thenReturn("Risk Score: 30\nRisk Level: LOW\nApprove.");

        RiskAssessment assessment = stage.execute(scenarioAContext());

        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.getScore()).isEqualTo(30.0);
        assertThat(assessment.getBaseScore()).isEqualTo(100.0);
        assertThat(assessment.getNarrativeScore()).isEqualTo(30.0);
        assertThat(assessment.getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(assessment.getRecommendation()).isEqualTo(Recommendation.APPROVE);
        // rule factors survive even when the narrative score wins
        assertThat(assessment.getFactors()).contains(RiskFactor.SANCTIONS_CONCERN);
    }

    @Test
    void execute_noExplicitScore_keepsRuleScoreAndMergesTextFactors() {
        when(reasoningClient.run(anyString()))
                .thenReturn("The counterparty shows a suspicious pattern of round-amount transfers; investigate.");

        RiskAssessment assessment = stage.execute(scenarioBContext());

        assertThat(assessment.getScore()).isEqualTo(0.0);
        assertThat(assessment.getNarrativeScore()).isEqualTo(50.0);
        assertThat(assessment.getFactors()).containsExactly(RiskFactor.SUSPICIOUS_PATTERN);
        assertThat(assessment.getNarrative()).contains("suspicious pattern");
    }

    @Test
    void execute_negatedNarrative_addsNoFactors() {
        when(reasoningClient.run(anyString())).thenReturn(
                "No sanctions concern; transaction is not suspicious and amount is below the reporting threshold.");

        RiskAssessment assessment = stage.execute(scenarioBContext());

        assertThat(assessment.getFactors()).isEmpty();
        assertThat(assessment.getLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void buildPrompt_carriesTransactionAndRuleScore() {
        EnrichedContext context = scenarioAContext();

        String prompt = stage.buildPrompt(context,
                TestDataFactory.createRuleEngine(new RiskScoringConfig()).evaluateAll(context));

        assertThat(prompt).contains("TX-A", "USD", "Destination country: IR", "Rule-based score: 100", "SANCTIONS_CONCERN");
    }

    private static EnrichedContext scenarioAContext() {
        return TestDataFactory.createContext(
                TestDataFactory.scenarioATransaction(),
                TestDataFactory.scenarioACustomer(),
                DerivedFlags.builder()
                        .highAmount(true)
                        .highRiskCountry(true)
                        .newAccount(true)
                        .lowDeviceTrust(true)
                        .pastFraud(true)
                        .crossBorder(true)
                        .build());
    }

    private static EnrichedContext scenarioBContext() {
        return TestDataFactory.createContext(
                TestDataFactory.scenarioBTransaction(),
                TestDataFactory.scenarioBCustomer(),
                DerivedFlags.builder().build());
    }
}
