package com.bank.fraudscreen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reasoning")
public class ReasoningServiceConfig {

    private boolean enabled = false;

    // OpenAI-compatible endpoint root, e.g. https://api.openai.com/v1
    private String baseUrl;
    private String apiKey;
    private String model = "gpt-4o-mini";
    private int maxTokens = 800;
    private double temperature = 0.0;

    // read timeout follows workflow.reasoning-timeout
    private Duration connectTimeout = Duration.ofSeconds(5);

    private String systemPrompt = "You are a financial crime and AML risk analyst. "
            + "Assess the transaction you are given and always state your conclusion as "
            + "'Risk Score: <0-100>' and 'Risk Level: <LOW|MEDIUM|HIGH>' followed by a recommendation "
            + "(APPROVE, INVESTIGATE or BLOCK) and the risk factors you relied on.";
}
