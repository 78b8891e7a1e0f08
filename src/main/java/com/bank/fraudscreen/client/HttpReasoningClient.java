package com.bank.fraudscreen.client;

import com.bank.fraudscreen.config.ReasoningServiceConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.util.List;

/**
 * Reasoning client for OpenAI-compatible chat-completions endpoints.
 */
@Component
public class HttpReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(HttpReasoningClient.class);

    private final ReasoningServiceConfig config;
    private final RestClient restClient;

    public HttpReasoningClient(ReasoningServiceConfig config, WorkflowConfig workflowConfig,
                               RestClient.Builder restClientBuilder) {
        this.config = config;
        this.restClient = config.isEnabled()
                ? restClientBuilder
                        .baseUrl(config.getBaseUrl())
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                        .requestFactory(requestFactory(config, workflowConfig))
                        .build()
                : null;
        log.info("Reasoning service is {}", config.isEnabled() ? "ENABLED (" + config.getBaseUrl() + ")" : "DISABLED");
    }

    // socket timeouts; cancelling the guarded future does not interrupt a blocked read
    private static JdkClientHttpRequestFactory requestFactory(ReasoningServiceConfig config,
                                                              WorkflowConfig workflowConfig) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(workflowConfig.getReasoningTimeout());
        log.info("Reasoning client timeouts: connect={}ms, read={}ms",
                config.getConnectTimeout().toMillis(), workflowConfig.getReasoningTimeout().toMillis());
        return factory;
    }

    @Override
    public String run(String prompt) {
        if (restClient == null) {
            throw new RemoteCallException("reasoning", "Reasoning service is disabled");
        }

        ChatRequest request = new ChatRequest(
                config.getModel(),
                List.of(new ChatMessage("system", config.getSystemPrompt()), new ChatMessage("user", prompt)),
                config.getMaxTokens(),
                config.getTemperature());

        ChatResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(ChatResponse.class);
        } catch (RestClientException e) {
            throw new RemoteCallException("reasoning", "Reasoning service call failed: " + e.getMessage(), false, e);
        }

        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new RemoteCallException("reasoning", "Reasoning service returned no choices");
        }
        String content = response.getChoices().get(0).getMessage().getContent();
        if (content == null || content.isBlank()) {
            throw new RemoteCallException("reasoning", "Reasoning service returned an empty answer");
        }
        return content;
    }

    @Data
    @AllArgsConstructor
    static class ChatRequest {
        private String model;
        private List<ChatMessage> messages;
        @JsonProperty("max_tokens")
        private int maxTokens;
        private double temperature;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatMessage {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatResponse {
        private List<Choice> choices;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Choice {
        private ChatMessage message;
    }
}
