package com.bank.fraudscreen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "workflow")
public class WorkflowConfig {

    // Deadline for one call to the reasoning service
    private Duration reasoningTimeout = Duration.ofSeconds(20);

    // Deadline for one alert dispatch
    private Duration alertDispatchTimeout = Duration.ofSeconds(10);

    // Upper bound on waiting for a sink branch after risk scoring
    private Duration branchTimeout = Duration.ofSeconds(60);

    // Threads running the audit and alert branches
    private int sinkPoolSize = 8;

    // Threads executing guarded remote calls
    private int remoteCallPoolSize = 16;

    // Largest number of transaction ids accepted by one batch request
    private int maxBatchSize = 100;
}
