package com.bank.fraudscreen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit")
public class AuditConfig {

    // Ask the reasoning service for advisory prose to append to each report
    private boolean supplementaryNarrativeEnabled = false;

    private int maxSupplementaryLength = 500;
}
