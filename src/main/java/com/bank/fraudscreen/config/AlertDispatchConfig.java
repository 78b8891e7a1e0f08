package com.bank.fraudscreen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alert")
public class AlertDispatchConfig {

    // Queue that new alerts are assigned to
    private String assignedTo = "fraud_monitoring_team";

    private Twilio twilio = new Twilio();

    @Data
    public static class Twilio {
        private boolean enabled = false;
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private String channel = "sms";  // "sms" or "whatsapp"
    }
}
