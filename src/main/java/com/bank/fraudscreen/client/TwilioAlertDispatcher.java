package com.bank.fraudscreen.client;

import com.bank.fraudscreen.config.AlertDispatchConfig;
import com.bank.fraudscreen.model.AlertRecord;
import com.bank.fraudscreen.model.DispatchReceipt;
import com.bank.fraudscreen.model.RiskFactor;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Sends alerts as SMS or WhatsApp messages through Twilio. When Twilio is disabled the alert is
 * written to the log instead and the receipt names the "log" channel.
 */
@Component
public class TwilioAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertDispatcher.class);

    private final AlertDispatchConfig.Twilio config;

    public TwilioAlertDispatcher(AlertDispatchConfig alertConfig) {
        this.config = alertConfig.getTwilio();
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert channel initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert channel is DISABLED. Alerts will be logged only.");
        }
    }

    @Override
    public DispatchReceipt send(AlertRecord alert) {
        String body = buildMessageBody(alert);

        if (!config.isEnabled()) {
            log.warn("[ALERT] {}", body.replace('\n', ' '));
            return new DispatchReceipt("log", alert.getAlertId());
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();
            log.info("Fraud alert {} sent for txn={}, sid={}", alert.getAlertId(), alert.getTransactionId(), message.getSid());
            return new DispatchReceipt(config.getChannel(), message.getSid());
        } catch (TwilioException e) {
            throw new RemoteCallException("alert-dispatch",
                    "Twilio rejected alert " + alert.getAlertId() + ": " + e.getMessage(), false, e);
        }
    }

    private String buildMessageBody(AlertRecord alert) {
        String factors = alert.getRiskFactors().isEmpty()
                ? "none"
                : alert.getRiskFactors().stream().map(RiskFactor::name).collect(Collectors.joining(", "));
        return String.format(
                "[FRAUD ALERT] %s severity\n" +
                "Alert: %s\n" +
                "Txn ID: %s\n" +
                "Customer: %s\n" +
                "Risk Score: %.1f\n" +
                "Action: %s\n" +
                "Factors: %s\n" +
                "Assigned: %s",
                alert.getSeverity(),
                alert.getAlertId(),
                alert.getTransactionId(),
                alert.getCustomerId(),
                alert.getRiskScore(),
                alert.getDecisionAction(),
                factors,
                alert.getAssignedTo());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
