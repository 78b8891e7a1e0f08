package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Customer profile used to enrich a transaction")
public class CustomerProfile {

    String customerId;
    String name;

    @Schema(description = "ISO country code of the customer's residence", example = "US")
    String country;

    @Schema(description = "Days since the account was opened", example = "400")
    int accountAgeDays;

    @Schema(description = "Device trust score between 0 and 1", example = "0.9")
    double deviceTrustScore;

    boolean pastFraud;

    /**
     * Placeholder used when the customer record is missing. Neutral values so that
     * none of the customer-based rules fire on absent data.
     */
    public static CustomerProfile empty(String customerId) {
        return CustomerProfile.builder()
                .customerId(customerId)
                .name("UNKNOWN")
                .country(null)
                .accountAgeDays(Integer.MAX_VALUE)
                .deviceTrustScore(1.0)
                .pastFraud(false)
                .build();
    }

    public boolean isEmpty() {
        return country == null && "UNKNOWN".equals(name);
    }
}
