package com.bank.fraudscreen.model;

import lombok.Builder;
import lombok.Value;

/**
 * Comparative features derived once during enrichment.
 */
@Value
@Builder
public class DerivedFlags {
    boolean highAmount;
    boolean highRiskCountry;
    boolean newAccount;
    boolean lowDeviceTrust;
    boolean pastFraud;
    boolean crossBorder;

    // current amount / historical average amount, 0 when there is no history
    double amountVsAverage;
}
