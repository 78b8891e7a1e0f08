package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A payment transaction as held by the record store")
public class Transaction {

    @Schema(description = "Unique transaction identifier", example = "TX1012")
    String transactionId;

    @Schema(description = "Owning customer identifier", example = "CUST1005")
    String customerId;

    @Schema(description = "Transaction amount", example = "15000.00")
    double amount;

    @Schema(description = "ISO currency code", example = "USD")
    String currency;

    @Schema(description = "ISO country code of the destination", example = "RU")
    String destinationCountry;

    @Schema(description = "Transaction timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;
}
