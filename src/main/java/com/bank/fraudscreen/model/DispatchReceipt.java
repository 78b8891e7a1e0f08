package com.bank.fraudscreen.model;

/**
 * Acknowledgement returned by an alert channel.
 */
public record DispatchReceipt(String channel, String reference) {}
