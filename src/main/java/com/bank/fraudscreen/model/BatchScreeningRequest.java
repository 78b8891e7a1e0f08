package com.bank.fraudscreen.model;

import java.util.List;

public record BatchScreeningRequest(List<String> transactionIds) {}
