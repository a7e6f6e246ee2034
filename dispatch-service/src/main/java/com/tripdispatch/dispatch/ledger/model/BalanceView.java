package com.tripdispatch.dispatch.ledger.model;

import java.math.BigDecimal;

public record BalanceView(String accountId, String currency, BigDecimal available) {
}
