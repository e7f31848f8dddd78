package com.kreasipositif.ledgerimporter.domain;

import java.math.BigDecimal;

/**
 * Sum of all stored signed CHF amounts and the number of transactions behind it.
 */
public record CashTotal(BigDecimal totalChf, long transactionCount) {

    public static CashTotal empty() {
        return new CashTotal(BigDecimal.ZERO, 0L);
    }
}
