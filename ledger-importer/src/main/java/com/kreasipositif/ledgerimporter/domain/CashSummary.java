package com.kreasipositif.ledgerimporter.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregated cash position, optionally converted into a display currency.
 *
 * <p>When no CHF → {@link #displayCurrency} rate is stored, {@link #displayTotal} carries the
 * unconverted CHF total and {@link #fxMissing} is {@code true}.
 */
@Value
@Builder
public class CashSummary {

    BigDecimal totalChf;

    long transactionCount;

    String displayCurrency;

    BigDecimal displayTotal;

    boolean fxMissing;

    /** Rate applied to the CHF total; {@code null} for CHF or when the rate is missing. */
    BigDecimal fxRate;
}
