package com.kreasipositif.ledgerimporter.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Market quote for an asset. Unique on (symbol, valuationDate, source).
 */
public record Quote(String symbol, LocalDate valuationDate, BigDecimal price, String currency, String source) {}
