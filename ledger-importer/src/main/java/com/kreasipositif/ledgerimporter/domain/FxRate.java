package com.kreasipositif.ledgerimporter.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * FX rate as stored locally. Unique on (base, quote, valuationDate, source).
 */
public record FxRate(String base, String quote, LocalDate valuationDate, BigDecimal rate, String source) {}
