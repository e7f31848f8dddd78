package com.kreasipositif.ledgerimporter.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Canonical, persisted view of a transaction after classification.
 *
 * <p>{@link #id} is inherited from the {@link RawTransactionRecord} and is the upsert key:
 * re-importing the same id replaces every column, {@link #createdAt} included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalisedTransaction {

    private String id;

    private String sheetName;

    private String accountId;

    private String accountName;

    private String accountHolder;

    private LocalDate transactionDate;

    private String transactionTime;

    private LocalDate accountingDate;

    private String currency;

    /** Signed CHF amount: positive = inflow, negative = outflow. */
    private BigDecimal amountChf;

    /** Amount in {@link #currency}; only set for non-CHF rows with a non-zero FX rate. */
    private BigDecimal amountNative;

    private BigDecimal fxRate;

    private BigDecimal debit;

    private BigDecimal credit;

    private BigDecimal balance;

    private String description;

    private String transactionNumber;

    private String category;

    private String subCategory;

    private String microCategory;

    private TransactionType inferredType;

    private String inferredCounterparty;

    private String notes;

    private LocalDateTime createdAt;
}
