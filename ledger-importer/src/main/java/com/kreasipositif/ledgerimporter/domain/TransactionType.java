package com.kreasipositif.ledgerimporter.domain;

/**
 * Economic nature of a transaction as inferred by the classifier.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    FEE,
    UNKNOWN
}
