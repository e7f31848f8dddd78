package com.kreasipositif.ledgerimporter.domain;

/**
 * Outcome of running the classification rules over one {@link RawTransactionRecord}.
 *
 * @param type         inferred transaction type, never {@code null}
 * @param counterparty advisory counterparty name; {@code null} when none could be derived
 * @param note         explains an ambiguous outcome; {@code null} otherwise
 */
public record ClassificationResult(TransactionType type, String counterparty, String note) {

    public static ClassificationResult of(TransactionType type, String counterparty) {
        return new ClassificationResult(type, counterparty, null);
    }
}
