package com.kreasipositif.ledgerimporter.repository;

import com.kreasipositif.ledgerimporter.domain.CashTotal;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.Quote;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for normalised transactions, FX rates, quotes and settings.
 *
 * <p>Every write is an upsert on the natural key: transactions on their id, FX rates on
 * (base, quote, valuation date, source), quotes on (symbol, valuation date, source), settings
 * on their key. The latest write replaces the stored row.
 */
public interface LedgerRepository {

    /**
     * Inserts or replaces each transaction, storing its verbatim source payload alongside.
     *
     * @param rawLookup transaction id → original row; a missing entry is stored as {@code {}}
     */
    void upsertTransactions(Collection<NormalisedTransaction> transactions,
                            Map<String, Map<String, String>> rawLookup);

    /**
     * Most recent transactions first (transaction date, then accounting date, then creation time).
     */
    List<NormalisedTransaction> listTransactions(int limit);

    /**
     * Verbatim source row stored with the transaction.
     */
    Optional<Map<String, String>> findRawPayload(String transactionId);

    long countTransactions();

    CashTotal totalChf();

    void upsertFxRates(Collection<FxRate> rates);

    /**
     * Rate of the latest valuation date stored for the pair, whatever its source.
     */
    Optional<BigDecimal> findLatestFxRate(String base, String quote);

    void saveQuotes(Collection<Quote> quotes);

    Optional<Quote> findLatestQuote(String symbol);

    Optional<String> findSetting(String key);

    void saveSetting(String key, String value);
}
