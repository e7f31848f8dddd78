package com.kreasipositif.ledgerimporter.service;

import com.kreasipositif.ledgerimporter.client.MarketDataClient;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.Quote;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Refreshes FX rates and quotes from the market-data providers and stores what comes back.
 *
 * <p>Provider calls go through the {@code marketDataBulkhead}. A rejected call is reported the
 * same way as an unavailable provider: an empty result and nothing written.
 */
@Slf4j
@Service
public class MarketDataService {

    private final MarketDataClient marketDataClient;
    private final LedgerRepository ledgerRepository;
    private final Bulkhead marketDataBulkhead;

    public MarketDataService(MarketDataClient marketDataClient,
                             LedgerRepository ledgerRepository,
                             @Qualifier("marketDataBulkhead") Bulkhead marketDataBulkhead) {
        this.marketDataClient = marketDataClient;
        this.ledgerRepository = ledgerRepository;
        this.marketDataBulkhead = marketDataBulkhead;
    }

    public Optional<FxRate> refreshFxRate(String base, String quote) {
        String from = SettingsService.requireCurrencyCode(base);
        String to = SettingsService.requireCurrencyCode(quote);
        Optional<FxRate> rate = call("FX " + from + "/" + to,
                () -> marketDataClient.fetchLatestFxRate(from, to));
        rate.ifPresent(r -> {
            ledgerRepository.upsertFxRates(List.of(r));
            log.info("Stored FX rate {}/{} = {} ({})", r.base(), r.quote(), r.rate(), r.valuationDate());
        });
        return rate;
    }

    public Optional<Quote> refreshEquityQuote(String symbol) {
        requireIdentifier(symbol, "symbol");
        return store(call("equity " + symbol, () -> marketDataClient.fetchEquityQuote(symbol.trim())));
    }

    public Optional<Quote> refreshCryptoQuote(String coinUuid) {
        requireIdentifier(coinUuid, "coin uuid");
        return store(call("crypto " + coinUuid, () -> marketDataClient.fetchCryptoQuote(coinUuid.trim())));
    }

    /**
     * Most recent stored quote for the symbol, without calling any provider.
     */
    public Optional<Quote> latestQuote(String symbol) {
        requireIdentifier(symbol, "symbol");
        return ledgerRepository.findLatestQuote(symbol.trim());
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private <T> Optional<T> call(String what, Supplier<Optional<T>> supplier) {
        try {
            return Bulkhead.decorateSupplier(marketDataBulkhead, supplier).get();
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full for market-data call {}: {}", what, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Quote> store(Optional<Quote> quote) {
        quote.ifPresent(q -> {
            ledgerRepository.saveQuotes(List.of(q));
            log.info("Stored quote {} = {} {} ({})", q.symbol(), q.price(), q.currency(), q.valuationDate());
        });
        return quote;
    }

    private static void requireIdentifier(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
