package com.kreasipositif.ledgerimporter.client;

import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.Quote;

import java.util.Optional;

/**
 * Point-in-time FX rates and asset quotes from external providers.
 *
 * <p>An empty result means "unavailable": provider not configured, unreachable, or answering
 * with an unexpected payload. Implementations do not throw for those cases.
 */
public interface MarketDataClient {

    Optional<FxRate> fetchLatestFxRate(String base, String quote);

    Optional<Quote> fetchEquityQuote(String symbol);

    /**
     * @param coinUuid provider-specific coin identifier
     */
    Optional<Quote> fetchCryptoQuote(String coinUuid);
}
