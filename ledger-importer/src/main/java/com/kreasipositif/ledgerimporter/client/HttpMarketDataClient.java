package com.kreasipositif.ledgerimporter.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.kreasipositif.ledgerimporter.config.MarketDataProperties;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * REST client for Alpha Vantage (FX rates, equity quotes) and Coinranking via RapidAPI
 * (crypto quotes).
 *
 * <p>Each call returns {@link Optional#empty()} when the provider's API key is not configured,
 * when the HTTP call fails, or when the expected fields are missing from the response.
 */
@Slf4j
@Component
public class HttpMarketDataClient implements MarketDataClient {

    static final String ALPHA_VANTAGE_SOURCE = "alpha_vantage";
    static final String COINRANKING_SOURCE = "coinranking";

    private final MarketDataProperties properties;
    private final RestClient alphaVantage;
    private final RestClient coinranking;

    public HttpMarketDataClient(RestClient.Builder builder, MarketDataProperties properties) {
        this.properties = properties;
        this.alphaVantage = builder.clone()
                .baseUrl(properties.getAlphaVantage().getEndpoint())
                .build();
        this.coinranking = builder.clone()
                .baseUrl("https://" + properties.getCoinranking().getHost())
                .defaultHeader("X-RapidAPI-Host", properties.getCoinranking().getHost())
                .build();
    }

    // ─── FX (Alpha Vantage) ──────────────────────────────────────────────────

    /**
     * Calls {@code ?function=CURRENCY_EXCHANGE_RATE&from_currency=&to_currency=}.
     */
    @Override
    public Optional<FxRate> fetchLatestFxRate(String base, String quote) {
        String apiKey = properties.getAlphaVantage().getApiKey();
        if (isBlank(apiKey)) {
            log.warn("Alpha Vantage API key not configured, FX rate {}/{} unavailable", base, quote);
            return Optional.empty();
        }
        String from = upper(base);
        String to = upper(quote);
        try {
            JsonNode payload = alphaVantage.get()
                    .uri(uriBuilder -> uriBuilder
                            .queryParam("function", "CURRENCY_EXCHANGE_RATE")
                            .queryParam("from_currency", from)
                            .queryParam("to_currency", to)
                            .queryParam("apikey", apiKey)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);

            return decimal(payload, "Realtime Currency Exchange Rate", "5. Exchange Rate")
                    .map(rate -> new FxRate(from, to, LocalDate.now(), rate, ALPHA_VANTAGE_SOURCE));
        } catch (RestClientException e) {
            log.warn("FX rate call failed for {}/{}: {}", from, to, e.getMessage());
            return Optional.empty();
        }
    }

    // ─── Equity quotes (Alpha Vantage) ───────────────────────────────────────

    /**
     * Calls {@code ?function=GLOBAL_QUOTE&symbol=}. The currency defaults to USD when the
     * response does not name one.
     */
    @Override
    public Optional<Quote> fetchEquityQuote(String symbol) {
        String apiKey = properties.getAlphaVantage().getApiKey();
        if (isBlank(apiKey)) {
            log.warn("Alpha Vantage API key not configured, equity quote {} unavailable", symbol);
            return Optional.empty();
        }
        try {
            JsonNode payload = alphaVantage.get()
                    .uri(uriBuilder -> uriBuilder
                            .queryParam("function", "GLOBAL_QUOTE")
                            .queryParam("symbol", symbol)
                            .queryParam("apikey", apiKey)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);

            String currency = text(payload, "Global Quote", "08. currency").orElse("USD");
            return decimal(payload, "Global Quote", "05. price")
                    .map(price -> new Quote(upper(symbol), LocalDate.now(), price, upper(currency),
                            ALPHA_VANTAGE_SOURCE));
        } catch (RestClientException e) {
            log.warn("Equity quote call failed for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    // ─── Crypto quotes (Coinranking) ─────────────────────────────────────────

    /**
     * Calls {@code GET /coin/{uuid}?timePeriod=24h}. Coinranking prices are quoted in USD.
     */
    @Override
    public Optional<Quote> fetchCryptoQuote(String coinUuid) {
        String apiKey = properties.getCoinranking().getApiKey();
        if (isBlank(apiKey)) {
            log.warn("Coinranking API key not configured, crypto quote {} unavailable", coinUuid);
            return Optional.empty();
        }
        try {
            JsonNode payload = coinranking.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/coin/{uuid}")
                            .queryParam("timePeriod", "24h")
                            .build(coinUuid))
                    .header("X-RapidAPI-Key", apiKey)
                    .retrieve()
                    .body(JsonNode.class);

            String symbol = text(payload, "data", "coin", "symbol").orElse(coinUuid);
            return decimal(payload, "data", "coin", "price")
                    .map(price -> new Quote(upper(symbol), LocalDate.now(), price, "USD", COINRANKING_SOURCE));
        } catch (RestClientException e) {
            log.warn("Crypto quote call failed for {}: {}", coinUuid, e.getMessage());
            return Optional.empty();
        }
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static Optional<String> text(JsonNode payload, String... path) {
        JsonNode node = payload;
        for (String field : path) {
            if (node == null) {
                return Optional.empty();
            }
            node = node.get(field);
        }
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    private static Optional<BigDecimal> decimal(JsonNode payload, String... path) {
        return text(payload, path).flatMap(value -> {
            try {
                return Optional.of(new BigDecimal(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Unexpected numeric value '{}' at {}", value, String.join(" / ", path));
                return Optional.empty();
            }
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }
}
