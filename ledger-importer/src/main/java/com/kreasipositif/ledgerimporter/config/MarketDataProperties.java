package com.kreasipositif.ledgerimporter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code market-data} section from application.yml.
 * Keys are optional; a missing key makes the matching provider report "unavailable".
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market-data")
public class MarketDataProperties {

    private AlphaVantage alphaVantage = new AlphaVantage();

    private Coinranking coinranking = new Coinranking();

    @Getter
    @Setter
    public static class AlphaVantage {
        private String apiKey;
        private String endpoint = "https://www.alphavantage.co/query";
    }

    @Getter
    @Setter
    public static class Coinranking {
        private String apiKey;
        /** RapidAPI host header; also used to build the base URL. */
        private String host = "coinranking1.p.rapidapi.com";
    }
}
