package com.kreasipositif.ledgerimporter.controller;

import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.Quote;
import com.kreasipositif.ledgerimporter.service.MarketDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Pulls fresh FX rates and quotes from the providers and stores them.
 * A provider that cannot answer yields {@code 503}.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Market Data", description = "Refresh FX rates and asset quotes")
public class MarketDataController {

    private final MarketDataService marketDataService;

    @PostMapping("/fx/refresh")
    @Operation(summary = "Refresh an FX rate",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Rate fetched and stored",
                            content = @Content(schema = @Schema(implementation = FxRate.class))),
                    @ApiResponse(responseCode = "503", description = "Provider unavailable")
            })
    public ResponseEntity<?> refreshFx(
            @Parameter(description = "Base currency", example = "CHF")
            @RequestParam(value = "base", defaultValue = "CHF") String base,
            @Parameter(description = "Quote currency", example = "EUR", required = true)
            @RequestParam("quote") String quote) {
        return orUnavailable(marketDataService.refreshFxRate(base, quote), "FX rate " + base + "/" + quote);
    }

    @PostMapping("/quotes/equity/{symbol}")
    @Operation(summary = "Refresh an equity quote",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Quote fetched and stored",
                            content = @Content(schema = @Schema(implementation = Quote.class))),
                    @ApiResponse(responseCode = "503", description = "Provider unavailable")
            })
    public ResponseEntity<?> refreshEquity(
            @Parameter(name = "symbol", description = "Ticker symbol", example = "NESN.SW", required = true)
            @PathVariable("symbol") String symbol) {
        return orUnavailable(marketDataService.refreshEquityQuote(symbol), "equity quote " + symbol);
    }

    @PostMapping("/quotes/crypto/{uuid}")
    @Operation(summary = "Refresh a crypto quote",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Quote fetched and stored",
                            content = @Content(schema = @Schema(implementation = Quote.class))),
                    @ApiResponse(responseCode = "503", description = "Provider unavailable")
            })
    public ResponseEntity<?> refreshCrypto(
            @Parameter(name = "uuid", description = "Coinranking coin uuid", example = "Qwsogvtv82FCd", required = true)
            @PathVariable("uuid") String uuid) {
        return orUnavailable(marketDataService.refreshCryptoQuote(uuid), "crypto quote " + uuid);
    }

    @GetMapping("/quotes/{symbol}")
    @Operation(summary = "Latest stored quote", description = "Reads the local store only; 404 when never refreshed.")
    public ResponseEntity<Quote> latestQuote(
            @Parameter(name = "symbol", description = "Symbol as stored (case-insensitive)", example = "BTC", required = true)
            @PathVariable("symbol") String symbol) {
        return marketDataService.latestQuote(symbol)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private static ResponseEntity<?> orUnavailable(Optional<?> result, String what) {
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", what + " unavailable"));
    }
}
