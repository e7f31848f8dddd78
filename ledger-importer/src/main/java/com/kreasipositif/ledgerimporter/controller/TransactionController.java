package com.kreasipositif.ledgerimporter.controller;

import com.kreasipositif.ledgerimporter.domain.CashSummary;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.service.CashSummaryService;
import com.kreasipositif.ledgerimporter.service.SettingsService;
import com.kreasipositif.ledgerimporter.service.TransactionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read side of the ledger: recent transactions and the aggregated cash position.
 */
@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Query imported transactions and the cash summary")
public class TransactionController {

    private final TransactionQueryService transactionQueryService;
    private final CashSummaryService cashSummaryService;
    private final SettingsService settingsService;

    @GetMapping("/transactions")
    @Operation(summary = "List recent transactions",
            description = "Most recent first: transaction date, then accounting date, then import time.")
    public ResponseEntity<List<NormalisedTransaction>> listTransactions(
            @Parameter(description = "Maximum rows, 1 to 1000", example = "200")
            @RequestParam(value = "limit", defaultValue = "" + TransactionQueryService.DEFAULT_LIMIT) int limit) {
        return ResponseEntity.ok(transactionQueryService.recentTransactions(limit));
    }

    @GetMapping("/transactions/{id}/raw")
    @Operation(summary = "Original spreadsheet row of a transaction")
    public ResponseEntity<Map<String, String>> rawPayload(
            @Parameter(name = "id", description = "Transaction id", required = true)
            @PathVariable("id") String id) {
        return transactionQueryService.rawPayload(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/summary")
    @Operation(summary = "Cash summary",
            description = "Total CHF cash converted into the display currency with the latest stored rate. "
                    + "`fxMissing` is true when no rate is stored; the CHF total is then returned unconverted. "
                    + "Defaults to the saved display-currency setting.")
    public ResponseEntity<CashSummary> summary(
            @Parameter(description = "Three-letter currency code", example = "EUR")
            @RequestParam(value = "displayCurrency", required = false) String displayCurrency) {
        String currency = displayCurrency == null || displayCurrency.isBlank()
                ? settingsService.displayCurrency()
                : SettingsService.requireCurrencyCode(displayCurrency);
        return ResponseEntity.ok(cashSummaryService.cashSummary(currency));
    }
}
