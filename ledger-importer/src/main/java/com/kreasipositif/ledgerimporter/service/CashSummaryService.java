package com.kreasipositif.ledgerimporter.service;

import com.kreasipositif.ledgerimporter.domain.CashSummary;
import com.kreasipositif.ledgerimporter.domain.CashTotal;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregates stored transactions into a cash position and converts it for display.
 *
 * <p>Conversion uses the most recent stored CHF → display-currency rate. A missing rate never
 * fails the query: the CHF total is returned under the requested label with
 * {@link CashSummary#isFxMissing()} set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CashSummaryService {

    static final String BASE_CURRENCY = "CHF";

    private final LedgerRepository ledgerRepository;

    public CashSummary cashSummary(String displayCurrency) {
        String currency = displayCurrency == null || displayCurrency.isBlank()
                ? BASE_CURRENCY
                : displayCurrency.trim().toUpperCase(Locale.ROOT);
        CashTotal total = ledgerRepository.totalChf();

        CashSummary.CashSummaryBuilder summary = CashSummary.builder()
                .totalChf(total.totalChf())
                .transactionCount(total.transactionCount())
                .displayCurrency(currency);

        if (BASE_CURRENCY.equals(currency)) {
            return summary.displayTotal(total.totalChf()).fxMissing(false).build();
        }

        Optional<BigDecimal> rate = ledgerRepository.findLatestFxRate(BASE_CURRENCY, currency);
        if (rate.isEmpty()) {
            log.warn("No stored {} → {} rate; reporting unconverted total", BASE_CURRENCY, currency);
            return summary.displayTotal(total.totalChf()).fxMissing(true).build();
        }

        return summary
                .displayTotal(total.totalChf().multiply(rate.get()))
                .fxMissing(false)
                .fxRate(rate.get())
                .build();
    }
}
