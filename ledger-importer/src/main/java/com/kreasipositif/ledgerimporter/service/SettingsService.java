package com.kreasipositif.ledgerimporter.service;

import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * User preferences stored as key/value settings.
 */
@Service
@RequiredArgsConstructor
public class SettingsService {

    static final String DISPLAY_CURRENCY_KEY = "display_currency";
    static final String DEFAULT_DISPLAY_CURRENCY = "CHF";

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Za-z]{3}");

    private final LedgerRepository ledgerRepository;

    public String displayCurrency() {
        return ledgerRepository.findSetting(DISPLAY_CURRENCY_KEY).orElse(DEFAULT_DISPLAY_CURRENCY);
    }

    /**
     * @throws IllegalArgumentException when {@code currency} is not a three-letter code
     */
    public String updateDisplayCurrency(String currency) {
        String code = requireCurrencyCode(currency);
        ledgerRepository.saveSetting(DISPLAY_CURRENCY_KEY, code);
        return code;
    }

    /**
     * Validates a three-letter currency code and returns it upper-cased.
     */
    public static String requireCurrencyCode(String currency) {
        if (currency == null || !CURRENCY_CODE.matcher(currency.trim()).matches()) {
            throw new IllegalArgumentException("Currency must be a three-letter code, got '" + currency + "'");
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }
}
