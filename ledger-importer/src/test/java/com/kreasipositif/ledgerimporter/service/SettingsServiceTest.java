package com.kreasipositif.ledgerimporter.service;

import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private LedgerRepository ledgerRepository;

    @InjectMocks
    private SettingsService service;

    @Test
    void displayCurrency_defaultsToChf() {
        when(ledgerRepository.findSetting(SettingsService.DISPLAY_CURRENCY_KEY)).thenReturn(Optional.empty());

        assertThat(service.displayCurrency()).isEqualTo("CHF");
    }

    @Test
    void displayCurrency_returnsStoredValue() {
        when(ledgerRepository.findSetting(SettingsService.DISPLAY_CURRENCY_KEY)).thenReturn(Optional.of("EUR"));

        assertThat(service.displayCurrency()).isEqualTo("EUR");
    }

    @Test
    void update_storesUpperCase() {
        assertThat(service.updateDisplayCurrency(" usd ")).isEqualTo("USD");

        verify(ledgerRepository).saveSetting(SettingsService.DISPLAY_CURRENCY_KEY, "USD");
    }

    @Test
    void update_rejectsInvalidCodes() {
        assertThatThrownBy(() -> service.updateDisplayCurrency("EURO"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.updateDisplayCurrency("E1R"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.updateDisplayCurrency(null))
                .isInstanceOf(IllegalArgumentException.class);

        verify(ledgerRepository, never()).saveSetting(anyString(), anyString());
    }
}
