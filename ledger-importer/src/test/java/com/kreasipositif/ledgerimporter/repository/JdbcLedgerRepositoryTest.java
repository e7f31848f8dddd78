package com.kreasipositif.ledgerimporter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kreasipositif.ledgerimporter.domain.CashTotal;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.Quote;
import com.kreasipositif.ledgerimporter.domain.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against an embedded H2 initialised from {@code schema.sql}; each test rolls back.
 */
@JdbcTest
class JdbcLedgerRepositoryTest {

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private JdbcLedgerRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcLedgerRepository(jdbc, new ObjectMapper());
    }

    // ─── transactions ────────────────────────────────────────────────────────

    @Test
    @DisplayName("Upserting the same ids twice keeps one row each, with the latest values")
    void upsertTransactions_isIdempotent() {
        NormalisedTransaction first = tx("a", LocalDate.of(2024, 4, 3), "100.00");
        repository.upsertTransactions(List.of(first, tx("b", LocalDate.of(2024, 4, 4), "-40")), Map.of());

        first.setAmountChf(new BigDecimal("120.50"));
        first.setNotes("corrected");
        repository.upsertTransactions(List.of(first), Map.of());

        assertThat(repository.countTransactions()).isEqualTo(2);
        NormalisedTransaction stored = repository.listTransactions(10).stream()
                .filter(t -> t.getId().equals("a"))
                .findFirst()
                .orElseThrow();
        assertThat(stored.getAmountChf()).isEqualByComparingTo("120.50");
        assertThat(stored.getNotes()).isEqualTo("corrected");
        assertThat(stored.getInferredType()).isEqualTo(TransactionType.DEPOSIT);
        assertThat(stored.getTransactionDate()).isEqualTo(LocalDate.of(2024, 4, 3));
    }

    @Test
    void upsertTransactions_emptyBatchIsNoOp() {
        repository.upsertTransactions(List.of(), Map.of());

        assertThat(repository.countTransactions()).isZero();
    }

    @Test
    @DisplayName("Raw payload round-trips with column order preserved; missing entry stored as {}")
    void rawPayload_isStoredVerbatim() {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("transac_nbr", "T-1");
        payload.put("debit", "");
        payload.put("descr_1", "Coop, Lausanne");

        repository.upsertTransactions(
                List.of(tx("a", LocalDate.of(2024, 4, 3), "1"), tx("b", LocalDate.of(2024, 4, 3), "2")),
                Map.of("a", payload));

        assertThat(repository.findRawPayload("a")).hasValueSatisfying(stored ->
                assertThat(stored).containsExactlyEntriesOf(payload));
        assertThat(repository.findRawPayload("b")).hasValueSatisfying(stored -> assertThat(stored).isEmpty());
        assertThat(repository.findRawPayload("missing")).isEmpty();
    }

    @Test
    @DisplayName("Wide text cells and amounts beyond 20 integer digits are stored unchanged")
    void upsertTransactions_wideCells() {
        NormalisedTransaction wide = tx("wide", LocalDate.of(2024, 4, 3), "-1000000000000000000000");
        wide.setCurrency("SWISS FRANC (CHF)");
        wide.setCategory("c".repeat(300));
        wide.setDescription("d".repeat(5000));
        wide.setDebit(new BigDecimal("1E+21"));
        wide.setTransactionNumber("n".repeat(300));
        repository.upsertTransactions(List.of(wide, tx("plain", LocalDate.of(2024, 4, 2), "10")), Map.of());

        NormalisedTransaction stored = repository.listTransactions(10).get(0);
        assertThat(stored.getId()).isEqualTo("wide");
        assertThat(stored.getCurrency()).isEqualTo("SWISS FRANC (CHF)");
        assertThat(stored.getCategory()).hasSize(300);
        assertThat(stored.getDescription()).hasSize(5000);
        assertThat(stored.getTransactionNumber()).hasSize(300);
        assertThat(stored.getDebit()).isEqualByComparingTo("1000000000000000000000");
        assertThat(stored.getAmountChf()).isEqualByComparingTo("-1000000000000000000000");
        assertThat(repository.totalChf().totalChf()).isEqualByComparingTo("-999999999999999999990");
    }

    @Test
    @DisplayName("Most recent first, undated rows last, limit honoured")
    void listTransactions_ordering() {
        repository.upsertTransactions(List.of(
                tx("old", LocalDate.of(2024, 1, 1), "1"),
                tx("undated", null, "1"),
                tx("new", LocalDate.of(2024, 6, 1), "1"),
                tx("mid", LocalDate.of(2024, 3, 1), "1")), Map.of());

        assertThat(repository.listTransactions(10))
                .extracting(NormalisedTransaction::getId)
                .containsExactly("new", "mid", "old", "undated");
        assertThat(repository.listTransactions(2))
                .extracting(NormalisedTransaction::getId)
                .containsExactly("new", "mid");
    }

    @Test
    void totalChf_sumsSignedAmounts() {
        CashTotal empty = repository.totalChf();
        assertThat(empty.totalChf()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(empty.transactionCount()).isZero();

        repository.upsertTransactions(List.of(
                tx("a", LocalDate.of(2024, 4, 3), "120.50"),
                tx("b", LocalDate.of(2024, 4, 4), "-45.00")), Map.of());

        CashTotal total = repository.totalChf();
        assertThat(total.totalChf()).isEqualByComparingTo("75.50");
        assertThat(total.transactionCount()).isEqualTo(2);
    }

    // ─── FX rates & quotes ───────────────────────────────────────────────────

    @Test
    @DisplayName("Latest valuation date wins; same key replaces the stored rate")
    void fxRates_latestAndReplace() {
        repository.upsertFxRates(List.of(
                new FxRate("CHF", "EUR", LocalDate.of(2024, 4, 1), new BigDecimal("1.01"), "alpha_vantage"),
                new FxRate("chf", "eur", LocalDate.of(2024, 4, 2), new BigDecimal("1.02"), "alpha_vantage")));
        assertThat(repository.findLatestFxRate("CHF", "EUR")).hasValueSatisfying(rate ->
                assertThat(rate).isEqualByComparingTo("1.02"));

        repository.upsertFxRates(List.of(
                new FxRate("CHF", "EUR", LocalDate.of(2024, 4, 2), new BigDecimal("1.03"), "alpha_vantage")));

        assertThat(repository.findLatestFxRate("chf", "eur")).hasValueSatisfying(rate ->
                assertThat(rate).isEqualByComparingTo("1.03"));
        assertThat(repository.findLatestFxRate("CHF", "USD")).isEmpty();
    }

    @Test
    void quotes_latestPerSymbol() {
        repository.saveQuotes(List.of(
                new Quote("aapl", LocalDate.of(2024, 4, 1), new BigDecimal("170"), "usd", "alpha_vantage"),
                new Quote("AAPL", LocalDate.of(2024, 4, 2), new BigDecimal("171.5"), "USD", "alpha_vantage")));
        repository.saveQuotes(List.of(
                new Quote("AAPL", LocalDate.of(2024, 4, 2), new BigDecimal("172"), "USD", "alpha_vantage")));

        assertThat(repository.findLatestQuote("aapl")).hasValueSatisfying(quote -> {
            assertThat(quote.symbol()).isEqualTo("AAPL");
            assertThat(quote.price()).isEqualByComparingTo("172");
            assertThat(quote.currency()).isEqualTo("USD");
            assertThat(quote.valuationDate()).isEqualTo(LocalDate.of(2024, 4, 2));
        });
        assertThat(repository.findLatestQuote("MSFT")).isEmpty();
    }

    // ─── settings ────────────────────────────────────────────────────────────

    @Test
    void settings_upsert() {
        assertThat(repository.findSetting("display_currency")).isEmpty();

        repository.saveSetting("display_currency", "EUR");
        repository.saveSetting("display_currency", "USD");

        assertThat(repository.findSetting("display_currency")).contains("USD");
    }

    private static NormalisedTransaction tx(String id, LocalDate date, String amountChf) {
        return NormalisedTransaction.builder()
                .id(id)
                .sheetName("bank")
                .accountId("CH-001")
                .transactionDate(date)
                .accountingDate(date)
                .currency("CHF")
                .amountChf(new BigDecimal(amountChf))
                .inferredType(TransactionType.DEPOSIT)
                .createdAt(LocalDateTime.of(2024, 5, 1, 8, 30))
                .build();
    }
}
