package com.kreasipositif.ledgerimporter.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kreasipositif.ledgerimporter.domain.CashTotal;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.Quote;
import com.kreasipositif.ledgerimporter.domain.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link LedgerRepository} on plain JDBC. Upserts use H2's {@code MERGE INTO … KEY (…)}, which
 * updates the row matching the key columns or inserts a new one.
 *
 * <p>Tables are created by {@code schema.sql}.
 */
@Slf4j
@Repository
public class JdbcLedgerRepository implements LedgerRepository {

    private static final TypeReference<LinkedHashMap<String, String>> PAYLOAD_TYPE = new TypeReference<>() {};

    private static final String UPSERT_TRANSACTION = """
            MERGE INTO transactions (
                id, sheet_name, account_id, account_name, account_holder,
                transaction_date, transaction_time, accounting_date,
                transaction_currency, amount_chf, amount_native, fx_rate,
                debit, credit, balance, description, transaction_number,
                category, sub_category, micro_category, inferred_type,
                inferred_counterparty, notes, raw_payload, created_at)
            KEY (id)
            VALUES (
                :id, :sheetName, :accountId, :accountName, :accountHolder,
                :transactionDate, :transactionTime, :accountingDate,
                :currency, :amountChf, :amountNative, :fxRate,
                :debit, :credit, :balance, :description, :transactionNumber,
                :category, :subCategory, :microCategory, :inferredType,
                :inferredCounterparty, :notes, :rawPayload, :createdAt)
            """;

    private static final String SELECT_TRANSACTIONS = """
            SELECT * FROM transactions
            ORDER BY transaction_date DESC NULLS LAST, accounting_date DESC NULLS LAST, created_at DESC
            LIMIT :limit
            """;

    private static final String UPSERT_FX_RATE = """
            MERGE INTO fx_rates (base, quote, valuation_date, rate, source)
            KEY (base, quote, valuation_date, source)
            VALUES (:base, :quote, :valuationDate, :rate, :source)
            """;

    private static final String SELECT_LATEST_FX_RATE = """
            SELECT rate FROM fx_rates
            WHERE base = :base AND quote = :quote
            ORDER BY valuation_date DESC, id DESC
            LIMIT 1
            """;

    private static final String UPSERT_QUOTE = """
            MERGE INTO quotes (symbol, valuation_date, price, currency, source)
            KEY (symbol, valuation_date, source)
            VALUES (:symbol, :valuationDate, :price, :currency, :source)
            """;

    private static final String SELECT_LATEST_QUOTE = """
            SELECT symbol, valuation_date, price, currency, source FROM quotes
            WHERE symbol = :symbol
            ORDER BY valuation_date DESC, id DESC
            LIMIT 1
            """;

    private static final String UPSERT_SETTING = """
            MERGE INTO settings (setting_key, setting_value)
            KEY (setting_key)
            VALUES (:key, :value)
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcLedgerRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    // ─── transactions ────────────────────────────────────────────────────────

    @Override
    public void upsertTransactions(Collection<NormalisedTransaction> transactions,
                                   Map<String, Map<String, String>> rawLookup) {
        if (transactions.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = transactions.stream()
                .map(tx -> transactionParameters(tx, rawLookup.getOrDefault(tx.getId(), Map.of())))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_TRANSACTION, batch);
        log.info("Upserted {} transactions", batch.length);
    }

    @Override
    public List<NormalisedTransaction> listTransactions(int limit) {
        return jdbc.query(SELECT_TRANSACTIONS, Map.of("limit", limit), transactionRowMapper());
    }

    @Override
    public Optional<Map<String, String>> findRawPayload(String transactionId) {
        List<String> payloads = jdbc.queryForList(
                "SELECT raw_payload FROM transactions WHERE id = :id", Map.of("id", transactionId), String.class);
        return payloads.stream().findFirst().map(this::readPayload);
    }

    @Override
    public long countTransactions() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM transactions", Map.of(), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public CashTotal totalChf() {
        CashTotal total = jdbc.queryForObject("""
                        SELECT COALESCE(SUM(amount_chf), 0) AS total_chf, COUNT(*) AS transaction_count
                        FROM transactions
                        """,
                Map.of(),
                (rs, rowNum) -> new CashTotal(rs.getBigDecimal("total_chf"), rs.getLong("transaction_count")));
        return total != null ? total : CashTotal.empty();
    }

    // ─── FX rates & quotes ───────────────────────────────────────────────────

    @Override
    public void upsertFxRates(Collection<FxRate> rates) {
        SqlParameterSource[] batch = rates.stream()
                .map(rate -> new MapSqlParameterSource()
                        .addValue("base", upper(rate.base()))
                        .addValue("quote", upper(rate.quote()))
                        .addValue("valuationDate", rate.valuationDate())
                        .addValue("rate", rate.rate())
                        .addValue("source", rate.source()))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_FX_RATE, batch);
    }

    @Override
    public Optional<BigDecimal> findLatestFxRate(String base, String quote) {
        List<BigDecimal> rates = jdbc.queryForList(SELECT_LATEST_FX_RATE,
                Map.of("base", upper(base), "quote", upper(quote)), BigDecimal.class);
        return rates.stream().findFirst();
    }

    @Override
    public void saveQuotes(Collection<Quote> quotes) {
        SqlParameterSource[] batch = quotes.stream()
                .map(quote -> new MapSqlParameterSource()
                        .addValue("symbol", upper(quote.symbol()))
                        .addValue("valuationDate", quote.valuationDate())
                        .addValue("price", quote.price())
                        .addValue("currency", upper(quote.currency()))
                        .addValue("source", quote.source()))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_QUOTE, batch);
    }

    @Override
    public Optional<Quote> findLatestQuote(String symbol) {
        List<Quote> quotes = jdbc.query(SELECT_LATEST_QUOTE, Map.of("symbol", upper(symbol)),
                (rs, rowNum) -> new Quote(
                        rs.getString("symbol"),
                        rs.getObject("valuation_date", LocalDate.class),
                        rs.getBigDecimal("price"),
                        rs.getString("currency"),
                        rs.getString("source")));
        return quotes.stream().findFirst();
    }

    // ─── settings ────────────────────────────────────────────────────────────

    @Override
    public Optional<String> findSetting(String key) {
        List<String> values = jdbc.queryForList(
                "SELECT setting_value FROM settings WHERE setting_key = :key", Map.of("key", key), String.class);
        return values.stream().findFirst();
    }

    @Override
    public void saveSetting(String key, String value) {
        jdbc.update(UPSERT_SETTING, Map.of("key", key, "value", value));
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private MapSqlParameterSource transactionParameters(NormalisedTransaction tx, Map<String, String> payload) {
        return new MapSqlParameterSource()
                .addValue("id", tx.getId())
                .addValue("sheetName", tx.getSheetName())
                .addValue("accountId", tx.getAccountId())
                .addValue("accountName", tx.getAccountName())
                .addValue("accountHolder", tx.getAccountHolder())
                .addValue("transactionDate", tx.getTransactionDate())
                .addValue("transactionTime", tx.getTransactionTime())
                .addValue("accountingDate", tx.getAccountingDate())
                .addValue("currency", tx.getCurrency())
                .addValue("amountChf", tx.getAmountChf())
                .addValue("amountNative", tx.getAmountNative())
                .addValue("fxRate", tx.getFxRate())
                .addValue("debit", tx.getDebit())
                .addValue("credit", tx.getCredit())
                .addValue("balance", tx.getBalance())
                .addValue("description", tx.getDescription())
                .addValue("transactionNumber", tx.getTransactionNumber())
                .addValue("category", tx.getCategory())
                .addValue("subCategory", tx.getSubCategory())
                .addValue("microCategory", tx.getMicroCategory())
                .addValue("inferredType", tx.getInferredType() != null ? tx.getInferredType().name() : null)
                .addValue("inferredCounterparty", tx.getInferredCounterparty())
                .addValue("notes", tx.getNotes())
                .addValue("rawPayload", writePayload(payload))
                .addValue("createdAt", tx.getCreatedAt());
    }

    private RowMapper<NormalisedTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            String type = rs.getString("inferred_type");
            return NormalisedTransaction.builder()
                    .id(rs.getString("id"))
                    .sheetName(rs.getString("sheet_name"))
                    .accountId(rs.getString("account_id"))
                    .accountName(rs.getString("account_name"))
                    .accountHolder(rs.getString("account_holder"))
                    .transactionDate(rs.getObject("transaction_date", LocalDate.class))
                    .transactionTime(rs.getString("transaction_time"))
                    .accountingDate(rs.getObject("accounting_date", LocalDate.class))
                    .currency(rs.getString("transaction_currency"))
                    .amountChf(rs.getBigDecimal("amount_chf"))
                    .amountNative(rs.getBigDecimal("amount_native"))
                    .fxRate(rs.getBigDecimal("fx_rate"))
                    .debit(rs.getBigDecimal("debit"))
                    .credit(rs.getBigDecimal("credit"))
                    .balance(rs.getBigDecimal("balance"))
                    .description(rs.getString("description"))
                    .transactionNumber(rs.getString("transaction_number"))
                    .category(rs.getString("category"))
                    .subCategory(rs.getString("sub_category"))
                    .microCategory(rs.getString("micro_category"))
                    .inferredType(type != null ? TransactionType.valueOf(type) : null)
                    .inferredCounterparty(rs.getString("inferred_counterparty"))
                    .notes(rs.getString("notes"))
                    .createdAt(rs.getObject("created_at", LocalDateTime.class))
                    .build();
        };
    }

    private String writePayload(Map<String, String> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise raw payload", e);
        }
    }

    private Map<String, String> readPayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored raw payload is not valid JSON", e);
        }
    }

    private static String upper(String value) {
        return value != null ? value.toUpperCase(Locale.ROOT) : null;
    }
}
