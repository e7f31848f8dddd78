package com.kreasipositif.ledgerimporter.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * One data row of a workbook sheet, typed but not yet interpreted.
 *
 * <p>Column mapping (sheet header → field):
 * <pre>
 *   account_id, account_name, account_holder    → account identity
 *   transac_date, transac_hour, accounting_date → dates / time of day
 *   amount_chf, debit, credit, balance          → CHF amounts
 *   transac_currency, rate                      → currency / FX rate used on the row
 *   descr_1, descr_2, descr_3                   → description (collapsed)
 *   transac_nbr                                 → transaction reference number
 *   category, sub_category, micro_category      → category hierarchy
 * </pre>
 *
 * <p>{@link #rawPayload} holds every original column as read, blanks included as empty
 * strings. It is the audit trail and is never transformed.
 */
@Value
@Builder
public class RawTransactionRecord {

    /** Upsert key, assigned at extraction time. */
    String id;

    String sheetName;

    String accountId;

    String accountName;

    String accountHolder;

    LocalDate transactionDate;

    /** Free-text time of day as found in the sheet. */
    String transactionTime;

    LocalDate accountingDate;

    /** ISO 4217 code; defaults to CHF when the cell is blank. */
    String currency;

    BigDecimal amountChf;

    BigDecimal debit;

    BigDecimal credit;

    BigDecimal balance;

    BigDecimal fxRate;

    String description;

    String transactionNumber;

    String category;

    String subCategory;

    String microCategory;

    Map<String, String> rawPayload;

    /**
     * Cash impact of the row in CHF: the explicit CHF amount when present, otherwise
     * {@code credit - debit} with absent values counted as zero.
     */
    public BigDecimal signedAmount() {
        if (amountChf != null) {
            return amountChf;
        }
        return orZero(credit).subtract(orZero(debit));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
