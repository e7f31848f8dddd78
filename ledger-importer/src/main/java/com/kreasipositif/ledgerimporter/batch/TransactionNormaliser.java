package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.ClassificationResult;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Combines a {@link RawTransactionRecord} and its {@link ClassificationResult} into the
 * canonical {@link NormalisedTransaction}.
 *
 * <p>The native amount is only derived for non-CHF rows carrying a non-zero FX rate; a zero
 * rate leaves it empty. {@code createdAt} is the time of normalisation, not a source field.
 */
@Component
public class TransactionNormaliser {

    static final int NATIVE_AMOUNT_SCALE = 10;

    private final Clock clock;

    public TransactionNormaliser() {
        this(Clock.systemUTC());
    }

    public TransactionNormaliser(Clock clock) {
        this.clock = clock;
    }

    public NormalisedTransaction normalise(RawTransactionRecord record, ClassificationResult classification) {
        String currency = FieldParsers.clean(record.getCurrency()).isEmpty()
                ? SheetRowMapper.DEFAULT_CURRENCY
                : record.getCurrency().trim().toUpperCase(Locale.ROOT);
        BigDecimal signedAmount = record.signedAmount();

        return NormalisedTransaction.builder()
                .id(record.getId())
                .sheetName(record.getSheetName())
                .accountId(record.getAccountId())
                .accountName(record.getAccountName())
                .accountHolder(record.getAccountHolder())
                .transactionDate(record.getTransactionDate())
                .transactionTime(record.getTransactionTime())
                .accountingDate(record.getAccountingDate())
                .currency(currency)
                .amountChf(signedAmount)
                .amountNative(nativeAmount(currency, signedAmount, record.getFxRate()))
                .fxRate(record.getFxRate())
                .debit(record.getDebit())
                .credit(record.getCredit())
                .balance(record.getBalance())
                .description(record.getDescription())
                .transactionNumber(record.getTransactionNumber())
                .category(record.getCategory())
                .subCategory(record.getSubCategory())
                .microCategory(record.getMicroCategory())
                .inferredType(classification.type())
                .inferredCounterparty(classification.counterparty())
                .notes(classification.note())
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private static BigDecimal nativeAmount(String currency, BigDecimal signedAmount, BigDecimal fxRate) {
        if (SheetRowMapper.DEFAULT_CURRENCY.equals(currency) || fxRate == null) {
            return null;
        }
        try {
            BigDecimal amount = signedAmount.divide(fxRate, NATIVE_AMOUNT_SCALE, RoundingMode.HALF_EVEN)
                    .stripTrailingZeros();
            return amount.scale() < 0 ? amount.setScale(0) : amount;
        } catch (ArithmeticException e) {
            // zero rate
            return null;
        }
    }
}
