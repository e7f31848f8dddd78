package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.config.ImporterProperties;
import com.kreasipositif.ledgerimporter.domain.ClassificationResult;
import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import com.kreasipositif.ledgerimporter.domain.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Infers the economic nature of a row with an ordered rule chain; the first matching rule wins.
 *
 * <ol>
 *   <li><b>Fee</b>: description or category contains a fee keyword. Checked first because the
 *       amount alone would make a fee look like a withdrawal.</li>
 *   <li><b>Inflow</b>: credit &gt; 0 and no debit → DEPOSIT.</li>
 *   <li><b>Outflow</b>: debit &gt; 0 and no credit → WITHDRAWAL.</li>
 *   <li><b>Fallback</b>: UNKNOWN with an explanatory note.</li>
 * </ol>
 *
 * <p>Counterparties are a heuristic (the description up to its first comma) and only advisory.
 */
@Slf4j
@Component
public class TransactionClassifier {

    static final String DIRECTION_UNKNOWN_NOTE = "direction could not be inferred";

    private static final ClassificationResult FALLBACK =
            new ClassificationResult(TransactionType.UNKNOWN, null, DIRECTION_UNKNOWN_NOTE);

    private final List<String> feeKeywords;
    private final List<Rule> rules;

    public TransactionClassifier(ImporterProperties importerProperties) {
        this.feeKeywords = importerProperties.getFeeKeywords().stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
        this.rules = List.of(
                new Rule("fee", this::isFee,
                        r -> ClassificationResult.of(TransactionType.FEE, FieldParsers.emptyToNull(r.getAccountName()))),
                new Rule("inflow", TransactionClassifier::isInflow,
                        r -> ClassificationResult.of(TransactionType.DEPOSIT, extractCounterparty(r.getDescription()))),
                new Rule("outflow", TransactionClassifier::isOutflow,
                        r -> ClassificationResult.of(TransactionType.WITHDRAWAL, extractCounterparty(r.getDescription()))));
    }

    public ClassificationResult classify(RawTransactionRecord record) {
        for (Rule rule : rules) {
            if (rule.matches().test(record)) {
                log.debug("Record {} matched rule '{}'", record.getId(), rule.name());
                return rule.outcome().apply(record);
            }
        }
        return FALLBACK;
    }

    /**
     * Description up to the first comma, trimmed; {@code null} when that is empty.
     */
    static String extractCounterparty(String description) {
        if (description == null || description.isEmpty()) {
            return null;
        }
        return FieldParsers.emptyToNull(description.split(",", 2)[0]);
    }

    // ─── rules ───────────────────────────────────────────────────────────────

    private boolean isFee(RawTransactionRecord record) {
        String description = FieldParsers.clean(record.getDescription()).toLowerCase(Locale.ROOT);
        String category = FieldParsers.clean(record.getCategory()).toLowerCase(Locale.ROOT);
        return feeKeywords.stream()
                .anyMatch(keyword -> description.contains(keyword) || category.contains(keyword));
    }

    private static boolean isInflow(RawTransactionRecord record) {
        return positive(record.getCredit()) && zero(record.getDebit());
    }

    private static boolean isOutflow(RawTransactionRecord record) {
        return positive(record.getDebit()) && zero(record.getCredit());
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static boolean zero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    private record Rule(String name,
                        Predicate<RawTransactionRecord> matches,
                        Function<RawTransactionRecord, ClassificationResult> outcome) {}
}
