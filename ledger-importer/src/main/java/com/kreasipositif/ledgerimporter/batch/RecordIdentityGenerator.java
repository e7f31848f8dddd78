package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.config.ImporterProperties.IdentityStrategy;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Assigns the upsert key of each extracted row.
 *
 * <p>With {@link IdentityStrategy#CONTENT_HASH} the id is a name-based UUID over the stable
 * source fields (sheet, account id, transaction date, reference number, raw amount cells) and
 * the number of identical rows already seen in this pass, so an unchanged workbook maps to the
 * same ids on every import. Rows with none of those discriminators fall back to a random id.
 *
 * <p>Instances keep per-pass state; use one per sheet extraction.
 */
public class RecordIdentityGenerator {

    static final List<String> AMOUNT_COLUMNS = List.of(
            SheetRowMapper.AMOUNT_CHF, SheetRowMapper.DEBIT, SheetRowMapper.CREDIT);

    private final IdentityStrategy strategy;
    private final Map<String, Integer> occurrences = new HashMap<>();

    public RecordIdentityGenerator(IdentityStrategy strategy) {
        this.strategy = strategy;
    }

    public String nextId(String sheetName, Map<String, String> payload) {
        if (strategy == IdentityStrategy.RANDOM) {
            return UUID.randomUUID().toString();
        }

        String accountId = FieldParsers.clean(payload.get(SheetRowMapper.ACCOUNT_ID));
        String transactionDate = FieldParsers.clean(payload.get(SheetRowMapper.TRANSACTION_DATE));
        String reference = FieldParsers.clean(payload.get(SheetRowMapper.TRANSACTION_NUMBER));
        List<String> amounts = AMOUNT_COLUMNS.stream()
                .map(column -> FieldParsers.clean(payload.get(column)))
                .toList();

        boolean noDiscriminator = Stream.concat(Stream.of(accountId, transactionDate, reference), amounts.stream())
                .allMatch(String::isEmpty);
        if (noDiscriminator) {
            return UUID.randomUUID().toString();
        }

        String key = String.join("\u001F", sheetName, accountId, transactionDate, reference,
                String.join("\u001F", amounts));
        int occurrence = occurrences.merge(key, 1, Integer::sum) - 1;
        return UUID.nameUUIDFromBytes((key + "\u001E" + occurrence).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
