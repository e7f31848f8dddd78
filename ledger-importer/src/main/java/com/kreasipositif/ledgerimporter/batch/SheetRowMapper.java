package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps one sheet row, exposed as a {@link FieldSet} named after the header row, to a
 * {@link RawTransactionRecord}.
 *
 * <p>Columns the sheet does not have are read as blank. Columns the mapper does not know
 * still end up in {@link RawTransactionRecord#getRawPayload()}.
 *
 * <p>Not a singleton: each instance carries the sheet name and the id generator of one
 * extraction pass.
 */
public class SheetRowMapper implements FieldSetMapper<RawTransactionRecord> {

    public static final String ACCOUNT_ID = "account_id";
    public static final String ACCOUNT_NAME = "account_name";
    public static final String ACCOUNT_HOLDER = "account_holder";
    public static final String TRANSACTION_DATE = "transac_date";
    public static final String TRANSACTION_TIME = "transac_hour";
    public static final String ACCOUNTING_DATE = "accounting_date";
    public static final String AMOUNT_CHF = "amount_chf";
    public static final String DEBIT = "debit";
    public static final String CREDIT = "credit";
    public static final String BALANCE = "balance";
    public static final String CURRENCY = "transac_currency";
    public static final String FX_RATE = "rate";
    public static final String DESCRIPTION_1 = "descr_1";
    public static final String DESCRIPTION_2 = "descr_2";
    public static final String DESCRIPTION_3 = "descr_3";
    public static final String TRANSACTION_NUMBER = "transac_nbr";
    public static final String CATEGORY = "category";
    public static final String SUB_CATEGORY = "sub_category";
    public static final String MICRO_CATEGORY = "micro_category";

    static final String DEFAULT_CURRENCY = "CHF";

    private final String sheetName;
    private final RecordIdentityGenerator identityGenerator;

    public SheetRowMapper(String sheetName, RecordIdentityGenerator identityGenerator) {
        this.sheetName = sheetName;
        this.identityGenerator = identityGenerator;
    }

    @Override
    public RawTransactionRecord mapFieldSet(FieldSet fieldSet) {
        Map<String, String> payload = new LinkedHashMap<>();
        String[] names = fieldSet.getNames();
        for (int i = 0; i < names.length; i++) {
            String raw = fieldSet.readRawString(i);
            payload.put(names[i], raw != null ? raw : "");
        }

        String currency = FieldParsers.clean(payload.get(CURRENCY));

        return RawTransactionRecord.builder()
                .id(identityGenerator.nextId(sheetName, payload))
                .sheetName(sheetName)
                .accountId(text(payload, ACCOUNT_ID))
                .accountName(text(payload, ACCOUNT_NAME))
                .accountHolder(text(payload, ACCOUNT_HOLDER))
                .transactionDate(FieldParsers.parseDate(payload.get(TRANSACTION_DATE)))
                .transactionTime(text(payload, TRANSACTION_TIME))
                .accountingDate(FieldParsers.parseDate(payload.get(ACCOUNTING_DATE)))
                .currency(currency.isEmpty() ? DEFAULT_CURRENCY : currency.toUpperCase(Locale.ROOT))
                .amountChf(FieldParsers.parseDecimal(payload.get(AMOUNT_CHF)))
                .debit(FieldParsers.parseDecimal(payload.get(DEBIT)))
                .credit(FieldParsers.parseDecimal(payload.get(CREDIT)))
                .balance(FieldParsers.parseDecimal(payload.get(BALANCE)))
                .fxRate(FieldParsers.parseDecimal(payload.get(FX_RATE)))
                .description(FieldParsers.collapseDescription(
                        payload.get(DESCRIPTION_1), payload.get(DESCRIPTION_2), payload.get(DESCRIPTION_3)))
                .transactionNumber(text(payload, TRANSACTION_NUMBER))
                .category(text(payload, CATEGORY))
                .subCategory(text(payload, SUB_CATEGORY))
                .microCategory(text(payload, MICRO_CATEGORY))
                .rawPayload(Collections.unmodifiableMap(payload))
                .build();
    }

    private static String text(Map<String, String> payload, String column) {
        return FieldParsers.clean(payload.get(column));
    }
}
