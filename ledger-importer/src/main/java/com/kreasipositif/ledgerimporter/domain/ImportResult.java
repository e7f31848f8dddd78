package com.kreasipositif.ledgerimporter.domain;

import java.util.List;
import java.util.Map;

/**
 * Output of one workbook import: normalised transactions in sheet/row order plus the
 * verbatim source payload of each, keyed by transaction id.
 */
public record ImportResult(List<NormalisedTransaction> transactions, Map<String, Map<String, String>> rawLookup) {

    public int size() {
        return transactions.size();
    }
}
