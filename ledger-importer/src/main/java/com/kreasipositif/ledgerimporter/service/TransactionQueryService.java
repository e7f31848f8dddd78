package com.kreasipositif.ledgerimporter.service;

import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 1000;

    private final LedgerRepository ledgerRepository;

    /**
     * @throws IllegalArgumentException when {@code limit} is outside 1..{@value #MAX_LIMIT}
     */
    public List<NormalisedTransaction> recentTransactions(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return ledgerRepository.listTransactions(limit);
    }

    public Optional<Map<String, String>> rawPayload(String transactionId) {
        return ledgerRepository.findRawPayload(transactionId);
    }
}
