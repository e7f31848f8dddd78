package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.ClassificationResult;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import com.kreasipositif.ledgerimporter.domain.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.stereotype.Component;

/**
 * Classifies a {@link RawTransactionRecord} and normalises it.
 *
 * <p>Never filters: every record comes out as a {@link NormalisedTransaction}. Rows whose
 * direction cannot be inferred are kept as {@link TransactionType#UNKNOWN} with a note.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionItemProcessor implements ItemProcessor<RawTransactionRecord, NormalisedTransaction> {

    private final TransactionClassifier classifier;
    private final TransactionNormaliser normaliser;

    @Override
    public NormalisedTransaction process(RawTransactionRecord record) {
        ClassificationResult classification = classifier.classify(record);
        if (classification.type() == TransactionType.UNKNOWN) {
            log.debug("Record {} ({}) UNKNOWN: {}", record.getId(), record.getSheetName(), classification.note());
        }
        return normaliser.normalise(record, classification);
    }
}
