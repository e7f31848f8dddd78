package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.ImportResult;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives extraction → classification → normalisation over the requested sheets of a workbook.
 *
 * <p>Sheets are processed in the given order, rows in sheet order. Any structural fault
 * (unreadable workbook, missing sheet) aborts the whole call with a
 * {@link WorkbookImportException}; partial results are never returned. Nothing is persisted here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkbookImporter {

    private final WorkbookSheetItemReaderFactory readerFactory;
    private final TransactionItemProcessor itemProcessor;

    public ImportResult load(Resource workbook, List<String> sheetNames) {
        List<NormalisedTransaction> transactions = new ArrayList<>();
        Map<String, Map<String, String>> rawLookup = new LinkedHashMap<>();

        for (String sheetName : sheetNames) {
            int before = transactions.size();
            WorkbookSheetItemReader reader = readerFactory.create(workbook, sheetName);
            open(reader, sheetName);
            try {
                RawTransactionRecord record;
                while ((record = reader.read()) != null) {
                    rawLookup.put(record.getId(), record.getRawPayload());
                    transactions.add(itemProcessor.process(record));
                }
            } catch (WorkbookImportException e) {
                throw e;
            } catch (Exception e) {
                throw new WorkbookImportException(
                        "Failed reading sheet '%s' of %s".formatted(sheetName, workbook.getDescription()), e);
            } finally {
                reader.close();
            }
            log.info("Sheet '{}': {} records normalised", sheetName, transactions.size() - before);
        }

        log.info("Workbook {}: {} records from {} sheet(s)",
                workbook.getDescription(), transactions.size(), sheetNames.size());
        return new ImportResult(transactions, rawLookup);
    }

    private static void open(WorkbookSheetItemReader reader, String sheetName) {
        try {
            reader.open(new ExecutionContext());
        } catch (ItemStreamException e) {
            if (e instanceof WorkbookImportException importException) {
                throw importException;
            }
            if (e.getCause() instanceof WorkbookImportException importException) {
                throw importException;
            }
            throw new WorkbookImportException("Cannot open sheet '%s'".formatted(sheetName), e);
        }
    }
}
