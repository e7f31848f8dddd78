package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.ImportResult;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.Arrays;
import java.util.List;

/**
 * Imports one workbook and upserts every normalised transaction in a single step transaction.
 *
 * <p>Extraction failures propagate out of {@link #execute}, so the step fails and its
 * transaction rolls back: a run either stores all of its rows or none.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkbookImportTasklet implements Tasklet {

    public static final String IMPORTED_COUNT_KEY = "importedCount";

    private final WorkbookImporter workbookImporter;
    private final LedgerRepository ledgerRepository;
    private final ResourceLoader resourceLoader;
    private final String workbookFile;
    private final List<String> sheetNames;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Resource workbook = resourceLoader.getResource(workbookFile);
        log.info("Importing {} sheet(s) {} from '{}'", sheetNames.size(), sheetNames, workbookFile);

        ImportResult result = workbookImporter.load(workbook, sheetNames);
        for (int i = 0; i < result.size(); i++) {
            contribution.incrementReadCount();
        }

        ledgerRepository.upsertTransactions(result.transactions(), result.rawLookup());
        contribution.incrementWriteCount(result.size());

        chunkContext.getStepContext().getStepExecution().getJobExecution()
                .getExecutionContext().putInt(IMPORTED_COUNT_KEY, result.size());
        log.info("Upserted {} transaction(s) from '{}'; ledger holds {}",
                result.size(), workbookFile, ledgerRepository.countTransactions());
        return RepeatStatus.FINISHED;
    }

    /**
     * Splits a comma-separated sheet list, dropping blanks.
     */
    public static List<String> parseSheetNames(String sheetNames) {
        if (sheetNames == null || sheetNames.isBlank()) {
            return List.of();
        }
        return Arrays.stream(sheetNames.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }
}
