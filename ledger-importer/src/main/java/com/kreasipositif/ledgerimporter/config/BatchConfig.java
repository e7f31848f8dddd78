package com.kreasipositif.ledgerimporter.config;

import com.kreasipositif.ledgerimporter.batch.WorkbookImportTasklet;
import com.kreasipositif.ledgerimporter.batch.WorkbookImporter;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;

/**
 * Spring Batch configuration for the workbook import.
 *
 * <pre>
 *  workbookImportJob ─► importStep (tasklet, one transaction)
 *                            │
 *                            └── WorkbookImportTasklet
 *                                    ├── WorkbookImporter   (read → classify → normalise)
 *                                    └── LedgerRepository   (upsert by transaction id)
 * </pre>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    public static final String WORKBOOK_FILE_PARAM = "workbookFile";
    public static final String SHEET_NAMES_PARAM = "sheetNames";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ImporterProperties importerProperties;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job workbookImportJob(Step importStep) {
        return new JobBuilder("workbookImportJob", jobRepository)
                .start(importStep)
                .build();
    }

    @Bean
    public Step importStep(WorkbookImportTasklet workbookImportTasklet) {
        return new StepBuilder("importStep", jobRepository)
                .tasklet(workbookImportTasklet, transactionManager)
                .build();
    }

    /**
     * Step-scoped so each run resolves its own workbook and sheet list from the job parameters,
     * falling back to {@code importer.*} when a parameter is absent.
     */
    @Bean
    @StepScope
    public WorkbookImportTasklet workbookImportTasklet(
            WorkbookImporter workbookImporter,
            LedgerRepository ledgerRepository,
            ResourceLoader resourceLoader,
            @Value("#{jobParameters['" + WORKBOOK_FILE_PARAM + "']}") String workbookFile,
            @Value("#{jobParameters['" + SHEET_NAMES_PARAM + "']}") String sheetNames) {

        String file = workbookFile == null || workbookFile.isBlank()
                ? importerProperties.getWorkbookFile()
                : workbookFile;
        List<String> sheets = sheetNames == null
                ? List.copyOf(importerProperties.getDefaultSheets())
                : WorkbookImportTasklet.parseSheetNames(sheetNames);
        return new WorkbookImportTasklet(workbookImporter, ledgerRepository, resourceLoader, file, sheets);
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher} for the REST trigger.
     *
     * <p>{@code run(...)} returns immediately with {@code BatchStatus.STARTING}; callers poll
     * {@code GET /api/v1/imports/status/{id}} to follow the run.
     */
    @Bean("asyncJobLauncher")
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("job-launcher-"));
        launcher.afterPropertiesSet();
        log.info("Async job launcher ready");
        return launcher;
    }
}
