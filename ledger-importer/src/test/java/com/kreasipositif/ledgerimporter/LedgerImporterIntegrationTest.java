package com.kreasipositif.ledgerimporter;

import com.kreasipositif.ledgerimporter.batch.WorkbookImportTasklet;
import com.kreasipositif.ledgerimporter.client.MarketDataClient;
import com.kreasipositif.ledgerimporter.config.BatchConfig;
import com.kreasipositif.ledgerimporter.domain.CashSummary;
import com.kreasipositif.ledgerimporter.domain.FxRate;
import com.kreasipositif.ledgerimporter.domain.NormalisedTransaction;
import com.kreasipositif.ledgerimporter.domain.TransactionType;
import com.kreasipositif.ledgerimporter.repository.LedgerRepository;
import com.kreasipositif.ledgerimporter.service.CashSummaryService;
import com.kreasipositif.ledgerimporter.service.MarketDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.JobRepositoryTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.kreasipositif.ledgerimporter.batch.WorkbookFixtures.BANK_HEADER;
import static com.kreasipositif.ledgerimporter.batch.WorkbookFixtures.bankRow;
import static com.kreasipositif.ledgerimporter.batch.WorkbookFixtures.workbook;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end: workbook on disk → {@code workbookImportJob} → H2 → summary and REST.
 *
 * <h3>Fixture workbook</h3>
 * <ul>
 *   <li>{@code crypto_transac}: deposit 500, network fee 1.50, unknown-direction transfer</li>
 *   <li>{@code stocks_transac}: USD purchase of 90 CHF at rate 0.90</li>
 * </ul>
 */
@SpringBatchTest
@SpringBootTest
@AutoConfigureMockMvc
class LedgerImporterIntegrationTest {

    /**
     * Synchronous launcher so that {@link JobLauncherTestUtils#launchJob} returns a finished execution.
     */
    @TestConfiguration
    static class SyncJobLauncherConfig {
        @Bean
        @Primary
        public JobLauncher syncJobLauncher(JobRepository jobRepository) throws Exception {
            TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
            launcher.setJobRepository(jobRepository);
            launcher.setTaskExecutor(new SyncTaskExecutor());
            launcher.afterPropertiesSet();
            return launcher;
        }
    }

    @TempDir
    Path tempDir;

    @Autowired private JobLauncherTestUtils jobLauncherTestUtils;
    @Autowired private JobRepositoryTestUtils jobRepositoryTestUtils;
    @Autowired private JdbcTemplate jdbcTemplate;
    @Autowired private LedgerRepository ledgerRepository;
    @Autowired private CashSummaryService cashSummaryService;
    @Autowired private MarketDataService marketDataService;
    @Autowired private MockMvc mockMvc;

    @MockitoBean private MarketDataClient marketDataClient;

    private String workbookUri;

    @BeforeEach
    void setUp() throws Exception {
        jobRepositoryTestUtils.removeJobExecutions();
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM fx_rates");

        Path file = workbook()
                .sheet("crypto_transac", BANK_HEADER, List.of(
                        bankRow("CR-1", LocalDate.of(2024, 4, 3), "CHF", null, 500, null,
                                "Kraken, payout", "C-1", null),
                        bankRow("CR-1", LocalDate.of(2024, 4, 4), "CHF", 1.5, null, null,
                                "Network fee", "C-2", null),
                        bankRow("CR-1", LocalDate.of(2024, 4, 5), "CHF", 10, 10, null,
                                "Internal transfer", "C-3", null)))
                .sheet("stocks_transac", BANK_HEADER, List.of(
                        bankRow("ST-9", LocalDate.of(2024, 4, 6), "USD", 90, null, 0.9,
                                "Broker, buy AAPL", "S-1", null)))
                .writeTo(tempDir.resolve("transactions_v3.xlsx"));
        workbookUri = file.toUri().toString();
    }

    @Test
    @DisplayName("Job COMPLETED: all rows of both sheets stored with their classification")
    void job_importsAllSheets() throws Exception {
        JobExecution execution = jobLauncherTestUtils.launchJob(jobParameters("crypto_transac,stocks_transac"));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExecutionContext().getInt(WorkbookImportTasklet.IMPORTED_COUNT_KEY)).isEqualTo(4);
        assertThat(execution.getStepExecutions()).singleElement().satisfies(step -> {
            assertThat(step.getReadCount()).isEqualTo(4);
            assertThat(step.getWriteCount()).isEqualTo(4);
        });

        assertThat(ledgerRepository.countTransactions()).isEqualTo(4);
        assertThat(ledgerRepository.listTransactions(10))
                .extracting(NormalisedTransaction::getTransactionNumber, NormalisedTransaction::getInferredType)
                .containsExactly(
                        tuple("S-1", TransactionType.WITHDRAWAL),
                        tuple("C-3", TransactionType.UNKNOWN),
                        tuple("C-2", TransactionType.FEE),
                        tuple("C-1", TransactionType.DEPOSIT));
    }

    @Test
    @DisplayName("Importing the same workbook twice does not duplicate rows")
    void job_reimportIsIdempotent() throws Exception {
        assertThat(jobLauncherTestUtils.launchJob(jobParameters("crypto_transac,stocks_transac")).getStatus())
                .isEqualTo(BatchStatus.COMPLETED);
        List<NormalisedTransaction> first = ledgerRepository.listTransactions(10);

        assertThat(jobLauncherTestUtils.launchJob(jobParameters("crypto_transac,stocks_transac")).getStatus())
                .isEqualTo(BatchStatus.COMPLETED);
        List<NormalisedTransaction> second = ledgerRepository.listTransactions(10);

        assertThat(ledgerRepository.countTransactions()).isEqualTo(4);
        assertThat(second)
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("createdAt")
                .containsExactlyElementsOf(first);
    }

    @Test
    @DisplayName("A missing sheet fails the job and stores nothing, not even the good sheet")
    void job_missingSheetStoresNothing() throws Exception {
        JobExecution execution = jobLauncherTestUtils.launchJob(jobParameters("crypto_transac,no_such_sheet"));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(execution.getAllFailureExceptions())
                .anySatisfy(e -> assertThat(e).hasMessageContaining("no_such_sheet"));
        assertThat(ledgerRepository.countTransactions()).isZero();
    }

    @Test
    @DisplayName("Over-wide cells in one row do not fail the import or lose the other rows")
    void job_wideCellsAreStored() throws Exception {
        List<Object> wide = bankRow("CR-2", LocalDate.of(2024, 4, 7), "Swiss franc (CHF)", 1e21, null, null,
                "Whale transfer", "W-1", "x".repeat(300));
        String wideWorkbook = workbook()
                .sheet("crypto_transac", BANK_HEADER, List.of(
                        bankRow("CR-1", LocalDate.of(2024, 4, 3), "CHF", null, 500, null,
                                "Kraken, payout", "C-1", null),
                        wide))
                .writeTo(tempDir.resolve("wide.xlsx"))
                .toUri().toString();

        JobExecution execution = jobLauncherTestUtils.launchJob(jobParameters(wideWorkbook, "crypto_transac"));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(ledgerRepository.countTransactions()).isEqualTo(2);
        assertThat(ledgerRepository.listTransactions(10)).first().satisfies(tx -> {
            assertThat(tx.getTransactionNumber()).isEqualTo("W-1");
            assertThat(tx.getCurrency()).isEqualTo("SWISS FRANC (CHF)");
            assertThat(tx.getCategory()).hasSize(300);
            assertThat(tx.getDebit()).isEqualByComparingTo("1000000000000000000000");
        });
    }

    @Test
    @DisplayName("Summary after import: CHF total, then EUR once a rate is refreshed")
    void summary_afterImport() throws Exception {
        jobLauncherTestUtils.launchJob(jobParameters("crypto_transac,stocks_transac"));

        // 500 - 1.50 + 0 - 90
        CashSummary chf = cashSummaryService.cashSummary("CHF");
        assertThat(chf.getTotalChf()).isEqualByComparingTo("408.50");
        assertThat(chf.getTransactionCount()).isEqualTo(4);

        CashSummary eurWithoutRate = cashSummaryService.cashSummary("EUR");
        assertThat(eurWithoutRate.isFxMissing()).isTrue();
        assertThat(eurWithoutRate.getDisplayTotal()).isEqualByComparingTo("408.50");

        when(marketDataClient.fetchLatestFxRate("CHF", "EUR")).thenReturn(Optional.of(
                new FxRate("CHF", "EUR", LocalDate.now(), new BigDecimal("1.02"), "alpha_vantage")));
        assertThat(marketDataService.refreshFxRate("CHF", "EUR")).isPresent();

        CashSummary eur = cashSummaryService.cashSummary("EUR");
        assertThat(eur.isFxMissing()).isFalse();
        assertThat(eur.getDisplayTotal()).isEqualByComparingTo("416.67");
    }

    @Test
    void statusEndpoint_reportsCompletedRun() throws Exception {
        JobExecution execution = jobLauncherTestUtils.launchJob(jobParameters("stocks_transac"));

        mockMvc.perform(get("/api/v1/imports/status/{id}", execution.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.importedCount").value(1))
                .andExpect(jsonPath("$.readCount").value(1));

        mockMvc.perform(get("/api/v1/imports/status/{id}", 987654L))
                .andExpect(status().isNotFound());
    }

    private JobParameters jobParameters(String sheetNames) {
        return jobParameters(workbookUri, sheetNames);
    }

    private JobParameters jobParameters(String workbook, String sheetNames) {
        return new JobParametersBuilder()
                .addString(BatchConfig.WORKBOOK_FILE_PARAM, workbook)
                .addString(BatchConfig.SHEET_NAMES_PARAM, sheetNames)
                .addLong("startedAt", System.nanoTime())
                .toJobParameters();
    }
}
