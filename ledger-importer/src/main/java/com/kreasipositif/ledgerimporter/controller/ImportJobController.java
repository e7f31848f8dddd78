package com.kreasipositif.ledgerimporter.controller;

import com.kreasipositif.ledgerimporter.batch.WorkbookImportTasklet;
import com.kreasipositif.ledgerimporter.config.BatchConfig;
import com.kreasipositif.ledgerimporter.config.ImporterProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST API for triggering and monitoring workbook imports.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/imports")
@Tag(name = "Imports", description = "Trigger and monitor workbook import jobs")
public class ImportJobController {

    private final JobLauncher asyncJobLauncher;
    private final Job workbookImportJob;
    private final JobExplorer jobExplorer;
    private final ImporterProperties importerProperties;

    public ImportJobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                               Job workbookImportJob,
                               JobExplorer jobExplorer,
                               ImporterProperties importerProperties) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.workbookImportJob = workbookImportJob;
        this.jobExplorer = jobExplorer;
        this.importerProperties = importerProperties;
    }

    // ─── POST /api/v1/imports/start ───────────────────────────────────────────

    @PostMapping("/start")
    @Operation(
            summary = "Start a workbook import",
            description = "Launches the import job **asynchronously** and returns its `jobExecutionId` "
                    + "with `STARTING` status. Poll `GET /api/v1/imports/status/{jobExecutionId}`. "
                    + "Re-importing the same workbook updates rows in place.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Import accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = ImportStartResponse.class))),
                    @ApiResponse(responseCode = "500", description = "Failed to launch the import",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> startImport(
            @Parameter(description = "Spring resource path of the workbook. Defaults to importer.workbook-file.",
                    example = "file:data/transactions_v3.xlsx")
            @RequestParam(value = "workbookFile", required = false) String workbookFile,
            @Parameter(description = "Comma-separated sheet names. Defaults to importer.default-sheets.",
                    example = "crypto_transac,stocks_transac")
            @RequestParam(value = "sheetNames", required = false) String sheetNames) {

        String resolvedFile = workbookFile != null && !workbookFile.isBlank()
                ? workbookFile
                : importerProperties.getWorkbookFile();
        String resolvedSheets = sheetNames != null && !sheetNames.isBlank()
                ? sheetNames
                : String.join(",", importerProperties.getDefaultSheets());
        log.info("Starting workbookImportJob with workbookFile='{}', sheetNames='{}'", resolvedFile, resolvedSheets);

        try {
            JobParameters params = new JobParametersBuilder()
                    .addString(BatchConfig.WORKBOOK_FILE_PARAM, resolvedFile)
                    .addString(BatchConfig.SHEET_NAMES_PARAM, resolvedSheets)
                    .addLong("startedAt", Instant.now().toEpochMilli())
                    .toJobParameters();

            JobExecution execution = asyncJobLauncher.run(workbookImportJob, params);

            return ResponseEntity.accepted().body(new ImportStartResponse(
                    execution.getId(),
                    execution.getStatus().name(),
                    resolvedFile,
                    WorkbookImportTasklet.parseSheetNames(resolvedSheets)));

        } catch (Exception e) {
            log.error("Failed to start import: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start import: " + e.getMessage()));
        }
    }

    // ─── GET /api/v1/imports/status/{jobExecutionId} ─────────────────────────

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Get import status",
            description = "Returns the status, counts and failure messages of an import run.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Import run found",
                            content = @Content(schema = @Schema(implementation = ImportStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Import run not found")
            })
    public ResponseEntity<ImportStatusResponse> getStatus(
            @Parameter(name = "jobExecutionId", description = "The id returned by /start", required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        LocalDateTime startTime = execution.getStartTime();
        LocalDateTime endTime = execution.getEndTime();
        String elapsed = null;
        if (startTime != null) {
            LocalDateTime until = endTime != null ? endTime : LocalDateTime.now();
            elapsed = Duration.between(startTime, until).toSeconds() + "s";
        }

        long read = execution.getStepExecutions().stream().mapToLong(StepExecution::getReadCount).sum();
        long written = execution.getStepExecutions().stream().mapToLong(StepExecution::getWriteCount).sum();
        Integer imported = execution.getExecutionContext().containsKey(WorkbookImportTasklet.IMPORTED_COUNT_KEY)
                ? execution.getExecutionContext().getInt(WorkbookImportTasklet.IMPORTED_COUNT_KEY)
                : null;
        List<String> failures = execution.getAllFailureExceptions().stream()
                .map(Throwable::getMessage)
                .toList();

        return ResponseEntity.ok(new ImportStatusResponse(
                jobExecutionId,
                execution.getStatus().name(),
                execution.getExitStatus() != null ? execution.getExitStatus().getExitCode() : null,
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                read,
                written,
                imported,
                failures));
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record ImportStartResponse(Long jobExecutionId, String status, String workbookFile,
                                      List<String> sheetNames) {}

    /**
     * @param importedCount transactions upserted by the run; {@code null} until the step commits
     * @param failures      messages of every exception recorded against the run
     */
    public record ImportStatusResponse(
            Long jobExecutionId,
            String status,
            String exitCode,
            String startTime,
            String endTime,
            String elapsed,
            long readCount,
            long writeCount,
            Integer importedCount,
            List<String> failures) {}
}
