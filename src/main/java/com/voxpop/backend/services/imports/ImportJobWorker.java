package com.voxpop.backend.services.imports;

import com.voxpop.backend.config.ImportProperties;
import com.voxpop.backend.exceptions.PipelineFaultException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.ImportJob;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ImportJobRepository;
import com.voxpop.backend.repositories.TagRepository;
import com.voxpop.backend.services.FileStorageService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Background half of the import pipeline.
 *
 * Row problems are recorded on the job and processing moves on; anything that stops the worker from
 * reading the file or writing to the database fails the job. The job row is saved after every data
 * row so pollers see processedRows grow.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportJobWorker {

    private final ImportJobRepository importJobRepository;
    private final TagRepository tagRepository;
    private final SpreadsheetParser spreadsheetParser;
    private final ImportRowParser importRowParser;
    private final ContactImportWriter contactImportWriter;
    private final FileStorageService fileStorageService;
    private final ImportProperties importProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Async("importExecutor")
    public void process(Long jobId) {
        run(jobId);
    }

    /**
     * Runs the job on the calling thread.
     */
    public void run(Long jobId) {
        ImportJob job = importJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.error("Import job {} vanished before it could start", jobId);
            return;
        }
        job.limitLoggedErrors(importProperties.maxLoggedErrors());
        Path file = job.getStoredPath() != null ? Paths.get(job.getStoredPath()) : null;

        try {
            execute(job, file);
        } catch (RuntimeException e) {
            PipelineFaultException fault = e instanceof PipelineFaultException pfe
                    ? pfe
                    : new PipelineFaultException("Import job " + jobId + " stopped: " + e.getMessage(), e);
            log.error("Import job {} failed: {}", jobId, fault.getMessage(), fault);
            fail(job, fault.getMessage());
        } finally {
            discard(file);
        }
    }

    private void execute(ImportJob job, Path file) {
        if (file == null) {
            throw new PipelineFaultException("Import job " + job.getId() + " has no stored file");
        }

        ParsedSheet sheet;
        try {
            sheet = spreadsheetParser.parse(file, job.getFileName());
        } catch (IOException e) {
            throw new PipelineFaultException("Could not read " + job.getFileName() + ": " + e.getMessage(), e);
        }
        if (sheet.size() > importProperties.maxRows()) {
            throw new PipelineFaultException("File has " + sheet.size() + " rows; the limit is " + importProperties.maxRows());
        }

        Map<String, ImportField> mapping = resolveMapping(job.getColumnMapping());
        List<Tag> autoTags = tagRepository.findAllById(job.getAutoTagIds());
        if (autoTags.size() != job.getAutoTagIds().size()) {
            log.warn("Import job {}: some auto-tags were removed after submission, applying {} of {}",
                    job.getId(), autoTags.size(), job.getAutoTagIds().size());
        }

        job.markProcessing(sheet.size(), OffsetDateTime.now(clock));
        importJobRepository.save(job);
        log.info("Import job {} processing {} rows from {}", job.getId(), sheet.size(), job.getFileName());

        for (ParsedSheet.SheetRow row : sheet.rows()) {
            processRow(job, row.number(), row.values(), mapping, autoTags);
            importJobRepository.save(job);
        }

        job.markCompleted(OffsetDateTime.now(clock));
        importJobRepository.save(job);
        countJob("completed");
        log.info("Import job {} completed: {} created, {} updated, {} skipped, {} errors",
                job.getId(), job.getCreatedCount(), job.getUpdatedCount(), job.getSkippedCount(), job.getErrorCount());
    }

    private void processRow(ImportJob job, int rowNumber, Map<String, String> raw,
                            Map<String, ImportField> mapping, List<Tag> autoTags) {
        try {
            ImportRow row = importRowParser.parse(rowNumber, raw, mapping);
            ContactImportWriter.Outcome outcome = contactImportWriter.write(row, autoTags, job.getDuplicateMode());
            switch (outcome) {
                case CREATED:
                    job.recordCreated();
                    countRow("success");
                    break;
                case UPDATED:
                    job.recordUpdated();
                    countRow("success");
                    break;
                case SKIPPED:
                    job.recordSkipped();
                    countRow("skipped");
                    break;
                default:
                    throw new IllegalStateException("Unhandled outcome " + outcome);
            }
        } catch (ValidationException e) {
            log.debug("Import job {} row {} rejected: {}", job.getId(), rowNumber, e.getMessage());
            job.recordError(rowNumber, e.getField(), e.getMessage());
            countRow("error");
        } catch (DataIntegrityViolationException e) {
            log.debug("Import job {} row {} conflicts: {}", job.getId(), rowNumber, e.getMostSpecificCause().getMessage());
            job.recordError(rowNumber, ImportField.PHONE.getValue(), "Conflicts with an existing contact");
            countRow("error");
        }
    }

    static Map<String, ImportField> resolveMapping(Map<String, Object> columnMapping) {
        Map<String, ImportField> mapping = new LinkedHashMap<>();
        columnMapping.forEach((header, field) -> {
            if (field != null) {
                ImportField.fromValue(field.toString()).ifPresent(f -> mapping.put(header, f));
            }
        });
        return mapping;
    }

    private void fail(ImportJob job, String reason) {
        try {
            if (!job.getStatus().isTerminal()) {
                job.markFailed(reason, OffsetDateTime.now(clock));
                importJobRepository.save(job);
            }
            countJob("failed");
        } catch (RuntimeException e) {
            log.error("Could not record failure of import job {}", job.getId(), e);
        }
    }

    private void discard(Path file) {
        try {
            fileStorageService.deleteFile(file);
        } catch (IOException e) {
            log.warn("Could not delete import upload {}: {}", file, e.getMessage());
        }
    }

    private void countRow(String outcome) {
        Counter.builder("voxpop.imports.rows")
                .description("Imported rows by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void countJob(String status) {
        Counter.builder("voxpop.imports.jobs")
                .description("Finished import jobs by status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }
}
