package com.voxpop.backend.services.imports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxpop.backend.config.ImportProperties;
import com.voxpop.backend.dto.ImportJobDto;
import com.voxpop.backend.dto.MappingSuggestionDto;
import com.voxpop.backend.enums.DuplicateMode;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.ImportJob;
import com.voxpop.backend.repositories.ImportJobRepository;
import com.voxpop.backend.services.FileStorageService;
import com.voxpop.backend.services.TagService;
import com.voxpop.backend.util.ImportJobMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Request-side half of the import pipeline: validates an upload, stores it, records a pending job and
 * hands the job id to {@link ImportJobWorker}. Returns before any row is read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportJobService {

    static final int PREVIEW_ROWS = 10;

    private final ImportJobRepository importJobRepository;
    private final ImportJobWorker importJobWorker;
    private final FileStorageService fileStorageService;
    private final TagService tagService;
    private final SpreadsheetParser spreadsheetParser;
    private final ColumnMappingSuggester columnMappingSuggester;
    private final ImportProperties importProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ImportJobDto submit(MultipartFile file, String columnMappingJson, List<Long> autoTagIds,
                               String duplicateMode, Long userId) {
        validateFile(file);
        Map<String, Object> mapping = parseMapping(columnMappingJson);
        validateMapping(mapping);
        tagService.resolveUserTags(autoTagIds, "auto_tag_ids");
        DuplicateMode mode = parseDuplicateMode(duplicateMode);

        Path stored;
        try {
            stored = fileStorageService.storeFile(file, "import");
        } catch (IOException e) {
            log.error("Could not store upload {}: {}", file.getOriginalFilename(), e.getMessage(), e);
            throw new IllegalStateException("Could not store the uploaded file", e);
        }

        ImportJob job = new ImportJob(file.getOriginalFilename(), mapping,
                autoTagIds != null ? autoTagIds : new ArrayList<>(), mode, userId);
        job.setStoredPath(stored.toString());
        ImportJob saved = importJobRepository.save(job);

        log.info("Accepted import job {} for {} ({} bytes)", saved.getId(), saved.getFileName(), file.getSize());
        try {
            importJobWorker.process(saved.getId());
        } catch (TaskRejectedException e) {
            log.error("Import job {} rejected by the worker pool: {}", saved.getId(), e.getMessage());
            return ImportJobMapper.toDto(abandon(saved, stored));
        }
        return ImportJobMapper.toDto(saved);
    }

    /**
     * Fails a job the worker pool would not take and removes its upload, so it never sits in pending.
     */
    private ImportJob abandon(ImportJob job, Path stored) {
        job.markFailed("Import queue is full, please retry later", OffsetDateTime.now(clock));
        ImportJob failed = importJobRepository.save(job);
        try {
            fileStorageService.deleteFile(stored);
        } catch (IOException e) {
            log.warn("Could not delete import upload {}: {}", stored, e.getMessage());
        }
        return failed;
    }

    /**
     * Reads headers and the first rows of an upload and proposes a mapping. Creates no job.
     */
    public MappingSuggestionDto suggestMapping(MultipartFile file) {
        validateFile(file);

        Path temp = null;
        try {
            temp = Files.createTempFile("voxpop-suggest-", "." + SpreadsheetParser.extensionOf(file.getOriginalFilename()));
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            ParsedSheet sheet = spreadsheetParser.parse(temp, file.getOriginalFilename());

            Map<String, String> fields = new LinkedHashMap<>();
            for (ImportField field : ImportField.values()) {
                fields.put(field.getValue(), field.getLabel());
            }

            return MappingSuggestionDto.builder()
                    .fileName(file.getOriginalFilename())
                    .headers(sheet.headers())
                    .suggestedMapping(columnMappingSuggester.suggest(sheet.headers()))
                    .sampleRows(sheet.rows().stream().limit(PREVIEW_ROWS).map(ParsedSheet.SheetRow::values).collect(Collectors.toList()))
                    .totalRows(sheet.size())
                    .availableFields(fields)
                    .build();
        } catch (IOException e) {
            throw new ValidationException("file", "Could not read file: " + e.getMessage());
        } finally {
            deleteQuietly(temp);
        }
    }

    public ImportJobDto getJob(Long id) {
        return importJobRepository.findById(id)
                .map(ImportJobMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Import job", id));
    }

    public List<ImportJobDto> listJobs() {
        return importJobRepository.findTop50ByOrderByCreatedAtDesc().stream()
                .map(ImportJobMapper::toDto)
                .collect(Collectors.toList());
    }

    void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("file", "A non-empty file is required");
        }
        String extension = SpreadsheetParser.extensionOf(file.getOriginalFilename());
        if (!importProperties.isAllowedExtension(extension)) {
            throw new ValidationException("file", "Unsupported file type; allowed: " + importProperties.allowedExtensions());
        }
        if (file.getSize() > importProperties.maxFileSizeBytes()) {
            throw new ValidationException("file", "File exceeds the limit of " + importProperties.maxFileSizeBytes() + " bytes");
        }
    }

    Map<String, Object> parseMapping(String columnMappingJson) {
        if (columnMappingJson == null || columnMappingJson.isBlank()) {
            throw new ValidationException("column_mapping", "Column mapping is required");
        }
        try {
            Map<String, Object> mapping = objectMapper.readValue(columnMappingJson,
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            return mapping != null ? mapping : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new ValidationException("column_mapping", "Column mapping must be a JSON object of header to field");
        }
    }

    /**
     * Every mapped value must be a known field (blank means "ignore this column"), no field may be
     * mapped twice, and name and phone must be mapped.
     */
    void validateMapping(Map<String, Object> mapping) {
        Set<ImportField> mapped = EnumSet.noneOf(ImportField.class);
        for (Map.Entry<String, Object> column : mapping.entrySet()) {
            Object value = column.getValue();
            if (value == null || value.toString().isBlank()) {
                continue;
            }
            ImportField field = ImportField.fromValue(value.toString())
                    .orElseThrow(() -> new ValidationException("column_mapping",
                            "Unknown field '" + value + "' for column '" + column.getKey() + "'"));
            if (!mapped.add(field)) {
                throw new ValidationException("column_mapping", "Field '" + field.getValue() + "' is mapped more than once");
            }
        }

        for (ImportField field : ImportField.values()) {
            if (field.isRequired() && !mapped.contains(field)) {
                throw new ValidationException("column_mapping", "Field '" + field.getValue() + "' must be mapped");
            }
        }
    }

    private DuplicateMode parseDuplicateMode(String value) {
        try {
            return DuplicateMode.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("duplicate_mode", e.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }
}
