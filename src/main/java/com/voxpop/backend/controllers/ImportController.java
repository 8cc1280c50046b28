package com.voxpop.backend.controllers;

import com.voxpop.backend.dto.ImportJobDto;
import com.voxpop.backend.dto.MappingSuggestionDto;
import com.voxpop.backend.services.imports.ImportJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Spreadsheet import. Submitting returns 202 with the pending job; clients poll {@code /import/{id}}.
 */
@RestController
@RequestMapping("/api/supporters/import")
@RequiredArgsConstructor
@Slf4j
public class ImportController {

    private final ImportJobService importJobService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportJobDto> submitImport(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "column_mapping", required = false) String columnMapping,
            @RequestParam(value = "auto_tag_ids", required = false) List<Long> autoTagIds,
            @RequestParam(value = "duplicate_mode", required = false) String duplicateMode,
            @RequestHeader(value = "X-User-Id", required = false) Long userId) {

        log.info("Import upload {} ({} bytes) from user {}", file.getOriginalFilename(), file.getSize(), userId);
        ImportJobDto job = importJobService.submit(file, columnMapping, autoTagIds, duplicateMode, userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @PostMapping(value = "/suggest-mapping", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MappingSuggestionDto> suggestMapping(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(importJobService.suggestMapping(file));
    }

    @GetMapping
    public ResponseEntity<List<ImportJobDto>> getJobs() {
        return ResponseEntity.ok(importJobService.listJobs());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ImportJobDto> getJob(@PathVariable Long id) {
        return ResponseEntity.ok(importJobService.getJob(id));
    }
}
