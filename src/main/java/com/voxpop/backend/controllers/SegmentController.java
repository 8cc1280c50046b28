package com.voxpop.backend.controllers;

import com.voxpop.backend.dto.AudiencePreviewDto;
import com.voxpop.backend.dto.FilterPreviewRequest;
import com.voxpop.backend.dto.SegmentDto;
import com.voxpop.backend.dto.SegmentRequest;
import com.voxpop.backend.services.SegmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/supporters/segments")
@RequiredArgsConstructor
@Slf4j
public class SegmentController {

    private final SegmentService segmentService;

    @GetMapping
    public ResponseEntity<List<SegmentDto>> getSegments(@RequestParam(required = false) Boolean active) {
        return ResponseEntity.ok(segmentService.listSegments(active));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<SegmentDto> getSegment(@PathVariable Long id) {
        return ResponseEntity.ok(segmentService.getSegment(id));
    }

    @PostMapping
    public ResponseEntity<SegmentDto> createSegment(
            @Valid @RequestBody SegmentRequest request,
            @RequestHeader(value = "X-User-Id", required = false) Long userId) {
        SegmentDto segment = segmentService.createSegment(request, userId);
        log.info("User {} created segment {}", userId, segment.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(segment);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<SegmentDto> updateSegment(@PathVariable Long id, @Valid @RequestBody SegmentRequest request) {
        return ResponseEntity.ok(segmentService.updateSegment(id, request));
    }

    @DeleteMapping("/{id:\\d+}")
    public ResponseEntity<Void> deleteSegment(@PathVariable Long id) {
        segmentService.deleteSegment(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id:\\d+}/duplicate")
    public ResponseEntity<SegmentDto> duplicateSegment(
            @PathVariable Long id,
            @RequestHeader(value = "X-User-Id", required = false) Long userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(segmentService.duplicateSegment(id, userId));
    }

    @PostMapping("/{id:\\d+}/refresh")
    public ResponseEntity<SegmentDto> refreshSegment(@PathVariable Long id) {
        return ResponseEntity.ok(segmentService.refreshSegment(id));
    }

    /**
     * Count and sample for a saved segment. Also refreshes its cached snapshot.
     */
    @GetMapping("/{id:\\d+}/preview")
    public ResponseEntity<AudiencePreviewDto> previewSegment(@PathVariable Long id) {
        return ResponseEntity.ok(segmentService.previewSegment(id));
    }

    @PostMapping("/preview")
    public ResponseEntity<AudiencePreviewDto> previewFilters(@RequestBody FilterPreviewRequest request) {
        return ResponseEntity.ok(segmentService.previewFilters(request.getFilters()));
    }
}
