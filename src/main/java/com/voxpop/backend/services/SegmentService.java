package com.voxpop.backend.services;

import com.voxpop.backend.dto.AudiencePreviewDto;
import com.voxpop.backend.dto.SegmentDto;
import com.voxpop.backend.dto.SegmentRequest;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.exceptions.SegmentInUseException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.Segment;
import com.voxpop.backend.repositories.SegmentRepository;
import com.voxpop.backend.services.audience.AudienceResolver;
import com.voxpop.backend.services.audience.AudienceSnapshot;
import com.voxpop.backend.services.audience.FilterSpecification;
import com.voxpop.backend.services.campaign.CampaignReferenceChecker;
import com.voxpop.backend.util.SegmentMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Segment Store.
 *
 * Every write (create, update, duplicate, refresh, preview of a saved segment) resolves the filter and
 * stores the count and status breakdown with the time they were taken. Nothing else recomputes them:
 * contact edits, transitions and imports leave existing snapshots as they were.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentService {

    static final String COPY_SUFFIX = " (Copia)";
    static final int MAX_NAME_LENGTH = 100;

    private final SegmentRepository segmentRepository;
    private final AudienceResolver audienceResolver;
    private final CampaignReferenceChecker campaignReferenceChecker;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<SegmentDto> listSegments(Boolean active) {
        List<Segment> segments = active == null
                ? segmentRepository.findAllByOrderByCreatedAtDesc()
                : segmentRepository.findByIsActiveOrderByCreatedAtDesc(active);
        return segments.stream().map(SegmentMapper::toDto).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SegmentDto getSegment(Long id) {
        return SegmentMapper.toDto(findSegment(id));
    }

    @Transactional
    public SegmentDto createSegment(SegmentRequest request, Long userId) {
        FilterSpecification specification = FilterSpecification.fromMap(request.getFilters());

        Segment segment = Segment.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .filters(new LinkedHashMap<>(specification.raw()))
                .isActive(request.getIsActive() == null || request.getIsActive())
                .createdBy(userId)
                .build();
        applySnapshot(segment, audienceResolver.resolve(specification, 0));

        Segment saved = segmentRepository.save(segment);
        log.info("Created segment {} '{}' with {} contacts", saved.getId(), saved.getName(), saved.getCachedCount());
        return SegmentMapper.toDto(saved);
    }

    @Transactional
    public SegmentDto updateSegment(Long id, SegmentRequest request) {
        Segment segment = findSegment(id);
        FilterSpecification specification = FilterSpecification.fromMap(request.getFilters());

        segment.setName(request.getName().trim());
        segment.setDescription(request.getDescription());
        segment.setFilters(new LinkedHashMap<>(specification.raw()));
        if (request.getIsActive() != null) {
            segment.setIsActive(request.getIsActive());
        }
        applySnapshot(segment, audienceResolver.resolve(specification, 0));

        Segment saved = segmentRepository.save(segment);
        log.info("Updated segment {} with {} contacts", id, saved.getCachedCount());
        return SegmentMapper.toDto(saved);
    }

    @Transactional
    public SegmentDto duplicateSegment(Long id, Long userId) {
        Segment source = findSegment(id);
        FilterSpecification specification = FilterSpecification.fromMap(source.getFilters());

        Segment copy = Segment.builder()
                .name(copyName(source.getName()))
                .description(source.getDescription())
                .filters(new LinkedHashMap<>(specification.raw()))
                .isActive(source.getIsActive())
                .createdBy(userId)
                .build();
        applySnapshot(copy, audienceResolver.resolve(specification, 0));

        Segment saved = segmentRepository.save(copy);
        log.info("Duplicated segment {} into {}", id, saved.getId());
        return SegmentMapper.toDto(saved);
    }

    @Transactional
    public SegmentDto refreshSegment(Long id) {
        Segment segment = findSegment(id);
        applySnapshot(segment, audienceResolver.resolve(FilterSpecification.fromMap(segment.getFilters()), 0));
        Segment saved = segmentRepository.save(segment);
        log.info("Refreshed segment {}: {} contacts", id, saved.getCachedCount());
        return SegmentMapper.toDto(saved);
    }

    /**
     * Count and sample of a saved segment. Counts as a manual refresh, so the snapshot is updated too.
     */
    @Transactional
    public AudiencePreviewDto previewSegment(Long id) {
        Segment segment = findSegment(id);
        AudienceSnapshot snapshot = audienceResolver.resolve(FilterSpecification.fromMap(segment.getFilters()));
        applySnapshot(segment, snapshot);
        segmentRepository.save(segment);
        return SegmentMapper.toPreview(snapshot, LocalDate.now(clock));
    }

    /**
     * Count and sample of an unsaved filter mapping. Nothing is persisted.
     */
    @Transactional(readOnly = true)
    public AudiencePreviewDto previewFilters(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            throw new ValidationException("filters", "At least one filter is required");
        }
        AudienceSnapshot snapshot = audienceResolver.resolve(FilterSpecification.fromMap(filters));
        return SegmentMapper.toPreview(snapshot, LocalDate.now(clock));
    }

    @Transactional
    public void deleteSegment(Long id) {
        Segment segment = findSegment(id);
        if (campaignReferenceChecker.isSegmentReferenced(id)) {
            throw new SegmentInUseException(id);
        }
        segmentRepository.delete(segment);
        log.info("Deleted segment {} '{}'", id, segment.getName());
    }

    private Segment findSegment(Long id) {
        return segmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Segment", id));
    }

    private void applySnapshot(Segment segment, AudienceSnapshot snapshot) {
        segment.setCachedCount(snapshot.count());
        segment.setLeadsCount(snapshot.leadsCount());
        segment.setSupportersCount(snapshot.supportersCount());
        segment.setBlacklistCount(snapshot.blacklistCount());
        segment.setCachedAt(OffsetDateTime.now(clock));
    }

    static String copyName(String name) {
        int room = MAX_NAME_LENGTH - COPY_SUFFIX.length();
        String base = name.length() > room ? name.substring(0, room) : name;
        return base + COPY_SUFFIX;
    }
}
