package com.voxpop.backend.services;

import com.voxpop.backend.TestFixtures;
import com.voxpop.backend.config.AudienceProperties;
import com.voxpop.backend.dto.SegmentDto;
import com.voxpop.backend.dto.SegmentRequest;
import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Segment;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.repositories.SegmentRepository;
import com.voxpop.backend.services.audience.AudienceResolver;
import com.voxpop.backend.services.audience.ContactFilterCompiler;
import com.voxpop.backend.services.campaign.CampaignReferenceChecker;
import com.voxpop.backend.services.lifecycle.ContactTransitionService;
import com.voxpop.backend.services.lifecycle.SystemTagRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.voxpop.backend.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Segment snapshots against a live contact collection: the real resolver, filter compiler and
 * transition engine over an in-memory list.
 */
@ExtendWith(MockitoExtension.class)
class SegmentSnapshotTest {

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private SegmentRepository segmentRepository;

    @Mock
    private SystemTagRegistry systemTagRegistry;

    @Mock
    private CampaignReferenceChecker campaignReferenceChecker;

    private SegmentService segmentService;
    private ContactTransitionService transitionService;
    private final List<Contact> contacts = new ArrayList<>();
    private Segment stored;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-06-15T12:00:00Z"), ZoneOffset.UTC);
        AudienceResolver resolver = new AudienceResolver(contactRepository, new ContactFilterCompiler(clock),
                new AudienceProperties(10));
        segmentService = new SegmentService(segmentRepository, resolver, campaignReferenceChecker, clock);
        transitionService = new ContactTransitionService(contactRepository, systemTagRegistry, new SimpleMeterRegistry());

        contacts.add(inState(contact(1L, APOIADOR_TAG), "SP"));
        contacts.add(inState(contact(2L, APOIADOR_TAG), "SP"));
        contacts.add(inState(contact(3L, LEAD_TAG), "SP"));
        contacts.add(inState(contact(4L, APOIADOR_TAG), "MG"));

        when(contactRepository.streamAllByDeletedAtIsNullOrderByIdAsc()).thenAnswer(inv -> contacts.stream());
        lenient().when(contactRepository.findByIdForUpdate(anyLong())).thenAnswer(inv -> contacts.stream()
                .filter(c -> c.getId().equals(inv.getArgument(0)))
                .findFirst());
        lenient().when(systemTagRegistry.resolve(any(SystemTag.class)))
                .thenAnswer(inv -> TestFixtures.systemTag(inv.getArgument(0, SystemTag.class)));
        when(segmentRepository.save(any(Segment.class))).thenAnswer(inv -> {
            stored = inv.getArgument(0);
            stored.setId(1L);
            return stored;
        });
        when(segmentRepository.findById(1L)).thenAnswer(inv -> Optional.ofNullable(stored));
    }

    private static Contact inState(Contact contact, String state) {
        contact.setState(state);
        return contact;
    }

    @Test
    void testCachedCountStaysStaleUntilRefresh() {
        // Given a segment of SP supporters, two of them today
        SegmentRequest request = SegmentRequest.builder()
                .name("Apoiadores SP")
                .filters(Map.of("contact_status", "apoiador", "state", "SP"))
                .build();
        SegmentDto created = segmentService.createSegment(request, null);
        assertEquals(2L, created.getCachedCount());

        // When a third SP contact is promoted into the filter
        assertTrue(transitionService.promote(3L).changed());

        // Then reading the segment still serves the snapshot
        assertEquals(2L, segmentService.getSegment(1L).getCachedCount());

        // And a refresh picks up the new member
        SegmentDto refreshed = segmentService.refreshSegment(1L);
        assertEquals(3L, refreshed.getCachedCount());
        assertEquals(3L, refreshed.getSupportersCount());
    }
}
