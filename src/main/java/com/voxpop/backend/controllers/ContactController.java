package com.voxpop.backend.controllers;

import com.voxpop.backend.dto.BulkTransitionRequest;
import com.voxpop.backend.dto.BulkTransitionResponse;
import com.voxpop.backend.dto.ContactDto;
import com.voxpop.backend.dto.ContactRequest;
import com.voxpop.backend.dto.TagAssignmentRequest;
import com.voxpop.backend.dto.TransitionResponse;
import com.voxpop.backend.enums.Transition;
import com.voxpop.backend.services.ContactService;
import com.voxpop.backend.services.lifecycle.BulkTransitionResult;
import com.voxpop.backend.services.lifecycle.BulkTransitionService;
import com.voxpop.backend.services.lifecycle.ContactTransitionService;
import com.voxpop.backend.services.lifecycle.TransitionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Supporter (contact) endpoints: CRUD, user-tag assignment and lifecycle transitions.
 */
@RestController
@RequestMapping("/api/supporters")
@RequiredArgsConstructor
@Slf4j
public class ContactController {

    private static final Set<String> PAGING_PARAMS = Set.of("search", "page", "size");

    private final ContactService contactService;
    private final ContactTransitionService contactTransitionService;
    private final BulkTransitionService bulkTransitionService;

    /**
     * Filtered listing. Any query parameter other than search/page/size is read as a segment filter key,
     * e.g. {@code ?city=Campinas&tags=3,4&age_min=18}.
     */
    @GetMapping
    public ResponseEntity<Page<ContactDto>> getContacts(
            @RequestParam Map<String, String> params,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "25") int size) {

        Map<String, String> filters = new LinkedHashMap<>(params);
        filters.keySet().removeAll(PAGING_PARAMS);

        return ResponseEntity.ok(contactService.listContacts(filters, search, page, size));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<ContactDto> getContact(@PathVariable Long id) {
        return ResponseEntity.ok(contactService.getContact(id));
    }

    @PostMapping
    public ResponseEntity<ContactDto> createContact(@Valid @RequestBody ContactRequest request) {
        ContactDto contact = contactService.createContact(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(contact);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<ContactDto> updateContact(@PathVariable Long id,
                                                    @Valid @RequestBody ContactRequest request) {
        return ResponseEntity.ok(contactService.updateContact(id, request));
    }

    @DeleteMapping("/{id:\\d+}")
    public ResponseEntity<Void> deleteContact(@PathVariable Long id) {
        contactService.deleteContact(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id:\\d+}/tags")
    public ResponseEntity<ContactDto> addTags(@PathVariable Long id, @Valid @RequestBody TagAssignmentRequest request) {
        return ResponseEntity.ok(contactService.addTags(id, request.getTagIds()));
    }

    @DeleteMapping("/{id:\\d+}/tags")
    public ResponseEntity<ContactDto> removeTags(@PathVariable Long id, @Valid @RequestBody TagAssignmentRequest request) {
        return ResponseEntity.ok(contactService.removeTags(id, request.getTagIds()));
    }

    // ===== Single transitions =====

    @PostMapping("/{id:\\d+}/promote")
    public ResponseEntity<TransitionResponse> promote(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(contactTransitionService.promote(id)));
    }

    @PostMapping("/{id:\\d+}/demote")
    public ResponseEntity<TransitionResponse> demote(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(contactTransitionService.demote(id)));
    }

    @PostMapping("/{id:\\d+}/blacklist")
    public ResponseEntity<TransitionResponse> blacklist(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(contactTransitionService.blacklist(id)));
    }

    @PostMapping("/{id:\\d+}/unblacklist")
    public ResponseEntity<TransitionResponse> unblacklist(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(contactTransitionService.unblacklist(id)));
    }

    // ===== Bulk transitions =====

    @PostMapping("/bulk-promote")
    public ResponseEntity<BulkTransitionResponse> bulkPromote(@RequestBody BulkTransitionRequest request) {
        return ResponseEntity.ok(bulk(request, Transition.PROMOTE));
    }

    @PostMapping("/bulk-demote")
    public ResponseEntity<BulkTransitionResponse> bulkDemote(@RequestBody BulkTransitionRequest request) {
        return ResponseEntity.ok(bulk(request, Transition.DEMOTE));
    }

    @PostMapping("/bulk-blacklist")
    public ResponseEntity<BulkTransitionResponse> bulkBlacklist(@RequestBody BulkTransitionRequest request) {
        return ResponseEntity.ok(bulk(request, Transition.BLACKLIST));
    }

    @PostMapping("/bulk-unblacklist")
    public ResponseEntity<BulkTransitionResponse> bulkUnblacklist(@RequestBody BulkTransitionRequest request) {
        return ResponseEntity.ok(bulk(request, Transition.UNBLACKLIST));
    }

    private BulkTransitionResponse bulk(BulkTransitionRequest request, Transition transition) {
        BulkTransitionResult result = bulkTransitionService.apply(request.getSupporterIds(), transition);
        return BulkTransitionResponse.builder()
                .success(result.success())
                .message(result.message())
                .updatedCount(result.updatedCount())
                .unchangedCount(result.unchangedCount())
                .failedCount(result.failedCount())
                .build();
    }

    static TransitionResponse toResponse(TransitionResult result) {
        String message = result.changed()
                ? "Contact " + result.contactId() + " moved from " + result.previousStatus().getValue()
                        + " to " + result.currentStatus().getValue()
                : "Contact " + result.contactId() + " is already " + result.currentStatus().getValue();

        return TransitionResponse.builder()
                .contactId(result.contactId())
                .previousStatus(result.previousStatus())
                .contactStatus(result.currentStatus())
                .changed(result.changed())
                .message(message)
                .build();
    }
}
