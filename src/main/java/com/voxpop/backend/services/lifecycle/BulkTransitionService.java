package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.Transition;
import com.voxpop.backend.exceptions.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a transition over many contacts. Every id gets its own transaction through
 * {@link ContactTransitionService}, so one bad id never rolls back the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkTransitionService {

    private final ContactTransitionService contactTransitionService;

    public BulkTransitionResult apply(List<Long> contactIds, Transition transition) {
        if (contactIds == null || contactIds.isEmpty()) {
            throw new ValidationException("supporterIds", "At least one contact id is required");
        }

        Set<Long> ids = new LinkedHashSet<>();
        contactIds.stream().filter(Objects::nonNull).forEach(ids::add);
        if (ids.isEmpty()) {
            throw new ValidationException("supporterIds", "At least one contact id is required");
        }

        int updated = 0;
        int unchanged = 0;
        int failed = 0;

        for (Long id : ids) {
            try {
                TransitionResult result = contactTransitionService.apply(id, transition);
                if (result.changed()) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Bulk {} skipped contact {}: {}", transition.getValue(), id, e.getMessage());
            }
        }

        log.info("Bulk {} over {} contacts: {} updated, {} unchanged, {} failed",
                transition.getValue(), ids.size(), updated, unchanged, failed);

        return new BulkTransitionResult(failed == 0, summarize(transition, updated, unchanged, failed),
                updated, unchanged, failed);
    }

    private String summarize(Transition transition, int updated, int unchanged, int failed) {
        StringBuilder message = new StringBuilder()
                .append(updated).append(updated == 1 ? " contact " : " contacts ")
                .append(pastTense(transition));
        if (unchanged > 0) {
            message.append(", ").append(unchanged).append(" already up to date");
        }
        if (failed > 0) {
            message.append(", ").append(failed).append(" could not be changed");
        }
        return message.toString();
    }

    private String pastTense(Transition transition) {
        switch (transition) {
            case PROMOTE:
                return "promoted";
            case DEMOTE:
                return "demoted";
            case BLACKLIST:
                return "blacklisted";
            case UNBLACKLIST:
                return "removed from blacklist";
            default:
                throw new IllegalArgumentException("Unknown transition " + transition);
        }
    }
}
