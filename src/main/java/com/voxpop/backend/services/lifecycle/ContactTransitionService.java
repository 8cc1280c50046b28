package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.enums.Transition;
import com.voxpop.backend.exceptions.InvalidTransitionException;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

/**
 * Applies lifecycle transitions to single contacts.
 *
 * Each call runs in its own transaction holding a row lock on the contact, and swaps the lifecycle
 * tag in one flush, so readers see either the old tag or the new one. Segment snapshots are not
 * touched; they go stale until explicitly refreshed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactTransitionService {

    private final ContactRepository contactRepository;
    private final SystemTagRegistry systemTagRegistry;
    private final MeterRegistry meterRegistry;

    @Transactional
    public TransitionResult apply(Long contactId, Transition transition) {
        Contact contact = contactRepository.findByIdForUpdate(contactId)
                .orElseThrow(() -> new ResourceNotFoundException("Contact", contactId));

        LifecycleStatus current = LifecycleStatusDeriver.derive(contact);

        if (transition.isAlreadySatisfied(current)) {
            log.debug("Contact {} already satisfies {} (status {})", contactId, transition.getValue(), current.getValue());
            count(transition, "unchanged");
            return new TransitionResult(contactId, transition, current, current, false);
        }

        if (!transition.isLegalSource(current)) {
            count(transition, "rejected");
            throw new InvalidTransitionException(contactId, current, transition);
        }

        LifecycleStatus target = resolveTarget(contact, transition);

        if (transition == Transition.BLACKLIST) {
            contact.setStatusBeforeBlacklist(current == LifecycleStatus.NONE ? null : current);
        } else if (transition == Transition.UNBLACKLIST) {
            contact.setStatusBeforeBlacklist(null);
        }

        replaceLifecycleTag(contact, systemTagRegistry.resolve(SystemTag.forStatus(target)));
        contactRepository.save(contact);

        log.info("Contact {} moved from {} to {} via {}", contactId, current.getValue(), target.getValue(), transition.getValue());
        count(transition, "changed");
        return new TransitionResult(contactId, transition, current, target, true);
    }

    public TransitionResult promote(Long contactId) {
        return apply(contactId, Transition.PROMOTE);
    }

    public TransitionResult demote(Long contactId) {
        return apply(contactId, Transition.DEMOTE);
    }

    public TransitionResult blacklist(Long contactId) {
        return apply(contactId, Transition.BLACKLIST);
    }

    public TransitionResult unblacklist(Long contactId) {
        return apply(contactId, Transition.UNBLACKLIST);
    }

    /**
     * Sets the lifecycle tag of a contact that is being created or imported. Caller owns the transaction.
     */
    public void assignInitialStatus(Contact contact, LifecycleStatus status) {
        replaceLifecycleTag(contact, systemTagRegistry.resolve(SystemTag.forStatus(status)));
    }

    private LifecycleStatus resolveTarget(Contact contact, Transition transition) {
        if (transition != Transition.UNBLACKLIST) {
            return transition.getTarget();
        }
        LifecycleStatus previous = contact.getStatusBeforeBlacklist();
        if (previous == LifecycleStatus.APOIADOR || previous == LifecycleStatus.LEAD) {
            return previous;
        }
        return LifecycleStatus.LEAD;
    }

    private void replaceLifecycleTag(Contact contact, Tag target) {
        Set<Tag> tags = contact.getTags();
        tags.removeIf(LifecycleStatusDeriver::isLifecycleTag);
        tags.add(target);
    }

    private void count(Transition transition, String outcome) {
        Counter.builder("voxpop.transitions")
                .description("Lifecycle transitions by outcome")
                .tag("transition", transition.getValue())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
