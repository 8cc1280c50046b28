package com.voxpop.backend.exceptions;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.Transition;

/**
 * Thrown when a contact's current status is not a legal starting point for the requested transition,
 * e.g. promoting a blacklisted contact.
 */
public class InvalidTransitionException extends RuntimeException {

    private final Long contactId;
    private final LifecycleStatus currentStatus;
    private final Transition transition;

    public InvalidTransitionException(Long contactId, LifecycleStatus currentStatus, Transition transition) {
        super("Cannot " + transition.getValue() + " contact " + contactId + " while its status is " + currentStatus.getValue());
        this.contactId = contactId;
        this.currentStatus = currentStatus;
        this.transition = transition;
    }

    public Long getContactId() {
        return contactId;
    }

    public LifecycleStatus getCurrentStatus() {
        return currentStatus;
    }

    public Transition getTransition() {
        return transition;
    }
}
