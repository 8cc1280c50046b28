package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.Transition;

/**
 * Outcome of one transition on one contact. {@code changed} is false for an idempotent no-op.
 */
public record TransitionResult(Long contactId,
                               Transition transition,
                               LifecycleStatus previousStatus,
                               LifecycleStatus currentStatus,
                               boolean changed) {
}
