package com.voxpop.backend.services.lifecycle;

/**
 * Aggregate outcome of a bulk transition. Failed ids are counted, not listed.
 *
 * @param updatedCount contacts whose status actually changed. Ids already in the target state are
 *                     successes too but are counted in {@code unchangedCount}, not here; a caller
 *                     wanting every successful id adds the two.
 * @param unchangedCount idempotent no-ops
 * @param failedCount ids that were missing or rejected by the transition rules
 */
public record BulkTransitionResult(boolean success,
                                   String message,
                                   int updatedCount,
                                   int unchangedCount,
                                   int failedCount) {
}
