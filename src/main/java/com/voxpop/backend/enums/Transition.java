package com.voxpop.backend.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status-changing commands. Each one names the statuses it may start from and the status it lands on;
 * a contact already in the target state is an idempotent no-op.
 */
public enum Transition {
    PROMOTE("promote", EnumSet.of(LifecycleStatus.LEAD, LifecycleStatus.NONE), LifecycleStatus.APOIADOR),
    DEMOTE("demote", EnumSet.of(LifecycleStatus.APOIADOR, LifecycleStatus.NONE), LifecycleStatus.LEAD),
    BLACKLIST("blacklist", EnumSet.of(LifecycleStatus.LEAD, LifecycleStatus.APOIADOR, LifecycleStatus.NONE),
            LifecycleStatus.BLACKLIST),
    // target resolved per contact from the status it held before blacklisting
    UNBLACKLIST("unblacklist", EnumSet.of(LifecycleStatus.BLACKLIST), null);

    private final String value;
    private final Set<LifecycleStatus> sources;
    private final LifecycleStatus target;

    Transition(String value, Set<LifecycleStatus> sources, LifecycleStatus target) {
        this.value = value;
        this.sources = sources;
        this.target = target;
    }

    public String getValue() {
        return value;
    }

    public boolean isLegalSource(LifecycleStatus status) {
        return sources.contains(status);
    }

    /**
     * True when a contact in {@code status} needs no change for this transition.
     */
    public boolean isAlreadySatisfied(LifecycleStatus status) {
        if (this == UNBLACKLIST) {
            return status != LifecycleStatus.BLACKLIST;
        }
        return status == target;
    }

    public LifecycleStatus getTarget() {
        return target;
    }
}
