/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a preview distribution.
 *
 * <pre>
 * ABSENT -> CREATING -> ENABLED -> DISABLING -> DISABLED -> DELETING -> ABSENT
 * </pre>
 *
 * Only the teardown half, from ENABLED or DISABLED onwards, is tracked and enforced, by
 * {@link DistributionTeardown}. Creation is a single CloudFront call with nothing to poll, so
 * ABSENT -> CREATING -> ENABLED is never driven. A distribution found already disabled enters
 * teardown at DISABLED.
 */
public enum DistributionState {
    ABSENT,
    CREATING,
    ENABLED,
    DISABLING,
    DISABLED,
    DELETING;

    private static final Map<DistributionState, Set<DistributionState>> transitions =
            new EnumMap<>(DistributionState.class);

    static {
        transitions.put(ABSENT, EnumSet.of(CREATING));
        transitions.put(CREATING, EnumSet.of(ENABLED));
        transitions.put(ENABLED, EnumSet.of(DISABLING));
        transitions.put(DISABLING, EnumSet.of(DISABLED));
        transitions.put(DISABLED, EnumSet.of(DELETING));
        transitions.put(DELETING, EnumSet.of(ABSENT));
    }

    public Set<DistributionState> successors() {
        return Collections.unmodifiableSet(transitions.get(this));
    }

    public boolean canTransitionTo(DistributionState next) {
        return successors().contains(next);
    }

    public static DistributionState fromEnabled(boolean enabled) {
        return enabled ? ENABLED : DISABLED;
    }
}
