/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks one distribution through disable, wait and delete, refusing transitions that
 * {@link DistributionState} does not allow.
 */
public class DistributionTeardown {

    private static final Logger logger = LogManager.getLogger(DistributionTeardown.class);

    private final String distributionId;
    private final List<DistributionState> history = new ArrayList<>();

    public DistributionTeardown(String distributionId) {
        this.distributionId = distributionId;
    }

    public void start(DistributionState initial) {
        if (!history.isEmpty()) {
            throw new IllegalStateException("teardown of %s already started".formatted(distributionId));
        }
        if (initial != DistributionState.ENABLED && initial != DistributionState.DISABLED) {
            throw new IllegalStateException("teardown of %s cannot start from %s".formatted(distributionId, initial));
        }
        history.add(initial);
        logger.info("Distribution {} teardown starting from {}", distributionId, initial);
    }

    public void transition(DistributionState next) {
        var current = state();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "distribution %s cannot move from %s to %s".formatted(distributionId, current, next));
        }
        history.add(next);
        logger.info("Distribution {} {} -> {}", distributionId, current, next);
    }

    public DistributionState state() {
        if (history.isEmpty()) {
            throw new IllegalStateException("teardown of %s not started".formatted(distributionId));
        }
        return history.get(history.size() - 1);
    }

    public boolean isComplete() {
        return !history.isEmpty() && state() == DistributionState.ABSENT;
    }

    public String distributionId() {
        return distributionId;
    }

    public List<DistributionState> history() {
        return Collections.unmodifiableList(history);
    }
}
