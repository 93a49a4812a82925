/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.errors;

import java.time.Duration;

/**
 * The distribution did not reach a deployed, disabled state before the ceiling elapsed.
 * The disable request was accepted, so polling again later and deleting by hand may still succeed.
 */
public class DistributionWaitTimeoutException extends PreviewException {

    private final String distributionId;
    private final Duration waited;

    public DistributionWaitTimeoutException(String distributionId, Duration waited) {
        super("distribution %s was not deployed in its disabled state after %d seconds"
                .formatted(distributionId, waited.toSeconds()));
        this.distributionId = distributionId;
        this.waited = waited;
    }

    public String getDistributionId() {
        return distributionId;
    }

    public Duration getWaited() {
        return waited;
    }
}
