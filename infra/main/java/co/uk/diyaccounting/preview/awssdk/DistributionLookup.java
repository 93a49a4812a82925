/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.Optional;

/**
 * Finds a distribution by one of its alternate domain names. An empty result means the
 * distribution does not exist yet and is not an error.
 */
public interface DistributionLookup {

    Optional<String> findByAlias(String hostname);
}
