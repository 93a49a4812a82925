/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.errors;

public class HostedZoneNotFoundException extends PreviewException {

    private final String baseDomain;

    public HostedZoneNotFoundException(String baseDomain) {
        super("no hosted zone found for domain: %s".formatted(baseDomain));
        this.baseDomain = baseDomain;
    }

    public String getBaseDomain() {
        return baseDomain;
    }
}
