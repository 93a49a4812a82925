/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview;

import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildBaseUrl;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildBucketName;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildHostname;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildOriginAccessControlName;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.stripTrailingDot;

import java.util.Locale;

/**
 * Identity of one preview environment. Every AWS resource name is derived from the pull request
 * number and app name, so repeated runs with the same inputs address the same resources.
 */
public record PreviewEnvironment(
        int prNumber, String appName, String region, String baseDomain, String bucketName, String hostname) {

    public static PreviewEnvironment of(int prNumber, String appName, String region, String baseDomain) {
        var bucketName = buildBucketName(prNumber, appName);
        // Route53 hands names back lowercased, so the hostname must already be lowercase to match
        var normalisedBaseDomain = stripTrailingDot(baseDomain).toLowerCase(Locale.ROOT);
        return new PreviewEnvironment(
                prNumber,
                appName,
                region,
                normalisedBaseDomain,
                bucketName,
                buildHostname(bucketName, normalisedBaseDomain));
    }

    public String originAccessControlName() {
        return buildOriginAccessControlName(bucketName);
    }

    public String baseUrl() {
        return buildBaseUrl(hostname);
    }
}
