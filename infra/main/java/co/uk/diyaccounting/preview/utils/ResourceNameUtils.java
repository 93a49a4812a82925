/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.utils;

import java.util.regex.Pattern;

public class ResourceNameUtils {

    private static final Pattern appNamePattern = Pattern.compile("[a-z0-9][a-z0-9-]*");

    public static String buildBucketName(int prNumber, String appName) {
        if (prNumber <= 0) {
            throw new IllegalArgumentException("prNumber must be positive");
        }
        if (appName == null || !appNamePattern.matcher(appName).matches()) {
            throw new IllegalArgumentException(
                    "appName must be lowercase letters, digits and dashes, got: %s".formatted(appName));
        }
        return "pr-%d-%s".formatted(prNumber, appName);
    }

    public static String buildHostname(String bucketName, String baseDomain) {
        if (baseDomain == null || baseDomain.isBlank()) {
            throw new IllegalArgumentException("baseDomain must be non-empty");
        }
        return "%s.%s".formatted(bucketName, stripTrailingDot(baseDomain));
    }

    public static String buildOriginAccessControlName(String bucketName) {
        return "OAC-%s".formatted(bucketName);
    }

    public static String buildOriginId(String bucketName) {
        return "S3-%s".formatted(bucketName);
    }

    public static String buildRegionalBucketDomainName(String bucketName, String region) {
        return "%s.s3.%s.amazonaws.com".formatted(bucketName, region);
    }

    public static String buildBucketObjectsArn(String bucketName) {
        return "arn:aws:s3:::%s/*".formatted(bucketName);
    }

    public static String buildBaseUrl(String hostname) {
        return "https://%s".formatted(hostname);
    }

    /**
     * Route53 returns names fully qualified, e.g. "pr-1-site.example.com." for "pr-1-site.example.com".
     */
    public static String buildFullyQualifiedName(String hostname) {
        return hostname.endsWith(".") ? hostname : hostname + ".";
    }

    public static String stripTrailingDot(String name) {
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }

    /**
     * Hosted zone ids come back as "/hostedzone/Z123", the change APIs take "Z123".
     */
    public static String trimHostedZoneId(String hostedZoneId) {
        if (hostedZoneId == null || hostedZoneId.isBlank()) {
            throw new IllegalArgumentException("hostedZoneId must be non-empty");
        }
        var parts = hostedZoneId.split("/");
        return parts[parts.length - 1];
    }
}
