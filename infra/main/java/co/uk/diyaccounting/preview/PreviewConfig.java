/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface PreviewConfig {

    String DEFAULT_REGION = "us-east-1";
    String DEFAULT_SOURCE_PATH = "./dist";
    String DEFAULT_GITHUB_API_URL = "https://api.github.com";

    @Value.Default
    default Action action() {
        return Action.DEPLOY;
    }

    int prNumber();

    String appName();

    @Value.Default
    default String region() {
        return DEFAULT_REGION;
    }

    String baseDomain();

    Optional<String> certificateArn();

    @Value.Default
    default Path sourcePath() {
        return Path.of(DEFAULT_SOURCE_PATH);
    }

    String repoOwner();

    String repoName();

    @Value.Redacted
    Optional<String> githubToken();

    @Value.Default
    default String githubApiUrl() {
        return DEFAULT_GITHUB_API_URL;
    }

    @Value.Default
    default Duration distributionWaitTimeout() {
        return Duration.ofMinutes(20);
    }

    @Value.Default
    default Duration distributionPollInterval() {
        return Duration.ofSeconds(30);
    }

    @Value.Check
    default void check() {
        if (prNumber() <= 0) {
            throw new IllegalStateException("PR number is required (--pr)");
        }
        if (appName().isBlank()) {
            throw new IllegalStateException("App name is required (--app)");
        }
        if (baseDomain().isBlank()) {
            throw new IllegalStateException("Base domain is required (--domain)");
        }
        if (repoOwner().isBlank()) {
            throw new IllegalStateException("Repository owner is required (--repo-owner)");
        }
        if (repoName().isBlank()) {
            throw new IllegalStateException("Repository name is required (--repo-name)");
        }
        if (region().isBlank()) {
            throw new IllegalStateException("Region must not be blank (--region)");
        }
        if (distributionWaitTimeout().isNegative() || distributionWaitTimeout().isZero()) {
            throw new IllegalStateException("Distribution wait timeout must be positive");
        }
        if (distributionPollInterval().isNegative() || distributionPollInterval().isZero()) {
            throw new IllegalStateException("Distribution poll interval must be positive");
        }
    }

    default PreviewEnvironment environment() {
        return PreviewEnvironment.of(prNumber(), appName(), region(), baseDomain());
    }
}
