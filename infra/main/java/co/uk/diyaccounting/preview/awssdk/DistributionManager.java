/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildOriginId;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildRegionalBucketDomainName;

import co.uk.diyaccounting.preview.PreviewEnvironment;
import co.uk.diyaccounting.preview.errors.DistributionWaitTimeoutException;
import co.uk.diyaccounting.preview.errors.PreviewException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.Aliases;
import software.amazon.awssdk.services.cloudfront.model.AllowedMethods;
import software.amazon.awssdk.services.cloudfront.model.CachedMethods;
import software.amazon.awssdk.services.cloudfront.model.CookiePreference;
import software.amazon.awssdk.services.cloudfront.model.CreateDistributionRequest;
import software.amazon.awssdk.services.cloudfront.model.CustomErrorResponse;
import software.amazon.awssdk.services.cloudfront.model.CustomErrorResponses;
import software.amazon.awssdk.services.cloudfront.model.DefaultCacheBehavior;
import software.amazon.awssdk.services.cloudfront.model.DeleteDistributionRequest;
import software.amazon.awssdk.services.cloudfront.model.Distribution;
import software.amazon.awssdk.services.cloudfront.model.DistributionConfig;
import software.amazon.awssdk.services.cloudfront.model.ForwardedValues;
import software.amazon.awssdk.services.cloudfront.model.GetDistributionConfigRequest;
import software.amazon.awssdk.services.cloudfront.model.GetDistributionConfigResponse;
import software.amazon.awssdk.services.cloudfront.model.GetDistributionRequest;
import software.amazon.awssdk.services.cloudfront.model.ItemSelection;
import software.amazon.awssdk.services.cloudfront.model.Method;
import software.amazon.awssdk.services.cloudfront.model.Origin;
import software.amazon.awssdk.services.cloudfront.model.Origins;
import software.amazon.awssdk.services.cloudfront.model.S3OriginConfig;
import software.amazon.awssdk.services.cloudfront.model.SSLSupportMethod;
import software.amazon.awssdk.services.cloudfront.model.TrustedSigners;
import software.amazon.awssdk.services.cloudfront.model.UpdateDistributionRequest;
import software.amazon.awssdk.services.cloudfront.model.ViewerCertificate;
import software.amazon.awssdk.services.cloudfront.model.ViewerProtocolPolicy;

/**
 * Creates the preview distribution and owns its disable, wait and delete teardown.
 *
 * <p>Every mutating CloudFront call needs the current ETag of the distribution config and each
 * mutation invalidates it, so the config is fetched again before the next call.
 */
public class DistributionManager {

    private static final Logger logger = LogManager.getLogger(DistributionManager.class);

    public static final String STATUS_DEPLOYED = "Deployed";
    public static final String DEFAULT_ROOT_OBJECT = "index.html";
    public static final String SPA_FALLBACK_PAGE = "/index.html";
    public static final String MINIMUM_PROTOCOL_VERSION = "TLSv1.3_2025";
    public static final long MIN_TTL_SECONDS = 0L;
    public static final long DEFAULT_TTL_SECONDS = 86400L;
    public static final long MAX_TTL_SECONDS = 31536000L;
    public static final long ERROR_CACHING_MIN_TTL_SECONDS = 300L;

    public record DistributionDetails(String id, String arn, String domainName, String status, boolean enabled) {
        static DistributionDetails from(Distribution distribution) {
            var config = distribution.distributionConfig();
            return new DistributionDetails(
                    distribution.id(),
                    distribution.arn(),
                    distribution.domainName(),
                    distribution.status(),
                    config != null && Boolean.TRUE.equals(config.enabled()));
        }
    }

    private final CloudFrontClient cloudFrontClient;
    private final DistributionLookup distributionLookup;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration waitTimeout;
    private final Duration pollInterval;

    public DistributionManager(
            CloudFrontClient cloudFrontClient,
            DistributionLookup distributionLookup,
            Clock clock,
            Sleeper sleeper,
            Duration waitTimeout,
            Duration pollInterval) {
        this.cloudFrontClient = cloudFrontClient;
        this.distributionLookup = distributionLookup;
        this.clock = clock;
        this.sleeper = sleeper;
        this.waitTimeout = waitTimeout;
        this.pollInterval = pollInterval;
    }

    public Optional<String> findByAlias(String hostname) {
        return distributionLookup.findByAlias(hostname);
    }

    public DistributionDetails create(
            PreviewEnvironment environment, String originAccessControlId, Optional<String> certificateArn) {
        if (certificateArn.isEmpty()) {
            logger.warn(
                    "No certificate supplied, the default CloudFront certificate will not match {} over HTTPS",
                    environment.hostname());
        }
        var callerReference = "pr-%d-%d".formatted(environment.prNumber(), clock.instant().getEpochSecond());
        var response = cloudFrontClient.createDistribution(CreateDistributionRequest.builder()
                .distributionConfig(
                        buildDistributionConfig(environment, originAccessControlId, certificateArn, callerReference))
                .build());
        var details = DistributionDetails.from(response.distribution());
        logger.info("Distribution {} created for {} ({})", details.id(), environment.hostname(), details.domainName());
        return details;
    }

    public DistributionDetails describe(String distributionId) {
        return DistributionDetails.from(cloudFrontClient
                .getDistribution(GetDistributionRequest.builder().id(distributionId).build())
                .distribution());
    }

    /**
     * Disables the distribution if needed, waits for CloudFront to report it deployed in its
     * disabled state, then deletes it with a freshly fetched ETag.
     *
     * @throws DistributionWaitTimeoutException if the wait ceiling elapses first
     */
    public DistributionTeardown teardown(String distributionId) {
        var teardown = new DistributionTeardown(distributionId);
        var current = getConfig(distributionId);
        teardown.start(DistributionState.fromEnabled(isEnabled(current)));

        if (teardown.state() == DistributionState.ENABLED) {
            teardown.transition(DistributionState.DISABLING);
            cloudFrontClient.updateDistribution(UpdateDistributionRequest.builder()
                    .id(distributionId)
                    .ifMatch(current.eTag())
                    .distributionConfig(current.distributionConfig().toBuilder()
                            .enabled(false)
                            .build())
                    .build());
            logger.info("Distribution {} disable submitted, waiting for deployment", distributionId);
            waitUntilDisabledAndDeployed(distributionId);
            teardown.transition(DistributionState.DISABLED);
        } else if (!isDisabledAndDeployed(describe(distributionId))) {
            // Disabled by an earlier run that did not see the change finish deploying
            logger.info("Distribution {} is disabled but still deploying, waiting", distributionId);
            waitUntilDisabledAndDeployed(distributionId);
        }

        var fresh = getConfig(distributionId);
        if (isEnabled(fresh)) {
            throw new IllegalStateException(
                    "distribution %s still reports enabled, refusing to delete".formatted(distributionId));
        }
        teardown.transition(DistributionState.DELETING);
        cloudFrontClient.deleteDistribution(DeleteDistributionRequest.builder()
                .id(distributionId)
                .ifMatch(fresh.eTag())
                .build());
        teardown.transition(DistributionState.ABSENT);
        logger.info("Distribution {} deleted", distributionId);
        return teardown;
    }

    /**
     * Polls until CloudFront reports the distribution both disabled and {@code Deployed}. A status
     * of {@code Deployed} on its own can still describe the previous, enabled configuration.
     */
    void waitUntilDisabledAndDeployed(String distributionId) {
        var started = clock.instant();
        var deadline = started.plus(waitTimeout);
        while (true) {
            var details = describe(distributionId);
            var status = details.enabled() ? details.status() + " and enabled" : details.status();
            if (isDisabledAndDeployed(details)) {
                logger.info(
                        "Distribution {} deployed after {} seconds",
                        distributionId,
                        Duration.between(started, clock.instant()).toSeconds());
                return;
            }
            var now = clock.instant();
            if (!now.isBefore(deadline)) {
                throw new DistributionWaitTimeoutException(distributionId, Duration.between(started, now));
            }
            var remaining = Duration.between(now, deadline);
            var delay = remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
            logger.info(
                    "Distribution {} is {}, checking again in {} seconds", distributionId, status, delay.toSeconds());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PreviewException("interrupted waiting for distribution %s".formatted(distributionId), e);
            }
        }
    }

    private static boolean isDisabledAndDeployed(DistributionDetails details) {
        return STATUS_DEPLOYED.equals(details.status()) && !details.enabled();
    }

    private GetDistributionConfigResponse getConfig(String distributionId) {
        return cloudFrontClient.getDistributionConfig(
                GetDistributionConfigRequest.builder().id(distributionId).build());
    }

    private static boolean isEnabled(GetDistributionConfigResponse response) {
        return Boolean.TRUE.equals(response.distributionConfig().enabled());
    }

    static @NotNull DistributionConfig buildDistributionConfig(
            PreviewEnvironment environment,
            String originAccessControlId,
            Optional<String> certificateArn,
            String callerReference) {
        var originId = buildOriginId(environment.bucketName());
        var getAndHead = new Method[] {Method.GET, Method.HEAD};
        return DistributionConfig.builder()
                .callerReference(callerReference)
                .comment("PR #%d Preview Environment".formatted(environment.prNumber()))
                .enabled(true)
                .aliases(Aliases.builder()
                        .quantity(1)
                        .items(environment.hostname())
                        .build())
                .defaultRootObject(DEFAULT_ROOT_OBJECT)
                .origins(Origins.builder()
                        .quantity(1)
                        .items(Origin.builder()
                                .id(originId)
                                .domainName(
                                        buildRegionalBucketDomainName(environment.bucketName(), environment.region()))
                                // OAC replaces the legacy identity, which must be present and empty
                                .s3OriginConfig(S3OriginConfig.builder()
                                        .originAccessIdentity("")
                                        .build())
                                .originAccessControlId(originAccessControlId)
                                .build())
                        .build())
                .defaultCacheBehavior(DefaultCacheBehavior.builder()
                        .targetOriginId(originId)
                        .viewerProtocolPolicy(ViewerProtocolPolicy.REDIRECT_TO_HTTPS)
                        .allowedMethods(AllowedMethods.builder()
                                .quantity(getAndHead.length)
                                .items(getAndHead)
                                .cachedMethods(CachedMethods.builder()
                                        .quantity(getAndHead.length)
                                        .items(getAndHead)
                                        .build())
                                .build())
                        .forwardedValues(ForwardedValues.builder()
                                .queryString(false)
                                .cookies(CookiePreference.builder()
                                        .forward(ItemSelection.NONE)
                                        .build())
                                .build())
                        .minTTL(MIN_TTL_SECONDS)
                        .defaultTTL(DEFAULT_TTL_SECONDS)
                        .maxTTL(MAX_TTL_SECONDS)
                        .compress(true)
                        .trustedSigners(TrustedSigners.builder()
                                .enabled(false)
                                .quantity(0)
                                .build())
                        .build())
                // Client side routes 404 at the origin, serve the app shell instead
                .customErrorResponses(CustomErrorResponses.builder()
                        .quantity(1)
                        .items(CustomErrorResponse.builder()
                                .errorCode(HttpStatus.SC_NOT_FOUND)
                                .responsePagePath(SPA_FALLBACK_PAGE)
                                .responseCode(String.valueOf(HttpStatus.SC_OK))
                                .errorCachingMinTTL(ERROR_CACHING_MIN_TTL_SECONDS)
                                .build())
                        .build())
                .viewerCertificate(buildViewerCertificate(certificateArn))
                .build();
    }

    static @NotNull ViewerCertificate buildViewerCertificate(Optional<String> certificateArn) {
        return certificateArn
                .map(arn -> ViewerCertificate.builder()
                        .acmCertificateArn(arn)
                        .sslSupportMethod(SSLSupportMethod.SNI_ONLY)
                        .minimumProtocolVersion(MINIMUM_PROTOCOL_VERSION)
                        .build())
                .orElseGet(() -> ViewerCertificate.builder()
                        .cloudFrontDefaultCertificate(true)
                        .build());
    }
}
