/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.lifecycle;

import co.uk.diyaccounting.preview.PreviewEnvironment;
import co.uk.diyaccounting.preview.awssdk.BucketPolicyWriter;
import co.uk.diyaccounting.preview.awssdk.CacheInvalidator;
import co.uk.diyaccounting.preview.awssdk.ContentSync;
import co.uk.diyaccounting.preview.awssdk.DistributionManager;
import co.uk.diyaccounting.preview.awssdk.DistributionManager.DistributionDetails;
import co.uk.diyaccounting.preview.awssdk.DnsRecordManager;
import co.uk.diyaccounting.preview.awssdk.OriginAccessControlManager;
import co.uk.diyaccounting.preview.awssdk.S3BucketManager;
import co.uk.diyaccounting.preview.errors.ConfigurationException;
import co.uk.diyaccounting.preview.errors.DistributionWaitTimeoutException;
import co.uk.diyaccounting.preview.errors.HostedZoneNotFoundException;
import co.uk.diyaccounting.preview.errors.StepFailedException;
import co.uk.diyaccounting.preview.lifecycle.CleanupReport.StepResult;
import co.uk.diyaccounting.preview.notify.Notifier;
import co.uk.diyaccounting.preview.notify.PreviewComments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives the deploy and cleanup sequences for one preview environment.
 *
 * <p>No state is kept between runs. Every step looks up what already exists by name or alias,
 * so either operation can be run again after a failure to finish the job. Deploy stops at the
 * first failed step and leaves what it created in place; cleanup carries on past the steps
 * whose resource being gone is an acceptable end state.
 */
public class EnvironmentController {

    private static final Logger logger = LogManager.getLogger(EnvironmentController.class);

    public static final String CREATE_BUCKET = "create bucket";
    public static final String SYNC_CONTENT = "sync content";
    public static final String MANAGE_ORIGIN_ACCESS_CONTROL = "manage origin access control";
    public static final String MANAGE_DISTRIBUTION = "manage distribution";
    public static final String SET_BUCKET_POLICY = "set bucket policy";
    public static final String INVALIDATE_CACHE = "invalidate cache";
    public static final String UPDATE_DNS = "update DNS";
    public static final String FIND_DISTRIBUTION = "find distribution";
    public static final String DELETE_DISTRIBUTION = "delete distribution";
    public static final String DELETE_ORIGIN_ACCESS_CONTROL = "delete origin access control";
    public static final String DELETE_DNS = "delete DNS record";
    public static final String DELETE_BUCKET = "delete bucket";

    public record DeployResult(String hostname, String baseUrl, String distributionId, int filesUploaded) {}

    private final S3BucketManager bucketManager;
    private final ContentSync contentSync;
    private final OriginAccessControlManager originAccessControlManager;
    private final DistributionManager distributionManager;
    private final BucketPolicyWriter bucketPolicyWriter;
    private final CacheInvalidator cacheInvalidator;
    private final DnsRecordManager dnsRecordManager;
    private final Notifier notifier;
    private final String repoOwner;
    private final String repoName;

    private EnvironmentController(Builder builder) {
        this.bucketManager = Objects.requireNonNull(builder.bucketManager, "bucketManager");
        this.contentSync = Objects.requireNonNull(builder.contentSync, "contentSync");
        this.originAccessControlManager =
                Objects.requireNonNull(builder.originAccessControlManager, "originAccessControlManager");
        this.distributionManager = Objects.requireNonNull(builder.distributionManager, "distributionManager");
        this.bucketPolicyWriter = Objects.requireNonNull(builder.bucketPolicyWriter, "bucketPolicyWriter");
        this.cacheInvalidator = Objects.requireNonNull(builder.cacheInvalidator, "cacheInvalidator");
        this.dnsRecordManager = Objects.requireNonNull(builder.dnsRecordManager, "dnsRecordManager");
        this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
        this.repoOwner = builder.repoOwner;
        this.repoName = builder.repoName;
    }

    public DeployResult deploy(PreviewEnvironment environment, Path sourceDir, Optional<String> certificateArn) {
        logger.info("Starting deployment of {} from {}", environment.hostname(), sourceDir);
        ContentSync.requireDirectory(sourceDir);

        step(CREATE_BUCKET, () -> bucketManager.ensureBucket(environment.bucketName(), environment.region()));

        int filesUploaded = step(SYNC_CONTENT, () -> contentSync.sync(sourceDir, environment.bucketName()));

        var originAccessControlId = step(
                MANAGE_ORIGIN_ACCESS_CONTROL,
                () -> originAccessControlManager.getOrCreate(
                        environment.originAccessControlName(),
                        "OAC for PR #%d preview environment".formatted(environment.prNumber())));

        DistributionDetails distribution = step(MANAGE_DISTRIBUTION, () -> distributionManager
                .findByAlias(environment.hostname())
                .map(id -> {
                    logger.info("Using existing distribution {}", id);
                    return distributionManager.describe(id);
                })
                .orElseGet(() -> distributionManager.create(environment, originAccessControlId, certificateArn)));

        // Scoped to the distribution ARN, so only possible once the distribution exists
        step(SET_BUCKET_POLICY, () -> {
            bucketPolicyWriter.attach(environment.bucketName(), distribution.arn());
            return null;
        });

        step(INVALIDATE_CACHE, () -> cacheInvalidator.invalidateAll(distribution.id()));

        step(UPDATE_DNS, () -> {
            var zoneId = dnsRecordManager.resolveZone(environment.baseDomain());
            dnsRecordManager.upsert(zoneId, environment.hostname(), distribution.domainName());
            return null;
        });

        notify(environment, PreviewComments.deployed(environment));

        logger.info("Deployment of {} complete", environment.hostname());
        return new DeployResult(environment.hostname(), environment.baseUrl(), distribution.id(), filesUploaded);
    }

    public CleanupReport cleanup(PreviewEnvironment environment) {
        logger.info("Starting cleanup of {}", environment.hostname());
        var results = new ArrayList<StepResult>();

        // A failed lookup cannot prove the distribution is gone, so it ends the run
        var distributionId = step(FIND_DISTRIBUTION, () -> distributionManager.findByAlias(environment.hostname()));
        if (distributionId.isPresent()) {
            step(DELETE_DISTRIBUTION, () -> distributionManager.teardown(distributionId.get()));
            results.add(StepResult.deletedOrAbsent(DELETE_DISTRIBUTION, true));
        } else {
            logger.info("No CloudFront distribution found for {}", environment.hostname());
            results.add(StepResult.deletedOrAbsent(DELETE_DISTRIBUTION, false));
        }

        results.add(bestEffort(
                DELETE_ORIGIN_ACCESS_CONTROL,
                () -> originAccessControlManager.deleteIfExists(environment.originAccessControlName())));

        results.add(bestEffort(DELETE_DNS, () -> {
            var zoneId = dnsRecordManager.resolveZone(environment.baseDomain());
            return dnsRecordManager.delete(zoneId, environment.hostname());
        }));

        boolean bucketDeleted = step(DELETE_BUCKET, () -> bucketManager.emptyAndDelete(environment.bucketName()));
        results.add(StepResult.deletedOrAbsent(DELETE_BUCKET, bucketDeleted));

        notify(environment, PreviewComments.cleanedUp(environment));

        var report = new CleanupReport(environment.hostname(), results);
        logger.info("Cleanup of {} complete{}", environment.hostname(), report.hasWarnings() ? " with warnings" : "");
        return report;
    }

    private static <T> T step(String name, Supplier<T> action) {
        try {
            return action.get();
        } catch (ConfigurationException | DistributionWaitTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Step {} failed: {}", name, e.getMessage());
            throw new StepFailedException(name, e);
        }
    }

    private static StepResult bestEffort(String name, Supplier<Boolean> action) {
        try {
            return StepResult.deletedOrAbsent(name, action.get());
        } catch (HostedZoneNotFoundException e) {
            logger.warn("Skipping {}: {}", name, e.getMessage());
            return StepResult.warning(name, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Failed to {}: {}", name, e.getMessage());
            return StepResult.warning(name, e.getMessage());
        }
    }

    private void notify(PreviewEnvironment environment, String text) {
        try {
            notifier.postComment(repoOwner, repoName, environment.prNumber(), text);
        } catch (RuntimeException e) {
            logger.warn("Failed to post GitHub comment: {}", e.getMessage());
        }
    }

    public static class Builder {
        private S3BucketManager bucketManager;
        private ContentSync contentSync;
        private OriginAccessControlManager originAccessControlManager;
        private DistributionManager distributionManager;
        private BucketPolicyWriter bucketPolicyWriter;
        private CacheInvalidator cacheInvalidator;
        private DnsRecordManager dnsRecordManager;
        private Notifier notifier;
        private String repoOwner;
        private String repoName;

        public static Builder create() {
            return new Builder();
        }

        public Builder bucketManager(S3BucketManager bucketManager) {
            this.bucketManager = bucketManager;
            return this;
        }

        public Builder contentSync(ContentSync contentSync) {
            this.contentSync = contentSync;
            return this;
        }

        public Builder originAccessControlManager(OriginAccessControlManager originAccessControlManager) {
            this.originAccessControlManager = originAccessControlManager;
            return this;
        }

        public Builder distributionManager(DistributionManager distributionManager) {
            this.distributionManager = distributionManager;
            return this;
        }

        public Builder bucketPolicyWriter(BucketPolicyWriter bucketPolicyWriter) {
            this.bucketPolicyWriter = bucketPolicyWriter;
            return this;
        }

        public Builder cacheInvalidator(CacheInvalidator cacheInvalidator) {
            this.cacheInvalidator = cacheInvalidator;
            return this;
        }

        public Builder dnsRecordManager(DnsRecordManager dnsRecordManager) {
            this.dnsRecordManager = dnsRecordManager;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder repository(String repoOwner, String repoName) {
            this.repoOwner = repoOwner;
            this.repoName = repoName;
            return this;
        }

        public EnvironmentController build() {
            return new EnvironmentController(this);
        }
    }
}
