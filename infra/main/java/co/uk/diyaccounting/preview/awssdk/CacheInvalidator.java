/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.time.Clock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.CreateInvalidationRequest;
import software.amazon.awssdk.services.cloudfront.model.InvalidationBatch;
import software.amazon.awssdk.services.cloudfront.model.Paths;

/**
 * Submits a whole-site invalidation. Returns once CloudFront accepts it, not when it has propagated.
 */
public class CacheInvalidator {

    private static final Logger logger = LogManager.getLogger(CacheInvalidator.class);

    public static final String ALL_PATHS = "/*";

    private final CloudFrontClient cloudFrontClient;
    private final Clock clock;

    public CacheInvalidator(CloudFrontClient cloudFrontClient, Clock clock) {
        this.cloudFrontClient = cloudFrontClient;
        this.clock = clock;
    }

    public String invalidateAll(String distributionId) {
        var callerReference = "invalidation-%d".formatted(clock.instant().getEpochSecond());
        var response = cloudFrontClient.createInvalidation(CreateInvalidationRequest.builder()
                .distributionId(distributionId)
                .invalidationBatch(InvalidationBatch.builder()
                        .callerReference(callerReference)
                        .paths(Paths.builder().quantity(1).items(ALL_PATHS).build())
                        .build())
                .build());
        var invalidationId = response.invalidation() == null ? null : response.invalidation().id();
        logger.info("Invalidation {} of {} submitted for distribution {}", invalidationId, ALL_PATHS, distributionId);
        return invalidationId;
    }
}
