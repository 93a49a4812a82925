/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.CreateOriginAccessControlRequest;
import software.amazon.awssdk.services.cloudfront.model.DeleteOriginAccessControlRequest;
import software.amazon.awssdk.services.cloudfront.model.GetOriginAccessControlRequest;
import software.amazon.awssdk.services.cloudfront.model.ListOriginAccessControlsRequest;
import software.amazon.awssdk.services.cloudfront.model.OriginAccessControlConfig;
import software.amazon.awssdk.services.cloudfront.model.OriginAccessControlOriginTypes;
import software.amazon.awssdk.services.cloudfront.model.OriginAccessControlSigningBehaviors;
import software.amazon.awssdk.services.cloudfront.model.OriginAccessControlSigningProtocols;

/**
 * Finds or creates the CloudFront Origin Access Control that lets a distribution read from a
 * private bucket. CloudFront has no filter by name, so every lookup lists all of them.
 */
public class OriginAccessControlManager {

    private static final Logger logger = LogManager.getLogger(OriginAccessControlManager.class);

    private final CloudFrontClient cloudFrontClient;

    public OriginAccessControlManager(CloudFrontClient cloudFrontClient) {
        this.cloudFrontClient = cloudFrontClient;
    }

    public String getOrCreate(String name, String description) {
        var existing = findIdByName(name);
        if (existing.isPresent()) {
            logger.info("Using existing Origin Access Control {} ({})", name, existing.get());
            return existing.get();
        }
        var response = cloudFrontClient.createOriginAccessControl(CreateOriginAccessControlRequest.builder()
                .originAccessControlConfig(OriginAccessControlConfig.builder()
                        .name(name)
                        .description(description)
                        .signingProtocol(OriginAccessControlSigningProtocols.SIGV4)
                        .signingBehavior(OriginAccessControlSigningBehaviors.ALWAYS)
                        .originAccessControlOriginType(OriginAccessControlOriginTypes.S3)
                        .build())
                .build());
        var id = response.originAccessControl().id();
        logger.info("Origin Access Control {} created ({})", name, id);
        return id;
    }

    // Exact, case sensitive match on name
    public Optional<String> findIdByName(String name) {
        String marker = null;
        do {
            var list = cloudFrontClient
                    .listOriginAccessControls(ListOriginAccessControlsRequest.builder()
                            .marker(marker)
                            .build())
                    .originAccessControlList();
            if (list == null) {
                return Optional.empty();
            }
            if (list.hasItems()) {
                for (var summary : list.items()) {
                    if (name.equals(summary.name())) {
                        return Optional.of(summary.id());
                    }
                }
            }
            marker = Boolean.TRUE.equals(list.isTruncated()) ? list.nextMarker() : null;
        } while (marker != null);
        return Optional.empty();
    }

    /**
     * Deletes the named Origin Access Control. CloudFront refuses while a distribution still uses it.
     *
     * @return false if there was nothing to delete
     */
    public boolean deleteIfExists(String name) {
        var id = findIdByName(name);
        if (id.isEmpty()) {
            logger.info("No Origin Access Control named {}", name);
            return false;
        }
        var eTag = cloudFrontClient
                .getOriginAccessControl(
                        GetOriginAccessControlRequest.builder().id(id.get()).build())
                .eTag();
        cloudFrontClient.deleteOriginAccessControl(DeleteOriginAccessControlRequest.builder()
                .id(id.get())
                .ifMatch(eTag)
                .build());
        logger.info("Origin Access Control {} deleted ({})", name, id.get());
        return true;
    }
}
