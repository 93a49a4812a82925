/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * The three AWS clients a run needs. Credentials come from the default provider chain.
 * CloudFront and Route53 are global services and are always addressed through aws-global.
 */
public record PreviewClients(S3Client s3Client, CloudFrontClient cloudFrontClient, Route53Client route53Client)
        implements AutoCloseable {

    public static PreviewClients create(String region) {
        return new PreviewClients(
                S3Client.builder().region(Region.of(region)).build(),
                CloudFrontClient.builder().region(Region.AWS_GLOBAL).build(),
                Route53Client.builder().region(Region.AWS_GLOBAL).build());
    }

    @Override
    public void close() {
        s3Client.close();
        cloudFrontClient.close();
        route53Client.close();
    }
}
