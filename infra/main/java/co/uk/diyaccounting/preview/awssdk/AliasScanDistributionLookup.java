/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.DistributionSummary;
import software.amazon.awssdk.services.cloudfront.model.ListDistributionsRequest;

/**
 * Lists every distribution in the account and scans the aliases. Cost grows with the number of
 * distributions in the account, a tag based lookup can replace this behind {@link DistributionLookup}.
 */
public class AliasScanDistributionLookup implements DistributionLookup {

    private static final Logger logger = LogManager.getLogger(AliasScanDistributionLookup.class);

    private final CloudFrontClient cloudFrontClient;

    public AliasScanDistributionLookup(CloudFrontClient cloudFrontClient) {
        this.cloudFrontClient = cloudFrontClient;
    }

    @Override
    public Optional<String> findByAlias(String hostname) {
        String marker = null;
        int scanned = 0;
        do {
            var list = cloudFrontClient
                    .listDistributions(
                            ListDistributionsRequest.builder().marker(marker).build())
                    .distributionList();
            if (list == null) {
                break;
            }
            if (list.hasItems()) {
                for (var summary : list.items()) {
                    scanned++;
                    if (hasAlias(summary, hostname)) {
                        logger.info("Distribution {} has alias {}", summary.id(), hostname);
                        return Optional.of(summary.id());
                    }
                }
            }
            marker = Boolean.TRUE.equals(list.isTruncated()) ? list.nextMarker() : null;
        } while (marker != null);
        logger.info("No distribution with alias {} among {} distributions", hostname, scanned);
        return Optional.empty();
    }

    static boolean hasAlias(DistributionSummary summary, String hostname) {
        var aliases = summary.aliases();
        return aliases != null && aliases.hasItems() && aliases.items().contains(hostname);
    }
}
