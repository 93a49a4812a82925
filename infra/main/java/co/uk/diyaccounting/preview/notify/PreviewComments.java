/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.notify;

import co.uk.diyaccounting.preview.PreviewEnvironment;

public final class PreviewComments {
    private PreviewComments() {}

    public static String deployed(PreviewEnvironment environment) {
        return """
                ## Preview Environment Deployed Successfully! 🚀

                Your preview environment is now available at:
                **%s**

                Note: Initial deployment may take 3-5 minutes for CloudFront to propagate globally."""
                .formatted(environment.baseUrl());
    }

    public static String cleanedUp(PreviewEnvironment environment) {
        return """
                ## Preview Environment Cleanup Complete 🧹

                The preview environment for PR #%d has been successfully cleaned up.

                All resources have been removed:
                - CloudFront distribution
                - Route53 DNS records
                - S3 bucket and contents"""
                .formatted(environment.prNumber());
    }
}
