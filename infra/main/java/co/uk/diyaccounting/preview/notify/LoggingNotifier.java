/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.notify;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Used when no GitHub token is configured: the comment is logged instead of posted.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger logger = LogManager.getLogger(LoggingNotifier.class);

    @Override
    public void postComment(String repoOwner, String repoName, int issueNumber, String text) {
        logger.info("Skipping GitHub comment on {}/{}#{} (no GitHub token provided)", repoOwner, repoName, issueNumber);
        logger.debug("Comment text:\n{}", text);
    }
}
