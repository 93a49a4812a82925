/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.notify;

import co.uk.diyaccounting.preview.errors.NotificationException;

public interface Notifier {

    /**
     * @throws NotificationException if the comment could not be posted
     */
    void postComment(String repoOwner, String repoName, int issueNumber, String text);
}
