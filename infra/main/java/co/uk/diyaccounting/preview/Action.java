/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum Action {
    DEPLOY,
    CLEANUP;

    public static Action fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action must be non-empty");
        }
        try {
            return Action.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown action %s, expected one of %s"
                    .formatted(name, Arrays.stream(values()).map(Action::cliName).collect(Collectors.joining(", "))));
        }
    }

    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
