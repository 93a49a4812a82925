/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.errors;

public class StepFailedException extends PreviewException {

    private final String step;

    public StepFailedException(String step, Throwable cause) {
        super("%s failed: %s".formatted(step, cause.getMessage()), cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
