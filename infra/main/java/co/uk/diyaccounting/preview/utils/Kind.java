/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.utils;

import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.utils.StringUtils;

public final class Kind {
    private Kind() {}

    private static final Logger logger = LogManager.getLogger(Kind.class);

    public static void infof(String fmt, Object... args) {
        logger.info(String.format(fmt, args));
    }

    public static String envOr(Map<String, String> environment, String environmentVariable, String alternativeValue) {
        return envOr(environment, environmentVariable, alternativeValue, "");
    }

    public static String envOr(
            Map<String, String> environment,
            String environmentVariable,
            String alternativeValue,
            String alternativeSource) {
        String environmentValue = environment == null ? null : environment.get(environmentVariable);
        if (StringUtils.isNotBlank(environmentValue)) {
            infof("Using environment variable %s", environmentVariable);
            return environmentValue;
        } else {
            var sourceLabel = StringUtils.isBlank(alternativeSource) ? "" : " " + alternativeSource;
            infof(
                    "Environment variable %s is null or blank using alternative%s, value %s",
                    environmentVariable, sourceLabel, alternativeValue);
            return alternativeValue;
        }
    }

    // First non-blank value, else null.
    public static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (var v : values) {
            if (StringUtils.isNotBlank(v)) return v;
        }
        return null;
    }
}
