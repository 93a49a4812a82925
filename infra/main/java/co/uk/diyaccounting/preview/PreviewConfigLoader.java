/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview;

import static co.uk.diyaccounting.preview.utils.Kind.envOr;
import static co.uk.diyaccounting.preview.utils.Kind.firstNonBlank;

import co.uk.diyaccounting.preview.errors.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves a {@link PreviewConfig} from command line flags, falling back to environment variables.
 */
public class PreviewConfigLoader {

    // flag name -> environment variable fallback
    static final Map<String, String> flagsToEnvironmentVariables = new LinkedHashMap<>();

    static {
        flagsToEnvironmentVariables.put("action", "ACTION");
        flagsToEnvironmentVariables.put("pr", "PR_NUMBER");
        flagsToEnvironmentVariables.put("app", "APP_NAME");
        flagsToEnvironmentVariables.put("region", "AWS_REGION");
        flagsToEnvironmentVariables.put("domain", "BASE_DOMAIN");
        flagsToEnvironmentVariables.put("cert", "CERTIFICATE_ARN");
        flagsToEnvironmentVariables.put("source", "SOURCE_PATH");
        flagsToEnvironmentVariables.put("repo-owner", "REPO_OWNER");
        flagsToEnvironmentVariables.put("repo-name", "REPO_NAME");
        flagsToEnvironmentVariables.put("wait-timeout-minutes", "DISTRIBUTION_WAIT_TIMEOUT_MINUTES");
        flagsToEnvironmentVariables.put("poll-interval-seconds", "DISTRIBUTION_POLL_INTERVAL_SECONDS");
    }

    private final Map<String, String> environment;

    public PreviewConfigLoader(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : environment;
    }

    public PreviewConfig load(String... args) {
        var flags = parseFlags(args);

        var builder = ImmutablePreviewConfig.builder()
                .action(parseAction(resolve(flags, "action", Action.DEPLOY.cliName())))
                .prNumber(parsePositiveInt("pr", resolve(flags, "pr", "0"), true))
                .appName(resolve(flags, "app", ""))
                .region(resolve(flags, "region", PreviewConfig.DEFAULT_REGION))
                .baseDomain(resolve(flags, "domain", ""))
                .sourcePath(Path.of(resolve(flags, "source", PreviewConfig.DEFAULT_SOURCE_PATH)))
                .repoOwner(resolve(flags, "repo-owner", ""))
                .repoName(resolve(flags, "repo-name", ""))
                .githubApiUrl(envOr(environment, "GITHUB_API_URL", PreviewConfig.DEFAULT_GITHUB_API_URL))
                .distributionWaitTimeout(Duration.ofMinutes(
                        parsePositiveInt("wait-timeout-minutes", resolve(flags, "wait-timeout-minutes", "20"), false)))
                .distributionPollInterval(Duration.ofSeconds(parsePositiveInt(
                        "poll-interval-seconds", resolve(flags, "poll-interval-seconds", "30"), false)));

        var certificateArn = resolve(flags, "cert", null);
        if (certificateArn != null) {
            builder.certificateArn(certificateArn);
        }
        // never logged
        var githubToken = environment.get("GITHUB_TOKEN");
        if (githubToken != null && !githubToken.isBlank()) {
            builder.githubToken(githubToken);
        }

        try {
            var config = builder.build();
            // validates the derived names before anything touches AWS
            config.environment();
            return config;
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    Map<String, String> parseFlags(String... args) {
        var flags = new HashMap<String, String>();
        if (args == null) return flags;
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                if (flags.containsKey("action")) {
                    throw new ConfigurationException("unexpected argument: %s".formatted(arg));
                }
                flags.put("action", arg);
                continue;
            }
            var body = arg.substring(2);
            String name;
            String value;
            var equals = body.indexOf('=');
            if (equals >= 0) {
                name = body.substring(0, equals);
                value = body.substring(equals + 1);
            } else {
                name = body;
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("flag --%s requires a value".formatted(name));
                }
                value = args[++i];
            }
            if (!flagsToEnvironmentVariables.containsKey(name)) {
                throw new ConfigurationException("unknown flag: --%s".formatted(name));
            }
            flags.put(name, value);
        }
        return flags;
    }

    private String resolve(Map<String, String> flags, String flag, String defaultValue) {
        var flagValue = flags.get(flag);
        if (flagValue != null && !flagValue.isBlank()) {
            return flagValue;
        }
        return firstNonBlank(
                envOr(environment, flagsToEnvironmentVariables.get(flag), defaultValue, "(default)"), defaultValue);
    }

    private static Action parseAction(String value) {
        try {
            return Action.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static int parsePositiveInt(String flag, String value, boolean zeroAllowed) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--%s must be a number, got: %s".formatted(flag, value), e);
        }
        if (parsed < 0 || (parsed == 0 && !zeroAllowed)) {
            throw new ConfigurationException("--%s must be positive, got: %s".formatted(flag, value));
        }
        return parsed;
    }
}
