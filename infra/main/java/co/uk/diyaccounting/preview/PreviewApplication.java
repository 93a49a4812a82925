/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview;

import co.uk.diyaccounting.preview.awssdk.AliasScanDistributionLookup;
import co.uk.diyaccounting.preview.awssdk.BucketPolicyWriter;
import co.uk.diyaccounting.preview.awssdk.CacheInvalidator;
import co.uk.diyaccounting.preview.awssdk.ContentSync;
import co.uk.diyaccounting.preview.awssdk.DistributionManager;
import co.uk.diyaccounting.preview.awssdk.DnsRecordManager;
import co.uk.diyaccounting.preview.awssdk.OriginAccessControlManager;
import co.uk.diyaccounting.preview.awssdk.PreviewClients;
import co.uk.diyaccounting.preview.awssdk.S3BucketManager;
import co.uk.diyaccounting.preview.awssdk.Sleeper;
import co.uk.diyaccounting.preview.errors.ConfigurationException;
import co.uk.diyaccounting.preview.lifecycle.EnvironmentController;
import co.uk.diyaccounting.preview.notify.GitHubNotifier;
import co.uk.diyaccounting.preview.notify.LoggingNotifier;
import co.uk.diyaccounting.preview.notify.Notifier;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point: {@code deploy} or {@code cleanup} one pull request preview environment.
 */
public class PreviewApplication {

    private static final Logger logger = LogManager.getLogger(PreviewApplication.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION_ERROR = 2;

    private final Function<PreviewConfig, PreviewClients> clientsFactory;
    private final Function<PreviewConfig, Notifier> notifierFactory;
    private final Clock clock;
    private final Sleeper sleeper;

    public PreviewApplication() {
        this(
                config -> PreviewClients.create(config.region()),
                PreviewApplication::createNotifier,
                Clock.systemUTC(),
                Sleeper.THREAD);
    }

    public PreviewApplication(
            Function<PreviewConfig, PreviewClients> clientsFactory,
            Function<PreviewConfig, Notifier> notifierFactory,
            Clock clock,
            Sleeper sleeper) {
        this.clientsFactory = clientsFactory;
        this.notifierFactory = notifierFactory;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static void main(final String[] args) {
        System.exit(new PreviewApplication().run(args, System.getenv()));
    }

    public int run(String[] args, Map<String, String> environment) {
        PreviewConfig config;
        try {
            config = new PreviewConfigLoader(environment).load(args);
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.printf("Configuration error: %s%n", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        var previewEnvironment = config.environment();
        System.out.printf(
                "Running %s for PR #%d (%s) in %s%n",
                config.action().cliName(),
                previewEnvironment.prNumber(),
                previewEnvironment.hostname(),
                config.region());

        var notifier = notifierFactory.apply(config);
        try (var clients = clientsFactory.apply(config)) {
            var controller = buildController(config, clients, notifier);
            if (config.action() == Action.CLEANUP) {
                var report = controller.cleanup(previewEnvironment);
                for (var result : report.results()) {
                    System.out.printf("  %-30s %s%n", result.step(), result.status());
                }
                System.out.printf("Cleanup complete for %s%n", report.hostname());
                logger.info("Cleanup report: {}", report.toJson());
            } else {
                var result = controller.deploy(previewEnvironment, config.sourcePath(), config.certificateArn());
                System.out.printf("Preview environment deployed: %s%n", result.hostname());
                System.out.printf("URL: %s%n", result.baseUrl());
                System.out.printf(
                        "Distribution: %s (%d files uploaded)%n", result.distributionId(), result.filesUploaded());
            }
            return EXIT_SUCCESS;
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.printf("Configuration error: %s%n", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (RuntimeException e) {
            logger.error("{} failed for {}", config.action().cliName(), previewEnvironment.hostname(), e);
            System.err.printf("Error: %s%n", e.getMessage());
            return EXIT_FAILURE;
        } finally {
            closeNotifier(notifier);
        }
    }

    EnvironmentController buildController(PreviewConfig config, PreviewClients clients, Notifier notifier) {
        var distributionManager = new DistributionManager(
                clients.cloudFrontClient(),
                new AliasScanDistributionLookup(clients.cloudFrontClient()),
                clock,
                sleeper,
                config.distributionWaitTimeout(),
                config.distributionPollInterval());
        return EnvironmentController.Builder.create()
                .bucketManager(new S3BucketManager(clients.s3Client()))
                .contentSync(new ContentSync(clients.s3Client()))
                .originAccessControlManager(new OriginAccessControlManager(clients.cloudFrontClient()))
                .distributionManager(distributionManager)
                .bucketPolicyWriter(new BucketPolicyWriter(clients.s3Client()))
                .cacheInvalidator(new CacheInvalidator(clients.cloudFrontClient(), clock))
                .dnsRecordManager(new DnsRecordManager(clients.route53Client()))
                .notifier(notifier)
                .repository(config.repoOwner(), config.repoName())
                .build();
    }

    static Notifier createNotifier(PreviewConfig config) {
        if (config.githubToken().isPresent()) {
            return new GitHubNotifier(config.githubApiUrl(), config.githubToken().get());
        }
        logger.info("GITHUB_TOKEN is not set, PR comments will be logged only");
        return new LoggingNotifier();
    }

    private static void closeNotifier(Notifier notifier) {
        if (notifier instanceof Closeable) {
            try {
                ((Closeable) notifier).close();
            } catch (IOException e) {
                logger.warn("Failed to close notifier: {}", e.getMessage());
            }
        }
    }
}
