/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import co.uk.diyaccounting.preview.errors.ConfigurationException;
import co.uk.diyaccounting.preview.utils.ContentTypes;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Uploads a built site to the environment bucket, one object per regular file.
 */
public class ContentSync {

    private static final Logger logger = LogManager.getLogger(ContentSync.class);

    private final S3Client s3Client;

    public ContentSync(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    public record ContentItem(String key, Path file, String contentType) {}

    /**
     * @return the number of files uploaded
     */
    public int sync(Path sourceDir, String bucketName) {
        var items = collect(sourceDir);
        logger.info("Syncing {} files from {} to bucket {}", items.size(), sourceDir, bucketName);
        for (var item : items) {
            try {
                s3Client.putObject(
                        PutObjectRequest.builder()
                                .bucket(bucketName)
                                .key(item.key())
                                .contentType(item.contentType())
                                .build(),
                        RequestBody.fromFile(item.file()));
            } catch (SdkException | UncheckedIOException e) {
                throw new IllegalStateException("failed to upload %s: %s".formatted(item.key(), e.getMessage()), e);
            }
            logger.debug("Uploaded {} as {}", item.key(), item.contentType());
        }
        logger.info("Uploaded {} files", items.size());
        return items.size();
    }

    public static List<ContentItem> collect(Path sourceDir) {
        requireDirectory(sourceDir);
        try (Stream<Path> paths = Files.walk(sourceDir)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .map(file -> {
                        var key = toKey(sourceDir, file);
                        return new ContentItem(key, file, ContentTypes.forFileName(key));
                    })
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to walk %s".formatted(sourceDir), e);
        }
    }

    public static void requireDirectory(Path sourceDir) {
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new ConfigurationException("source directory %s does not exist or is not a directory"
                    .formatted(sourceDir));
        }
    }

    static String toKey(Path sourceDir, Path file) {
        var relative = sourceDir.relativize(file);
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }
}
