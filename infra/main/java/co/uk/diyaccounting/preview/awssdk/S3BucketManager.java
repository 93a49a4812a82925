/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteMarkerEntry;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.ObjectVersion;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.PutPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

public class S3BucketManager {

    private static final Logger logger = LogManager.getLogger(S3BucketManager.class);

    // CreateBucket rejects a LocationConstraint of us-east-1
    static final String DEFAULT_BUCKET_REGION = "us-east-1";

    private final S3Client s3Client;

    public S3BucketManager(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    /**
     * Creates the bucket unless it already exists and blocks all public access to it. Content is
     * only ever read through CloudFront origin access control.
     *
     * @return true if the bucket was created by this call
     */
    public boolean ensureBucket(String bucketName, String region) {
        if (exists(bucketName)) {
            logger.info("Bucket {} already exists", bucketName);
            return false;
        }
        var request = CreateBucketRequest.builder().bucket(bucketName);
        if (!DEFAULT_BUCKET_REGION.equals(region)) {
            request.createBucketConfiguration(
                    CreateBucketConfiguration.builder().locationConstraint(region).build());
        }
        s3Client.createBucket(request.build());
        logger.info("Bucket {} created in {}", bucketName, region);
        blockPublicAccess(bucketName);
        return true;
    }

    void blockPublicAccess(String bucketName) {
        s3Client.putPublicAccessBlock(PutPublicAccessBlockRequest.builder()
                .bucket(bucketName)
                .publicAccessBlockConfiguration(PublicAccessBlockConfiguration.builder()
                        .blockPublicAcls(true)
                        .ignorePublicAcls(true)
                        .blockPublicPolicy(true)
                        .restrictPublicBuckets(true)
                        .build())
                .build());
        logger.info("Public access blocked on bucket {}", bucketName);
    }

    public boolean exists(String bucketName) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            // HeadBucket has no body so a missing bucket can surface as a bare 404
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Deletes every object version and delete marker, then the bucket itself. Listing versions
     * also covers unversioned buckets, where each object has the version id {@code null}.
     *
     * @return false if there was no bucket to delete
     */
    public boolean emptyAndDelete(String bucketName) {
        if (!exists(bucketName)) {
            logger.info("Bucket {} does not exist", bucketName);
            return false;
        }
        int deleted = 0;
        String keyMarker = null;
        String versionIdMarker = null;
        boolean truncated;
        do {
            var page = s3Client.listObjectVersions(ListObjectVersionsRequest.builder()
                    .bucket(bucketName)
                    .keyMarker(keyMarker)
                    .versionIdMarker(versionIdMarker)
                    .build());
            var versions = page.hasVersions() ? page.versions() : List.<ObjectVersion>of();
            var markers = page.hasDeleteMarkers() ? page.deleteMarkers() : List.<DeleteMarkerEntry>of();
            var identifiers = Stream.concat(
                            versions.stream().map(v -> identifier(v.key(), v.versionId())),
                            markers.stream().map(m -> identifier(m.key(), m.versionId())))
                    .collect(Collectors.toList());
            if (!identifiers.isEmpty()) {
                deleteObjects(bucketName, identifiers);
                deleted += identifiers.size();
            }
            truncated = Boolean.TRUE.equals(page.isTruncated());
            keyMarker = page.nextKeyMarker();
            versionIdMarker = page.nextVersionIdMarker();
        } while (truncated);
        logger.info("Deleted {} object versions from bucket {}", deleted, bucketName);

        s3Client.deleteBucket(DeleteBucketRequest.builder().bucket(bucketName).build());
        logger.info("Bucket {} deleted", bucketName);
        return true;
    }

    private static ObjectIdentifier identifier(String key, String versionId) {
        return ObjectIdentifier.builder().key(key).versionId(versionId).build();
    }

    private void deleteObjects(String bucketName, List<ObjectIdentifier> identifiers) {
        var response = s3Client.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucketName)
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build());
        if (response != null && response.hasErrors() && !response.errors().isEmpty()) {
            var first = response.errors().get(0);
            throw new IllegalStateException("failed to delete %d objects from %s, first %s: %s"
                    .formatted(response.errors().size(), bucketName, first.key(), first.message()));
        }
    }
}
