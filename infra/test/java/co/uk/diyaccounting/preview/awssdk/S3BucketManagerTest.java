/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteMarkerEntry;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectVersion;
import software.amazon.awssdk.services.s3.model.PutPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;

class S3BucketManagerTest {

    private static S3Exception notFound() {
        return (S3Exception) S3Exception.builder().statusCode(404).message("Not Found").build();
    }

    private static ObjectVersion version(String key, String versionId) {
        return ObjectVersion.builder().key(key).versionId(versionId).build();
    }

    @Test
    void ensureBucketCreatesInUsEast1WithoutLocationConstraint() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(notFound());

        assertTrue(new S3BucketManager(s3).ensureBucket("pr-1-site", "us-east-1"));

        ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
        verify(s3).createBucket(captor.capture());
        assertEquals("pr-1-site", captor.getValue().bucket());
        assertNull(captor.getValue().createBucketConfiguration());
    }

    @Test
    void ensureBucketBlocksAllPublicAccessAfterCreating() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(notFound());

        new S3BucketManager(s3).ensureBucket("pr-1-site", "us-east-1");

        var order = inOrder(s3);
        order.verify(s3).createBucket(any(CreateBucketRequest.class));
        ArgumentCaptor<PutPublicAccessBlockRequest> captor = ArgumentCaptor.forClass(PutPublicAccessBlockRequest.class);
        order.verify(s3).putPublicAccessBlock(captor.capture());
        assertEquals("pr-1-site", captor.getValue().bucket());
        var configuration = captor.getValue().publicAccessBlockConfiguration();
        assertTrue(configuration.blockPublicAcls());
        assertTrue(configuration.ignorePublicAcls());
        assertTrue(configuration.blockPublicPolicy());
        assertTrue(configuration.restrictPublicBuckets());
    }

    @Test
    void ensureBucketSetsLocationConstraintOutsideUsEast1() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(NoSuchBucketException.builder().message("missing").build());

        assertTrue(new S3BucketManager(s3).ensureBucket("pr-1-site", "eu-west-2"));

        ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
        verify(s3).createBucket(captor.capture());
        assertEquals(
                "eu-west-2",
                captor.getValue().createBucketConfiguration().locationConstraintAsString());
    }

    @Test
    void ensureBucketLeavesExistingBucketAlone() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());

        assertFalse(new S3BucketManager(s3).ensureBucket("pr-1-site", "us-east-1"));
        verify(s3, never()).createBucket(any(CreateBucketRequest.class));
        verify(s3, never()).putPublicAccessBlock(any(PutPublicAccessBlockRequest.class));
    }

    @Test
    void existsRethrowsErrorsOtherThanNotFound() {
        S3Client s3 = mock(S3Client.class);
        var forbidden = (S3Exception) S3Exception.builder().statusCode(403).message("Forbidden").build();
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(forbidden);

        var thrown = assertThrows(S3Exception.class, () -> new S3BucketManager(s3).exists("pr-1-site"));
        assertSame(forbidden, thrown);
    }

    @Test
    void emptyAndDeleteWalksEveryPageBeforeDeletingTheBucket() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .versions(version("index.html", "null"), version("app.js", "null"))
                        .isTruncated(true)
                        .nextKeyMarker("app.js")
                        .nextVersionIdMarker("null")
                        .build())
                .thenReturn(ListObjectVersionsResponse.builder()
                        .versions(version("style.css", "null"))
                        .isTruncated(false)
                        .build());
        when(s3.deleteObjects(any(DeleteObjectsRequest.class))).thenReturn(DeleteObjectsResponse.builder().build());

        assertTrue(new S3BucketManager(s3).emptyAndDelete("pr-1-site"));

        ArgumentCaptor<ListObjectVersionsRequest> listCaptor =
                ArgumentCaptor.forClass(ListObjectVersionsRequest.class);
        verify(s3, times(2)).listObjectVersions(listCaptor.capture());
        assertNull(listCaptor.getAllValues().get(0).keyMarker());
        assertEquals("app.js", listCaptor.getAllValues().get(1).keyMarker());
        assertEquals("null", listCaptor.getAllValues().get(1).versionIdMarker());

        ArgumentCaptor<DeleteObjectsRequest> deleteCaptor = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(s3, times(2)).deleteObjects(deleteCaptor.capture());
        assertEquals(2, deleteCaptor.getAllValues().get(0).delete().objects().size());
        assertEquals("style.css", deleteCaptor.getAllValues().get(1).delete().objects().get(0).key());

        var order = inOrder(s3);
        order.verify(s3, times(2)).deleteObjects(any(DeleteObjectsRequest.class));
        order.verify(s3).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void emptyAndDeleteRemovesEveryVersionAndDeleteMarkerOfAVersionedBucket() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .versions(version("index.html", "v2"), version("index.html", "v1"))
                        .deleteMarkers(DeleteMarkerEntry.builder()
                                .key("old.html")
                                .versionId("m1")
                                .build())
                        .isTruncated(false)
                        .build());
        when(s3.deleteObjects(any(DeleteObjectsRequest.class))).thenReturn(DeleteObjectsResponse.builder().build());

        assertTrue(new S3BucketManager(s3).emptyAndDelete("pr-1-site"));

        ArgumentCaptor<DeleteObjectsRequest> deleteCaptor = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(s3).deleteObjects(deleteCaptor.capture());
        var deleted = deleteCaptor.getValue().delete().objects();
        assertEquals(
                List.of("index.html@v2", "index.html@v1", "old.html@m1"),
                deleted.stream().map(o -> o.key() + "@" + o.versionId()).collect(Collectors.toList()));
        verify(s3).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void emptyAndDeleteOfMissingBucketIsANoOp() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(notFound());

        assertFalse(new S3BucketManager(s3).emptyAndDelete("pr-1-site"));
        verify(s3, never()).listObjectVersions(any(ListObjectVersionsRequest.class));
        verify(s3, never()).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void emptyAndDeleteStopsWhenObjectsFailToDelete() {
        S3Client s3 = mock(S3Client.class);
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .versions(version("index.html", "null"))
                        .isTruncated(false)
                        .build());
        when(s3.deleteObjects(any(DeleteObjectsRequest.class)))
                .thenReturn(DeleteObjectsResponse.builder()
                        .errors(S3Error.builder().key("index.html").message("Access Denied").build())
                        .build());

        var thrown = assertThrows(
                IllegalStateException.class, () -> new S3BucketManager(s3).emptyAndDelete("pr-1-site"));
        assertTrue(thrown.getMessage().contains("index.html"));
        verify(s3, never()).deleteBucket(any(DeleteBucketRequest.class));
    }
}
