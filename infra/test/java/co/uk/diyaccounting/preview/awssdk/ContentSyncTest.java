/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.uk.diyaccounting.preview.errors.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

class ContentSyncTest {

    @TempDir
    Path sourceDir;

    private void writeSite() throws IOException {
        Files.writeString(sourceDir.resolve("index.html"), "<html></html>");
        Files.createDirectories(sourceDir.resolve("assets/img"));
        Files.writeString(sourceDir.resolve("assets/app.js"), "console.log('hi')");
        Files.write(sourceDir.resolve("assets/img/logo.PNG"), new byte[] {1, 2, 3});
        Files.writeString(sourceDir.resolve("assets/font.woff2"), "font");
    }

    @Test
    void collectUsesForwardSlashKeysAndContentTypes() throws IOException {
        writeSite();

        var items = ContentSync.collect(sourceDir);
        Map<String, String> typesByKey = items.stream()
                .collect(Collectors.toMap(ContentSync.ContentItem::key, ContentSync.ContentItem::contentType));

        assertEquals(4, items.size());
        assertEquals("text/html", typesByKey.get("index.html"));
        assertEquals("application/javascript", typesByKey.get("assets/app.js"));
        assertEquals("image/png", typesByKey.get("assets/img/logo.PNG"));
        assertEquals("application/octet-stream", typesByKey.get("assets/font.woff2"));
    }

    @Test
    void syncUploadsEachFileWithItsContentType() throws IOException {
        writeSite();
        S3Client s3 = mock(S3Client.class);
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        int uploaded = new ContentSync(s3).sync(sourceDir, "pr-42-site");

        assertEquals(4, uploaded);
        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3, times(4)).putObject(captor.capture(), any(RequestBody.class));
        var requests = captor.getAllValues().stream()
                .collect(Collectors.toMap(PutObjectRequest::key, r -> r));
        assertEquals("pr-42-site", requests.get("index.html").bucket());
        assertEquals("text/html", requests.get("index.html").contentType());
        assertEquals("image/png", requests.get("assets/img/logo.PNG").contentType());
    }

    @Test
    void emptyDirectoryUploadsNothing() {
        S3Client s3 = mock(S3Client.class);
        assertEquals(0, new ContentSync(s3).sync(sourceDir, "pr-42-site"));
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void missingSourceDirectoryIsAConfigurationError() throws IOException {
        S3Client s3 = mock(S3Client.class);
        var missing = sourceDir.resolve("dist");
        assertThrows(ConfigurationException.class, () -> new ContentSync(s3).sync(missing, "pr-42-site"));

        var file = Files.writeString(sourceDir.resolve("not-a-dir.txt"), "x");
        assertThrows(ConfigurationException.class, () -> ContentSync.requireDirectory(file));
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void uploadFailureNamesTheObject() throws IOException {
        Files.writeString(sourceDir.resolve("index.html"), "<html></html>");
        S3Client s3 = mock(S3Client.class);
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        var thrown = assertThrows(IllegalStateException.class, () -> new ContentSync(s3).sync(sourceDir, "pr-42-site"));
        assertTrue(thrown.getMessage().startsWith("failed to upload index.html"));
    }
}
