/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.utils;

import java.util.Locale;
import java.util.Map;

public final class ContentTypes {
    private ContentTypes() {}

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final Map<String, String> contentTypesByExtension = Map.ofEntries(
            Map.entry(".html", "text/html"),
            Map.entry(".css", "text/css"),
            Map.entry(".js", "application/javascript"),
            Map.entry(".json", "application/json"),
            Map.entry(".png", "image/png"),
            Map.entry(".jpg", "image/jpeg"),
            Map.entry(".jpeg", "image/jpeg"),
            Map.entry(".gif", "image/gif"),
            Map.entry(".svg", "image/svg+xml"),
            Map.entry(".ico", "image/x-icon"),
            Map.entry(".xml", "application/xml"),
            Map.entry(".pdf", "application/pdf"),
            Map.entry(".txt", "text/plain"));

    public static String forFileName(String fileName) {
        return contentTypesByExtension.getOrDefault(extensionOf(fileName), DEFAULT_CONTENT_TYPE);
    }

    // ".html" for "a/b/index.HTML", "" when there is no extension
    static String extensionOf(String fileName) {
        if (fileName == null) return "";
        var slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        var dot = fileName.lastIndexOf('.');
        if (dot <= slash) return "";
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
