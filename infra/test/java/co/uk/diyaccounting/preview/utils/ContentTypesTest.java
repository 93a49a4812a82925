/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ContentTypesTest {

    @Test
    void knownExtensions() {
        assertEquals("text/html", ContentTypes.forFileName("index.html"));
        assertEquals("text/css", ContentTypes.forFileName("assets/site.css"));
        assertEquals("application/javascript", ContentTypes.forFileName("assets/app.js"));
        assertEquals("application/json", ContentTypes.forFileName("manifest.json"));
        assertEquals("image/png", ContentTypes.forFileName("logo.png"));
        assertEquals("image/jpeg", ContentTypes.forFileName("photo.jpg"));
        assertEquals("image/jpeg", ContentTypes.forFileName("photo.jpeg"));
        assertEquals("image/gif", ContentTypes.forFileName("spinner.gif"));
        assertEquals("image/svg+xml", ContentTypes.forFileName("icon.svg"));
        assertEquals("image/x-icon", ContentTypes.forFileName("favicon.ico"));
        assertEquals("application/xml", ContentTypes.forFileName("sitemap.xml"));
        assertEquals("application/pdf", ContentTypes.forFileName("docs/guide.pdf"));
        assertEquals("text/plain", ContentTypes.forFileName("robots.txt"));
    }

    @Test
    void extensionMatchIsCaseInsensitive() {
        assertEquals("text/html", ContentTypes.forFileName("INDEX.HTML"));
        assertEquals("image/png", ContentTypes.forFileName("Logo.Png"));
    }

    @Test
    void unknownOrMissingExtensionFallsBackToOctetStream() {
        assertEquals(ContentTypes.DEFAULT_CONTENT_TYPE, ContentTypes.forFileName("fonts/inter.woff2"));
        assertEquals(ContentTypes.DEFAULT_CONTENT_TYPE, ContentTypes.forFileName("LICENSE"));
        assertEquals(ContentTypes.DEFAULT_CONTENT_TYPE, ContentTypes.forFileName("v1.2/README"));
        assertEquals("application/octet-stream", ContentTypes.DEFAULT_CONTENT_TYPE);
    }

    @Test
    void extensionIsTakenFromTheLastSegmentOnly() {
        assertEquals(".gz", ContentTypes.extensionOf("bundle.js.gz"));
        assertEquals("", ContentTypes.extensionOf("release.d/notes"));
        assertEquals("", ContentTypes.extensionOf(null));
    }
}
