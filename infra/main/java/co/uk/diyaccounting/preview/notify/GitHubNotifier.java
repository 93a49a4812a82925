/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.notify;

import co.uk.diyaccounting.preview.errors.NotificationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Posts issue comments through the GitHub REST API. Pull requests are issues for commenting purposes.
 */
public class GitHubNotifier implements Notifier, Closeable {

    private static final Logger logger = LogManager.getLogger(GitHubNotifier.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String GITHUB_MEDIA_TYPE = "application/vnd.github+json";
    public static final String GITHUB_API_VERSION = "2022-11-28";

    private final CloseableHttpClient httpClient;
    private final String apiUrl;
    private final String token;

    public GitHubNotifier(String apiUrl, String token) {
        this(HttpClients.createDefault(), apiUrl, token);
    }

    public GitHubNotifier(CloseableHttpClient httpClient, String apiUrl, String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
    }

    @Override
    public void postComment(String repoOwner, String repoName, int issueNumber, String text) {
        var uri = buildCommentsUri(repoOwner, repoName, issueNumber);
        var post = new HttpPost(uri);
        post.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        post.setHeader(HttpHeaders.ACCEPT, GITHUB_MEDIA_TYPE);
        post.setHeader("X-GitHub-Api-Version", GITHUB_API_VERSION);
        post.setEntity(new StringEntity(toJsonBody(text), ContentType.APPLICATION_JSON));

        logger.info("Posting comment to {}/{}#{}", repoOwner, repoName, issueNumber);
        try {
            httpClient.execute(post, response -> {
                var body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
                if (response.getCode() != HttpStatus.SC_CREATED) {
                    throw new NotificationException("GitHub returned %d for %s: %s"
                            .formatted(response.getCode(), uri, body));
                }
                return null;
            });
        } catch (IOException e) {
            throw new NotificationException("failed to post comment to %s: %s".formatted(uri, e.getMessage()), e);
        }
        logger.info("GitHub comment posted to {}/{}#{}", repoOwner, repoName, issueNumber);
    }

    String buildCommentsUri(String repoOwner, String repoName, int issueNumber) {
        return "%s/repos/%s/%s/issues/%d/comments".formatted(apiUrl, repoOwner, repoName, issueNumber);
    }

    static String toJsonBody(String text) {
        try {
            return objectMapper.writeValueAsString(Map.of("body", text));
        } catch (JsonProcessingException e) {
            throw new NotificationException("failed to serialise comment", e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
