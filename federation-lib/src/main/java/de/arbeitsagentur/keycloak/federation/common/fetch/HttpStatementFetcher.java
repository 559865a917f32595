/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.keycloak.federation.common.fetch;

import de.arbeitsagentur.keycloak.federation.common.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches federation documents with {@link HttpClient#sendAsync}, one request per URL.
 * <p>
 * All requests of a batch are started before the first one is awaited. The batch shares one
 * deadline; a request still pending when it passes is cancelled and reported as failed.
 */
public class HttpStatementFetcher implements StatementFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(HttpStatementFetcher.class);
    public static final String ENTITY_STATEMENT_MEDIA_TYPE = "application/entity-statement+jwt";

    private final HttpClient httpClient;

    public HttpStatementFetcher() {
        this(FetchParams.defaults());
    }

    public HttpStatementFetcher(FetchParams params) {
        this(HttpClient.newBuilder()
                .connectTimeout(params.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpStatementFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<FetchResult> fetch(List<String> urls, FetchParams params) {
        FetchParams effective = params != null ? params : FetchParams.defaults();
        List<CompletableFuture<HttpResponse<String>>> pending = new ArrayList<>(urls.size());
        for (String url : urls) {
            LOG.debug("Requesting {}", url);
            pending.add(send(url, effective));
        }
        long deadlineNanos = System.nanoTime() + effective.deadline().toNanos();
        List<FetchResult> results = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            results.add(await(urls.get(i), pending.get(i), deadlineNanos));
        }
        return results;
    }

    private CompletableFuture<HttpResponse<String>> send(String url, FetchParams params) {
        try {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Accept", ENTITY_STATEMENT_MEDIA_TYPE)
                    .timeout(params.requestTimeout())
                    .GET();
            if (params.userAgent() != null && !params.userAgent().isBlank()) {
                request.header("User-Agent", params.userAgent());
            }
            return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private FetchResult await(String url, CompletableFuture<HttpResponse<String>> future, long deadlineNanos) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            HttpResponse<String> response = future.get(remaining, TimeUnit.NANOSECONDS);
            LOG.debug("Response from {}: status={}, content-type={}", url, response.statusCode(),
                    response.headers().firstValue("content-type").orElse("(none)"));
            if (response.statusCode() != 200) {
                return failed(url, new FetchException(url, "HTTP " + response.statusCode() + " from " + url));
            }
            String body = response.body() != null ? response.body().trim() : "";
            if (body.isEmpty()) {
                return failed(url, new FetchException(url, "Empty response body from " + url));
            }
            return FetchResult.success(url, body);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(url, new FetchException(url, "Deadline exceeded while fetching " + url, e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(url, new FetchException(url, "Request to " + url + " failed: " + cause.getMessage(), cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(url, new FetchException(url, "Interrupted while fetching " + url, e));
        }
    }

    private static FetchResult failed(String url, FetchException error) {
        LOG.warn("Fetching {} failed: {}", url, error.getMessage());
        return FetchResult.failure(url, error);
    }
}
