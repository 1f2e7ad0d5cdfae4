package com.fxfeed.adapter.out.http;

import com.fxfeed.application.port.out.FeedFetchException;
import com.fxfeed.application.port.out.RateFeedFetcher;
import io.vertx.core.Future;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP adapter to download rate feeds from the publishing source
 * Implements RateFeedFetcher output port
 * The HttpClient is owned by the caller and may be shared between concurrent requests
 */
@Slf4j
public class RateFeedHttpAdapter implements RateFeedFetcher {

    private final HttpClient httpClient;
    private final long timeoutMs;

    /**
     * @param httpClient Shared Vert.x client
     * @param timeoutMs Request timeout, 0 for none
     */
    public RateFeedHttpAdapter(HttpClient httpClient, long timeoutMs) {
        if (httpClient == null) {
            throw new IllegalArgumentException("HTTP client cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeoutMs);
        }
        this.httpClient = httpClient;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<String> fetch(String url) {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }

        RequestOptions options;
        try {
            options = new RequestOptions()
                    .setMethod(HttpMethod.GET)
                    .setAbsoluteURI(url)
                    .setFollowRedirects(true);
        } catch (RuntimeException e) {
            log.warn("Invalid feed URL {}: {}", url, e.getMessage());
            return Future.failedFuture(new FeedFetchException(url, e));
        }
        if (timeoutMs > 0) {
            options.setTimeout(timeoutMs);
        }

        log.info("Fetching rate feed from {}", url);

        return httpClient.request(options)
                .compose(request -> request.send())
                .compose(response -> readBody(url, response))
                .onSuccess(body -> log.debug("Fetched {} characters from {}", body.length(), url))
                .recover(error -> {
                    log.warn("Rate feed request to {} failed: {}", url, error.getMessage());
                    if (error instanceof FeedFetchException) {
                        return Future.failedFuture(error);
                    }
                    return Future.failedFuture(new FeedFetchException(url, error));
                });
    }

    private Future<String> readBody(String url, HttpClientResponse response) {
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            // drain the body so the connection can be reused
            response.end();
            return Future.failedFuture(new FeedFetchException(url, "HTTP status code " + statusCode));
        }
        return response.body().map(buffer -> buffer.toString());
    }
}
