package com.fxfeed.application.port.out;

import io.vertx.core.Future;

/**
 * Output port for downloading a plain-text rate feed
 * Part of hexagonal architecture - defines what the application needs
 */
public interface RateFeedFetcher {

    /**
     * Perform a single request for the feed, without retry
     * @param url Absolute feed URL, must be non-empty
     * @return Future with the response body, or failed with {@link FeedFetchException}
     * @throws IllegalArgumentException if url is null or empty
     */
    Future<String> fetch(String url);
}
