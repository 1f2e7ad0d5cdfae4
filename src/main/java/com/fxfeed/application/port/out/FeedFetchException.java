package com.fxfeed.application.port.out;

import lombok.Getter;

/**
 * Raised when a rate feed could not be retrieved (bad status, connection failure, timeout)
 */
@Getter
public class FeedFetchException extends RuntimeException {

    private final String url;

    public FeedFetchException(String url, String message) {
        super("Failed to retrieve data from " + url + ": " + message);
        this.url = url;
    }

    public FeedFetchException(String url, Throwable cause) {
        super("Failed to retrieve data from " + url + ": " + cause.getMessage(), cause);
        this.url = url;
    }
}
