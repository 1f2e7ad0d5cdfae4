package com.fxfeed.config;

import io.vertx.core.json.JsonObject;

/**
 * Typed view of the configuration used to build the rate provider
 */
public record FeedRatesConfig(
        int httpPort,
        String commonCurrenciesUrl,
        String otherCurrenciesUrl,
        long timeoutMs,
        String referenceCurrency
) {
    static final String COMMON_URL_KEY = "common-currencies-url";
    static final String OTHER_URL_KEY = "other-currencies-url";

    private static final int DEFAULT_PORT = 8080;
    private static final long DEFAULT_TIMEOUT_MS = 10_000;
    private static final String DEFAULT_REFERENCE_CURRENCY = "CZK";

    public static FeedRatesConfig fromJson(JsonObject config) {
        JsonObject http = config.getJsonObject("http", new JsonObject());
        JsonObject feeds = config.getJsonObject("feeds");
        if (feeds == null) {
            throw new IllegalArgumentException("Feed configuration not found");
        }
        JsonObject rates = config.getJsonObject("rates", new JsonObject());

        return new FeedRatesConfig(
                http.getInteger("port", DEFAULT_PORT),
                requireUrl(feeds, COMMON_URL_KEY),
                requireUrl(feeds, OTHER_URL_KEY),
                feeds.getLong("timeout-ms", DEFAULT_TIMEOUT_MS),
                rates.getString("reference-currency", DEFAULT_REFERENCE_CURRENCY)
        );
    }

    private static String requireUrl(JsonObject feeds, String key) {
        String url = feeds.getString(key);
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("feeds." + key + " is required");
        }
        return url;
    }
}
