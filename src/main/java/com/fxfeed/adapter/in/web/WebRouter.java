package com.fxfeed.adapter.in.web;

import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for exchange rate endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private static final String NOT_FOUND = "{\"status\":\"error\",\"message\":\"Endpoint not found\"}";

    private final Router router;
    private final ExchangeRateQueryHandler exchangeRateQueryHandler;

    public void setupRoutes() {
        router.get("/api/exchange-rates")
                .handler(exchangeRateQueryHandler);

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"fx-feed-rates\"}"));

        // Default route - 404
        router.route().handler(ctx -> ctx.response()
                .setStatusCode(404)
                .putHeader("Content-Type", "application/json")
                .end(NOT_FOUND));
    }
}
