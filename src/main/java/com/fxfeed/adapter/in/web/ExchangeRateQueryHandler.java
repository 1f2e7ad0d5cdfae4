package com.fxfeed.adapter.in.web;

import com.fxfeed.application.port.in.ExchangeRateQueryUseCase;
import com.fxfeed.application.port.out.FeedFetchException;
import com.fxfeed.domain.model.Currency;
import io.vertx.core.Handler;
import io.vertx.core.json.Json;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP handler for exchange rate queries
 * Handles GET /api/exchange-rates?currencies=USD,EUR
 */
@Slf4j
@RequiredArgsConstructor
public class ExchangeRateQueryHandler implements Handler<RoutingContext> {

    static final String CURRENCIES_PARAM = "currencies";
    private static final int CODE_LENGTH = 3;

    private final ExchangeRateQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        List<Currency> currencies;
        try {
            currencies = parseCurrencies(context.queryParam(CURRENCIES_PARAM));
        } catch (IllegalArgumentException e) {
            sendError(context, 400, e.getMessage());
            return;
        }

        log.info("Received exchange rate query for {}", currencies);

        queryUseCase.getRates(currencies)
                .onSuccess(rates -> {
                    log.info("Returning {} exchange rates", rates.size());
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(Json.encode(ExchangeRateResponse.success(rates)));
                })
                .onFailure(error -> {
                    log.error("Failed to query exchange rates: {}", error.getMessage(), error);

                    int statusCode = 500;
                    if (error instanceof IllegalArgumentException) {
                        statusCode = 400;
                    } else if (error instanceof FeedFetchException) {
                        statusCode = 502;
                    }
                    sendError(context, statusCode, error.getMessage());
                });
    }

    static List<Currency> parseCurrencies(List<String> values) {
        List<Currency> currencies = new ArrayList<>();
        for (String value : values) {
            for (String code : value.split(",")) {
                String trimmed = code.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.length() != CODE_LENGTH) {
                    throw new IllegalArgumentException("Invalid currency code: " + trimmed);
                }
                currencies.add(new Currency(trimmed));
            }
        }
        return currencies;
    }

    private void sendError(RoutingContext context, int statusCode, String message) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(ExchangeRateResponse.error(message)));
    }
}
