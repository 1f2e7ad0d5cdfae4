package com.fxfeed.adapter.in.web;

import com.fxfeed.adapter.out.http.RateFeedHttpAdapter;
import com.fxfeed.application.port.in.ExchangeRateQueryUseCase;
import com.fxfeed.application.port.out.RateFeedFetcher;
import com.fxfeed.application.service.ExchangeRateExtractor;
import com.fxfeed.application.service.ExchangeRateProviderService;
import com.fxfeed.config.FeedRatesConfig;
import com.fxfeed.domain.model.Currency;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP Server Verticle - serves exchange rate queries
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private HttpClient feedHttpClient;
    private HttpServer server;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        FeedRatesConfig feedConfig;
        ExchangeRateQueryHandler queryHandler;
        try {
            feedConfig = FeedRatesConfig.fromJson(config());
            queryHandler = new ExchangeRateQueryHandler(initializeServices(feedConfig));
        } catch (RuntimeException e) {
            log.error("Invalid configuration", e);
            startPromise.fail(e);
            return;
        }

        startHttpServer(feedConfig.httpPort(), queryHandler)
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (feedHttpClient != null) {
            feedHttpClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to, useful when configured with port 0
     */
    public int actualPort() {
        return server != null ? server.actualPort() : -1;
    }

    private ExchangeRateQueryUseCase initializeServices(FeedRatesConfig feedConfig) {
        // One client for the verticle lifetime, shared by concurrent queries
        feedHttpClient = vertx.createHttpClient(new HttpClientOptions().setTryUseCompression(true));
        RateFeedFetcher feedFetcher = new RateFeedHttpAdapter(feedHttpClient, feedConfig.timeoutMs());

        ExchangeRateExtractor extractor = new ExchangeRateExtractor(new Currency(feedConfig.referenceCurrency()));
        ExchangeRateQueryUseCase queryUseCase = new ExchangeRateProviderService(
                feedFetcher,
                extractor,
                feedConfig.commonCurrenciesUrl(),
                feedConfig.otherCurrenciesUrl()
        );

        log.info("Services wired up: common feed {}, other feed {}",
                feedConfig.commonCurrenciesUrl(), feedConfig.otherCurrenciesUrl());
        return queryUseCase;
    }

    private Future<Void> startHttpServer(int port, ExchangeRateQueryHandler queryHandler) {
        Router router = Router.router(vertx);
        router.route().handler(LoggerHandler.create());

        new WebRouter(router, queryHandler).setupRoutes();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(httpServer -> {
                    server = httpServer;
                    log.info("HTTP server listening on port {}", httpServer.actualPort());
                })
                .mapEmpty();
    }
}
