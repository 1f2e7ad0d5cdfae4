package com.fxfeed.adapter.out.http;

import com.fxfeed.application.port.out.FeedFetchException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for RateFeedHttpAdapter against a local feed server
 */
class RateFeedHttpAdapterTest {

    private static final String FEED_BODY = "18.10.2026 #201\nzemě|měna|množství|kód|kurz\nUSA|dolar|1|USD|22,871\n";

    private Vertx vertx;
    private HttpServer server;
    private HttpClient httpClient;
    private RateFeedHttpAdapter adapter;
    private final AtomicInteger requestCount = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = vertx.createHttpServer()
                .requestHandler(request -> {
                    requestCount.incrementAndGet();
                    switch (request.path()) {
                        case "/feed.txt" -> request.response()
                                .putHeader("Content-Type", "text/plain; charset=UTF-8")
                                .end(FEED_BODY);
                        case "/moved.txt" -> request.response()
                                .setStatusCode(302)
                                .putHeader("Location", "/feed.txt")
                                .end();
                        case "/slow.txt" -> vertx.setTimer(2000, id -> request.response().end(FEED_BODY));
                        default -> request.response().setStatusCode(404).end("not found");
                    }
                })
                .listen(0)
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        httpClient = vertx.createHttpClient();
        adapter = new RateFeedHttpAdapter(httpClient, 500);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void fetch_shouldReturnBody() throws Exception {
        // When
        String body = await(adapter.fetch(url("/feed.txt")));

        // Then
        assertEquals(FEED_BODY, body);
        assertEquals(1, requestCount.get());
    }

    @Test
    void fetch_shouldFollowRedirects() throws Exception {
        assertEquals(FEED_BODY, await(adapter.fetch(url("/moved.txt"))));
    }

    @Test
    void fetch_shouldFailOnErrorStatus() throws InterruptedException {
        String url = url("/missing.txt");
        CountDownLatch latch = new CountDownLatch(1);

        // When
        adapter.fetch(url)
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.failed());
                    assertInstanceOf(FeedFetchException.class, ar.cause());
                    assertEquals(url, ((FeedFetchException) ar.cause()).getUrl());
                    assertTrue(ar.cause().getMessage().contains("404"));
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(1, requestCount.get());
    }

    @Test
    void fetch_shouldFailOnTimeout() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        adapter.fetch(url("/slow.txt"))
                .onComplete(ar -> {
                    assertTrue(ar.failed());
                    assertInstanceOf(FeedFetchException.class, ar.cause());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void fetch_shouldFailOnConnectionError() throws Exception {
        // Given - nothing listens on the port after the server is closed
        String url = url("/feed.txt");
        server.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        CountDownLatch latch = new CountDownLatch(1);

        // When
        adapter.fetch(url)
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.failed());
                    assertInstanceOf(FeedFetchException.class, ar.cause());
                    assertEquals(url, ((FeedFetchException) ar.cause()).getUrl());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void fetch_shouldFailOnMalformedUrl() {
        Future<String> future = adapter.fetch("not a url");

        assertTrue(future.failed());
        assertInstanceOf(FeedFetchException.class, future.cause());
        assertEquals(0, requestCount.get());
    }

    @Test
    void fetch_shouldRejectEmptyUrlBeforeAnyRequest() {
        assertThrows(IllegalArgumentException.class, () -> adapter.fetch(""));
        assertThrows(IllegalArgumentException.class, () -> adapter.fetch(null));
        assertEquals(0, requestCount.get());
    }

    @Test
    void constructor_shouldValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RateFeedHttpAdapter(null, 0));
        assertThrows(IllegalArgumentException.class, () -> new RateFeedHttpAdapter(httpClient, -1));
    }

    private String url(String path) {
        return "http://localhost:" + server.actualPort() + path;
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
