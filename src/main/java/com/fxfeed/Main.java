package com.fxfeed;

import com.fxfeed.adapter.in.web.HttpServerVerticle;
import com.fxfeed.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting FX Feed Rates service...");

        JsonObject config = new ConfigLoader().load();

        Vertx vertx = Vertx.vertx();

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down FX Feed Rates service...");
                        vertx.close();
                    }));

                    log.info("FX Feed Rates service is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }
}
