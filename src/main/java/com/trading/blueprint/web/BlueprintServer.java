package com.trading.blueprint.web;

import io.javalin.Javalin;
import java.io.UncheckedIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A lightweight HTTP server exposing the compiler to editor front ends.
 *
 * <ul>
 * <li>{@code GET /api/catalog}: node palette</li>
 * <li>{@code POST /api/validate}: validation report for a posted graph</li>
 * <li>{@code POST /api/generate?name=...}: strategy source</li>
 * <li>{@code POST /api/preview}: live-preview source</li>
 * </ul>
 * Request bodies are saved-graph JSON documents.
 */
public class BlueprintServer {
    private static final Logger log = LogManager.getLogger(BlueprintServer.class);

    private final BlueprintApi api;
    private Javalin app;

    public BlueprintServer(BlueprintApi api) {
        this.api = api;
    }

    /**
     * Starts the server.
     *
     * @param port The port to listen on, 0 for any free port.
     */
    public void start(int port) {
        log.info("Starting Blueprint Server on port {}", port);

        app = Javalin.create();

        app.get("/api/catalog", ctx -> {
            ctx.contentType("application/json");
            ctx.result(api.catalogJson());
        });
        app.post("/api/validate", ctx -> {
            ctx.contentType("application/json");
            ctx.result(api.validateJson(ctx.body()));
        });
        app.post("/api/generate", ctx -> {
            ctx.contentType("text/plain; charset=utf-8");
            ctx.result(api.generate(ctx.body(), ctx.queryParam("name")));
        });
        app.post("/api/preview", ctx -> {
            ctx.contentType("text/plain; charset=utf-8");
            ctx.result(api.preview(ctx.body()));
        });

        // malformed graph documents
        app.exception(UncheckedIOException.class, (e, ctx) -> {
            log.warn("Bad request on {}: {}", ctx.path(), e.getMessage());
            ctx.status(400);
            ctx.contentType("application/json");
            ctx.result(api.errorJson(e.getMessage()));
        });

        app.start(port);
        log.info("Blueprint Server listening on port {}", app.port());
    }

    public int port() {
        return app == null ? -1 : app.port();
    }

    /**
     * Stops the server.
     */
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            log.info("Blueprint Server stopped");
        }
    }
}
