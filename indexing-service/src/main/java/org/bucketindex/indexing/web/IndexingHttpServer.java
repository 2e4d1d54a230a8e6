package org.bucketindex.indexing.web;

import org.bucketindex.indexing.controller.IndexingController;
import org.bucketindex.indexing.service.IndexingService;

import io.javalin.Javalin;

/** HTTP server wiring for the Indexing Service. */
public final class IndexingHttpServer {
    private IndexingHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind, {@code 0} for any free port
     * @param indexingService service used by route handlers
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, IndexingService indexingService) {
        Javalin app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.http.defaultContentType = "application/json";
        });
        new IndexingController(indexingService).registerRoutes(app);
        return app.start(port);
    }
}
