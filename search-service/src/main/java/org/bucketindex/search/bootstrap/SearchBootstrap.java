package org.bucketindex.search.bootstrap;

import org.bucketindex.core.model.SchemaException;
import org.bucketindex.search.config.SearchConfig;
import org.bucketindex.search.controller.SearchController;
import org.bucketindex.search.service.SearchService;
import org.bucketindex.search.web.SearchHttpServer;
import org.bucketindex.store.ParquetColumnarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;
import java.util.Map;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, opens the Parquet index, starts the HTTP API and registers a JVM
 * shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     *
     * @param overrides configuration values from the command line
     */
    public static void run(Map<String, String> overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(Map<String, String> overrides) throws IOException {
        SearchConfig cfg = SearchConfig.load(overrides);
        logger.info("Configuration: index {}, max results {}, default limit {}",
            cfg.indexPath(), cfg.maxResults(), cfg.defaultLimit());
        ParquetColumnarStore store = new ParquetColumnarStore(cfg.indexPath());
        SearchService service = new SearchService(store, cfg.maxResults());
        preloadSchema(service);
        Javalin app = SearchHttpServer.start(cfg.serverPort(), new SearchController(service, cfg.defaultLimit()));
        addShutdownHook(store, app);
        logger.info("Search Service started on port {}", cfg.serverPort());
    }

    private static void preloadSchema(SearchService service) throws IOException {
        try {
            service.reload();
        } catch (SchemaException e) {
            logger.warn("No usable index yet ({}); it will be loaded on the first query", e.getMessage());
        }
    }

    private static void addShutdownHook(ParquetColumnarStore store, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(store, app)));
    }

    private static void shutdown(ParquetColumnarStore store, Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        store.close();
        logger.info("Search Service stopped.");
    }
}
