package org.bucketindex.indexing.bootstrap;

import org.bucketindex.indexing.config.IndexingConfig;
import org.bucketindex.indexing.service.IndexReport;
import org.bucketindex.indexing.service.IndexingService;
import org.bucketindex.indexing.web.IndexingHttpServer;
import org.bucketindex.store.ParquetColumnarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;
import java.util.Map;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration, opens the Parquet store, optionally builds the index before serving,
 * starts the HTTP server and registers a JVM shutdown hook for clean termination.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     *
     * @param overrides configuration values from the command line
     */
    public static void run(Map<String, String> overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Indexing Service", e);
            System.exit(1);
        }
    }

    private static void start(Map<String, String> overrides) throws IOException {
        IndexingConfig cfg = IndexingConfig.load(overrides);
        logConfiguration(cfg);
        ParquetColumnarStore store = openStore(cfg);
        IndexingService service = new IndexingService(cfg.corpus(), cfg.index(), store);
        buildOnStartup(cfg, service);
        Javalin app = IndexingHttpServer.start(cfg.serverPort(), service);
        addShutdownHook(store, app);
        logger.info("Indexing Service started on port {}", cfg.serverPort());
    }

    private static void logConfiguration(IndexingConfig cfg) {
        logger.info("Configuration:");
        logger.info("  Corpus: {} (limit {})", cfg.corpus().path(), cfg.corpus().documentLimit());
        logger.info("  Index: {} ({} buckets, chunk size {}, {} sample documents, {})",
            cfg.index().path(), cfg.index().bucketCount(), cfg.index().chunkSize(),
            cfg.index().sampleDocuments(), cfg.index().compression());
    }

    private static ParquetColumnarStore openStore(IndexingConfig cfg) {
        return new ParquetColumnarStore(cfg.index().path(), cfg.index().compression(), cfg.index().chunkSize());
    }

    private static void buildOnStartup(IndexingConfig cfg, IndexingService service) throws IOException {
        if (!cfg.index().buildOnStartup()) {
            return;
        }
        logger.info("Building index before serving...");
        IndexReport report = service.build();
        logger.info("Startup build complete: {} documents", report.documents());
    }

    private static void addShutdownHook(ParquetColumnarStore store, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(store, app)));
    }

    private static void shutdown(ParquetColumnarStore store, Javalin app) {
        logger.info("Shutting down Indexing Service...");
        app.stop();
        store.close();
        logger.info("Indexing Service stopped.");
    }
}
