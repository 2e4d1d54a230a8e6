package org.bucketindex.indexing.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.bucketindex.indexing.model.IndexResponse;
import org.bucketindex.indexing.service.BuildInProgressException;
import org.bucketindex.indexing.service.IndexReport;
import org.bucketindex.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

public class IndexingController {
	private static final Logger logger = LoggerFactory.getLogger(IndexingController.class);
	private static final Gson gson = new Gson();
	private final IndexingService indexingService;

	public IndexingController(IndexingService indexingService) {
		this.indexingService = indexingService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.post("/index/build", this::handleIndexBuild);

		app.get("/index/status", this::handleIndexStatus);

		logger.info("Indexing routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "indexing-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("building", indexingService.isBuilding());

		try {
			health.put("documents_indexed", indexingService.getStatus().documentsIndexed());
		} catch (Exception e) {
			health.put("documents_indexed", "error");
			logger.error("Error reading index status for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * POST /index/build
	 * Rebuild the whole index from the corpus
	 */
	private void handleIndexBuild(Context ctx) {
		try {
			logger.info("Received index build request");

			IndexReport report = indexingService.build();

			ctx.status(200).result(gson.toJson(IndexResponse.completed(report)));
			logger.info("Index build finished with {} documents", report.documents());

		} catch (BuildInProgressException e) {
			ctx.status(409).result(gson.toJson(IndexResponse.busy(e.getMessage())));
			logger.warn("Rejected index build request: {}", e.getMessage());

		} catch (Exception e) {
			ctx.status(500).result(gson.toJson(IndexResponse.failed(e.getMessage())));
			logger.error("Failed to build index: {}", e.getMessage());
		}
	}

	/**
	 * GET /index/status
	 */
	private void handleIndexStatus(Context ctx) {
		try {
			IndexingService.IndexStatus status = indexingService.getStatus();

			ctx.status(200).result(gson.toJson(status));
			logger.debug("Retrieved index status: {} documents, {} bytes",
					status.documentsIndexed(), status.indexSizeBytes());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Failed to retrieve index status: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to get index status: {}", e.getMessage());
		}
	}
}
