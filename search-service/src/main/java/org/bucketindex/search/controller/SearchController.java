package org.bucketindex.search.controller;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.bucketindex.search.model.SearchResponse;
import org.bucketindex.search.model.SearchResult;
import org.bucketindex.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;
	private final int defaultLimit;

	public SearchController(SearchService searchService, int defaultLimit) {
		this.searchService = searchService;
		this.defaultLimit = defaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.post("/search/count", this::handleCountAll);

		app.get("/stats", this::handleStats);

		app.post("/index/reload", this::handleReload);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("index_loaded", searchService.isIndexLoaded());

		try {
			health.put("documents", searchService.getStats().documents());
		} catch (Exception e) {
			health.put("documents", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&limit={limit}&ids={true|false}
	 * Count documents containing every query token and list the first ids
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");
			String limitStr = ctx.queryParam("limit");
			String idsStr = ctx.queryParam("ids");

			int limit = defaultLimit;
			if (limitStr != null && !limitStr.isEmpty()) {
				try {
					limit = Integer.parseInt(limitStr);
				} catch (NumberFormatException e) {
					badRequest(ctx, "Invalid limit format. Must be an integer.");
					return;
				}
			}

			if (query == null || query.trim().isEmpty()) {
				badRequest(ctx, "Query parameter 'q' is required.");
				return;
			}

			boolean includeIds = idsStr == null || !idsStr.equalsIgnoreCase("false");
			logger.info("Search request: q='{}', limit={}, ids={}", query, limit, includeIds);

			SearchResult result = searchService.search(query, limit, includeIds);

			ctx.status(200).result(gson.toJson(SearchResponse.from(query, result)));
			logger.info("Returned {} of {} matches", result.ids().size(), result.totalMatches());

		} catch (Exception e) {
			serverError(ctx, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * POST /search/count
	 * Body: JSON array of query strings; returns the summed match count
	 */
	private void handleCountAll(Context ctx) {
		List<String> queries;
		try {
			queries = gson.fromJson(ctx.body(), new TypeToken<List<String>>() {}.getType());
		} catch (JsonParseException e) {
			badRequest(ctx, "Body must be a JSON array of query strings.");
			return;
		}
		if (queries == null) {
			badRequest(ctx, "Body must be a JSON array of query strings.");
			return;
		}

		try {
			long total = searchService.countAll(queries);

			Map<String, Object> response = new HashMap<>();
			response.put("queries", queries.size());
			response.put("total_matches", total);

			ctx.status(200).result(gson.toJson(response));
		} catch (Exception e) {
			serverError(ctx, "Count failed: " + e.getMessage());
			logger.error("Count over {} queries failed", queries.size(), e);
		}
	}

	/**
	 * GET /stats
	 */
	private void handleStats(Context ctx) {
		try {
			SearchService.SearchStats stats = searchService.getStats();

			Map<String, Object> response = new HashMap<>();
			response.put("documents", stats.documents());
			response.put("buckets", stats.buckets());
			response.put("single_buckets", stats.singleBuckets());
			response.put("multi_buckets", stats.multiBuckets());

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved search statistics");

		} catch (Exception e) {
			serverError(ctx, "Failed to retrieve statistics: " + e.getMessage());
			logger.error("Failed to get statistics", e);
		}
	}

	/**
	 * POST /index/reload
	 * Re-read the index schema after a rebuild
	 */
	private void handleReload(Context ctx) {
		try {
			searchService.reload();

			Map<String, Object> response = new HashMap<>();
			response.put("status", "reloaded");
			response.put("buckets", searchService.getStats().buckets());
			ctx.status(200).result(gson.toJson(response));

		} catch (Exception e) {
			serverError(ctx, "Reload failed: " + e.getMessage());
			logger.error("Failed to reload index", e);
		}
	}

	private static void badRequest(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(400).result(gson.toJson(error));
	}

	private static void serverError(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(500).result(gson.toJson(error));
	}
}
