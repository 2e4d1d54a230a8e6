package org.bucketindex.search.service;

import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.BucketType;
import org.bucketindex.core.query.Predicate;
import org.bucketindex.core.query.QueryPlanner;
import org.bucketindex.core.source.Tokenizer;
import org.bucketindex.core.store.BatchMatch;
import org.bucketindex.core.store.ColumnarStore;
import org.bucketindex.core.store.Projection;
import org.bucketindex.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Answers token-containment queries against a stored bucket index.
 *
 * <p>The query planner is built from the stored schema on first use and cached until
 * {@link #reload()}.</p>
 */
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private final ColumnarStore store;
    private final int maxResults;
    private volatile QueryPlanner planner;

    public SearchService(ColumnarStore store, int maxResults) {
        this.store = store;
        this.maxResults = maxResults;
    }

    /**
     * Number of documents containing every token of {@code query}. A query without tokens matches
     * nothing.
     */
    public long count(String query) throws IOException {
        Set<String> tokens = Tokenizer.tokenize(query);
        long total = store.count(planner().plan(tokens));
        logger.debug("Counted {} matches for {}", total, tokens);
        return total;
    }

    /**
     * Total count and the ids of the first matches.
     *
     * @param limit ids to return; non-positive or larger values are capped to the configured maximum
     * @param includeIds {@code false} skips id collection and only counts
     */
    public SearchResult search(String query, int limit, boolean includeIds) throws IOException {
        Set<String> tokens = Tokenizer.tokenize(query);
        Predicate predicate = planner().plan(tokens);
        int resultLimit = limit > 0 ? Math.min(limit, maxResults) : maxResults;

        if (!includeIds) {
            return new SearchResult(tokens, store.count(predicate), List.of());
        }

        long total = 0;
        List<Long> ids = new ArrayList<>(Math.min(resultLimit, 1024));
        for (BatchMatch match : store.scan(predicate, Projection.IDS)) {
            total += match.matched();
            for (long id : match.ids()) {
                if (ids.size() == resultLimit) {
                    break;
                }
                ids.add(id);
            }
        }
        logger.info("Query {} matched {} documents, returning {}", tokens, total, ids.size());
        return new SearchResult(tokens, total, ids);
    }

    public SearchResult search(String query, int limit) throws IOException {
        return search(query, limit, true);
    }

    /**
     * Sum of the match counts of every query, planned against one schema.
     */
    public long countAll(List<String> queries) throws IOException {
        QueryPlanner current = planner();
        long total = 0;
        for (String query : queries) {
            total += store.count(current.plan(Tokenizer.tokenize(query)));
        }
        logger.info("Counted {} matches over {} queries", total, queries.size());
        return total;
    }

    public SearchStats getStats() throws IOException {
        BucketPlan plan = planner().bucketPlan();
        return new SearchStats(
            store.rowCount(),
            plan.size(),
            plan.countOf(BucketType.SINGLE),
            plan.countOf(BucketType.MULTI)
        );
    }

    /**
     * Re-read the stored schema, e.g. after the index was rebuilt.
     */
    public void reload() throws IOException {
        planner = new QueryPlanner(store.columnNames());
        logger.info("Loaded index schema with {} buckets", planner.bucketPlan().size());
    }

    public boolean isIndexLoaded() {
        return planner != null;
    }

    private QueryPlanner planner() throws IOException {
        QueryPlanner current = planner;
        if (current == null) {
            synchronized (this) {
                if (planner == null) {
                    reload();
                }
                current = planner;
            }
        }
        return current;
    }

    public record SearchStats(long documents, int buckets, int singleBuckets, int multiBuckets) {}
}
