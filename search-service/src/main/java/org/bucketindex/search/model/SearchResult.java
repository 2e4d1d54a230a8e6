package org.bucketindex.search.model;

import java.util.List;
import java.util.Set;

/**
 * Matches of one query.
 *
 * @param tokens normalized query tokens
 * @param totalMatches documents containing every token
 * @param ids ids of the first matches in stored order, at most the requested limit
 */
public record SearchResult(
		Set<String> tokens,
		long totalMatches,
		List<Long> ids
) {}
