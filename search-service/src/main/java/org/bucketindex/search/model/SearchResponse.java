package org.bucketindex.search.model;

import java.util.List;

public record SearchResponse(
		String query,
		List<String> tokens,
		long totalResults,
		int returnedResults,
		List<String> ids
) {
	public static SearchResponse from(String query, SearchResult result) {
		List<String> ids = result.ids().stream()
				.map(Long::toUnsignedString)
				.toList();
		return new SearchResponse(query, result.tokens().stream().sorted().toList(),
				result.totalMatches(), ids.size(), ids);
	}
}
