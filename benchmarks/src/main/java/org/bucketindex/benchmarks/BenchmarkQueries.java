package org.bucketindex.benchmarks;

import org.bucketindex.benchmarks.corpus.SyntheticCorpus;
import org.bucketindex.core.model.Document;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Corpus and query set shared by the benchmark states.
 */
final class BenchmarkQueries {
	static final int VOCABULARY = 50_000;
	static final int TOKENS_PER_DOCUMENT = 40;
	static final int QUERY_COUNT = 200;

	private BenchmarkQueries() {}

	/**
	 * Reads {@code corpusPath} when it is set, otherwise generates a corpus of {@code documents}.
	 */
	static List<Document> corpus(String corpusPath, int documents) throws IOException {
		if (corpusPath == null || corpusPath.isBlank()) {
			return SyntheticCorpus.generate(documents, VOCABULARY, TOKENS_PER_DOCUMENT, 42);
		}
		return SyntheticCorpus.load(Path.of(corpusPath), documents);
	}

	/**
	 * One- and two-token queries whose tokens are drawn from random documents of the corpus.
	 */
	static List<Set<String>> queries(List<Document> corpus, long seed) {
		Random random = new Random(seed);
		List<Set<String>> queries = new ArrayList<>(QUERY_COUNT);
		while (queries.size() < QUERY_COUNT) {
			Document document = corpus.get(random.nextInt(corpus.size()));
			List<String> tokens = new ArrayList<>(document.tokens());
			if (tokens.isEmpty()) {
				continue;
			}
			String first = tokens.get(random.nextInt(tokens.size()));
			String second = tokens.get(random.nextInt(tokens.size()));
			queries.add(random.nextBoolean() ? Set.of(first) : Set.copyOf(List.of(first, second)));
		}
		return queries;
	}
}
