package org.bucketindex.benchmarks.corpus;

import org.bucketindex.core.model.Document;
import org.bucketindex.core.source.LineDocumentSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Corpora for benchmarks: either generated with a Zipf-like token distribution or read from a
 * line-per-document file.
 */
public final class SyntheticCorpus {
	private SyntheticCorpus() {}

	/**
	 * Generate {@code documents} documents over a vocabulary of {@code vocabulary} words. Word rank
	 * {@code r} is drawn with probability roughly proportional to {@code 1 / r}, so a few words are
	 * very common and most are rare.
	 */
	public static List<Document> generate(int documents, int vocabulary, int tokensPerDocument, long seed) {
		if (vocabulary <= 0 || tokensPerDocument <= 0) {
			throw new IllegalArgumentException("Vocabulary and tokens per document must be positive");
		}
		double[] cumulative = new double[vocabulary];
		double sum = 0;
		for (int rank = 0; rank < vocabulary; rank++) {
			sum += 1.0 / (rank + 1);
			cumulative[rank] = sum;
		}

		Random random = new Random(seed);
		List<Document> corpus = new ArrayList<>(documents);
		for (int id = 0; id < documents; id++) {
			Set<String> tokens = new HashSet<>();
			for (int t = 0; t < tokensPerDocument; t++) {
				tokens.add(word(rankOf(cumulative, random.nextDouble() * sum)));
			}
			corpus.add(new Document(id, tokens));
		}
		return corpus;
	}

	/**
	 * Word of the given frequency rank; rank 0 is the most common.
	 */
	public static String word(int rank) {
		return "w" + rank;
	}

	public static List<Document> load(Path path, long limit) throws IOException {
		List<Document> corpus = new ArrayList<>();
		try (LineDocumentSource source = new LineDocumentSource(path, limit)) {
			source.forEachRemaining(corpus::add);
		}
		return corpus;
	}

	private static int rankOf(double[] cumulative, double target) {
		int low = 0;
		int high = cumulative.length - 1;
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (cumulative[mid] < target) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}
}
