package org.bucketindex.benchmarks;

import org.bucketindex.benchmarks.baseline.LuceneBaselineIndex;
import org.bucketindex.core.model.Document;
import org.openjdk.jmh.annotations.*;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the exact Lucene index the bucket index is compared with
 * Tests: index build, query counts
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BaselineIndexBenchmark {

	@Param({"20000"})
	private int documents;

	@Param({""})
	private String corpusPath;

	private List<Document> corpus;
	private List<Set<String>> queries;
	private LuceneBaselineIndex index;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Baseline Index Benchmark Setup (documents=" + documents + ") ===");

		corpus = BenchmarkQueries.corpus(corpusPath, documents);
		queries = BenchmarkQueries.queries(corpus, 7);
		index = LuceneBaselineIndex.inMemory();
		index.build(corpus.iterator());

		System.out.println("Baseline ready: " + index.documentCount() + " documents");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		index.close();
	}

	/**
	 * Benchmark: Build an in-memory Lucene index of the corpus
	 */
	@Benchmark
	public long buildIndex() throws IOException {
		try (LuceneBaselineIndex fresh = LuceneBaselineIndex.inMemory()) {
			return fresh.build(corpus.iterator());
		}
	}

	/**
	 * Benchmark: Count matches of every query
	 */
	@Benchmark
	public long countQueries() throws IOException {
		long total = 0;
		for (Set<String> query : queries) {
			total += index.count(query);
		}
		return total;
	}
}
