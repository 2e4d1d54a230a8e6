package org.bucketindex.benchmarks;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.bucketindex.core.encode.DocumentEncoder;
import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.Document;
import org.bucketindex.core.plan.BucketPlanner;
import org.bucketindex.core.query.Predicate;
import org.bucketindex.core.query.QueryPlanner;
import org.bucketindex.core.store.MemoryColumnarStore;
import org.bucketindex.store.ParquetColumnarStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for the bucket index
 * Tests: planning, encoding, query counts over the in-memory and Parquet stores
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BucketIndexBenchmark {

	private static final int SAMPLE_DOCUMENTS = 2_000;

	@Param({"64", "256", "1024"})
	private int bucketCount;

	@Param({"20000"})
	private int documents;

	@Param({""})
	private String corpusPath;

	private List<Document> corpus;
	private List<String> sample;
	private BucketPlan plan;
	private List<Set<String>> queries;
	private List<Predicate> predicates;

	private MemoryColumnarStore memoryStore;
	private ParquetColumnarStore parquetStore;
	private Path workDir;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Bucket Index Benchmark Setup (bucketCount=" + bucketCount + ", documents=" + documents + ") ===");

		corpus = BenchmarkQueries.corpus(corpusPath, documents);
		sample = BucketPlanner.sampleTokens(corpus.iterator(), SAMPLE_DOCUMENTS);
		plan = BucketPlanner.plan(sample, bucketCount);
		queries = BenchmarkQueries.queries(corpus, 7);

		memoryStore = new MemoryColumnarStore();
		DocumentEncoder toMemory = new DocumentEncoder(corpus.iterator(), plan);
		memoryStore.write(toMemory.columnNames(), toMemory);

		workDir = Files.createTempDirectory("bucket-index-bench");
		parquetStore = new ParquetColumnarStore(workDir.resolve("index.parquet"), CompressionCodecName.SNAPPY,
				DocumentEncoder.DEFAULT_CHUNK_SIZE);
		DocumentEncoder toParquet = new DocumentEncoder(corpus.iterator(), plan);
		parquetStore.write(toParquet.columnNames(), toParquet);

		QueryPlanner planner = new QueryPlanner(parquetStore.columnNames());
		predicates = new ArrayList<>(queries.size());
		for (Set<String> query : queries) {
			predicates.add(planner.plan(query));
		}

		System.out.println("Corpus ready: " + corpus.size() + " documents, " + plan.size() + " buckets, "
				+ Files.size(workDir.resolve("index.parquet")) + " bytes on disk");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		parquetStore.close();
		memoryStore.close();
		try (Stream<Path> paths = Files.walk(workDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	/**
	 * Benchmark: Plan buckets from the token sample
	 */
	@Benchmark
	public void planBuckets(Blackhole blackhole) {
		blackhole.consume(BucketPlanner.plan(sample, bucketCount));
	}

	/**
	 * Benchmark: Encode the whole corpus into batches
	 */
	@Benchmark
	public void encodeCorpus(Blackhole blackhole) {
		DocumentEncoder encoder = new DocumentEncoder(corpus.iterator(), plan);
		while (encoder.hasNext()) {
			Batch batch = encoder.next();
			blackhole.consume(batch);
		}
	}

	/**
	 * Benchmark: Plan every query against the stored schema
	 */
	@Benchmark
	public void planQueries(Blackhole blackhole) throws IOException {
		QueryPlanner planner = new QueryPlanner(memoryStore.columnNames());
		for (Set<String> query : queries) {
			blackhole.consume(planner.plan(query));
		}
	}

	/**
	 * Benchmark: Count matches of every query in memory
	 */
	@Benchmark
	public long countInMemory() throws IOException {
		long total = 0;
		for (Predicate predicate : predicates) {
			total += memoryStore.count(predicate);
		}
		return total;
	}

	/**
	 * Benchmark: Count matches of every query from the Parquet file
	 */
	@Benchmark
	@Measurement(iterations = 3, time = 2)
	public long countFromParquet() throws IOException {
		long total = 0;
		for (Predicate predicate : predicates.subList(0, 20)) {
			total += parquetStore.count(predicate);
		}
		return total;
	}
}
