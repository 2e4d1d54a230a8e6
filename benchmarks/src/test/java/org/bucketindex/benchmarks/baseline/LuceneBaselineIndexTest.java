package org.bucketindex.benchmarks.baseline;

import org.bucketindex.benchmarks.corpus.SyntheticCorpus;
import org.bucketindex.core.encode.DocumentEncoder;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.Document;
import org.bucketindex.core.plan.BucketPlanner;
import org.bucketindex.core.query.QueryPlanner;
import org.bucketindex.core.store.MemoryColumnarStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LuceneBaselineIndexTest {

	@TempDir
	Path tempDir;

	@Test
	public void testCountsConjunctions() throws Exception {
		try (LuceneBaselineIndex index = LuceneBaselineIndex.inMemory()) {
			index.build(List.of(
					new Document(1, Set.of("red", "green")),
					new Document(2, Set.of("green", "blue")),
					new Document(3, Set.of("red", "green", "blue"))
			).iterator());

			assertEquals(3, index.documentCount());
			assertEquals(3, index.count(Set.of("green")));
			assertEquals(2, index.count(Set.of("red", "green")));
			assertEquals(1, index.count(Set.of("red", "blue")));
			assertEquals(0, index.count(Set.of("purple")));
			assertEquals(0, index.count(Set.of()));
		}
	}

	@Test
	public void testTopIdsFollowIndexOrder() throws Exception {
		try (LuceneBaselineIndex index = LuceneBaselineIndex.onDisk(tempDir.resolve("lucene"))) {
			index.build(List.of(
					new Document(40, Set.of("x")),
					new Document(10, Set.of("x", "y")),
					new Document(30, Set.of("y")),
					new Document(20, Set.of("x"))
			).iterator());

			assertEquals(List.of(40L, 10L), index.topIds(Set.of("x"), 2));
			assertEquals(List.of(40L, 10L, 20L), index.topIds(Set.of("x"), 10));
			assertEquals(List.of(), index.topIds(Set.of(), 10));
		}
	}

	@Test
	public void testUnbuiltIndexRejectsQueries() throws Exception {
		try (LuceneBaselineIndex index = LuceneBaselineIndex.inMemory()) {
			assertThrows(IllegalStateException.class, () -> index.count(Set.of("x")));
		}
	}

	@Test
	public void testBucketIndexAgreesWithBaseline() throws Exception {
		List<Document> corpus = SyntheticCorpus.generate(1_500, 300, 12, 3);
		BucketPlan plan = BucketPlanner.plan(BucketPlanner.sampleTokens(corpus.iterator(), 200), 32);
		MemoryColumnarStore store = new MemoryColumnarStore();
		DocumentEncoder encoder = new DocumentEncoder(corpus.iterator(), plan, 256);
		store.write(encoder.columnNames(), encoder);
		QueryPlanner planner = new QueryPlanner(store.columnNames());

		try (LuceneBaselineIndex baseline = LuceneBaselineIndex.inMemory()) {
			baseline.build(corpus.iterator());

			for (int a = 0; a < 40; a += 3) {
				for (int b = a; b < 340; b += 37) {
					Set<String> query = Set.of(SyntheticCorpus.word(a), SyntheticCorpus.word(b));
					assertEquals(baseline.count(query), store.count(planner.plan(query)), "query " + query);
				}
			}
		}
	}
}
