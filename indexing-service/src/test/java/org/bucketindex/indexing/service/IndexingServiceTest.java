package org.bucketindex.indexing.service;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.bucketindex.core.model.Batch;
import org.bucketindex.core.plan.PlanningException;
import org.bucketindex.core.query.QueryPlanner;
import org.bucketindex.core.store.MemoryColumnarStore;
import org.bucketindex.indexing.config.IndexingConfig;
import org.bucketindex.store.ParquetColumnarStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingServiceTest {

	@TempDir
	Path tempDir;

	@Test
	public void testBuildWritesEveryDocument() throws Exception {
		Path corpus = writeCorpus(
				"The quick brown fox",
				"jumps over the lazy dog",
				"The dog sleeps",
				"A fox, a dog and a cat!",
				"quick quick quick"
		);
		Path indexFile = tempDir.resolve("out/index.parquet");
		IndexingConfig.Index index = new IndexingConfig.Index(indexFile, 4, 2, 3, CompressionCodecName.SNAPPY, false);
		ParquetColumnarStore store = new ParquetColumnarStore(indexFile, index.compression(), index.chunkSize());
		IndexingService service = new IndexingService(new IndexingConfig.Corpus(corpus, 0), index, store);

		IndexReport report = service.build();

		assertEquals(5, report.documents());
		assertEquals(3, report.batches());
		assertTrue(report.singleBuckets() + report.multiBuckets() <= 5);
		assertTrue(report.indexSizeBytes() > 0);
		assertEquals(Files.size(indexFile), report.indexSizeBytes());
		assertEquals(5, store.rowCount());

		QueryPlanner planner = new QueryPlanner(store.columnNames());
		assertEquals(3, store.count(planner.plan(Set.of("dog"))));
		assertEquals(1, store.count(planner.plan(Set.of("fox", "dog"))));
		assertEquals(2, store.count(planner.plan(Set.of("the", "dog"))));
		assertEquals(0, store.count(planner.plan(Set.of("unicorn"))));
	}

	@Test
	public void testDocumentLimitCapsTheBuild() throws Exception {
		Path corpus = writeCorpus("a b", "b c", "c d", "d e");
		IndexingConfig.Index index = new IndexingConfig.Index(tempDir.resolve("index.parquet"), 2, 10, 10,
				CompressionCodecName.UNCOMPRESSED, false);
		MemoryColumnarStore store = new MemoryColumnarStore();
		IndexingService service = new IndexingService(new IndexingConfig.Corpus(corpus, 2), index, store);

		IndexReport report = service.build();

		assertEquals(2, report.documents());
		assertEquals(0, report.indexSizeBytes());
		assertEquals(2, store.rowCount());
	}

	@Test
	public void testEmptyCorpusCannotBePlanned() throws Exception {
		Path corpus = writeCorpus("", "  ", "...");
		IndexingConfig.Index index = new IndexingConfig.Index(tempDir.resolve("index.parquet"), 4, 10, 10,
				CompressionCodecName.SNAPPY, false);
		IndexingService service = new IndexingService(new IndexingConfig.Corpus(corpus, 0), index, new MemoryColumnarStore());

		assertThrows(PlanningException.class, service::build);
		assertFalse(service.isBuilding());
		assertTrue(service.lastReport().isEmpty());
	}

	@Test
	public void testStatusBeforeAndAfterBuild() throws Exception {
		Path corpus = writeCorpus("one two", "two three");
		Path indexFile = tempDir.resolve("index.parquet");
		IndexingConfig.Index index = new IndexingConfig.Index(indexFile, 2, 10, 10, CompressionCodecName.SNAPPY, false);
		IndexingService service = new IndexingService(new IndexingConfig.Corpus(corpus, 0), index,
				new ParquetColumnarStore(indexFile));

		IndexingService.IndexStatus before = service.getStatus();
		assertEquals(0, before.documentsIndexed());
		assertNull(before.lastBuild());

		service.build();

		IndexingService.IndexStatus after = service.getStatus();
		assertEquals(2, after.documentsIndexed());
		assertTrue(after.buckets() > 0);
		assertNotNull(after.lastBuild());
		assertFalse(after.building());
	}

	@Test
	public void testSecondBuildWhileRunningIsRejected() throws Exception {
		Path corpus = writeCorpus("one two", "two three", "three four");
		IndexingConfig.Index index = new IndexingConfig.Index(tempDir.resolve("index.parquet"), 2, 10, 10,
				CompressionCodecName.SNAPPY, false);
		CountDownLatch writing = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		MemoryColumnarStore store = new MemoryColumnarStore() {
			@Override
			public void write(List<String> columnNames, Iterator<Batch> batches) throws IOException {
				writing.countDown();
				try {
					release.await();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IOException(e);
				}
				super.write(columnNames, batches);
			}
		};
		IndexingService service = new IndexingService(new IndexingConfig.Corpus(corpus, 0), index, store);

		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<IndexReport> first = executor.submit(service::build);
			assertTrue(writing.await(30, TimeUnit.SECONDS));

			assertThrows(BuildInProgressException.class, service::build);
			IndexingService.IndexStatus during = service.getStatus();
			assertTrue(during.building());
			assertEquals(0, during.documentsIndexed());

			release.countDown();
			assertEquals(3, first.get(30, TimeUnit.SECONDS).documents());
		} finally {
			release.countDown();
			executor.shutdownNow();
		}
		assertFalse(service.isBuilding());
		assertEquals(3, service.getStatus().documentsIndexed());
	}

	private Path writeCorpus(String... lines) throws Exception {
		Path corpus = tempDir.resolve("corpus.txt");
		Files.write(corpus, List.of(lines));
		return corpus;
	}
}
