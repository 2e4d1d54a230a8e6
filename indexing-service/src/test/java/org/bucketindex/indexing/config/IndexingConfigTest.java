package org.bucketindex.indexing.config;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	@Test
	public void testReadsEveryKey() {
		IndexingConfig config = IndexingConfig.from(baseProperties());

		assertEquals(7002, config.serverPort());
		assertEquals(Path.of("corpus.txt"), config.corpus().path());
		assertEquals(0, config.corpus().documentLimit());
		assertEquals(Path.of("index.parquet"), config.index().path());
		assertEquals(64, config.index().bucketCount());
		assertEquals(1000, config.index().chunkSize());
		assertEquals(50, config.index().sampleDocuments());
		assertEquals(CompressionCodecName.GZIP, config.index().compression());
		assertFalse(config.index().buildOnStartup());
	}

	@Test
	public void testMissingKeyFailsFast() {
		Properties properties = baseProperties();
		properties.remove("index.path");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> IndexingConfig.from(properties));
		assertTrue(e.getMessage().contains("index.path"));
	}

	@Test
	public void testNonPositiveBucketCountIsRejected() {
		Properties properties = baseProperties();
		properties.setProperty("index.bucket.count", "0");

		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(properties));
	}

	@Test
	public void testUnknownCodecIsRejected() {
		Properties properties = baseProperties();
		properties.setProperty("index.compression", "rar");

		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(properties));
	}

	@Test
	public void testEnvironmentOverridesKnownKeysOnly() {
		Properties properties = baseProperties();

		IndexingConfig.overlayEnvironment(properties, Map.of("INDEX_PATH", "/data/idx.parquet", "HOME", "/root"));

		assertEquals("/data/idx.parquet", properties.getProperty("index.path"));
		assertNull(properties.getProperty("home"));
	}

	@Test
	public void testLoadAppliesOverrides() {
		IndexingConfig config = IndexingConfig.load(Map.of("index.bucket.count", "7", "server.port", "9100"));

		assertEquals(7, config.index().bucketCount());
		assertEquals(9100, config.serverPort());
	}

	private static Properties baseProperties() {
		Properties properties = new Properties();
		properties.setProperty("server.port", "7002");
		properties.setProperty("corpus.path", "corpus.txt");
		properties.setProperty("corpus.document.limit", "0");
		properties.setProperty("index.path", "index.parquet");
		properties.setProperty("index.bucket.count", "64");
		properties.setProperty("index.chunk.size", "1000");
		properties.setProperty("index.sample.documents", "50");
		properties.setProperty("index.compression", "gzip");
		properties.setProperty("index.build.on.startup", "false");
		return properties;
	}
}
