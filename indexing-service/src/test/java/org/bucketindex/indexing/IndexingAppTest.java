package org.bucketindex.indexing;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingAppTest {

	@Test
	public void testParsesKeyValuePairs() {
		Map<String, String> overrides = IndexingApp.parseArguments(
				new String[] {"--index.bucket.count", "256", "--corpus.path", "/tmp/docs.txt"});

		assertEquals(Map.of("index.bucket.count", "256", "corpus.path", "/tmp/docs.txt"), overrides);
	}

	@Test
	public void testDanglingKeyIsIgnored() {
		Map<String, String> overrides = IndexingApp.parseArguments(new String[] {"stray", "--server.port"});

		assertTrue(overrides.isEmpty());
	}
}
