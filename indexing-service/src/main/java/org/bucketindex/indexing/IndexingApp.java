package org.bucketindex.indexing;

import org.bucketindex.indexing.bootstrap.IndexingBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class IndexingApp {
	private static final Logger logger = LoggerFactory.getLogger(IndexingApp.class);

	public static void main(String[] args) {
		IndexingBootstrap.run(parseArguments(args));
	}

	/**
	 * Parse {@code --key value} pairs into configuration overrides
	 */
	static Map<String, String> parseArguments(String[] args) {
		Map<String, String> overrides = new LinkedHashMap<>();
		for (int i = 0; i < args.length; i++) {
			if (args[i].equals("-h") || args[i].equals("--help")) {
				printUsage();
				System.exit(0);
			} else if (args[i].startsWith("--") && i + 1 < args.length) {
				String key = args[i].substring(2);
				String value = args[i + 1];
				overrides.put(key, value);
				logger.info("Command line argument: {} = {}", key, value);
				i++;
			} else {
				logger.warn("Ignoring argument: {}", args[i]);
			}
		}
		return overrides;
	}

	/**
	 * Print usage information
	 */
	private static void printUsage() {
		System.out.println("\n=== Indexing Service Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --server.port <port>              Server port (default: 7002)");
		System.out.println("  --corpus.path <file>              Corpus file, one document per line");
		System.out.println("  --corpus.document.limit <n>       Documents to index, 0 for all (default: 0)");
		System.out.println("  --index.path <file>               Parquet index file");
		System.out.println("  --index.bucket.count <n>          Number of bucket ranges (default: 1024)");
		System.out.println("  --index.chunk.size <n>            Documents per batch (default: 8192)");
		System.out.println("  --index.sample.documents <n>      Documents sampled for planning (default: 10000)");
		System.out.println("  --index.compression <codec>       UNCOMPRESSED, SNAPPY, GZIP, ZSTD (default: SNAPPY)");
		System.out.println("  --index.build.on.startup <bool>   Build before serving (default: false)");
		System.out.println("  -h, --help                        Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  # Build from a custom corpus, then serve");
		System.out.println("  java -jar indexing-service-1.0.0.jar --corpus.path docs.txt --index.build.on.startup true\n");
	}
}
