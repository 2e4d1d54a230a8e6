package org.bucketindex.search;

import org.bucketindex.search.bootstrap.SearchBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class SearchApp {
	private static final Logger logger = LoggerFactory.getLogger(SearchApp.class);

	public static void main(String[] args) {
		SearchBootstrap.run(parseArguments(args));
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

	private static void printUsage() {
		System.out.println("\n=== Search Service Usage ===\n");
		System.out.println("Usage: java -jar search-service-1.0.0.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --server.port <port>           Server port (default: 7003)");
		System.out.println("  --index.path <file>            Parquet index file");
		System.out.println("  --search.max.results <n>       Upper bound on returned ids (default: 1000)");
		System.out.println("  --search.default.limit <n>     Ids returned when no limit is given (default: 10)");
		System.out.println("  -h, --help                     Show this help message\n");
	}
}
