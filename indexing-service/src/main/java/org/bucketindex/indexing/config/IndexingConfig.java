package org.bucketindex.indexing.config;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables and finally the command
 * line overrides. An environment variable replaces a property when its lower-cased name with
 * {@code _} turned into {@code .} matches the key, so {@code INDEX_PATH} sets {@code index.path}.
 * Missing or malformed keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    int serverPort,
    Corpus corpus,
    Index index
) {
    /** Where documents are read from; a limit of {@code 0} reads the whole file. */
    public record Corpus(Path path, long documentLimit) {}

    /** Location and shape of the built index. */
    public record Index(
        Path path,
        int bucketCount,
        int chunkSize,
        int sampleDocuments,
        CompressionCodecName compression,
        boolean buildOnStartup
    ) {}

    public static IndexingConfig load() {
        return load(Map.of());
    }

    /**
     * Loads configuration from classpath properties, environment variables and {@code overrides}.
     *
     * @param overrides values taken from the command line, applied last
     */
    public static IndexingConfig load(Map<String, String> overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties, System.getenv());
        properties.putAll(overrides);
        return from(properties);
    }

    static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            requireInt(p, "server.port"),
            readCorpus(p),
            readIndex(p)
        );
    }

    private static Corpus readCorpus(Properties p) {
        long limit = requireLong(p, "corpus.document.limit");
        if (limit < 0) {
            throw new IllegalStateException("corpus.document.limit must not be negative: " + limit);
        }
        return new Corpus(Path.of(requireString(p, "corpus.path")), limit);
    }

    private static Index readIndex(Properties p) {
        return new Index(
            Path.of(requireString(p, "index.path")),
            requirePositiveInt(p, "index.bucket.count"),
            requirePositiveInt(p, "index.chunk.size"),
            requirePositiveInt(p, "index.sample.documents"),
            requireCodec(p, "index.compression"),
            Boolean.parseBoolean(requireString(p, "index.build.on.startup"))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    static void overlayEnvironment(Properties properties, Map<String, String> environment) {
        environment.forEach((name, value) -> {
            String key = name.toLowerCase(Locale.ROOT).replace('_', '.');
            if (properties.containsKey(key)) {
                properties.setProperty(key, value);
            }
        });
    }

    private static CompressionCodecName requireCodec(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return CompressionCodecName.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown compression codec for '" + key + "': '" + value + "'", e);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requirePositiveInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value <= 0) {
            throw new IllegalStateException("Configuration '" + key + "' must be positive: " + value);
        }
        return value;
    }

    private static long requireLong(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
