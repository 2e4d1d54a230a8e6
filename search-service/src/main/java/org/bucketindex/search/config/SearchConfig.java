package org.bucketindex.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables whose lower-cased,
 * dot-separated name matches a key (for example {@code INDEX_PATH}), then the command line
 * overrides. Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    Path indexPath,
    int maxResults,
    int defaultLimit
) {
    public static SearchConfig load() {
        return load(Map.of());
    }

    public static SearchConfig load(Map<String, String> overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties, System.getenv());
        properties.putAll(overrides);
        return from(properties);
    }

    static SearchConfig from(Properties p) {
        int maxResults = requirePositiveInt(p, "search.max.results");
        int defaultLimit = requirePositiveInt(p, "search.default.limit");
        if (defaultLimit > maxResults) {
            throw new IllegalStateException("search.default.limit (" + defaultLimit
                + ") exceeds search.max.results (" + maxResults + ")");
        }
        return new SearchConfig(
            requireInt(p, "server.port"),
            Path.of(requireString(p, "index.path")),
            maxResults,
            defaultLimit
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
