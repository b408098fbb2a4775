package io.mnemos.core.graph;

import io.mnemos.core.config.ConfigPaths;
import io.mnemos.core.config.ConfigurationException;
import io.mnemos.core.config.model.GraphConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the configured graph store once at startup.
 */
public final class GraphStores {
    private static final Logger LOG = LoggerFactory.getLogger(GraphStores.class);
    static final String SQLITE_PREFIX = "jdbc:sqlite:";
    static final String MEMORY_PREFIX = "mem:";

    private GraphStores() {
    }

    public static GraphStore open(GraphConfig config, Clock clock) throws IOException {
        String uri = validate(config);
        if (uri.toLowerCase(Locale.ROOT).startsWith(MEMORY_PREFIX)) {
            LOG.info("Using in-memory graph store");
            return new InMemoryGraphStore(clock, config.vectorIndex());
        }
        Path path = Path.of(ConfigPaths.expandHome(uri.substring(SQLITE_PREFIX.length())));
        LOG.info("Opening SQLite graph store at {}", path);
        return new SqliteGraphStore(path, clock, config.vectorIndex());
    }

    /**
     * Returns the trimmed URI, or throws when the configuration cannot produce a store.
     */
    static String validate(GraphConfig config) {
        if (config == null || config.uri() == null || config.uri().isBlank()) {
            throw new ConfigurationException("Graph store URI is not configured (graph.uri or MNEMOS_GRAPH_URI)");
        }
        String uri = config.uri().trim();
        String lower = uri.toLowerCase(Locale.ROOT);
        boolean embedded = lower.startsWith(SQLITE_PREFIX) || lower.startsWith(MEMORY_PREFIX);
        if (!embedded) {
            if (blank(config.username()) || blank(config.password())) {
                throw new ConfigurationException("Graph store credentials are required for " + uri);
            }
            throw new ConfigurationException("Unsupported graph store URI: " + uri);
        }
        if (lower.startsWith(SQLITE_PREFIX) && uri.length() == SQLITE_PREFIX.length()) {
            throw new ConfigurationException("SQLite graph store URI has no path: " + uri);
        }
        return uri;
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
