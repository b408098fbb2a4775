package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Graph store connection. {@code jdbc:sqlite:<path>} selects the embedded store, {@code mem:} the
 * in-process one. Any other scheme needs credentials.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphConfig(
    String uri,
    String username,
    String password,
    @JsonAlias({"vector_index"}) boolean vectorIndex
) {

    public static GraphConfig defaults() {
        return new GraphConfig("jdbc:sqlite:~/.mnemos/graph.db", "", "", true);
    }
}
