package io.mnemos.core.embedding;

import java.util.Locale;
import java.util.Set;

/**
 * Deterministic bag-of-words embedding: each token is hashed into one of a fixed number of buckets and the
 * counts are L2-normalized. Needs no network and gives useful similarity for overlapping vocabulary.
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSIONS = 256;

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her"
    );

    private final int dimensions;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public String modelName() {
        return "hashing-" + dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimensions];
        if (text == null) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0;
            }
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        if (norm == 0.0) {
            return vector;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < dimensions; i++) {
            vector[i] /= norm;
        }
        return vector;
    }
}
