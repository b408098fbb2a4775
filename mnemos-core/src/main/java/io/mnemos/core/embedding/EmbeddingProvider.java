package io.mnemos.core.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into a fixed-length vector. Implementations differ only in dimensionality and transport.
 */
public interface EmbeddingProvider {

    String name();

    String modelName();

    /**
     * Vector length. HTTP providers may only know the real value after their first successful call.
     */
    int dimensions();

    double[] embed(String text) throws EmbeddingException;

    default List<double[]> embedBatch(List<String> texts) throws EmbeddingException {
        List<double[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
