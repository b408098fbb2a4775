package io.mnemos.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mnemos.core.graph.GraphSearch;
import org.junit.jupiter.api.Test;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider();

    @Test
    void shouldProduceUnitLengthVectors() {
        double[] vector = provider.embed("Tomatoes need plenty of sun");

        double norm = 0;
        for (double value : vector) {
            norm += value * value;
        }
        assertThat(vector).hasSize(HashingEmbeddingProvider.DEFAULT_DIMENSIONS);
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldIgnoreCaseAndStopWords() {
        double[] a = provider.embed("The GARDEN and the tomatoes");
        double[] b = provider.embed("garden tomatoes");

        assertThat(GraphSearch.cosine(a, b)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldScoreRelatedTextAboveUnrelatedText() {
        double[] query = provider.embed("watering tomato plants");

        double related = GraphSearch.cosine(query, provider.embed("tomato plants need watering daily"));
        double unrelated = GraphSearch.cosine(query, provider.embed("quarterly budget review meeting"));

        assertThat(related).isGreaterThan(unrelated);
    }

    @Test
    void shouldReturnZeroVectorForTextWithoutTokens() {
        assertThat(provider.embed("a !! ?")).containsOnly(0.0);
        assertThat(provider.modelName()).isEqualTo("hashing-256");
    }
}
