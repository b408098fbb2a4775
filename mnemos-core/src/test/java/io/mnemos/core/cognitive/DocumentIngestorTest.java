package io.mnemos.core.cognitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemos.core.embedding.DisabledEmbeddingProvider;
import io.mnemos.core.embedding.HashingEmbeddingProvider;
import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.InMemoryGraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentIngestorTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();

    @Test
    void shouldStoreDocumentWithEmbeddedChunks() throws Exception {
        DocumentIngestor ingestor = new DocumentIngestor(store, new HashingEmbeddingProvider());
        String text = "Tomatoes need six hours of sun.\n".repeat(10);

        IngestResult result = ingestor.store("Tomato guide", text, "https://example.org/tomatoes", "article", 100, 20);

        assertThat(result.embedded()).isTrue();
        assertThat(result.chunkIds()).hasSizeGreaterThan(1);
        Node document = store.getNode(result.documentId()).orElseThrow();
        assertThat(document.string("source_url", null)).isEqualTo("https://example.org/tomatoes");
        List<RelatedNode> chunks = store.getRelated(result.documentId(), RelationType.HAS_CHUNK, Direction.OUT, NodeType.CHUNK, 100);
        assertThat(chunks).hasSize(result.chunkIds().size());
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.node().embedding()).hasSize(256));
    }

    @Test
    void shouldStoreChunksWithoutEmbeddingsWhenProviderFails() throws Exception {
        DocumentIngestor ingestor = new DocumentIngestor(store, new DisabledEmbeddingProvider("openai", "no key"));

        IngestResult result = ingestor.store("Note", "short note about compost", null, null);

        assertThat(result.embedded()).isFalse();
        assertThat(result.chunkIds()).hasSize(1);
        assertThat(store.getNode(result.chunkIds().get(0)).orElseThrow().embedding()).isNull();
    }

    @Test
    void shouldRejectBlankText() {
        DocumentIngestor ingestor = new DocumentIngestor(store, new HashingEmbeddingProvider());

        assertThatThrownBy(() -> ingestor.store("Empty", "  ", null, null)).isInstanceOf(ValidationException.class);
    }
}
