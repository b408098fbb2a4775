package io.mnemos.core.cognitive;

import io.mnemos.core.embedding.EmbeddingException;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.embedding.TextChunk;
import io.mnemos.core.embedding.TextChunker;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.ValidationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores a document as a Document node plus embedded Chunk nodes linked with {@code HAS_CHUNK}.
 */
public final class DocumentIngestor {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentIngestor.class);

    private final GraphStore store;
    private final EmbeddingProvider embeddings;

    public DocumentIngestor(GraphStore store, EmbeddingProvider embeddings) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
    }

    public IngestResult store(String title, String text, String sourceUrl, String docType) throws IOException {
        return store(title, text, sourceUrl, docType, TextChunker.DEFAULT_SIZE, TextChunker.DEFAULT_OVERLAP);
    }

    public IngestResult store(String title, String text, String sourceUrl, String docType, int chunkSize, int overlap)
        throws IOException {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text is required");
        }
        List<TextChunk> chunks = new TextChunker(chunkSize, overlap, "\n").chunk(text);
        String documentId = store.createNode(Nodes.document(title, text, sourceUrl, docType));

        List<double[]> vectors = null;
        if (!chunks.isEmpty()) {
            List<String> texts = new ArrayList<>(chunks.size());
            for (TextChunk chunk : chunks) {
                texts.add(chunk.text());
            }
            try {
                vectors = embeddings.embedBatch(texts);
            } catch (EmbeddingException e) {
                LOG.warn("Storing '{}' without embeddings: {}", title, e.getMessage());
            }
        }

        List<String> chunkIds = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("title", title);
            extra.put("start_char", chunk.startChar());
            extra.put("end_char", chunk.endChar());
            double[] vector = vectors == null ? null : vectors.get(i);
            Node node = Nodes.chunk(chunk.text(), vector, documentId, chunk.index(), extra);
            String chunkId = store.createNode(node);
            store.createRelationship(documentId, chunkId, RelationType.HAS_CHUNK);
            chunkIds.add(chunkId);
        }
        LOG.info("Stored document '{}' as {} chunks", title, chunkIds.size());
        return new IngestResult(documentId, chunkIds, vectors != null);
    }
}
