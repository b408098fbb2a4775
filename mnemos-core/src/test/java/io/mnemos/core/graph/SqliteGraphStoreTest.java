package io.mnemos.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteGraphStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistNodesAndRelationshipsAcrossReopen() throws Exception {
        Path db = tempDir.resolve("graph/mnemos.db");
        SqliteGraphStore store = new SqliteGraphStore(db);
        String persona = store.createNode(NodeType.PERSONA, "Nova", Map.of("tagline", "curious"));
        String trait = store.createNode(NodeType.TRAIT, "warm", Map.of("strength", 0.8));
        store.createRelationship(persona, trait, RelationType.HAS_TRAIT);

        SqliteGraphStore reopened = new SqliteGraphStore(db);

        Node loaded = reopened.getNode(persona).orElseThrow();
        assertThat(loaded.string("tagline", null)).isEqualTo("curious");
        List<RelatedNode> traits = reopened.getRelated(persona, RelationType.HAS_TRAIT, Direction.OUT, NodeType.TRAIT, 10);
        assertThat(traits).extracting(related -> related.node().name()).containsExactly("warm");
        assertThat(traits.get(0).node().number("strength", 0)).isEqualTo(0.8);
    }

    @Test
    void shouldUpsertPreferenceByName() throws Exception {
        SqliteGraphStore store = new SqliteGraphStore(tempDir.resolve("mnemos.db"));

        UpsertResult first = store.createOrMatch(NodeType.PREFERENCE, "name", "tone", "tone", Map.of("value", "formal"));
        UpsertResult second = store.createOrMatch(NodeType.PREFERENCE, "name", "tone", "tone", Map.of("value", "casual"));

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(store.findNodes(NodeType.PREFERENCE, Map.of(), 10)).hasSize(1);
        assertThat(store.getNode(first.node().id()).orElseThrow().string("value", null)).isEqualTo("casual");
    }

    @Test
    void shouldRoundTripEmbeddingAndRankByCosine() throws Exception {
        SqliteGraphStore store = new SqliteGraphStore(tempDir.resolve("mnemos.db"), Clock.systemUTC(), true);
        String persona = store.createNode(NodeType.PERSONA, "Nova", Map.of());
        String near = store.createNode(NodeType.MEMORY, "near", Map.of(Node.EMBEDDING, new double[] {0.9, 0.1, 0.0}));
        String far = store.createNode(NodeType.MEMORY, "far", Map.of(Node.EMBEDDING, new double[] {0.0, 0.2, 1.0}));
        store.createRelationship(persona, near, RelationType.HAS_MEMORY);
        store.createRelationship(persona, far, RelationType.HAS_MEMORY);

        assertThat(store.getNode(near).orElseThrow().embedding()).containsExactly(0.9, 0.1, 0.0);

        List<ScoredNode> hits = store.vectorSearch(
            new double[] {1.0, 0.0, 0.0}, NodeType.MEMORY, new OwnerScope(persona, RelationType.HAS_MEMORY), 5, 0.5
        );

        assertThat(hits).extracting(hit -> hit.node().name()).containsExactly("near");
    }

    @Test
    void shouldFindNodesByTextAndCountStats() throws Exception {
        SqliteGraphStore store = new SqliteGraphStore(tempDir.resolve("mnemos.db"));
        store.createNode(NodeType.INSIGHT, "Morning person", Map.of("content", "Prefers early meetings"));
        store.createNode(NodeType.TASK, "Buy seeds", Map.of("description", "tomato seeds"));

        assertThat(store.searchAll("EARLY", 10)).extracting(Node::name).containsExactly("Morning person");
        assertThat(store.textSearch("tomato", NodeType.TASK, 5)).extracting(hit -> hit.node().name())
            .containsExactly("Buy seeds");
        assertThat(store.stats().totalNodes()).isEqualTo(2);
    }

    @Test
    void shouldIncrementCounterAndDeleteNode() throws Exception {
        SqliteGraphStore store = new SqliteGraphStore(tempDir.resolve("mnemos.db"));
        String id = store.createNode(NodeType.PERSONA, "Nova", Map.of());

        store.incrementProperty(id, "conversation_count", 1);
        store.incrementProperty(id, "conversation_count", 1);

        assertThat(store.getNode(id).orElseThrow().number("conversation_count", 0)).isEqualTo(2.0);
        assertThat(store.deleteNode(id)).isTrue();
        assertThat(store.getNode(id)).isEmpty();
    }
}
