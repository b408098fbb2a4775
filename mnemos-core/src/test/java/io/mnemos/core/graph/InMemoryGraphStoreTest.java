package io.mnemos.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryGraphStoreTest {

    private final InMemoryGraphStore store =
        new InMemoryGraphStore(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC), false);

    @Test
    void shouldKeepIdAndCreationTimeWhenUpdating() throws Exception {
        String id = store.createNode(NodeType.PROJECT, "Garden", Map.of("status", "active"));
        Node before = store.getNode(id).orElseThrow();

        boolean updated = store.updateNode(id, Map.of("id", "other", "status", "paused", "name", "Backyard"));

        Node after = store.getNode(id).orElseThrow();
        assertThat(updated).isTrue();
        assertThat(after.id()).isEqualTo(id);
        assertThat(after.createdAt()).isEqualTo(before.createdAt());
        assertThat(after.name()).isEqualTo("Backyard");
        assertThat(after.string("status", null)).isEqualTo("paused");
    }

    @Test
    void shouldRemovePropertyWhenUpdatedWithNull() throws Exception {
        String id = store.createNode(NodeType.TASK, "Water plants", Map.of("priority", 3));
        Map<String, Object> changes = new HashMap<>();
        changes.put("priority", null);

        store.updateNode(id, changes);

        assertThat(store.getNode(id).orElseThrow().property("priority")).isEmpty();
    }

    @Test
    void shouldReturnNewestNodesFirst() throws Exception {
        store.createNode(NodeType.INSIGHT, "first", Map.of());
        store.createNode(NodeType.INSIGHT, "second", Map.of());
        store.createNode(NodeType.INSIGHT, "third", Map.of());

        List<Node> found = store.findNodes(NodeType.INSIGHT, Map.of(), 2);

        assertThat(found).extracting(Node::name).containsExactly("third", "second");
    }

    @Test
    void shouldFilterOnExactPropertyValues() throws Exception {
        store.createNode(NodeType.PROJECT, "Work", Map.of("category", "work"));
        store.createNode(NodeType.PROJECT, "Health", Map.of("category", "health"));

        assertThat(store.findNodes(NodeType.PROJECT, Map.of("category", "health"), 10))
            .extracting(Node::name)
            .containsExactly("Health");
        assertThatThrownBy(() -> store.findNodes(NodeType.PROJECT, Map.of("category", List.of("a")), 10))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectRelationshipWithMissingEndpoint() throws Exception {
        String id = store.createNode(NodeType.PERSON, "Ada", Map.of());

        assertThat(store.createRelationship(id, "missing", RelationType.KNOWS)).isFalse();
        assertThat(store.stats().relationships()).isZero();
    }

    @Test
    void shouldTraverseRelationshipsInBothDirections() throws Exception {
        String user = store.createNode(NodeType.USER, "Sam", Map.of());
        String project = store.createNode(NodeType.PROJECT, "Garden", Map.of());
        String person = store.createNode(NodeType.PERSON, "Ada", Map.of());
        store.createRelationship(user, project, RelationType.OWNS);
        store.createRelationship(person, project, RelationType.COLLABORATES_ON, Map.of("role", "helper"));

        List<RelatedNode> incoming = store.getRelated(project, null, Direction.IN, null, 10);
        List<RelatedNode> owned = store.getRelated(user, RelationType.OWNS, Direction.OUT, NodeType.PROJECT, 10);

        assertThat(incoming).extracting(related -> related.node().name()).containsExactly("Ada", "Sam");
        assertThat(incoming.get(0).relationString("role")).isEqualTo("helper");
        assertThat(incoming.get(0).direction()).isEqualTo(Direction.IN);
        assertThat(owned).hasSize(1);
        assertThat(store.countRelated(project, null, Direction.BOTH, null)).isEqualTo(2);
    }

    @Test
    void shouldDropRelationshipsOfDeletedNode() throws Exception {
        String a = store.createNode(NodeType.TOPIC, "a", Map.of());
        String b = store.createNode(NodeType.TOPIC, "b", Map.of());
        store.createRelationship(a, b, RelationType.RELATED_TO);

        assertThat(store.deleteNode(b)).isTrue();

        assertThat(store.getRelated(a, null, Direction.BOTH, null, 10)).isEmpty();
        assertThat(store.deleteNode(b)).isFalse();
    }

    @Test
    void shouldMatchExistingNodeOnKeyInsteadOfCreating() throws Exception {
        UpsertResult first = store.createOrMatch(NodeType.PREFERENCE, "name", "tone", "tone", Map.of("value", "formal"));
        UpsertResult second = store.createOrMatch(NodeType.PREFERENCE, "name", "tone", "tone", Map.of("value", "casual"));

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.node().id()).isEqualTo(first.node().id());
        assertThat(second.node().string("value", null)).isEqualTo("casual");
        assertThat(store.findNodes(NodeType.PREFERENCE, Map.of(), 10)).hasSize(1);
    }

    @Test
    void shouldIncrementMissingPropertyFromZero() throws Exception {
        String id = store.createNode(NodeType.PERSONA, "Nova", Map.of());

        store.incrementProperty(id, "conversation_count", 1);
        store.incrementProperty(id, "conversation_count", 1);

        assertThat(store.getNode(id).orElseThrow().number("conversation_count", -1)).isEqualTo(2.0);
        assertThat(store.incrementProperty("missing", "conversation_count", 1)).isFalse();
    }

    @Test
    void shouldRankVectorHitsWithinOwnerScope() throws Exception {
        String persona = store.createNode(NodeType.PERSONA, "Nova", Map.of());
        String near = store.createNode(NodeType.MEMORY, "near", Map.of(Node.EMBEDDING, new double[] {1.0, 0.1}));
        String far = store.createNode(NodeType.MEMORY, "far", Map.of(Node.EMBEDDING, new double[] {0.2, 1.0}));
        store.createNode(NodeType.MEMORY, "stranger", Map.of(Node.EMBEDDING, new double[] {1.0, 0.0}));
        store.createRelationship(persona, near, RelationType.HAS_MEMORY);
        store.createRelationship(persona, far, RelationType.HAS_MEMORY);

        List<ScoredNode> hits = store.vectorSearch(
            new double[] {1.0, 0.0}, NodeType.MEMORY, new OwnerScope(persona, RelationType.HAS_MEMORY), 5, 0.0
        );

        assertThat(hits).extracting(hit -> hit.node().name()).containsExactly("near", "far");
        assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }

    @Test
    void shouldCombineTextAndVectorScoresInHybridSearch() throws Exception {
        store.createNode(NodeType.DOCUMENT, "Tomato notes", Map.of(
            "content", "tomatoes need sun", Node.EMBEDDING, new double[] {0.0, 1.0}
        ));
        store.createNode(NodeType.DOCUMENT, "Other", Map.of(
            "content", "unrelated text", Node.EMBEDDING, new double[] {1.0, 0.0}
        ));

        List<ScoredNode> hits = store.hybridSearch("tomatoes", new double[] {1.0, 0.0}, NodeType.DOCUMENT, 5);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).node().name()).isEqualTo("Other");
        assertThat(hits.get(0).score()).isCloseTo(0.7, within(1e-9));
        assertThat(hits.get(1).score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void shouldSearchAcrossTextPropertiesCaseInsensitively() throws Exception {
        store.createNode(NodeType.INSIGHT, "Morning", Map.of("content", "User prefers EARLY meetings"));
        store.createNode(NodeType.TASK, "Buy seeds", Map.of("description", "tomato seeds"));

        assertThat(store.searchAll("early", 10)).extracting(Node::name).containsExactly("Morning");
        assertThat(store.searchAll("  ", 10)).isEmpty();
    }

    @Test
    void shouldRejectBlankNodeName() {
        assertThatThrownBy(() -> store.createNode(NodeType.TASK, " ", Map.of()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldCountNodesByTypeLabel() throws Exception {
        store.createNode(NodeType.TASK, "a", Map.of());
        store.createNode(NodeType.TASK, "b", Map.of());
        store.createNode(NodeType.GOAL, "c", Map.of());

        GraphStats stats = store.stats();

        assertThat(stats.totalNodes()).isEqualTo(3);
        assertThat(stats.nodesByType()).containsEntry(NodeType.TASK.label(), 2L);
    }
}
