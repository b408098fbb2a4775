package io.mnemos.core.graph;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Process-local graph store, selected with the {@code mem:} URI. Optionally reports a vector index so
 * retrieval can exercise the indexed path; the search itself is always a scan.
 */
public final class InMemoryGraphStore implements GraphStore {
    private final Clock clock;
    private final boolean vectorIndexed;
    private final Map<String, StoredNode> nodes = new LinkedHashMap<>();
    private final List<StoredRelationship> relationships = new ArrayList<>();
    private long sequence;

    public InMemoryGraphStore() {
        this(Clock.systemUTC(), false);
    }

    public InMemoryGraphStore(Clock clock, boolean vectorIndexed) {
        this.clock = clock;
        this.vectorIndexed = vectorIndexed;
    }

    @Override
    public synchronized String createNode(NodeType type, String name, Map<String, ?> properties) {
        GraphProperties.validateNew(type, name);
        Map<String, PropertyValue> converted = PropertyValue.ofAll(properties);
        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        nodes.put(id, new StoredNode(++sequence, new Node(id, type, name.trim(), converted, now, now)));
        return id;
    }

    @Override
    public synchronized Optional<Node> getNode(String id) {
        StoredNode stored = id == null ? null : nodes.get(id);
        return stored == null ? Optional.empty() : Optional.of(stored.node);
    }

    @Override
    public synchronized List<Node> findNodes(NodeType type, Map<String, ?> filters, int limit) {
        Map<String, PropertyValue> expected = GraphProperties.filters(filters);
        return newestFirst(type).stream()
            .filter(node -> matchesAll(node, expected))
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public synchronized List<Node> searchNodes(NodeType type, String property, String substring, int limit) {
        if (property == null || property.isBlank() || substring == null) {
            return List.of();
        }
        return newestFirst(type).stream()
            .filter(node -> GraphSearch.containsIgnoreCase(valueOf(node, property), substring))
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public synchronized boolean updateNode(String id, Map<String, ?> properties) {
        StoredNode stored = id == null ? null : nodes.get(id);
        if (stored == null) {
            return false;
        }
        stored.node = GraphProperties.merge(stored.node, properties, clock.instant());
        return true;
    }

    @Override
    public synchronized boolean deleteNode(String id) {
        if (id == null || nodes.remove(id) == null) {
            return false;
        }
        relationships.removeIf(rel -> rel.from.equals(id) || rel.to.equals(id));
        return true;
    }

    @Override
    public synchronized boolean createRelationship(
        String fromId,
        String toId,
        RelationType type,
        Map<String, ?> properties
    ) {
        GraphProperties.validateLink(fromId, toId, type);
        if (!nodes.containsKey(fromId) || !nodes.containsKey(toId)) {
            return false;
        }
        relationships.add(new StoredRelationship(++sequence, fromId, toId, type, PropertyValue.ofAll(properties), clock.instant()));
        return true;
    }

    @Override
    public synchronized List<RelatedNode> getRelated(
        String id,
        RelationType type,
        Direction direction,
        NodeType targetType,
        int limit
    ) {
        List<RelatedNode> related = new ArrayList<>();
        for (int i = relationships.size() - 1; i >= 0 && related.size() < Math.max(0, limit); i--) {
            StoredRelationship rel = relationships.get(i);
            if (type != null && rel.type != type) {
                continue;
            }
            String otherId = null;
            Direction traversed = null;
            if (direction != Direction.IN && rel.from.equals(id)) {
                otherId = rel.to;
                traversed = Direction.OUT;
            } else if (direction != Direction.OUT && rel.to.equals(id)) {
                otherId = rel.from;
                traversed = Direction.IN;
            }
            if (otherId == null) {
                continue;
            }
            Node other = nodes.get(otherId).node;
            if (targetType == null || other.type() == targetType) {
                related.add(new RelatedNode(other, rel.type, traversed, rel.properties));
            }
        }
        return related;
    }

    @Override
    public synchronized int countRelated(String id, RelationType type, Direction direction, NodeType targetType) {
        return getRelated(id, type, direction, targetType, Integer.MAX_VALUE).size();
    }

    @Override
    public synchronized List<ScoredNode> vectorSearch(
        double[] embedding,
        NodeType targetType,
        OwnerScope scope,
        int limit,
        double minScore
    ) {
        if (embedding == null || embedding.length == 0) {
            return List.of();
        }
        Set<String> allowed = scope == null ? null : scopedIds(scope);
        List<ScoredNode> hits = new ArrayList<>();
        for (Node node : newestFirst(targetType)) {
            if (allowed != null && !allowed.contains(node.id())) {
                continue;
            }
            double[] candidate = node.embedding();
            if (candidate == null) {
                continue;
            }
            double score = GraphSearch.cosine(embedding, candidate);
            if (score >= minScore) {
                hits.add(new ScoredNode(node, score));
            }
        }
        hits.sort(Comparator.comparingDouble(ScoredNode::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, Math.max(0, limit))) : List.copyOf(hits);
    }

    @Override
    public boolean hasVectorIndex(NodeType type) {
        return vectorIndexed;
    }

    @Override
    public synchronized List<ScoredNode> textSearch(String text, NodeType type, int limit) {
        List<String> terms = GraphSearch.terms(text);
        List<ScoredNode> hits = new ArrayList<>();
        for (Node node : newestFirst(type)) {
            double score = GraphSearch.textScore(terms, node);
            if (score > 0) {
                hits.add(new ScoredNode(node, score));
            }
        }
        hits.sort(Comparator.comparingDouble(ScoredNode::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, Math.max(0, limit))) : List.copyOf(hits);
    }

    @Override
    public synchronized UpsertResult createOrMatch(
        NodeType type,
        String keyProperty,
        Object keyValue,
        String name,
        Map<String, ?> properties
    ) {
        if (keyProperty == null || keyProperty.isBlank() || keyValue == null) {
            throw new ValidationException("createOrMatch needs a key property and value");
        }
        PropertyValue key = PropertyValue.of(keyValue);
        for (Node node : newestFirst(type)) {
            boolean matches = "name".equals(keyProperty)
                ? node.name().equals(key.asString())
                : key.matches(node.properties().get(keyProperty));
            if (matches) {
                StoredNode stored = nodes.get(node.id());
                stored.node = GraphProperties.merge(stored.node, properties, clock.instant());
                return new UpsertResult(stored.node, false);
            }
        }
        Map<String, Object> initial = new LinkedHashMap<>();
        if (properties != null) {
            initial.putAll(properties);
        }
        if (!"name".equals(keyProperty)) {
            initial.put(keyProperty, keyValue);
        }
        String id = createNode(type, name, initial);
        return new UpsertResult(nodes.get(id).node, true);
    }

    @Override
    public synchronized boolean incrementProperty(String id, String key, double delta) {
        StoredNode stored = id == null ? null : nodes.get(id);
        if (stored == null) {
            return false;
        }
        Map<String, PropertyValue> properties = new LinkedHashMap<>(stored.node.properties());
        properties.put(key, PropertyValue.increment(properties.get(key), delta));
        Node node = stored.node;
        stored.node = new Node(node.id(), node.type(), node.name(), properties, node.createdAt(), clock.instant());
        return true;
    }

    @Override
    public synchronized List<Node> searchAll(String text, int limit) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return newestFirst(null).stream()
            .filter(node -> GraphSearch.TEXT_PROPERTIES.stream()
                .anyMatch(property -> GraphSearch.containsIgnoreCase(valueOf(node, property), text)))
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public synchronized GraphStats stats() {
        Map<String, Long> counts = new TreeMap<>();
        for (StoredNode stored : nodes.values()) {
            counts.merge(stored.node.type().label(), 1L, Long::sum);
        }
        return new GraphStats(counts, relationships.size());
    }

    private List<Node> newestFirst(NodeType type) {
        return nodes.values().stream()
            .filter(stored -> type == null || stored.node.type() == type)
            .sorted(Comparator.comparing((StoredNode stored) -> stored.node.createdAt())
                .thenComparingLong(stored -> stored.sequence)
                .reversed())
            .map(stored -> stored.node)
            .toList();
    }

    private Set<String> scopedIds(OwnerScope scope) {
        Set<String> ids = new HashSet<>();
        for (StoredRelationship rel : relationships) {
            if (rel.type == scope.relation() && rel.from.equals(scope.ownerId())) {
                ids.add(rel.to);
            }
        }
        return ids;
    }

    private static String valueOf(Node node, String property) {
        if ("name".equals(property)) {
            return node.name();
        }
        return node.property(property).map(PropertyValue::asString).orElse(null);
    }

    private static boolean matchesAll(Node node, Map<String, PropertyValue> expected) {
        for (Map.Entry<String, PropertyValue> entry : expected.entrySet()) {
            PropertyValue actual = "name".equals(entry.getKey())
                ? PropertyValue.of(node.name())
                : node.properties().get(entry.getKey());
            if (!entry.getValue().matches(actual)) {
                return false;
            }
        }
        return true;
    }

    private static final class StoredNode {
        private final long sequence;
        private Node node;

        private StoredNode(long sequence, Node node) {
            this.sequence = sequence;
            this.node = node;
        }
    }

    private record StoredRelationship(
        long sequence,
        String from,
        String to,
        RelationType type,
        Map<String, PropertyValue> properties,
        Instant createdAt
    ) {
    }
}
