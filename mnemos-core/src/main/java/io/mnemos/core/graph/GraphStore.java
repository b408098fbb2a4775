package io.mnemos.core.graph;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed property-graph persistence. Absence is reported through {@link Optional} or {@code false},
 * connection failures through {@link StoreUnavailableException}, bad input through {@link ValidationException}.
 */
public interface GraphStore {
    double HYBRID_VECTOR_MIN_SCORE = 0.5;

    String createNode(NodeType type, String name, Map<String, ?> properties) throws IOException;

    default String createNode(Node node) throws IOException {
        if (node.persisted()) {
            throw new ValidationException("Node is already persisted: " + node.id());
        }
        return createNode(node.type(), node.name(), node.plainProperties());
    }

    Optional<Node> getNode(String id) throws IOException;

    /**
     * Newest first. Filters are exact matches, AND-combined.
     */
    List<Node> findNodes(NodeType type, Map<String, ?> filters, int limit) throws IOException;

    /**
     * Case-insensitive substring match on one property, newest first. Not ranked.
     */
    List<Node> searchNodes(NodeType type, String property, String substring, int limit) throws IOException;

    /**
     * Merges properties into the node. A {@code null} value removes the key and a {@code name} key renames
     * the node. {@code id}, {@code type} and the timestamps cannot be changed.
     */
    boolean updateNode(String id, Map<String, ?> properties) throws IOException;

    /**
     * Deletes the node and every relationship touching it.
     */
    boolean deleteNode(String id) throws IOException;

    /**
     * Returns {@code false} when either endpoint does not exist.
     */
    boolean createRelationship(String fromId, String toId, RelationType type, Map<String, ?> properties)
        throws IOException;

    default boolean createRelationship(String fromId, String toId, RelationType type) throws IOException {
        return createRelationship(fromId, toId, type, Map.of());
    }

    default boolean createRelationship(Node from, Node to, RelationType type) throws IOException {
        if (!from.persisted() || !to.persisted()) {
            throw new ValidationException("Unpersisted nodes cannot be linked");
        }
        return createRelationship(from.id(), to.id(), type, Map.of());
    }

    /**
     * Nodes adjacent to {@code id}, newest relationship first. {@code type} and {@code targetType} may be null.
     */
    List<RelatedNode> getRelated(String id, RelationType type, Direction direction, NodeType targetType, int limit)
        throws IOException;

    int countRelated(String id, RelationType type, Direction direction, NodeType targetType) throws IOException;

    /**
     * Nodes of {@code targetType} whose embedding has cosine similarity of at least {@code minScore},
     * highest first. {@code scope} may be null. Stores without a vector index scan.
     */
    List<ScoredNode> vectorSearch(double[] embedding, NodeType targetType, OwnerScope scope, int limit, double minScore)
        throws IOException;

    default List<ScoredNode> vectorSearch(double[] embedding, NodeType targetType, int limit, double minScore)
        throws IOException {
        return vectorSearch(embedding, targetType, null, limit, minScore);
    }

    boolean hasVectorIndex(NodeType type);

    /**
     * Full-text candidates scored in [0, 1], highest first.
     */
    List<ScoredNode> textSearch(String text, NodeType type, int limit) throws IOException;

    default List<ScoredNode> hybridSearch(
        String text,
        double[] embedding,
        NodeType type,
        int limit,
        double textWeight,
        double vectorWeight
    ) throws IOException {
        List<ScoredNode> vectorHits = embedding == null
            ? List.of()
            : vectorSearch(embedding, type, null, limit * 2, HYBRID_VECTOR_MIN_SCORE);
        List<ScoredNode> textHits = text == null || text.isBlank() ? List.of() : textSearch(text, type, limit * 2);
        return GraphSearch.combine(vectorHits, textHits, limit, textWeight, vectorWeight);
    }

    default List<ScoredNode> hybridSearch(String text, double[] embedding, NodeType type, int limit) throws IOException {
        return hybridSearch(text, embedding, type, limit, 0.3, 0.7);
    }

    /**
     * Finds a node of {@code type} whose {@code keyProperty} equals {@code keyValue}, merging the given
     * properties into it, or creates one. Use {@code "name"} as key to match on the node name.
     */
    UpsertResult createOrMatch(NodeType type, String keyProperty, Object keyValue, String name, Map<String, ?> properties)
        throws IOException;

    /**
     * Adds {@code delta} to a numeric property, treating a missing value as zero.
     */
    boolean incrementProperty(String id, String key, double delta) throws IOException;

    /**
     * Case-insensitive substring search over the common text properties of every node type, newest first.
     */
    List<Node> searchAll(String text, int limit) throws IOException;

    GraphStats stats() throws IOException;
}
