package io.mnemos.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded graph store on SQLite. Nodes keep their properties as a JSON document; embeddings are
 * mirrored into {@code node_vectors} (the vector index) and searchable text into an FTS5 table when
 * the driver supports it. Each operation opens and closes its own connection.
 */
public final class SqliteGraphStore implements GraphStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteGraphStore.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String NODE_COLUMNS = "n.id, n.type, n.name, n.properties_json, n.created_at, n.updated_at";

    private final String jdbcUrl;
    private final Clock clock;
    private final boolean vectorIndex;
    private final ObjectMapper mapper;
    private boolean fullTextIndex;

    public SqliteGraphStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC(), true);
    }

    public SqliteGraphStore(Path dbPath, Clock clock, boolean vectorIndex) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock;
        this.vectorIndex = vectorIndex;
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized String createNode(NodeType type, String name, Map<String, ?> properties) throws IOException {
        GraphProperties.validateNew(type, name);
        Map<String, PropertyValue> converted = PropertyValue.ofAll(properties);
        Instant now = clock.instant();
        Node node = new Node(UUID.randomUUID().toString(), type, name.trim(), converted, now, now);
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            insertNode(connection, node);
            syncIndexes(connection, node);
            connection.commit();
            return node.id();
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to create " + type.label() + " node", e);
        }
    }

    @Override
    public synchronized Optional<Node> getNode(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        try (Connection connection = openConnection()) {
            return loadNode(connection, id);
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to load node " + id, e);
        }
    }

    @Override
    public synchronized List<Node> findNodes(NodeType type, Map<String, ?> filters, int limit) throws IOException {
        Map<String, PropertyValue> expected = GraphProperties.filters(filters);
        StringBuilder sql = new StringBuilder("SELECT " + NODE_COLUMNS + " FROM nodes n WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (type != null) {
            sql.append(" AND n.type = ?");
            params.add(type.label());
        }
        for (Map.Entry<String, PropertyValue> entry : expected.entrySet()) {
            if ("name".equals(entry.getKey())) {
                sql.append(" AND n.name = ?");
            } else {
                sql.append(" AND json_extract(n.properties_json, ?) = ?");
                params.add(jsonPath(entry.getKey()));
            }
            params.add(sqlValue(entry.getValue()));
        }
        sql.append(" ORDER BY n.created_at DESC, n.seq DESC LIMIT ?");
        params.add(Math.max(0, limit));
        return queryNodes(sql.toString(), params, "find nodes");
    }

    @Override
    public synchronized List<Node> searchNodes(NodeType type, String property, String substring, int limit)
        throws IOException {
        if (property == null || property.isBlank() || substring == null) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        String column;
        if ("name".equals(property)) {
            column = "n.name";
        } else {
            column = "json_extract(n.properties_json, ?)";
            params.add(jsonPath(property));
        }
        String sql = "SELECT " + NODE_COLUMNS + " FROM nodes n WHERE instr(lower(" + column + "), lower(?)) > 0"
            + (type == null ? "" : " AND n.type = ?")
            + " ORDER BY n.created_at DESC, n.seq DESC LIMIT ?";
        params.add(substring);
        if (type != null) {
            params.add(type.label());
        }
        params.add(Math.max(0, limit));
        return queryNodes(sql, params, "search nodes");
    }

    @Override
    public synchronized boolean updateNode(String id, Map<String, ?> properties) throws IOException {
        if (id == null) {
            return false;
        }
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            Optional<Node> existing = loadNode(connection, id);
            if (existing.isEmpty()) {
                return false;
            }
            Node merged = GraphProperties.merge(existing.get(), properties, clock.instant());
            writeNode(connection, merged);
            syncIndexes(connection, merged);
            connection.commit();
            return true;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to update node " + id, e);
        }
    }

    @Override
    public synchronized boolean deleteNode(String id) throws IOException {
        if (id == null) {
            return false;
        }
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            int deleted = executeUpdate(connection, "DELETE FROM nodes WHERE id = ?", List.of(id));
            executeUpdate(connection, "DELETE FROM relationships WHERE from_id = ? OR to_id = ?", List.of(id, id));
            executeUpdate(connection, "DELETE FROM node_vectors WHERE node_id = ?", List.of(id));
            if (fullTextIndex) {
                executeUpdate(connection, "DELETE FROM node_text WHERE node_id = ?", List.of(id));
            }
            connection.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to delete node " + id, e);
        }
    }

    @Override
    public synchronized boolean createRelationship(
        String fromId,
        String toId,
        RelationType type,
        Map<String, ?> properties
    ) throws IOException {
        GraphProperties.validateLink(fromId, toId, type);
        String sql = """
            INSERT INTO relationships (from_id, to_id, type, properties_json, created_at)
            SELECT ?, ?, ?, ?, ?
            WHERE EXISTS (SELECT 1 FROM nodes WHERE id = ?)
              AND EXISTS (SELECT 1 FROM nodes WHERE id = ?)
            """;
        try (Connection connection = openConnection()) {
            int inserted = executeUpdate(connection, sql, List.of(
                fromId,
                toId,
                type.name(),
                toJson(PropertyValue.ofAll(properties)),
                clock.instant().toString(),
                fromId,
                toId
            ));
            return inserted > 0;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to create relationship " + type, e);
        }
    }

    @Override
    public synchronized List<RelatedNode> getRelated(
        String id,
        RelationType type,
        Direction direction,
        NodeType targetType,
        int limit
    ) throws IOException {
        List<Object> params = new ArrayList<>();
        String sql = relatedQuery(id, type, direction, targetType, params)
            + " ORDER BY rel_seq DESC LIMIT ?";
        params.add(Math.max(0, limit));
        try (Connection connection = openConnection();
             PreparedStatement statement = prepare(connection, sql, params);
             ResultSet resultSet = statement.executeQuery()) {
            List<RelatedNode> related = new ArrayList<>();
            while (resultSet.next()) {
                related.add(new RelatedNode(
                    readNode(resultSet),
                    RelationType.valueOf(resultSet.getString("rel_type")),
                    Direction.valueOf(resultSet.getString("rel_dir")),
                    PropertyValue.ofAll(mapper.readValue(resultSet.getString("rel_props"), MAP_TYPE))
                ));
            }
            return related;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to load related nodes of " + id, e);
        }
    }

    @Override
    public synchronized int countRelated(String id, RelationType type, Direction direction, NodeType targetType)
        throws IOException {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT count(*) FROM (" + relatedQuery(id, type, direction, targetType, params) + ")";
        try (Connection connection = openConnection();
             PreparedStatement statement = prepare(connection, sql, params);
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to count related nodes of " + id, e);
        }
    }

    @Override
    public synchronized List<ScoredNode> vectorSearch(
        double[] embedding,
        NodeType targetType,
        OwnerScope scope,
        int limit,
        double minScore
    ) throws IOException {
        if (embedding == null || embedding.length == 0) {
            return List.of();
        }
        try (Connection connection = openConnection()) {
            Map<String, Double> scores = vectorIndex
                ? scoreIndexed(connection, embedding, targetType, scope, minScore)
                : scoreByScan(connection, embedding, targetType, scope, minScore);
            List<Map.Entry<String, Double>> ranked = new ArrayList<>(scores.entrySet());
            ranked.sort(Map.Entry.<String, Double>comparingByValue().reversed());
            List<ScoredNode> hits = new ArrayList<>();
            for (Map.Entry<String, Double> entry : ranked) {
                if (hits.size() >= limit) {
                    break;
                }
                loadNode(connection, entry.getKey()).ifPresent(node -> hits.add(new ScoredNode(node, entry.getValue())));
            }
            return hits;
        } catch (SQLException e) {
            throw new GraphStoreException("Vector search failed", e);
        }
    }

    @Override
    public boolean hasVectorIndex(NodeType type) {
        return vectorIndex;
    }

    public synchronized boolean hasFullTextIndex() {
        return fullTextIndex;
    }

    @Override
    public synchronized List<ScoredNode> textSearch(String text, NodeType type, int limit) throws IOException {
        List<String> terms = GraphSearch.terms(text);
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<Node> candidates = fullTextIndex ? fullTextCandidates(terms, type, limit * 4) : scanCandidates(terms, type);
        List<ScoredNode> hits = new ArrayList<>();
        for (Node node : candidates) {
            double score = GraphSearch.textScore(terms, node);
            if (score > 0) {
                hits.add(new ScoredNode(node, score));
            }
        }
        hits.sort(Comparator.comparingDouble(ScoredNode::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public synchronized UpsertResult createOrMatch(
        NodeType type,
        String keyProperty,
        Object keyValue,
        String name,
        Map<String, ?> properties
    ) throws IOException {
        if (keyProperty == null || keyProperty.isBlank() || keyValue == null) {
            throw new ValidationException("createOrMatch needs a key property and value");
        }
        PropertyValue key = PropertyValue.of(keyValue);
        List<Object> params = new ArrayList<>();
        params.add(type.label());
        String condition;
        if ("name".equals(keyProperty)) {
            condition = "n.name = ?";
        } else {
            condition = "json_extract(n.properties_json, ?) = ?";
            params.add(jsonPath(keyProperty));
        }
        params.add(sqlValue(key));
        String sql = "SELECT " + NODE_COLUMNS + " FROM nodes n WHERE n.type = ? AND " + condition
            + " ORDER BY n.created_at DESC, n.seq DESC LIMIT 1";
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            Optional<Node> existing;
            try (PreparedStatement statement = prepare(connection, sql, params);
                 ResultSet resultSet = statement.executeQuery()) {
                existing = resultSet.next() ? Optional.of(readNode(resultSet)) : Optional.empty();
            }
            Node node;
            boolean created;
            if (existing.isPresent()) {
                node = GraphProperties.merge(existing.get(), properties, clock.instant());
                writeNode(connection, node);
                created = false;
            } else {
                GraphProperties.validateNew(type, name);
                Map<String, PropertyValue> initial = PropertyValue.ofAll(properties);
                if (!"name".equals(keyProperty)) {
                    initial.put(keyProperty, key);
                }
                Instant now = clock.instant();
                node = new Node(UUID.randomUUID().toString(), type, name.trim(), initial, now, now);
                insertNode(connection, node);
                created = true;
            }
            syncIndexes(connection, node);
            connection.commit();
            return new UpsertResult(node, created);
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to upsert " + type.label() + " node", e);
        }
    }

    @Override
    public synchronized boolean incrementProperty(String id, String key, double delta) throws IOException {
        if (id == null) {
            return false;
        }
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            Optional<Node> existing = loadNode(connection, id);
            if (existing.isEmpty()) {
                return false;
            }
            Node node = existing.get();
            Map<String, PropertyValue> properties = new LinkedHashMap<>(node.properties());
            properties.put(key, PropertyValue.increment(properties.get(key), delta));
            writeNode(connection, new Node(node.id(), node.type(), node.name(), properties, node.createdAt(), clock.instant()));
            connection.commit();
            return true;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to increment " + key + " on node " + id, e);
        }
    }

    @Override
    public synchronized List<Node> searchAll(String text, int limit) throws IOException {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        for (String property : GraphSearch.TEXT_PROPERTIES) {
            if ("name".equals(property)) {
                conditions.add("instr(lower(n.name), lower(?)) > 0");
            } else {
                conditions.add("instr(lower(coalesce(json_extract(n.properties_json, ?), '')), lower(?)) > 0");
                params.add(jsonPath(property));
            }
            params.add(text);
        }
        String sql = "SELECT " + NODE_COLUMNS + " FROM nodes n WHERE " + String.join(" OR ", conditions)
            + " ORDER BY n.created_at DESC, n.seq DESC LIMIT ?";
        params.add(Math.max(0, limit));
        return queryNodes(sql, params, "search all nodes");
    }

    @Override
    public synchronized GraphStats stats() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            Map<String, Long> counts = new TreeMap<>();
            try (ResultSet resultSet = statement.executeQuery("SELECT type, count(*) FROM nodes GROUP BY type")) {
                while (resultSet.next()) {
                    counts.put(resultSet.getString(1), resultSet.getLong(2));
                }
            }
            long relationships;
            try (ResultSet resultSet = statement.executeQuery("SELECT count(*) FROM relationships")) {
                relationships = resultSet.next() ? resultSet.getLong(1) : 0L;
            }
            return new GraphStats(counts, relationships);
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to compute graph stats", e);
        }
    }

    private Map<String, Double> scoreIndexed(
        Connection connection,
        double[] query,
        NodeType targetType,
        OwnerScope scope,
        double minScore
    ) throws SQLException {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT DISTINCT v.node_id, v.vector FROM node_vectors v");
        if (scope != null) {
            sql.append(" JOIN relationships r ON r.to_id = v.node_id AND r.from_id = ? AND r.type = ?");
            params.add(scope.ownerId());
            params.add(scope.relation().name());
        }
        sql.append(" WHERE v.dimensions = ?");
        params.add(query.length);
        if (targetType != null) {
            sql.append(" AND v.type = ?");
            params.add(targetType.label());
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        try (PreparedStatement statement = prepare(connection, sql.toString(), params);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                double score = GraphSearch.cosine(query, decodeVector(resultSet.getBytes("vector")));
                if (score >= minScore) {
                    scores.put(resultSet.getString("node_id"), score);
                }
            }
        }
        return scores;
    }

    private Map<String, Double> scoreByScan(
        Connection connection,
        double[] query,
        NodeType targetType,
        OwnerScope scope,
        double minScore
    ) throws SQLException, IOException {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT DISTINCT " + NODE_COLUMNS + " FROM nodes n");
        if (scope != null) {
            sql.append(" JOIN relationships r ON r.to_id = n.id AND r.from_id = ? AND r.type = ?");
            params.add(scope.ownerId());
            params.add(scope.relation().name());
        }
        sql.append(" WHERE json_extract(n.properties_json, '$.embedding') IS NOT NULL");
        if (targetType != null) {
            sql.append(" AND n.type = ?");
            params.add(targetType.label());
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        try (PreparedStatement statement = prepare(connection, sql.toString(), params);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                Node node = readNode(resultSet);
                double[] candidate = node.embedding();
                double score = GraphSearch.cosine(query, candidate);
                if (candidate != null && score >= minScore) {
                    scores.put(node.id(), score);
                }
            }
        }
        return scores;
    }

    private List<Node> fullTextCandidates(List<String> terms, NodeType type, int limit) throws IOException {
        String match = terms.stream().map(term -> "\"" + term + "\"").collect(Collectors.joining(" OR "));
        List<Object> params = new ArrayList<>();
        params.add(match);
        String sql = "SELECT " + NODE_COLUMNS + " FROM node_text JOIN nodes n ON n.id = node_text.node_id"
            + " WHERE node_text MATCH ?"
            + (type == null ? "" : " AND n.type = ?")
            + " ORDER BY bm25(node_text) LIMIT ?";
        if (type != null) {
            params.add(type.label());
        }
        params.add(limit);
        return queryNodes(sql, params, "full-text search");
    }

    private List<Node> scanCandidates(List<String> terms, NodeType type) throws IOException {
        List<Node> candidates = new ArrayList<>();
        for (String term : terms) {
            for (Node node : searchAllOfType(term, type)) {
                if (candidates.stream().noneMatch(existing -> existing.id().equals(node.id()))) {
                    candidates.add(node);
                }
            }
        }
        return candidates;
    }

    private List<Node> searchAllOfType(String text, NodeType type) throws IOException {
        List<Node> matches = new ArrayList<>();
        for (Node node : searchAll(text, Integer.MAX_VALUE)) {
            if (type == null || node.type() == type) {
                matches.add(node);
            }
        }
        return matches;
    }

    private String relatedQuery(
        String id,
        RelationType type,
        Direction direction,
        NodeType targetType,
        List<Object> params
    ) {
        List<String> parts = new ArrayList<>();
        if (direction != Direction.IN) {
            parts.add(relatedBranch("OUT", "r.to_id", "r.from_id", id, type, targetType, params));
        }
        if (direction != Direction.OUT) {
            parts.add(relatedBranch("IN", "r.from_id", "r.to_id", id, type, targetType, params));
        }
        return String.join(" UNION ALL ", parts);
    }

    private String relatedBranch(
        String label,
        String otherColumn,
        String selfColumn,
        String id,
        RelationType type,
        NodeType targetType,
        List<Object> params
    ) {
        StringBuilder sql = new StringBuilder("SELECT " + NODE_COLUMNS + ", r.type AS rel_type, '" + label
            + "' AS rel_dir, r.seq AS rel_seq, r.properties_json AS rel_props FROM relationships r JOIN nodes n ON n.id = " + otherColumn
            + " WHERE " + selfColumn + " = ?");
        params.add(id);
        if (type != null) {
            sql.append(" AND r.type = ?");
            params.add(type.name());
        }
        if (targetType != null) {
            sql.append(" AND n.type = ?");
            params.add(targetType.label());
        }
        return sql.toString();
    }

    private List<Node> queryNodes(String sql, List<Object> params, String operation) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = prepare(connection, sql, params);
             ResultSet resultSet = statement.executeQuery()) {
            List<Node> nodes = new ArrayList<>();
            while (resultSet.next()) {
                nodes.add(readNode(resultSet));
            }
            return nodes;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to " + operation, e);
        }
    }

    private Optional<Node> loadNode(Connection connection, String id) throws SQLException, IOException {
        String sql = "SELECT " + NODE_COLUMNS + " FROM nodes n WHERE n.id = ?";
        try (PreparedStatement statement = prepare(connection, sql, List.of(id));
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? Optional.of(readNode(resultSet)) : Optional.empty();
        }
    }

    private Node readNode(ResultSet resultSet) throws SQLException, IOException {
        Map<String, Object> raw = mapper.readValue(resultSet.getString("properties_json"), MAP_TYPE);
        return new Node(
            resultSet.getString("id"),
            NodeType.parse(resultSet.getString("type")),
            resultSet.getString("name"),
            PropertyValue.ofAll(raw),
            Instant.parse(resultSet.getString("created_at")),
            Instant.parse(resultSet.getString("updated_at"))
        );
    }

    private void insertNode(Connection connection, Node node) throws SQLException, IOException {
        String sql = """
            INSERT INTO nodes (id, type, name, properties_json, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        executeUpdate(connection, sql, List.of(
            node.id(),
            node.type().label(),
            node.name(),
            toJson(node.properties()),
            node.createdAt().toString(),
            node.updatedAt().toString()
        ));
    }

    private void writeNode(Connection connection, Node node) throws SQLException, IOException {
        String sql = """
            UPDATE nodes SET name = ?, properties_json = ?, updated_at = ?
            WHERE id = ?
            """;
        executeUpdate(connection, sql, List.of(
            node.name(),
            toJson(node.properties()),
            node.updatedAt().toString(),
            node.id()
        ));
    }

    private void syncIndexes(Connection connection, Node node) throws SQLException {
        if (vectorIndex) {
            executeUpdate(connection, "DELETE FROM node_vectors WHERE node_id = ?", List.of(node.id()));
            double[] embedding = node.embedding();
            if (embedding != null) {
                executeUpdate(
                    connection,
                    "INSERT INTO node_vectors (node_id, type, dimensions, vector) VALUES (?, ?, ?, ?)",
                    List.of(node.id(), node.type().label(), embedding.length, encodeVector(embedding))
                );
            }
        }
        if (fullTextIndex) {
            executeUpdate(connection, "DELETE FROM node_text WHERE node_id = ?", List.of(node.id()));
            executeUpdate(
                connection,
                "INSERT INTO node_text (node_id, body) VALUES (?, ?)",
                List.of(node.id(), GraphSearch.searchableText(node))
            );
        }
    }

    private int executeUpdate(Connection connection, String sql, List<Object> params) throws SQLException {
        try (PreparedStatement statement = prepare(connection, sql, params)) {
            return statement.executeUpdate();
        }
    }

    private PreparedStatement prepare(Connection connection, String sql, List<Object> params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        for (int i = 0; i < params.size(); i++) {
            statement.setObject(i + 1, params.get(i));
        }
        return statement;
    }

    private String toJson(Map<String, PropertyValue> properties) throws IOException {
        try {
            return mapper.writeValueAsString(PropertyValue.toPlain(properties));
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Failed to serialize node properties", e);
        }
    }

    private static Object sqlValue(PropertyValue value) {
        if (value.value() instanceof Boolean flag) {
            return flag ? 1 : 0;
        }
        return value.value();
    }

    private static String jsonPath(String property) {
        return "$.\"" + property.replace("\"", "") + "\"";
    }

    private static byte[] encodeVector(double[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double value : vector) {
            buffer.putDouble(value);
        }
        return buffer.array();
    }

    private static double[] decodeVector(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        double[] vector = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getDouble();
        }
        return vector;
    }

    private Connection openConnection() throws StoreUnavailableException {
        try {
            Connection connection = DriverManager.getConnection(jdbcUrl);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=WAL;");
                statement.execute("PRAGMA synchronous=NORMAL;");
                statement.execute("PRAGMA busy_timeout=5000;");
            }
            return connection;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Graph store unavailable at " + jdbcUrl, e);
        }
    }

    private void init() throws IOException {
        String nodes = """
            CREATE TABLE IF NOT EXISTS nodes (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                id TEXT NOT NULL UNIQUE,
                type TEXT NOT NULL,
                name TEXT NOT NULL,
                properties_json TEXT NOT NULL,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
        String relationships = """
            CREATE TABLE IF NOT EXISTS relationships (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                from_id TEXT NOT NULL,
                to_id TEXT NOT NULL,
                type TEXT NOT NULL,
                properties_json TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String vectors = """
            CREATE TABLE IF NOT EXISTS node_vectors (
                node_id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                dimensions INTEGER NOT NULL,
                vector BLOB NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(nodes);
            statement.execute(relationships);
            statement.execute(vectors);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_nodes_type_created ON nodes(type, created_at DESC)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_relationships_from ON relationships(from_id, type)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_relationships_to ON relationships(to_id, type)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_node_vectors_type ON node_vectors(type, dimensions)");
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to initialize SQLite graph store", e);
        }

        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE VIRTUAL TABLE IF NOT EXISTS node_text USING fts5(node_id UNINDEXED, body)");
            fullTextIndex = true;
        } catch (SQLException e) {
            LOG.warn("Full-text index unavailable, text search will scan: {}", e.getMessage());
            fullTextIndex = false;
        }
    }
}
