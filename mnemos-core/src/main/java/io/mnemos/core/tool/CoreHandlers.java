package io.mnemos.core.tool;

import io.mnemos.core.capability.CapabilityRegistry;
import io.mnemos.core.capability.RefreshResult;
import io.mnemos.core.capability.ToolDefinition;
import io.mnemos.core.cognitive.CognitiveGraph;
import io.mnemos.core.cognitive.DocumentIngestor;
import io.mnemos.core.cognitive.IngestResult;
import io.mnemos.core.cognitive.ProjectCategory;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.identity.IdentityService;
import io.mnemos.core.identity.PersonaIdentity;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process handlers for the bundled core tools. Registered by name on the {@link CapabilityRegistry}.
 */
public final class CoreHandlers {
    private static final Logger LOG = LoggerFactory.getLogger(CoreHandlers.class);

    public static final String GET_COGNITIVE_CONTEXT = "get_cognitive_context";
    public static final String UPDATE_COGNITIVE_TREE = "update_cognitive_tree";
    public static final String REFRESH_TOOLS = "refresh_tools";
    public static final String LIST_AVAILABLE_TOOLS = "list_available_tools";
    public static final String SEARCH_GRAPH = "search_graph";
    public static final String GET_PERSONA_INFO = "get_persona_info";
    public static final String STORE_DOCUMENT = "store_document";
    public static final String LEARN_PREFERENCE = "learn_preference";

    static final int DESCRIPTION_LIMIT = 300;
    private static final int SCAN_LIMIT = 500;
    private static final List<NodeType> RECENT_TYPES =
        List.of(NodeType.INSIGHT, NodeType.TASK, NodeType.CYCLE, NodeType.MEMORY);

    private final CognitiveGraph graph;
    private final CapabilityRegistry registry;
    private final IdentityService identity;
    private final DocumentIngestor ingestor;

    public CoreHandlers(CognitiveGraph graph, CapabilityRegistry registry, IdentityService identity, DocumentIngestor ingestor) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor must not be null");
    }

    public void registerAll() {
        registry.registerHandler(GET_COGNITIVE_CONTEXT, this::cognitiveContext);
        registry.registerHandler(UPDATE_COGNITIVE_TREE, this::updateCognitiveTree);
        registry.registerHandler(REFRESH_TOOLS, input -> refreshTools());
        registry.registerHandler(LIST_AVAILABLE_TOOLS, this::listAvailableTools);
        registry.registerHandler(SEARCH_GRAPH, this::searchGraph);
        registry.registerHandler(GET_PERSONA_INFO, input -> identity.personaInfo());
        registry.registerHandler(STORE_DOCUMENT, this::storeDocument);
        registry.registerHandler(LEARN_PREFERENCE, this::learnPreference);
        LOG.debug("Registered core tool handlers");
    }

    Map<String, Object> cognitiveContext(Map<String, Object> input) throws IOException {
        String contextType = ToolInputs.string(input, "context_type", "full").toLowerCase(Locale.ROOT);
        String projectName = ToolInputs.string(input, "project_name", null);
        int limit = ToolInputs.integer(input, "limit", 10);
        boolean full = "full".equals(contextType);

        Map<String, Object> result = new LinkedHashMap<>();
        if (full || "user".equals(contextType)) {
            Optional<Node> user = graph.getUser();
            if (user.isPresent()) {
                Map<String, Object> userInfo = new LinkedHashMap<>();
                userInfo.put("id", user.get().id());
                userInfo.put("name", user.get().name());
                userInfo.put("email", user.get().string("email", null));
                userInfo.put("first_name", user.get().string("first_name", null));
                userInfo.put("last_name", user.get().string("last_name", null));
                result.put("user", userInfo);
            }
        }
        if (full || "projects".equals(contextType)) {
            List<Node> projects = projectName == null
                ? graph.userProjects(limit, null, false)
                : graph.store().searchNodes(NodeType.PROJECT, "name", projectName, limit);
            result.put("projects", toMaps(projects));
        }
        if (full || "people".equals(contextType)) {
            result.put("people", toMaps(graph.store().findNodes(NodeType.PERSON, Map.of(), limit)));
        }
        if (full || "recent".equals(contextType)) {
            result.put("recent_activity", toMaps(recent(limit)));
        }
        if (full) {
            Optional<PersonaIdentity> persona = identity.current();
            if (persona.isPresent()) {
                List<String> traits = new ArrayList<>();
                persona.get().traits().forEach(trait -> traits.add(trait.name()));
                Map<String, Object> personaInfo = new LinkedHashMap<>();
                personaInfo.put("id", persona.get().id());
                personaInfo.put("name", persona.get().name());
                personaInfo.put("tagline", persona.get().tagline());
                personaInfo.put("traits", traits);
                result.put("persona", personaInfo);
            }
        }
        return result;
    }

    /**
     * Never throws: failures come back as {@code {success: false, error}} so the model can correct itself.
     */
    Map<String, Object> updateCognitiveTree(Map<String, Object> input) {
        String operation = ToolInputs.string(input, "operation", "");
        String nodeType = ToolInputs.string(input, "node_type", "");
        Map<String, Object> data = ToolInputs.map(input, "data");
        try {
            return switch (operation.toLowerCase(Locale.ROOT)) {
                case "create" -> create(nodeType, data);
                case "update" -> update(data);
                case "link" -> link(data, ToolInputs.string(input, "link_to", null));
                default -> failure("Unknown operation: " + operation);
            };
        } catch (IOException | RuntimeException e) {
            LOG.warn("update_cognitive_tree {} {} failed: {}", operation, nodeType, e.getMessage());
            return failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    Map<String, Object> refreshTools() {
        RefreshResult changes = registry.refresh();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("changes", changes.toMap());
        result.put("total_tools", registry.list(null, null, false).size());
        result.put("message", "Registry refreshed. Added: " + changes.added().size()
            + ", Updated: " + changes.updated().size()
            + ", Removed: " + changes.removed().size());
        return result;
    }

    List<Map<String, Object>> listAvailableTools(Map<String, Object> input) {
        String category = ToolInputs.string(input, "category", null);
        boolean includeDisabled = ToolInputs.bool(input, "include_disabled", false);
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolDefinition tool : registry.list(null, category, !includeDisabled)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", tool.name());
            row.put("description", truncate(tool.description()));
            row.put("category", tool.category());
            row.put("tier", tool.tier());
            row.put("enabled", tool.active());
            tools.add(row);
        }
        return tools;
    }

    List<Map<String, Object>> searchGraph(Map<String, Object> input) throws IOException {
        String query = ToolInputs.required(input, "query");
        int limit = ToolInputs.integer(input, "limit", 20);
        List<String> types = ToolInputs.strings(input, "node_types");

        List<Map<String, Object>> results = new ArrayList<>();
        for (Node node : graph.store().searchAll(query, types.isEmpty() ? limit : SCAN_LIMIT)) {
            if (!types.isEmpty() && types.stream().noneMatch(type -> type.equalsIgnoreCase(node.type().label()))) {
                continue;
            }
            results.add(node.toMap());
            if (results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    Map<String, Object> storeDocument(Map<String, Object> input) throws IOException {
        IngestResult ingested = ingestor.store(
            ToolInputs.required(input, "title"),
            ToolInputs.required(input, "text"),
            ToolInputs.string(input, "source_url", null),
            ToolInputs.string(input, "doc_type", null),
            ToolInputs.integer(input, "chunk_size", 500),
            ToolInputs.integer(input, "chunk_overlap", 50)
        );
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("document_id", ingested.documentId());
        result.put("chunk_ids", ingested.chunkIds());
        result.put("chunks", ingested.chunkIds().size());
        result.put("embedded", ingested.embedded());
        return result;
    }

    Map<String, Object> learnPreference(Map<String, Object> input) throws IOException {
        Node preference = identity.upsertPreference(
            ToolInputs.required(input, "name"),
            input.get("value"),
            ToolInputs.string(input, "category", "general"),
            Math.max(0.0, Math.min(1.0, ToolInputs.decimal(input, "confidence", 0.7)))
        );
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("id", preference.id());
        result.put("name", preference.name());
        result.put("observation_count", (long) preference.number("observation_count", 1));
        return result;
    }

    private Map<String, Object> create(String nodeType, Map<String, Object> data) throws IOException {
        Node created;
        switch (nodeType.toLowerCase(Locale.ROOT)) {
            case "project":
                created = graph.createProject(
                    ToolInputs.string(data, "name", "Unnamed Project"),
                    ToolInputs.string(data, "description", ""),
                    ProjectCategory.parse(ToolInputs.string(data, "category", null)),
                    ToolInputs.bool(data, "is_life_area", false)
                );
                break;
            case "person":
                Map<String, Object> extra = new LinkedHashMap<>();
                for (String key : List.of("email", "phone", "relationship")) {
                    String value = ToolInputs.string(data, key, null);
                    if (value != null) {
                        extra.put(key, value);
                    }
                }
                String notes = ToolInputs.string(data, "notes", ToolInputs.string(data, "context", null));
                if (notes != null) {
                    extra.put("notes", notes);
                }
                created = graph.createPerson(ToolInputs.required(data, "name"), extra);
                break;
            case "task":
                String cycleId = ToolInputs.string(data, "cycle_id", null);
                String description = ToolInputs.required(data, "description");
                int priority = ToolInputs.integer(data, "priority", 5);
                if (cycleId == null) {
                    created = graph.createTask(description, priority);
                } else {
                    Optional<Node> task = graph.addTaskToCycle(cycleId, description, priority);
                    if (task.isEmpty()) {
                        return failure("Cycle not found: " + cycleId);
                    }
                    created = task.get();
                }
                break;
            case "insight":
                created = graph.createInsight(
                    ToolInputs.string(data, "insight", ToolInputs.string(data, "content", null)),
                    ToolInputs.string(data, "source_type", "conversation"),
                    ToolInputs.decimal(data, "confidence", 0.7)
                );
                break;
            case "goal":
                created = graph.createGoal(
                    ToolInputs.required(data, "name"),
                    ToolInputs.string(data, "description", ""),
                    ToolInputs.string(data, "timeframe", null),
                    ToolInputs.strings(data, "success_criteria")
                );
                break;
            default:
                return failure("Unsupported node type: " + nodeType);
        }
        Map<String, Object> result = success("create");
        result.put("node_type", created.type().label());
        result.put("id", created.id());
        result.put("name", created.name());
        return result;
    }

    private Map<String, Object> update(Map<String, Object> data) throws IOException {
        String id = ToolInputs.string(data, "id", null);
        if (id == null) {
            return failure("Node ID required for update");
        }
        Map<String, Object> properties = new LinkedHashMap<>(data);
        properties.remove("id");
        Map<String, Object> result = success("update");
        result.put("success", graph.store().updateNode(id, properties));
        result.put("id", id);
        return result;
    }

    private Map<String, Object> link(Map<String, Object> data, String linkTo) throws IOException {
        String fromId = ToolInputs.string(data, "from_id", ToolInputs.string(data, "id", null));
        String toId = linkTo != null ? linkTo : ToolInputs.string(data, "to_id", null);
        if (fromId == null || toId == null) {
            return failure("Both from_id and to_id required");
        }
        RelationType relation = RelationType.fromName(ToolInputs.string(data, "relationship", null))
            .orElse(RelationType.RELATED_TO);
        Map<String, Object> result = success("link");
        result.put("success", graph.store().createRelationship(fromId, toId, relation));
        result.put("from", fromId);
        result.put("to", toId);
        result.put("relationship", relation.name());
        return result;
    }

    private List<Node> recent(int limit) throws IOException {
        List<Node> nodes = new ArrayList<>();
        GraphStore store = graph.store();
        for (NodeType type : RECENT_TYPES) {
            nodes.addAll(store.findNodes(type, Map.of(), limit));
        }
        nodes.sort(Comparator.comparing(Node::createdAt).reversed());
        return nodes.size() > limit ? nodes.subList(0, limit) : nodes;
    }

    private static List<Map<String, Object>> toMaps(List<Node> nodes) {
        List<Map<String, Object>> maps = new ArrayList<>(nodes.size());
        nodes.forEach(node -> maps.add(node.toMap()));
        return maps;
    }

    private static String truncate(String description) {
        return description.length() > DESCRIPTION_LIMIT
            ? description.substring(0, DESCRIPTION_LIMIT) + "..."
            : description;
    }

    private static Map<String, Object> success(String operation) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("operation", operation);
        return result;
    }

    private static Map<String, Object> failure(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", error);
        return result;
    }
}
