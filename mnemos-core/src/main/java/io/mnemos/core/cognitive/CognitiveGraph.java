package io.mnemos.core.cognitive;

import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.UpsertResult;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Domain operations over the graph: the user and assistant roots, projects and life areas, cycles with
 * their tasks and insights, goals, people and topics.
 */
public final class CognitiveGraph {
    private static final Logger LOG = LoggerFactory.getLogger(CognitiveGraph.class);
    private static final int SCAN_LIMIT = 500;
    private static final Map<ProjectCategory, String> LIFE_AREA_DESCRIPTIONS = new EnumMap<>(ProjectCategory.class);

    static {
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.FAMILY, "Family relationships and activities");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.HEALTH, "Health, fitness, and wellness");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.FINANCE, "Financial planning and goals");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.SOCIAL, "Friendships and community");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.HOBBY, "Hobbies and creative pursuits");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.LEARNING, "Learning and personal development");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.WORK, "Professional career and work");
        LIFE_AREA_DESCRIPTIONS.put(ProjectCategory.HOME, "Home and living space");
    }

    private final GraphStore store;
    private final Clock clock;

    public CognitiveGraph(GraphStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public GraphStore store() {
        return store;
    }

    // ==================== Roots ====================

    public Node getOrCreateUser(String firstName, String lastName, Map<String, ?> extra) throws IOException {
        Node template = Nodes.user(firstName, lastName, extra);
        return store.createOrMatch(NodeType.USER, "first_name", firstName, template.name(), template.plainProperties())
            .node();
    }

    public Optional<Node> getUser() throws IOException {
        List<Node> users = store.findNodes(NodeType.USER, Map.of(), 1);
        return users.isEmpty() ? Optional.empty() : Optional.of(users.get(0));
    }

    public Node getOrCreateAssistant(String name, String model) throws IOException {
        Node template = Nodes.assistant(name, model);
        return store.createOrMatch(NodeType.ASSISTANT, "name", name, name, template.plainProperties()).node();
    }

    public Optional<Node> getAssistant() throws IOException {
        List<Node> assistants = store.findNodes(NodeType.ASSISTANT, Map.of(), 1);
        return assistants.isEmpty() ? Optional.empty() : Optional.of(assistants.get(0));
    }

    /**
     * Ensures the user and assistant roots exist and are linked by a single ASSISTS edge.
     */
    public GraphRoots initializeGraph(String userFirstName, String userLastName, String assistantName, String assistantModel)
        throws IOException {
        Node user = getOrCreateUser(userFirstName, userLastName, Map.of());
        Node assistant = getOrCreateAssistant(assistantName, assistantModel);
        boolean linked = store.getRelated(assistant.id(), RelationType.ASSISTS, Direction.OUT, NodeType.USER, SCAN_LIMIT)
            .stream()
            .anyMatch(related -> related.node().id().equals(user.id()));
        if (!linked) {
            store.createRelationship(assistant.id(), user.id(), RelationType.ASSISTS);
            LOG.info("Linked assistant {} to user {}", assistant.name(), user.name());
        }
        return new GraphRoots(user, assistant);
    }

    // ==================== Projects ====================

    public Node createProject(String name, String description, ProjectCategory category, boolean lifeArea)
        throws IOException {
        String id = store.createNode(Nodes.project(name, description, category, lifeArea));
        Optional<Node> user = getUser();
        if (user.isPresent()) {
            store.createRelationship(user.get().id(), id, RelationType.OWNS);
        }
        return require(id);
    }

    public Node createLifeArea(String name, ProjectCategory category, String description) throws IOException {
        String resolved = description == null || description.isBlank()
            ? LIFE_AREA_DESCRIPTIONS.getOrDefault(category, name + " life area")
            : description;
        return createProject(name, resolved, category, true);
    }

    public List<Node> userProjects(int limit, String category, boolean lifeAreasOnly) throws IOException {
        Optional<Node> user = getUser();
        if (user.isEmpty()) {
            return List.of();
        }
        List<Node> projects = new ArrayList<>();
        for (RelatedNode related : store.getRelated(user.get().id(), RelationType.OWNS, Direction.OUT, NodeType.PROJECT, SCAN_LIMIT)) {
            Node project = related.node();
            if (category != null && !category.isBlank() && !category.equalsIgnoreCase(project.string("category", ""))) {
                continue;
            }
            if (lifeAreasOnly && !project.bool("is_life_area", false)) {
                continue;
            }
            projects.add(project);
        }
        projects.sort(Comparator.comparing(Node::createdAt).reversed());
        return projects.size() > limit ? List.copyOf(projects.subList(0, limit)) : List.copyOf(projects);
    }

    public Optional<Node> findProjectByName(String name) throws IOException {
        List<Node> matches = store.searchNodes(NodeType.PROJECT, "name", name, 1);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public boolean addPersonToProject(String personId, String projectId, RelationType relation, String role)
        throws IOException {
        RelationType resolved = relation == RelationType.COLLABORATES_ON ? RelationType.COLLABORATES_ON : RelationType.MEMBER_OF;
        Map<String, Object> properties = new LinkedHashMap<>();
        if (role != null && !role.isBlank()) {
            properties.put("role", role);
        }
        return store.createRelationship(personId, projectId, resolved, properties);
    }

    public List<ProjectMember> projectMembers(String projectId) throws IOException {
        List<ProjectMember> members = new ArrayList<>();
        for (RelatedNode related : store.getRelated(projectId, null, Direction.IN, NodeType.PERSON, SCAN_LIMIT)) {
            if (related.relation() == RelationType.MEMBER_OF || related.relation() == RelationType.COLLABORATES_ON) {
                members.add(new ProjectMember(related.node(), related.relation(), related.relationString("role")));
            }
        }
        return members;
    }

    // ==================== People ====================

    public Node createPerson(String name, Map<String, ?> extra) throws IOException {
        return require(store.createNode(Nodes.person(name, extra)));
    }

    // ==================== Cycles ====================

    public Node createCycle(
        String name,
        String objective,
        CycleType cycleType,
        int priority,
        String goalId,
        String projectId,
        String context
    ) throws IOException {
        String id = store.createNode(Nodes.cycle(name, objective, cycleType, priority, context));
        Optional<Node> assistant = getAssistant();
        if (assistant.isPresent()) {
            store.createRelationship(assistant.get().id(), id, RelationType.INITIATED);
        }
        if (goalId != null && !store.createRelationship(id, goalId, RelationType.WORKS_TOWARD)) {
            LOG.warn("Goal {} not found, cycle {} left unlinked", goalId, id);
        }
        if (projectId != null && !store.createRelationship(id, projectId, RelationType.PART_OF)) {
            LOG.warn("Project {} not found, cycle {} left unlinked", projectId, id);
        }
        return require(id);
    }

    /**
     * Planning and active cycles, highest priority first, then newest.
     */
    public List<Node> activeCycles(int limit) throws IOException {
        List<Node> cycles = new ArrayList<>();
        cycles.addAll(store.findNodes(NodeType.CYCLE, Map.of("status", CycleStatus.PLANNING.value()), SCAN_LIMIT));
        cycles.addAll(store.findNodes(NodeType.CYCLE, Map.of("status", CycleStatus.ACTIVE.value()), SCAN_LIMIT));
        cycles.sort(Comparator.comparingDouble((Node cycle) -> cycle.number("priority", 0))
            .thenComparing(Node::createdAt)
            .reversed());
        return cycles.size() > limit ? List.copyOf(cycles.subList(0, limit)) : List.copyOf(cycles);
    }

    public boolean updateCycleStatus(String cycleId, CycleStatus status, String reason) throws IOException {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", status.value());
        if (reason != null && !reason.isBlank()) {
            changes.put("status_reason", reason);
        }
        if (status == CycleStatus.COMPLETED) {
            changes.put("completed_at", clock.instant().toString());
        }
        return store.updateNode(cycleId, changes);
    }

    public Optional<Node> addTaskToCycle(String cycleId, String description, int priority) throws IOException {
        if (!isType(cycleId, NodeType.CYCLE)) {
            return Optional.empty();
        }
        String taskId = store.createNode(Nodes.task(description, priority));
        store.createRelationship(cycleId, taskId, RelationType.CONTAINS);
        store.incrementProperty(cycleId, "estimated_tasks", 1);
        return store.getNode(taskId);
    }

    public Node createTask(String description, int priority) throws IOException {
        return require(store.createNode(Nodes.task(description, priority)));
    }

    /**
     * Marks the task completed and bumps {@code tasks_completed} on every cycle containing it.
     */
    public boolean completeTask(String taskId) throws IOException {
        if (!isType(taskId, NodeType.TASK)) {
            return false;
        }
        store.updateNode(taskId, Map.of("status", "completed", "completed_at", clock.instant().toString()));
        for (RelatedNode cycle : store.getRelated(taskId, RelationType.CONTAINS, Direction.IN, NodeType.CYCLE, SCAN_LIMIT)) {
            store.incrementProperty(cycle.node().id(), "tasks_completed", 1);
        }
        return true;
    }

    public Optional<Node> addInsightToCycle(String cycleId, String insight, String sourceType, double confidence)
        throws IOException {
        if (!isType(cycleId, NodeType.CYCLE)) {
            return Optional.empty();
        }
        String insightId = store.createNode(Nodes.insight(insight, sourceType, confidence));
        store.createRelationship(insightId, cycleId, RelationType.INFORMS);
        store.incrementProperty(cycleId, "insights_count", 1);
        return store.getNode(insightId);
    }

    public Node createInsight(String insight, String sourceType, double confidence) throws IOException {
        return require(store.createNode(Nodes.insight(insight, sourceType, confidence)));
    }

    // ==================== Goals ====================

    public Node createGoal(String name, String description, String timeframe, List<String> successCriteria)
        throws IOException {
        String id = store.createNode(Nodes.goal(name, description, timeframe, successCriteria));
        Optional<Node> user = getUser();
        if (user.isPresent()) {
            store.createRelationship(user.get().id(), id, RelationType.INTERESTED_IN);
        }
        return require(id);
    }

    public List<Node> userGoals(String timeframe) throws IOException {
        Optional<Node> user = getUser();
        if (user.isEmpty()) {
            return List.of();
        }
        List<Node> goals = new ArrayList<>();
        for (RelatedNode related : store.getRelated(user.get().id(), RelationType.INTERESTED_IN, Direction.OUT, NodeType.GOAL, SCAN_LIMIT)) {
            if (timeframe == null || timeframe.equals(related.node().string("timeframe", null))) {
                goals.add(related.node());
            }
        }
        goals.sort(Comparator.comparing(Node::createdAt).reversed());
        return goals;
    }

    // ==================== Topics ====================

    public Node getOrCreateTopic(String name, String description) throws IOException {
        Node template = Nodes.topic(name, description);
        UpsertResult result = store.createOrMatch(NodeType.TOPIC, "name", name, name, template.plainProperties());
        return result.node();
    }

    /**
     * Links the node to each named topic once, creating topics as needed. Returns the number of new links.
     */
    public int linkToTopics(String nodeId, List<String> topics) throws IOException {
        List<RelatedNode> existing = store.getRelated(nodeId, RelationType.ABOUT_TOPIC, Direction.OUT, NodeType.TOPIC, SCAN_LIMIT);
        int created = 0;
        for (String topicName : topics) {
            if (topicName == null || topicName.isBlank()) {
                continue;
            }
            Node topic = getOrCreateTopic(topicName.trim(), null);
            boolean linked = existing.stream().anyMatch(related -> related.node().id().equals(topic.id()));
            if (!linked && store.createRelationship(nodeId, topic.id(), RelationType.ABOUT_TOPIC)) {
                created++;
            }
        }
        return created;
    }

    private boolean isType(String id, NodeType type) throws IOException {
        return store.getNode(id).map(node -> node.type() == type).orElse(false);
    }

    private Node require(String id) throws IOException {
        return store.getNode(id).orElseThrow(() -> new IOException("Node " + id + " vanished after creation"));
    }
}
