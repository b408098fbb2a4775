package io.mnemos.core.cognitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.InMemoryGraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.ValidationException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CognitiveGraphTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final CognitiveGraph graph = new CognitiveGraph(store, Clock.systemUTC());

    @Test
    void shouldInitializeRootsOnlyOnce() throws Exception {
        GraphRoots first = graph.initializeGraph("Sam", "Lee", "Mnemos", "echo");
        GraphRoots second = graph.initializeGraph("Sam", "Lee", "Mnemos", "echo");

        assertThat(second.user().id()).isEqualTo(first.user().id());
        assertThat(second.assistant().id()).isEqualTo(first.assistant().id());
        assertThat(first.user().name()).isEqualTo("Sam Lee");
        assertThat(store.countRelated(first.assistant().id(), RelationType.ASSISTS, Direction.OUT, NodeType.USER))
            .isEqualTo(1);
    }

    @Test
    void shouldLinkProjectsAndGoalsToUser() throws Exception {
        graph.initializeGraph("Sam", null, "Mnemos", "echo");
        graph.createProject("Garden", "Vegetables", ProjectCategory.HOBBY, false);
        graph.createLifeArea("Health", ProjectCategory.HEALTH, null);
        graph.createGoal("Run 10k", "Build endurance", "quarterly", List.of("finish a race"));

        assertThat(graph.userProjects(10, null, false)).extracting(Node::name).containsExactly("Health", "Garden");
        assertThat(graph.userProjects(10, null, true)).extracting(Node::name).containsExactly("Health");
        assertThat(graph.userProjects(10, "hobby", false)).extracting(Node::name).containsExactly("Garden");
        assertThat(graph.userGoals("quarterly")).extracting(Node::name).containsExactly("Run 10k");
        assertThat(graph.findProjectByName("gard")).map(Node::name).contains("Garden");
    }

    @Test
    void shouldReturnNoProjectsWithoutUser() throws Exception {
        graph.createProject("Orphan", "", ProjectCategory.GENERAL, false);

        assertThat(graph.userProjects(10, null, false)).isEmpty();
    }

    @Test
    void shouldTrackTaskProgressOnCycle() throws Exception {
        graph.initializeGraph("Sam", null, "Mnemos", "echo");
        Node cycle = graph.createCycle("Research soil", "Pick a soil mix", CycleType.RESEARCH, 5, null, null, null);

        Node task = graph.addTaskToCycle(cycle.id(), "Compare compost brands", 3).orElseThrow();
        graph.completeTask(task.id());
        graph.addInsightToCycle(cycle.id(), "Peat-free mixes drain better", "research", 0.7);

        Node updated = store.getNode(cycle.id()).orElseThrow();
        assertThat(updated.number("estimated_tasks", 0)).isEqualTo(1.0);
        assertThat(updated.number("tasks_completed", 0)).isEqualTo(1.0);
        assertThat(updated.number("insights_count", 0)).isEqualTo(1.0);
        assertThat(store.getNode(task.id()).orElseThrow().string("status", null)).isEqualTo("completed");
        assertThat(graph.activeCycles(5)).extracting(Node::id).containsExactly(cycle.id());
    }

    @Test
    void shouldRefuseTaskForNodeThatIsNotACycle() throws Exception {
        Node person = graph.createPerson("Ada", Map.of());

        assertThat(graph.addTaskToCycle(person.id(), "Call Ada", 5)).isEmpty();
        assertThat(graph.completeTask(person.id())).isFalse();
    }

    @Test
    void shouldDropCompletedCyclesFromActiveList() throws Exception {
        Node cycle = graph.createCycle("Tidy", "Clean the shed", CycleType.MAINTENANCE, 2, null, null, null);

        graph.updateCycleStatus(cycle.id(), CycleStatus.COMPLETED, "done");

        assertThat(graph.activeCycles(5)).isEmpty();
        assertThat(store.getNode(cycle.id()).orElseThrow().string("completed_at", null)).isNotNull();
    }

    @Test
    void shouldRejectCyclePriorityOutOfRange() {
        assertThatThrownBy(() -> graph.createCycle("x", "y", CycleType.RESEARCH, 11, null, null, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRecordProjectMembersWithRoles() throws Exception {
        Node project = graph.createProject("Book", "Novel draft", ProjectCategory.BOOK, false);
        Node editor = graph.createPerson("Ada", Map.of());

        graph.addPersonToProject(editor.id(), project.id(), RelationType.COLLABORATES_ON, "editor");

        List<ProjectMember> members = graph.projectMembers(project.id());
        assertThat(members).hasSize(1);
        assertThat(members.get(0).role()).isEqualTo("editor");
    }

    @Test
    void shouldLinkTopicsOnce() throws Exception {
        Node insight = graph.createInsight("Tomatoes like sun", "conversation", 0.6);

        int first = graph.linkToTopics(insight.id(), List.of("gardening", "food"));
        int second = graph.linkToTopics(insight.id(), List.of("gardening"));

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(store.findNodes(NodeType.TOPIC, Map.of(), 10)).hasSize(2);
    }
}
