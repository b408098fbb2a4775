package io.mnemos.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemos.core.capability.CapabilityRegistry;
import io.mnemos.core.capability.ToolDefinition;
import io.mnemos.core.config.model.RetrievalConfig;
import io.mnemos.core.context.ContextRetrievalEngine;
import io.mnemos.core.embedding.HashingEmbeddingProvider;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.InMemoryGraphStore;
import io.mnemos.core.identity.IdentityGenerator;
import io.mnemos.core.identity.IdentityService;
import io.mnemos.core.model.AgentResult;
import io.mnemos.core.model.ChatMessage;
import io.mnemos.core.model.MessageRole;
import io.mnemos.core.model.ToolCall;
import io.mnemos.core.provider.LlmProvider;
import io.mnemos.core.provider.LlmResponse;
import io.mnemos.core.provider.ProviderRegistry;
import io.mnemos.core.provider.ProviderRouter;
import java.io.IOException;
import java.lang.reflect.Proxy;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentRuntimeTest {

    @TempDir
    Path tempDir;

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final ScriptedProvider chat = new ScriptedProvider();
    private final IdentityService identity = new IdentityService(
        store,
        new IdentityGenerator(new OfflineProvider(), "test-model", new ObjectMapper()),
        new HashingEmbeddingProvider(),
        null,
        Clock.systemUTC()
    );
    private final AgentSettings settings = new AgentSettings("scripted", "test-model", 3, false);
    private CapabilityRegistry registry;
    private ProviderRouter router;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry(tempDir, Clock.systemUTC());
        ProviderRegistry providers = new ProviderRegistry();
        providers.register(chat);
        router = new ProviderRouter(providers);
    }

    @Test
    void shouldRunToolLoopUntilFinalAnswer() throws Exception {
        identity.initialize(null);
        registry.register(ToolDefinition.of("lookup", "Looks things up", Map.of("type", "object"), 1, "util"), false);
        List<Map<String, Object>> seenInputs = new ArrayList<>();
        registry.registerHandler("lookup", input -> {
            seenInputs.add(input);
            return Map.of("ok", true);
        });
        chat.reply(new LlmResponse("", List.of(new ToolCall("call-1", "lookup", Map.of("q", "tomato"))), Map.of()));
        chat.reply(new LlmResponse("Tomatoes like sun.", List.of(), Map.of("total_tokens", 42)));

        AgentResult result = runtime(store).run("what about tomatoes?", settings);

        assertThat(result.content()).isEqualTo("Tomatoes like sun.");
        assertThat(result.usage()).containsEntry("total_tokens", 42);
        assertThat(seenInputs).containsExactly(Map.of("q", "tomato"));
        assertThat(result.toolRuns()).containsExactly(new AgentResult.ToolRun("lookup", true, null));
        assertThat(result.transcript()).extracting(ChatMessage::role).containsExactly(
            MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL, MessageRole.ASSISTANT
        );
        assertThat(result.transcript().get(3).toolCallId()).isEqualTo("call-1");
        assertThat(result.transcript().get(3).content()).contains("\"ok\"");
        assertThat(result.transcript().get(0).content()).startsWith("You are Nova");
        assertThat(result.contextUsed()).containsKey("strategy").doesNotContainKey("fallback");
        assertThat(chat.toolNames.get(0)).containsExactly("lookup");
        assertThat(identity.load().orElseThrow().conversationCount()).isEqualTo(1);
    }

    @Test
    void shouldOfferOnlyCoreToolsWhenRequested() throws Exception {
        registry.register(ToolDefinition.of("core_tool", "Core", Map.of("type", "object"), 0, "core"), false);
        registry.register(ToolDefinition.of("extra_tool", "Extra", Map.of("type", "object"), 3, "util"), false);
        chat.reply(new LlmResponse("hi", List.of(), Map.of()));

        runtime(store).run("hello", settings.withCoreToolsOnly(true));

        assertThat(chat.toolNames.get(0)).containsExactly("core_tool");
    }

    @Test
    void shouldStopAfterMaxToolIterations() throws Exception {
        identity.initialize(null);
        registry.registerHandler("loop", input -> "again");
        for (int i = 0; i < 5; i++) {
            chat.reply(new LlmResponse("", List.of(new ToolCall("call-" + i, "loop", Map.of())), Map.of()));
        }

        AgentResult result = runtime(store).run("spin", new AgentSettings("scripted", "test-model", 2, false));

        assertThat(result.content()).isEqualTo(AgentRuntime.MAX_ITERATIONS_MESSAGE);
        assertThat(result.toolRuns()).hasSize(2);
        assertThat(chat.calls).isEqualTo(2);
        assertThat(identity.load().orElseThrow().conversationCount()).isEqualTo(1);
    }

    @Test
    void shouldReportMissingHandlerToModel() throws Exception {
        chat.reply(new LlmResponse("", List.of(new ToolCall("call-1", "ghost", Map.of())), Map.of()));
        chat.reply(new LlmResponse("sorry", List.of(), Map.of()));

        AgentResult result = runtime(store).run("use ghost", settings);

        assertThat(result.toolRuns()).singleElement().satisfies(run -> {
            assertThat(run.success()).isFalse();
            assertThat(run.error()).contains("ghost");
        });
        assertThat(result.transcript().get(3).content()).contains("handler_not_found");
        assertThat(result.content()).isEqualTo("sorry");
    }

    @Test
    void shouldNotCountFailedTurns() throws Exception {
        identity.initialize(null);
        chat.reply(LlmResponse.error("HTTP 503", Map.of()));

        AgentResult result = runtime(store).run("hello", settings);

        assertThat(result.content()).startsWith(LlmResponse.ERROR_PREFIX).contains("HTTP 503");
        assertThat(identity.load().orElseThrow().conversationCount()).isZero();
    }

    @Test
    void shouldFallBackToStaticIdentityWhenRetrievalFails() throws Exception {
        identity.initialize(null);
        chat.reply(new LlmResponse("still here", List.of(), Map.of()));

        AgentResult result = runtime(offlineStore()).run("hello", settings, Map.of("project", "Garden"));

        assertThat(result.content()).isEqualTo("still here");
        assertThat(result.usedFallbackContext()).isTrue();
        assertThat(result.contextUsed()).containsEntry("error", "graph offline");
        String prompt = chat.lastMessages.get(0).content();
        assertThat(prompt).startsWith("You are Nova").contains("Current project context:").contains("Garden");
    }

    @Test
    void shouldUseDefaultPromptWithoutPersonaOrContext() {
        chat.reply(new LlmResponse("hi", List.of(), Map.of()));

        AgentResult result = runtime(offlineStore()).run("hello", settings);

        assertThat(result.usedFallbackContext()).isTrue();
        assertThat(chat.lastMessages.get(0).content()).isEqualTo(AgentRuntime.DEFAULT_PROMPT);
    }

    private AgentRuntime runtime(GraphStore retrievalStore) {
        ContextRetrievalEngine engine = new ContextRetrievalEngine(
            retrievalStore, new HashingEmbeddingProvider(), RetrievalConfig.defaults(), Clock.systemUTC()
        );
        return new AgentRuntime(router, engine, registry, identity);
    }

    private static GraphStore offlineStore() {
        return (GraphStore) Proxy.newProxyInstance(
            GraphStore.class.getClassLoader(),
            new Class<?>[] {GraphStore.class},
            (proxy, method, args) -> {
                throw new IOException("graph offline");
            }
        );
    }

    private static final class ScriptedProvider implements LlmProvider {
        private final Deque<LlmResponse> replies = new ArrayDeque<>();
        private final List<List<String>> toolNames = new ArrayList<>();
        private List<ChatMessage> lastMessages = List.of();
        private int calls;

        void reply(LlmResponse response) {
            replies.add(response);
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            calls++;
            lastMessages = List.copyOf(messages);
            List<String> names = new ArrayList<>();
            tools.forEach(tool -> names.add(String.valueOf(tool.get("name"))));
            toolNames.add(names);
            LlmResponse next = replies.poll();
            return next == null ? LlmResponse.error("no scripted reply", Map.of()) : next;
        }
    }

    private static final class OfflineProvider implements LlmProvider {
        @Override
        public String name() {
            return "offline";
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            return LlmResponse.error("offline", Map.of());
        }
    }
}
