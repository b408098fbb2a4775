package io.mnemos.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemos.core.capability.CapabilityRegistry;
import io.mnemos.core.capability.ToolResult;
import io.mnemos.core.context.ContextRetrievalEngine;
import io.mnemos.core.context.RetrievedContext;
import io.mnemos.core.identity.IdentityService;
import io.mnemos.core.identity.PersonaIdentity;
import io.mnemos.core.model.AgentResult;
import io.mnemos.core.model.ChatMessage;
import io.mnemos.core.model.ToolCall;
import io.mnemos.core.provider.LlmProvider;
import io.mnemos.core.provider.LlmResponse;
import io.mnemos.core.provider.ProviderRouter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversational turn: retrieves the persona's context, renders it as the system prompt and loops
 * over tool calls until the model answers or the iteration cap is reached.
 */
public final class AgentRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(AgentRuntime.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    static final String MAX_ITERATIONS_MESSAGE = "Stopped after max tool iterations";
    static final String DEFAULT_PROMPT = "You are a thoughtful AI companion. Speak in first person and be genuine.";

    private final ProviderRouter providerRouter;
    private final ContextRetrievalEngine retrieval;
    private final CapabilityRegistry registry;
    private final IdentityService identity;

    public AgentRuntime(
        ProviderRouter providerRouter,
        ContextRetrievalEngine retrieval,
        CapabilityRegistry registry,
        IdentityService identity
    ) {
        this.providerRouter = Objects.requireNonNull(providerRouter, "providerRouter must not be null");
        this.retrieval = Objects.requireNonNull(retrieval, "retrieval must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
    }

    public AgentResult run(String userPrompt, AgentSettings settings) {
        return run(userPrompt, settings, null);
    }

    public AgentResult run(String userPrompt, AgentSettings settings, Map<String, Object> projectContext) {
        Map<String, Object> contextUsed = new LinkedHashMap<>();
        String systemPrompt = systemPrompt(userPrompt, projectContext, contextUsed);

        List<ChatMessage> transcript = new ArrayList<>();
        transcript.add(ChatMessage.system(systemPrompt));
        transcript.add(ChatMessage.user(userPrompt));

        LlmProvider provider = providerRouter.resolve(settings.provider(), settings.model());
        List<Map<String, Object>> tools = settings.coreToolsOnly() ? registry.coreSchemasForApi() : registry.schemasForApi();
        LOG.debug("Using provider {} with model {} and {} tools", provider.name(), settings.model(), tools.size());

        List<AgentResult.ToolRun> toolRuns = new ArrayList<>();
        Map<String, Object> usage = Map.of();
        for (int i = 0; i < settings.maxToolIterations(); i++) {
            LlmResponse response = provider.chat(settings.model(), transcript, tools);
            usage = response.usage();

            if (response.failed() || response.toolCalls().isEmpty()) {
                transcript.add(ChatMessage.assistant(response.content()));
                if (!response.failed()) {
                    recordConversation();
                }
                return new AgentResult(response.content(), transcript, toolRuns, contextUsed, usage);
            }

            transcript.add(ChatMessage.assistantWithToolCalls(response.content(), response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                ToolResult result = registry.execute(call.name(), call.arguments());
                toolRuns.add(new AgentResult.ToolRun(call.name(), result.success(), result.error()));
                transcript.add(ChatMessage.tool(serialize(result.payload()), call.id()));
            }
        }

        transcript.add(ChatMessage.assistant(MAX_ITERATIONS_MESSAGE));
        recordConversation();
        return new AgentResult(MAX_ITERATIONS_MESSAGE, transcript, toolRuns, contextUsed, usage);
    }

    /**
     * Retrieval failures fall back to the static identity prompt and mark the turn's metadata.
     */
    private String systemPrompt(String userPrompt, Map<String, Object> projectContext, Map<String, Object> contextUsed) {
        try {
            RetrievedContext context = retrieval.retrieve(userPrompt, projectContext);
            contextUsed.putAll(context.metadata());
            return context.toSystemPrompt();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Context retrieval failed, using static identity prompt: {}", e.getMessage());
            contextUsed.put("fallback", true);
            contextUsed.put("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }

        String prompt = DEFAULT_PROMPT;
        try {
            Optional<PersonaIdentity> persona = identity.current();
            if (persona.isPresent()) {
                prompt = persona.get().toSystemPrompt();
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Persona unavailable, using default prompt: {}", e.getMessage());
        }
        if (projectContext != null && !projectContext.isEmpty()) {
            prompt += "\n\nCurrent project context:\n" + serialize(projectContext);
        }
        return prompt;
    }

    private void recordConversation() {
        try {
            identity.recordConversation();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to record conversation count: {}", e.getMessage());
        }
    }

    private static String serialize(Object payload) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOG.warn("Tool output is not serializable as JSON", e);
            return String.valueOf(payload);
        }
    }
}
