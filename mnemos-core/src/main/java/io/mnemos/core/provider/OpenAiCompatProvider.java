package io.mnemos.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemos.core.model.ChatMessage;
import io.mnemos.core.model.MessageRole;
import io.mnemos.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions client for OpenAI-compatible endpoints (OpenRouter, OpenAI, gateways). Requests are
 * streamed; the reply may still come back as a plain JSON body, and both are accepted.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final long MAX_BACKOFF_MS = 2000;

    private final String name;
    private final String apiKey;
    private final HttpUrl completionsUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final int maxTokens;
    private final double temperature;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3, 0, -1);
    }

    /**
     * {@code maxTokens <= 0} and {@code temperature < 0} leave the values to the endpoint.
     */
    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts,
        int maxTokens,
        double temperature
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.completionsUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name, Map.of("provider", name));
        }

        Request request;
        try {
            request = buildRequest(model, messages, tools);
        } catch (JsonProcessingException e) {
            LOG.warn("Cannot encode request for provider {}: {}", name, e.getOriginalMessage());
            return LlmResponse.error("cannot encode request: " + e.getOriginalMessage(), Map.of("provider", name));
        }

        long delayMs = 250;
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    String errorBody = body == null ? "" : body.string();
                    if (retryable(response.code()) && attempt < maxAttempts) {
                        LOG.debug("Provider {} returned HTTP {}, retrying", name, response.code());
                        lastFailure = new IOException("HTTP " + response.code());
                        if (!backoff(delayMs)) {
                            return interrupted();
                        }
                        delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                        continue;
                    }
                    return LlmResponse.error(
                        "HTTP " + response.code() + " " + errorBody,
                        Map.of("http_status", response.code())
                    );
                }
                if (body == null) {
                    return new LlmResponse("", List.of(), Map.of());
                }
                String contentType = response.header("Content-Type", "").toLowerCase(Locale.ROOT);
                return contentType.contains("text/event-stream")
                    ? readStream(body.source())
                    : readJson(body.string());
            } catch (IOException e) {
                lastFailure = e;
                if (attempt < maxAttempts) {
                    if (!backoff(delayMs)) {
                        return interrupted();
                    }
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                }
            }
        }
        String reason = lastFailure == null ? "exhausted retries" : String.valueOf(lastFailure.getMessage());
        LOG.warn("Provider {} failed after {} attempts: {}", name, maxAttempts, reason);
        return LlmResponse.error(reason, Map.of("provider", name));
    }

    private Request buildRequest(String model, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws JsonProcessingException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        payload.set("messages", encodeMessages(messages));
        payload.put("stream", true);
        if (maxTokens > 0) {
            payload.put("max_tokens", maxTokens);
        }
        if (temperature >= 0) {
            payload.put("temperature", temperature);
        }
        if (tools != null && !tools.isEmpty()) {
            payload.set("tools", mapper.valueToTree(toWireTools(tools)));
            payload.put("tool_choice", "auto");
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");
        extraHeaders.forEach(builder::header);
        return builder.build();
    }

    /**
     * Registry schemas {@code {name, description, input_schema}} become function tools. Entries already
     * in function shape pass through untouched.
     */
    static List<Map<String, Object>> toWireTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> wire = new ArrayList<>(tools.size());
        for (Map<String, Object> tool : tools) {
            if ("function".equals(tool.get("type"))) {
                wire.add(tool);
                continue;
            }
            Object schema = tool.get("input_schema");
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.get("name"));
            function.put("description", tool.getOrDefault("description", ""));
            function.put("parameters", schema == null ? Map.of("type", "object", "properties", Map.of()) : schema);
            wire.add(Map.of("type", "function", "function", function));
        }
        return wire;
    }

    private ArrayNode encodeMessages(List<ChatMessage> messages) throws JsonProcessingException {
        ArrayNode wire = mapper.createArrayNode();
        for (ChatMessage message : messages) {
            ObjectNode row = wire.addObject();
            row.put("role", message.role().name().toLowerCase(Locale.ROOT));
            row.put("content", message.content());
            if (message.hasToolCalls()) {
                ArrayNode calls = row.putArray("tool_calls");
                for (int i = 0; i < message.toolCalls().size(); i++) {
                    ToolCall call = message.toolCalls().get(i);
                    ObjectNode item = calls.addObject();
                    item.put("id", call.id() == null || call.id().isBlank() ? "call_" + i : call.id());
                    item.put("type", "function");
                    ObjectNode function = item.putObject("function");
                    function.put("name", call.name());
                    function.put("arguments", mapper.writeValueAsString(call.arguments()));
                }
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
        }
        return wire;
    }

    private LlmResponse readJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode message = root.path("choices").path(0).path("message");
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : message.path("tool_calls")) {
            JsonNode function = item.path("function");
            JsonNode arguments = function.path("arguments");
            toolCalls.add(new ToolCall(
                item.path("id").asText(""),
                function.path("name").asText(""),
                arguments.isTextual() ? parseArguments(arguments.asText()) : mapper.convertValue(arguments, MAP_TYPE)
            ));
        }
        return new LlmResponse(message.path("content").asText(""), toolCalls, usage(root.path("usage")));
    }

    private LlmResponse readStream(BufferedSource source) throws IOException {
        StreamAccumulator accumulator = new StreamAccumulator();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || !line.startsWith("data:")) {
                continue;
            }
            String data = line.substring(5).trim();
            if ("[DONE]".equals(data)) {
                break;
            }
            if (!data.isEmpty()) {
                accumulator.accept(mapper.readTree(data));
            }
        }
        return accumulator.toResponse();
    }

    private Map<String, Object> usage(JsonNode usage) {
        return usage.isObject() ? mapper.convertValue(usage, MAP_TYPE) : Map.of();
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            LOG.debug("Discarding malformed tool arguments from {}: {}", name, e.getOriginalMessage());
            return Map.of();
        }
    }

    private static boolean retryable(int status) {
        return status == 429 || status >= 500;
    }

    /**
     * Waits before the next attempt. Returns false when the thread was interrupted, with the flag restored.
     */
    private static boolean backoff(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private LlmResponse interrupted() {
        LOG.warn("Provider {} interrupted while waiting to retry", name);
        return LlmResponse.error("interrupted while waiting to retry", Map.of("provider", name, "interrupted", true));
    }

    /**
     * Folds streamed deltas into one response. Tool call fragments are grouped by their {@code index};
     * only the first fragment of a call carries its id and name.
     */
    private final class StreamAccumulator {
        private final StringBuilder content = new StringBuilder();
        private final Map<Integer, PartialCall> calls = new TreeMap<>();
        private Map<String, Object> usage = Map.of();

        void accept(JsonNode event) {
            if (event.path("usage").isObject()) {
                usage = usage(event.path("usage"));
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                JsonNode text = delta.path("content");
                if (text.isTextual()) {
                    content.append(text.asText());
                }
                for (JsonNode fragment : delta.path("tool_calls")) {
                    int index = fragment.path("index").asInt(calls.size());
                    PartialCall call = calls.computeIfAbsent(index, PartialCall::new);
                    call.merge(fragment);
                }
            }
        }

        LlmResponse toResponse() {
            List<ToolCall> toolCalls = new ArrayList<>(calls.size());
            for (PartialCall call : calls.values()) {
                toolCalls.add(new ToolCall(call.id(), call.name, parseArguments(call.arguments.toString())));
            }
            return new LlmResponse(content.toString(), toolCalls, usage);
        }
    }

    private static final class PartialCall {
        private final int index;
        private String id = "";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();

        PartialCall(int index) {
            this.index = index;
        }

        void merge(JsonNode fragment) {
            String fragmentId = fragment.path("id").asText("");
            if (!fragmentId.isBlank()) {
                id = fragmentId;
            }
            JsonNode function = fragment.path("function");
            String fragmentName = function.path("name").asText("");
            if (!fragmentName.isBlank()) {
                name = fragmentName;
            }
            arguments.append(function.path("arguments").asText(""));
        }

        String id() {
            return id.isBlank() ? "call_" + index : id;
        }
    }
}
