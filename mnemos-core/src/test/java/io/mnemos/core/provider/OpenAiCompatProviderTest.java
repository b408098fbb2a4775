package io.mnemos.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemos.core.model.ChatMessage;
import io.mnemos.core.model.ToolCall;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "hello from json" } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/v1").toString(),
            Map.of("X-Title", "mnemos")
        );

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("hello from json");
        assertThat(response.failed()).isFalse();
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-Title")).isEqualTo("mnemos");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"stream\":true").doesNotContain("\"tools\"");
    }

    @Test
    void shouldParseSseCompletionAndToolCalls() {
        String sse = """
            data: {"choices":[{"delta":{"content":"hello "}}]}

            data: {"choices":[{"delta":{"content":"world"}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"id":"call_1","index":0,"function":{"name":"search_graph","arguments":"{\\\"query\\\":"}}]}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\\"tomato\\\"}"}}]}}]}

            data: {"usage":{"total_tokens":13}}

            data: [DONE]

            """;

        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(sse));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/v1/").toString(),
            Map.of()
        );

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("hello world");
        assertThat(response.toolCalls()).hasSize(1);
        assertThat(response.toolCalls().get(0).id()).isEqualTo("call_1");
        assertThat(response.toolCalls().get(0).name()).isEqualTo("search_graph");
        assertThat(response.toolCalls().get(0).arguments()).containsEntry("query", "tomato");
        assertThat(response.usage()).containsEntry("total_tokens", 13);
    }

    @Test
    void shouldSendToolsAndToolTranscript() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"done\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());
        List<ChatMessage> messages = List.of(
            ChatMessage.user("find tomatoes"),
            ChatMessage.assistantWithToolCalls("", List.of(new ToolCall("call_9", "search_graph", Map.of("query", "tomato")))),
            ChatMessage.tool("[]", "call_9")
        );
        List<Map<String, Object>> tools = List.of(Map.of(
            "name", "search_graph",
            "description", "Search the graph",
            "input_schema", Map.of("type", "object")
        ));

        provider.chat("gpt-4.1", messages, tools);

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body)
            .contains("\"tool_choice\":\"auto\"")
            .contains("\"type\":\"function\"")
            .contains("\"parameters\":{\"type\":\"object\"}")
            .contains("\"tool_call_id\":\"call_9\"")
            .contains("\"arguments\":\"{\\\"query\\\":\\\"tomato\\\"}\"");
    }

    @Test
    void shouldRetryServerErrorsThenSucceed() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"recovered\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("recovered");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldStopRetryingOnceInterrupted() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());

        LlmResponse response;
        Thread.currentThread().interrupt();
        try {
            response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("interrupted");
        assertThat(response.usage()).containsEntry("interrupted", true);
        assertThat(server.getRequestCount()).isLessThanOrEqualTo(1);
    }

    @Test
    void shouldReturnErrorResponseForClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("bad key"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).startsWith(LlmResponse.ERROR_PREFIX).contains("HTTP 401").contains("bad key");
        assertThat(response.usage()).containsEntry("http_status", 401);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldFailFastWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openrouter", "", server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("missing API key for provider openrouter");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPassThroughFunctionShapedTools() {
        Map<String, Object> alreadyWire = Map.of("type", "function", "function", Map.of("name", "x"));

        List<Map<String, Object>> wire = OpenAiCompatProvider.toWireTools(List.of(
            alreadyWire,
            Map.of("name", "bare")
        ));

        assertThat(wire.get(0)).isSameAs(alreadyWire);
        assertThat(wire.get(1)).containsEntry("type", "function");
        assertThat((Map<String, Object>) wire.get(1).get("function"))
            .containsEntry("name", "bare")
            .containsEntry("description", "")
            .containsEntry("parameters", Map.of("type", "object", "properties", Map.of()));
    }
}
