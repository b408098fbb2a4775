package io.mnemos.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemos.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {

    @Test
    void shouldResolveByModelHeuristics() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new EchoProvider("echo"));
        registry.register(new StubProvider("openai"));
        registry.register(new StubProvider("openrouter"));

        ProviderRouter router = new ProviderRouter(registry);

        assertThat(router.resolve(null, "echo").name()).isEqualTo("echo");
        assertThat(router.resolve(null, "gpt-4.1").name()).isEqualTo("openai");
        assertThat(router.resolve("", "openai/gpt-4o-mini").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "anthropic/claude-sonnet").name()).isEqualTo("openrouter");
    }

    @Test
    void shouldFailForUnknownPreferredProvider() {
        ProviderRouter router = new ProviderRouter(new ProviderRegistry());

        assertThatThrownBy(() -> router.resolve("missing", "gpt-5"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown provider");
    }

    @Test
    void shouldFailWhenHeuristicTargetIsNotRegistered() {
        ProviderRouter router = new ProviderRouter(new ProviderRegistry());

        assertThatThrownBy(() -> router.resolve(null, "some-model"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Provider openrouter is not registered");
    }

    @Test
    void shouldResolvePreferredProviderWithHyphenAlias() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new StubProvider("hosted_gateway"));
        ProviderRouter router = new ProviderRouter(registry);

        assertThat(router.resolve("hosted-gateway", "ignored").name()).isEqualTo("hosted_gateway");
        assertThat(router.resolve("HOSTED_GATEWAY", "gpt-4.1").name()).isEqualTo("hosted_gateway");
    }

    @Test
    void shouldEchoLastUserMessage() {
        LlmResponse response = new EchoProvider("echo").chat("echo", List.of(
            ChatMessage.system("ignored"),
            ChatMessage.user("first"),
            ChatMessage.assistant("reply"),
            ChatMessage.user("second")
        ), List.of());

        assertThat(response.content()).isEqualTo("[echo] second");
        assertThat(response.failed()).isFalse();
    }

    @Test
    void shouldExplainDisabledProvider() {
        LlmResponse response = new DisabledProvider("openrouter", "missing API key").chat("m", List.of(), List.of());

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).isEqualTo(
            LlmResponse.ERROR_PREFIX + "provider openrouter is not configured (missing API key)"
        );
    }

    private record StubProvider(String name) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            return new LlmResponse("ok", List.of(), Map.of());
        }
    }
}
