package io.mnemos.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemos.core.config.model.MnemosConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");

        MnemosConfig config = service.load(configPath);

        assertThat(config.agents().defaults().model()).isEqualTo("anthropic/claude-sonnet-4.5");
        assertThat(config.providers().openrouter().configured()).isFalse();
        assertThat(config.embedding().provider()).isEqualTo("local");
        assertThat(config.graph().uri()).isEqualTo("jdbc:sqlite:~/.mnemos/graph.db");
    }

    @Test
    void shouldRefreshConfigByMergingDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": {
                "defaults": {
                  "model": "gpt-4.1"
                }
              },
              "providers": {
                "openrouter": {
                  "api_key": "sk-test"
                }
              },
              "graph": {
                "uri": "mem:"
              }
            }
            """);

        MnemosConfig config = service.load(configPath);

        assertThat(config.agents().defaults().model()).isEqualTo("gpt-4.1");
        assertThat(config.agents().defaults().maxToolIterations()).isEqualTo(10);
        assertThat(config.providers().openrouter().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().openai().apiKey()).isEqualTo("");
        assertThat(config.graph().uri()).isEqualTo("mem:");
        assertThat(config.graph().vectorIndex()).isTrue();
    }

    @Test
    void shouldAcceptSnakeCaseAliasesAtEveryLevel() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": { "defaults": { "max_tool_iterations": 4, "core_tools_only": true } },
              "providers": {
                "hosted-gateway": {
                  "api_key": "gw-key",
                  "api_base": "https://gateway.local/v1",
                  "extra_headers": { "HTTP-Referer": "https://mnemos.dev", "x_trace": "on" }
                }
              },
              "graph": { "vector_index": false },
              "retrieval": { "memory_limit": 7 }
            }
            """);

        MnemosConfig config = service.load(configPath);
        MnemosConfig fileOnly = service.loadFileOnly(configPath);

        assertThat(config.agents().defaults().maxToolIterations()).isEqualTo(4);
        assertThat(config.agents().defaults().coreToolsOnly()).isTrue();
        assertThat(config.providers().gateway().apiKey()).isEqualTo("gw-key");
        assertThat(config.providers().gateway().apiBase()).isEqualTo("https://gateway.local/v1");
        assertThat(config.providers().gateway().extraHeaders())
            .containsEntry("HTTP-Referer", "https://mnemos.dev")
            .containsEntry("x_trace", "on");
        assertThat(config.graph().vectorIndex()).isFalse();
        assertThat(config.retrieval().memoryLimit()).isEqualTo(7);
        assertThat(fileOnly.providers().gateway().apiKey()).isEqualTo("gw-key");
    }

    @Test
    void shouldApplyEnvironmentOverridesOnTopOfFile() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "providers": { "openai": { "api_key": "from-file" } }, "graph": { "uri": "mem:" } }
            """);
        ConfigService service = new ConfigService(Map.of(
            "OPENAI_API_KEY", " from-env ",
            "MNEMOS_GRAPH_URI", "bolt://localhost:7687",
            "MNEMOS_EMBEDDING_PROVIDER", "openai"
        ));

        MnemosConfig config = service.load(configPath);

        assertThat(config.providers().openai().apiKey()).isEqualTo("from-env");
        assertThat(config.graph().uri()).isEqualTo("bolt://localhost:7687");
        assertThat(config.embedding().provider()).isEqualTo("openai");
    }

    @Test
    void shouldKeepEnvironmentSecretsOutOfSavedFile() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        ConfigService service = new ConfigService(Map.of("OPENROUTER_API_KEY", "sk-secret"));

        service.save(configPath, service.loadFileOnly(configPath));

        assertThat(service.load(configPath).providers().openrouter().apiKey()).isEqualTo("sk-secret");
        assertThat(Files.readString(configPath)).doesNotContain("sk-secret");
    }

    @Test
    void onboardShouldCreateConfigAndCapabilityDirectory() throws Exception {
        Path capabilities = tempDir.resolve("capabilities");
        ConfigService service = new ConfigService(Map.of("MNEMOS_CAPABILITIES_DIR", capabilities.toString()));
        Path configPath = tempDir.resolve(".mnemos/config.json");

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isTrue();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(result.capabilitiesPath()).isEqualTo(capabilities);
        assertThat(result.seededDefinitions()).containsExactlyElementsOf(CapabilityBootstrap.BUNDLED);
        assertThat(capabilities.resolve("generated")).isDirectory();
        assertThat(capabilities.resolve("core/cognitive.json")).isRegularFile();
    }

    @Test
    void onboardShouldPreserveExistingFilesUnlessOverwriting() throws Exception {
        Path capabilities = tempDir.resolve("capabilities");
        ConfigService service = new ConfigService(Map.of("MNEMOS_CAPABILITIES_DIR", capabilities.toString()));
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{ \"agents\": { \"defaults\": { \"model\": \"echo\" } } }");

        OnboardResult kept = service.onboard(configPath, false);

        assertThat(kept.createdConfig()).isFalse();
        assertThat(service.load(configPath).agents().defaults().model()).isEqualTo("echo");

        OnboardResult overwritten = service.onboard(configPath, true);

        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(overwritten.seededDefinitions()).isEmpty();
        assertThat(service.load(configPath).agents().defaults().model()).isEqualTo("anthropic/claude-sonnet-4.5");
    }
}
