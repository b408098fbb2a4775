package io.mnemos.core.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemos.core.config.CapabilityBootstrap;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CapabilityRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldReportAddedUpdatedAndRemovedToolsBetweenRefreshes() throws Exception {
        write("builtin/a.json", tool("alpha", 1, "first"));
        write("builtin/b.json", tool("beta", 2, "only in b"));
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        write("builtin/a.json", tool("alpha", 1, "changed"));
        write("builtin/c.json", tool("gamma", 2, "new"));
        Files.delete(tempDir.resolve("builtin/b.json"));
        RefreshResult result = registry.refresh();

        assertThat(result.added()).containsExactly("gamma");
        assertThat(result.updated()).containsExactly("alpha");
        assertThat(result.removed()).containsExactly("beta");
        assertThat(result.errors()).isEmpty();
        assertThat(registry.find("alpha")).map(ToolDefinition::description).contains("changed");
    }

    @Test
    void shouldReportNoChangesWhenFilesAreUntouched() throws Exception {
        write("core/a.json", tool("alpha", 1, "first"));
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        RefreshResult result = registry.refresh();

        assertThat(result.hasChanges()).isFalse();
    }

    @Test
    void shouldIsolateMalformedFile() throws Exception {
        write("builtin/good.json", "[" + tool("one", 2, "x") + "," + tool("two", 3, "y") + "]");
        write("builtin/broken.json", "{ not json");
        write("generated/third.json", tool("three", 3, "z"));

        CapabilityRegistry registry = new CapabilityRegistry(tempDir, CLOCK);
        RefreshResult result = registry.refresh();

        assertThat(result.added()).containsExactlyInAnyOrder("one", "two", "three");
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).contains("broken.json");
    }

    @Test
    void shouldRejectDefinitionWithTierOutOfRange() throws Exception {
        write("builtin/bad.json", tool("bad", 7, "x"));
        CapabilityRegistry registry = new CapabilityRegistry(tempDir, CLOCK);

        RefreshResult result = registry.refresh();

        assertThat(result.errors()).singleElement().asString().contains("bad.json", "tier must be within 0..3");
        assertThat(registry.find("bad")).isEmpty();
    }

    @Test
    void shouldRemoveToolWhoseFileWasDeleted() throws Exception {
        write("core/x.json", tool("x", 1, "temporary"));
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);
        assertThat(registry.find("x")).isPresent();

        Files.delete(tempDir.resolve("core/x.json"));
        RefreshResult result = registry.refresh();

        assertThat(result.removed()).contains("x");
        assertThat(registry.list(null, null, false)).extracting(ToolDefinition::name).doesNotContain("x");
    }

    @Test
    void shouldPersistRegisteredToolUnderGenerated() throws Exception {
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        registry.register(ToolDefinition.of("weather", "Look up weather", Map.of("type", "object"), 3, "utility"), true);

        Path file = tempDir.resolve("generated/weather.json");
        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("\"created_at\" : \"2026-02-01T12:00:00Z\"");
        assertThat(registry.refresh().hasChanges()).isFalse();
        assertThat(CapabilityRegistry.open(tempDir, CLOCK).find("weather")).isPresent();
    }

    @Test
    void shouldRejectToolNamesThatAreNotPlainFileNames() throws Exception {
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        for (String name : new String[] {"math/add", "../escape", "a..b", "back\\slash", "with space"}) {
            assertThatThrownBy(() -> registry.register(
                ToolDefinition.of(name, "Bad name", Map.of("type", "object"), 3, "utility"), true))
                .as(name)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tool name must match");
        }
        registry.register(ToolDefinition.of("math.add-v2", "Adds", Map.of("type", "object"), 3, "utility"), true);

        assertThat(tempDir.resolve("escape.json")).doesNotExist();
        assertThat(tempDir.resolve("generated/math")).doesNotExist();
        assertThat(tempDir.resolve("generated/math.add-v2.json")).exists();
        assertThat(registry.refresh().removed()).isEmpty();
        assertThat(registry.find("math.add-v2")).isPresent();
    }

    @Test
    void shouldSkipDefinitionFileWithPathLikeToolName() throws Exception {
        write("builtin/sneaky.json", tool("../sneaky", 2, "x"));
        CapabilityRegistry registry = new CapabilityRegistry(tempDir, CLOCK);

        RefreshResult result = registry.refresh();

        assertThat(result.added()).isEmpty();
        assertThat(result.errors()).singleElement().asString().contains("sneaky.json");
    }

    @Test
    void shouldKeepEphemeralToolAcrossRefreshUntilUnregistered() throws Exception {
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);
        registry.register(ToolDefinition.of("scratch", "In memory only", Map.of("type", "object"), 2, "general"), false);

        registry.refresh();

        assertThat(registry.find("scratch")).isPresent();
        assertThat(tempDir.resolve("generated/scratch.json")).doesNotExist();
        assertThat(registry.unregister("scratch", false)).isTrue();
        assertThat(registry.find("scratch")).isEmpty();
        assertThat(registry.unregister("scratch", false)).isFalse();
    }

    @Test
    void shouldSplitCoreAndDeferredSchemas() throws Exception {
        write("core/a.json", tool("core_tool", 0, "always"));
        write("builtin/b.json", tool("deferred_tool", 2, "on request"));
        write("builtin/c.json", """
            {"name": "off_tool", "description": "disabled", "input_schema": {"type": "object"}, "tier": 1, "enabled": false}
            """);
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        assertThat(registry.coreSchemasForApi()).extracting(schema -> schema.get("name")).containsExactly("core_tool");
        assertThat(registry.schemasForApi()).extracting(schema -> schema.get("name"))
            .containsExactlyInAnyOrder("core_tool", "deferred_tool");
        assertThat(registry.schemasForApi().get(0)).containsOnlyKeys("name", "description", "input_schema");
        RegistryStats stats = registry.stats();
        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.disabled()).isEqualTo(1);
        assertThat(stats.byTier()).containsEntry(2, 1);
        assertThat(stats.lastRefresh()).isEqualTo(CLOCK.instant());
    }

    @Test
    void shouldPreferRegisteredHandlerAndWrapFailures() throws Exception {
        write("core/a.json", tool("echo", 1, "echo input"));
        write("core/b.json", tool("boom", 1, "always fails"));
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);
        registry.registerHandler("echo", input -> Map.of("echo", input.get("text")));
        registry.registerHandler("boom", input -> {
            throw new IllegalStateException("kaboom");
        });

        ToolResult ok = registry.execute("echo", Map.of("text", "hi"));
        ToolResult failed = registry.execute("boom", Map.of());
        ToolResult missing = registry.execute("nobody", Map.of());

        assertThat(ok.success()).isTrue();
        assertThat(ok.payload()).isEqualTo(Map.of("echo", "hi"));
        assertThat(failed.errorType()).isEqualTo(ToolResult.EXECUTION_ERROR);
        assertThat(failed.error()).contains("kaboom");
        assertThat(missing.errorType()).isEqualTo(ToolResult.HANDLER_NOT_FOUND);
        assertThatThrownBy(() -> registry.invoke("boom", Map.of())).isInstanceOf(HandlerExecutionException.class);
    }

    @Test
    void shouldResolveReflectiveHandlerFromBundledDefinitions() throws Exception {
        CapabilityBootstrap.ensureCapabilityDirectory(tempDir);
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        ToolResult result = registry.execute("chunk_text", Map.of("text", "hello world", "chunk_size", 100));

        assertThat(result.success()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> output = (Map<String, Object>) result.output();
        assertThat(output).containsEntry("count", 1);
    }

    @Test
    void shouldReportUnresolvableHandlerReference() throws Exception {
        write("builtin/a.json", """
            {"name": "ghost", "description": "d", "input_schema": {}, "handler_module": "io.mnemos.Missing",
             "handler_function": "run"}
            """);
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);

        ToolResult result = registry.execute("ghost", Map.of());

        assertThat(result.errorType()).isEqualTo(ToolResult.HANDLER_NOT_FOUND);
        assertThat(result.error()).contains("io.mnemos.Missing#run");
    }

    @Test
    void shouldRefuseDisabledTool() throws Exception {
        write("builtin/a.json", """
            {"name": "off", "description": "d", "input_schema": {}, "enabled": false}
            """);
        CapabilityRegistry registry = CapabilityRegistry.open(tempDir, CLOCK);
        registry.registerHandler("off", input -> "should not run");

        ToolResult result = registry.execute("off", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(ToolResult.TOOL_DISABLED);
        assertThat(registry.list(null, null, true)).isEmpty();
        assertThat(registry.list(null, null, false)).hasSize(1);
    }

    private void write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String tool(String name, int tier, String description) {
        return """
            {"name": "%s", "description": "%s", "input_schema": {"type": "object", "properties": {}}, "tier": %d}
            """.formatted(name, description, tier);
    }
}
