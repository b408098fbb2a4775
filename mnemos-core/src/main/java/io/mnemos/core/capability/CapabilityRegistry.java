package io.mnemos.core.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tools the agent can call, loaded from {@code core/}, {@code builtin/} and {@code generated/} under a
 * capability directory.
 *
 * <p>{@link #refresh()} rescans the directory and only reparses files whose SHA-256 changed. Refreshes and
 * registrations are serialized on a lock and publish an immutable snapshot; readers always see the last
 * published snapshot without blocking.
 */
public final class CapabilityRegistry {
    public static final List<String> TIER_DIRECTORIES = List.of("core", "builtin", "generated");
    public static final String GENERATED = "generated";

    private static final Logger LOG = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<String, ToolHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, ToolHandler> resolvedHandlers = new ConcurrentHashMap<>();
    private volatile Snapshot snapshot = Snapshot.empty();

    public CapabilityRegistry(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Creates the tier directories and performs the initial scan.
     */
    public static CapabilityRegistry open(Path root, Clock clock) throws IOException {
        CapabilityRegistry registry = new CapabilityRegistry(root, clock);
        for (String directory : TIER_DIRECTORIES) {
            Files.createDirectories(root.resolve(directory));
        }
        RefreshResult initial = registry.refresh();
        LOG.info("Loaded {} tools from {}", registry.list(null, null, false).size(), root);
        if (!initial.errors().isEmpty()) {
            LOG.warn("Skipped capability files: {}", initial.errors());
        }
        return registry;
    }

    public Path root() {
        return root;
    }

    public RefreshResult refresh() {
        writeLock.lock();
        try {
            Snapshot previous = snapshot;
            Map<Path, LoadedFile> files = new LinkedHashMap<>();
            Map<String, ToolDefinition> tools = new LinkedHashMap<>();
            List<String> added = new ArrayList<>();
            List<String> updated = new ArrayList<>();
            List<String> errors = new ArrayList<>();

            for (String directory : TIER_DIRECTORIES) {
                for (Path file : definitionFiles(root.resolve(directory), errors)) {
                    try {
                        byte[] content = Files.readAllBytes(file);
                        String hash = sha256(content);
                        LoadedFile known = previous.files().get(file);
                        if (known != null && known.hash().equals(hash)) {
                            files.put(file, known);
                            known.definitions().forEach(definition -> tools.put(definition.name(), definition));
                            continue;
                        }
                        List<ToolDefinition> definitions = parse(content);
                        files.put(file, new LoadedFile(hash, definitions));
                        for (ToolDefinition definition : definitions) {
                            if (previous.tools().containsKey(definition.name()) || tools.containsKey(definition.name())) {
                                updated.add(definition.name());
                            } else {
                                added.add(definition.name());
                            }
                            tools.put(definition.name(), definition);
                        }
                    } catch (IOException | IllegalArgumentException e) {
                        LOG.warn("Skipping capability file {}: {}", file, e.getMessage());
                        errors.add(root.relativize(file) + ": " + e.getMessage());
                    }
                }
            }

            for (String name : previous.ephemeral()) {
                ToolDefinition definition = previous.tools().get(name);
                if (definition != null && !tools.containsKey(name)) {
                    tools.put(name, definition);
                }
            }

            List<String> removed = new ArrayList<>();
            for (String name : previous.tools().keySet()) {
                if (!tools.containsKey(name)) {
                    removed.add(name);
                }
            }
            removed.forEach(resolvedHandlers::remove);
            updated.forEach(resolvedHandlers::remove);

            Set<String> ephemeral = new HashSet<>(previous.ephemeral());
            ephemeral.retainAll(tools.keySet());
            snapshot = new Snapshot(tools, files, ephemeral, clock.instant());

            RefreshResult result = new RefreshResult(added, updated, removed, errors);
            if (result.hasChanges()) {
                LOG.info("Capability refresh: added={} updated={} removed={}", added, updated, removed);
            }
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Adds or replaces a tool. Persisted tools are written to {@code generated/<name>.json}; the others live
     * in memory until unregistered and survive later refreshes.
     */
    public void register(ToolDefinition definition, boolean persist) throws IOException {
        Objects.requireNonNull(definition, "definition must not be null");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            ToolDefinition stamped = definition.createdAt() == null
                ? definition.withCreated(clock.instant().toString(), definition.createdBy())
                : definition;
            Map<Path, LoadedFile> files = new LinkedHashMap<>(current.files());
            Set<String> ephemeral = new HashSet<>(current.ephemeral());
            if (persist) {
                Path file = root.resolve(GENERATED).resolve(stamped.name() + ".json");
                Files.createDirectories(file.getParent());
                byte[] content = mapper.writeValueAsBytes(stamped);
                Files.write(file, content);
                files.put(file, new LoadedFile(sha256(content), List.of(stamped)));
                ephemeral.remove(stamped.name());
            } else {
                ephemeral.add(stamped.name());
            }
            Map<String, ToolDefinition> tools = new LinkedHashMap<>(current.tools());
            tools.put(stamped.name(), stamped);
            resolvedHandlers.remove(stamped.name());
            snapshot = new Snapshot(tools, files, ephemeral, current.lastRefresh());
            LOG.info("Registered tool {} (tier {}, persisted={})", stamped.name(), stamped.tier(), persist);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean unregister(String name, boolean deleteFile) throws IOException {
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (!current.tools().containsKey(name)) {
                return false;
            }
            Map<String, ToolDefinition> tools = new LinkedHashMap<>(current.tools());
            tools.remove(name);
            Map<Path, LoadedFile> files = new LinkedHashMap<>(current.files());
            if (deleteFile) {
                for (String directory : List.of(GENERATED, "builtin", "core")) {
                    Path file = root.resolve(directory).resolve(name + ".json");
                    if (Files.deleteIfExists(file)) {
                        files.remove(file);
                        break;
                    }
                }
            }
            Set<String> ephemeral = new HashSet<>(current.ephemeral());
            ephemeral.remove(name);
            resolvedHandlers.remove(name);
            snapshot = new Snapshot(tools, files, ephemeral, current.lastRefresh());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(snapshot.tools().get(name));
    }

    /**
     * {@code tier} and {@code category} may be null to match anything.
     */
    public List<ToolDefinition> list(Integer tier, String category, boolean enabledOnly) {
        List<ToolDefinition> out = new ArrayList<>();
        for (ToolDefinition definition : snapshot.tools().values()) {
            if (tier != null && definition.tier() != tier.intValue()) {
                continue;
            }
            if (category != null && !category.isBlank() && !category.equals(definition.category())) {
                continue;
            }
            if (enabledOnly && !definition.active()) {
                continue;
            }
            out.add(definition);
        }
        return out;
    }

    /**
     * Every enabled tool.
     */
    public List<Map<String, Object>> schemasForApi() {
        return list(null, null, true).stream().map(ToolDefinition::toApiSchema).collect(Collectors.toList());
    }

    /**
     * Enabled tools of tier 0 and 1 only.
     */
    public List<Map<String, Object>> coreSchemasForApi() {
        return list(null, null, true).stream()
            .filter(ToolDefinition::core)
            .map(ToolDefinition::toApiSchema)
            .collect(Collectors.toList());
    }

    public RegistryStats stats() {
        Snapshot current = snapshot;
        Map<Integer, Integer> byTier = new TreeMap<>();
        for (int tier = 0; tier <= 3; tier++) {
            byTier.put(tier, 0);
        }
        Map<String, Integer> byCategory = new TreeMap<>();
        int enabled = 0;
        for (ToolDefinition definition : current.tools().values()) {
            byTier.merge(definition.tier(), 1, Integer::sum);
            byCategory.merge(definition.category(), 1, Integer::sum);
            if (definition.active()) {
                enabled++;
            }
        }
        return new RegistryStats(
            current.tools().size(),
            byTier,
            byCategory,
            enabled,
            current.tools().size() - enabled,
            current.lastRefresh()
        );
    }

    public void registerHandler(String toolName, ToolHandler handler) {
        handlers.put(Objects.requireNonNull(toolName, "toolName must not be null"),
            Objects.requireNonNull(handler, "handler must not be null"));
    }

    /**
     * In-process handlers win over handler references declared in the definition.
     */
    public ToolHandler handler(String toolName) throws HandlerNotFoundException {
        ToolHandler registered = handlers.get(toolName);
        if (registered != null) {
            return registered;
        }
        ToolHandler resolved = resolvedHandlers.get(toolName);
        if (resolved != null) {
            return resolved;
        }
        ToolDefinition definition = snapshot.tools().get(toolName);
        if (definition == null || !definition.hasHandlerReference()) {
            throw new HandlerNotFoundException("No handler registered for tool: " + toolName);
        }
        ToolHandler handler = reflectiveHandler(definition);
        resolvedHandlers.put(toolName, handler);
        return handler;
    }

    public Object invoke(String toolName, Map<String, Object> input) throws CapabilityException {
        ToolHandler handler = handler(toolName);
        try {
            return handler.handle(input == null ? Map.of() : input);
        } catch (InvocationTargetException e) {
            throw new HandlerExecutionException(toolName, e.getCause() == null ? e : e.getCause());
        } catch (Exception e) {
            throw new HandlerExecutionException(toolName, e);
        }
    }

    /**
     * Runs a tool and folds every failure into an error result.
     */
    public ToolResult execute(String toolName, Map<String, Object> input) {
        ToolDefinition definition = snapshot.tools().get(toolName);
        if (definition != null && !definition.active()) {
            return ToolResult.failure(toolName, ToolResult.TOOL_DISABLED, "Tool is disabled: " + toolName);
        }
        try {
            return ToolResult.success(toolName, invoke(toolName, input));
        } catch (HandlerNotFoundException e) {
            LOG.warn("Tool {} has no handler: {}", toolName, e.getMessage());
            return ToolResult.failure(toolName, ToolResult.HANDLER_NOT_FOUND, e.getMessage());
        } catch (CapabilityException e) {
            LOG.warn("Tool {} failed", toolName, e.getCause());
            return ToolResult.failure(toolName, ToolResult.EXECUTION_ERROR, e.getMessage());
        }
    }

    private ToolHandler reflectiveHandler(ToolDefinition definition) throws HandlerNotFoundException {
        String reference = definition.handlerModule() + "#" + definition.handlerFunction();
        try {
            Class<?> type = Class.forName(definition.handlerModule());
            Method method = type.getMethod(definition.handlerFunction(), Map.class);
            if (!Modifier.isStatic(method.getModifiers())) {
                throw new HandlerNotFoundException("Handler " + reference + " is not static");
            }
            return input -> method.invoke(null, input);
        } catch (ClassNotFoundException | NoSuchMethodException e) {
            throw new HandlerNotFoundException("Cannot resolve handler " + reference + " for tool " + definition.name(), e);
        }
    }

    private List<Path> definitionFiles(Path directory, List<String> errors) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .filter(path -> path.getFileName().toString().endsWith(".json"))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot list capability directory {}: {}", directory, e.getMessage());
            errors.add(root.relativize(directory) + ": " + e.getMessage());
            return List.of();
        }
    }

    private List<ToolDefinition> parse(byte[] content) throws IOException {
        JsonNode tree = mapper.readTree(content);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            throw new IOException("file is empty");
        }
        List<ToolDefinition> definitions = new ArrayList<>();
        if (tree.isArray()) {
            for (JsonNode item : tree) {
                definitions.add(toDefinition(item));
            }
        } else {
            definitions.add(toDefinition(tree));
        }
        return definitions;
    }

    private ToolDefinition toDefinition(JsonNode node) throws IOException {
        if (!node.isObject()) {
            throw new IOException("tool definition must be a JSON object");
        }
        try {
            return mapper.treeToValue(node, ToolDefinition.class);
        } catch (IOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException) {
                throw new IOException(cause.getMessage(), e);
            }
            throw e;
        }
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record LoadedFile(String hash, List<ToolDefinition> definitions) {

        LoadedFile {
            definitions = List.copyOf(definitions);
        }
    }

    private record Snapshot(
        Map<String, ToolDefinition> tools,
        Map<Path, LoadedFile> files,
        Set<String> ephemeral,
        Instant lastRefresh
    ) {

        Snapshot {
            tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
            files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
            ephemeral = Set.copyOf(ephemeral);
        }

        static Snapshot empty() {
            return new Snapshot(Map.of(), Map.of(), Set.of(), null);
        }
    }
}
