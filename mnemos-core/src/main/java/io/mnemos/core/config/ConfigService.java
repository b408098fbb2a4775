package io.mnemos.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemos.core.config.model.MnemosConfig;
import java.io.IOException;
import java.lang.reflect.RecordComponent;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@code config.json} merged over the defaults, then applies environment overrides.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    private static final Map<String, String[]> ENVIRONMENT_OVERRIDES = new LinkedHashMap<>();

    static {
        ENVIRONMENT_OVERRIDES.put("MNEMOS_GRAPH_URI", new String[] {"graph", "uri"});
        ENVIRONMENT_OVERRIDES.put("MNEMOS_GRAPH_USERNAME", new String[] {"graph", "username"});
        ENVIRONMENT_OVERRIDES.put("MNEMOS_GRAPH_PASSWORD", new String[] {"graph", "password"});
        ENVIRONMENT_OVERRIDES.put("MNEMOS_EMBEDDING_PROVIDER", new String[] {"embedding", "provider"});
        ENVIRONMENT_OVERRIDES.put("MNEMOS_EMBEDDING_MODEL", new String[] {"embedding", "model"});
        ENVIRONMENT_OVERRIDES.put("MNEMOS_CAPABILITIES_DIR", new String[] {"capabilities", "directory"});
        ENVIRONMENT_OVERRIDES.put("OPENAI_API_KEY", new String[] {"providers", "openai", "apiKey"});
        ENVIRONMENT_OVERRIDES.put("OPENROUTER_API_KEY", new String[] {"providers", "openrouter", "apiKey"});
    }

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MnemosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        JsonNode merged = mapper.valueToTree(MnemosConfig.defaults());
        if (Files.exists(configPath)) {
            merged = deepMerge(merged, readFile(configPath));
        }
        applyEnvironment((ObjectNode) merged);
        return mapper.treeToValue(merged, MnemosConfig.class);
    }

    /**
     * Reads the file merged over defaults without environment overrides, so secrets from the
     * environment are never written back to disk.
     */
    public MnemosConfig loadFileOnly(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemosConfig.defaults();
        }
        JsonNode defaultsNode = mapper.valueToTree(MnemosConfig.defaults());
        return mapper.treeToValue(deepMerge(defaultsNode, readFile(configPath)), MnemosConfig.class);
    }

    public void save(Path configPath, MnemosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MnemosConfig config;
        if (created || overwrite) {
            config = MnemosConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = loadFileOnly(configPath);
        }

        save(configPath, config);

        Path capabilities = ConfigPaths.resolve(
            load(configPath).capabilities().directory(),
            ConfigPaths.home().resolve("capabilities")
        );
        var seeded = CapabilityBootstrap.ensureCapabilityDirectory(capabilities);
        return new OnboardResult(configPath, capabilities, created, overwritten, seeded);
    }

    public String toPrettyJson(MnemosConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void applyEnvironment(ObjectNode root) {
        for (Map.Entry<String, String[]> override : ENVIRONMENT_OVERRIDES.entrySet()) {
            String value = environment.get(override.getKey());
            if (value == null || value.isBlank()) {
                continue;
            }
            String[] path = override.getValue();
            ObjectNode target = root;
            for (int i = 0; i < path.length - 1; i++) {
                JsonNode child = target.get(path[i]);
                target = child instanceof ObjectNode object ? object : target.putObject(path[i]);
            }
            String field = path[path.length - 1];
            target.put(field, value.trim());
            LOG.debug("Applied {} from environment", override.getKey());
        }
    }

    private JsonNode readFile(Path configPath) throws IOException {
        JsonNode node = mapper.readTree(Files.readString(configPath));
        if (node instanceof ObjectNode object) {
            canonicalizeKeys(object, MnemosConfig.class);
        }
        return node;
    }

    /**
     * Renames {@link JsonAlias} keys to the component names the defaults serialize with, so file and
     * defaults merge key for key. Map-typed components (extra headers) keep their keys as written.
     */
    static void canonicalizeKeys(ObjectNode node, Class<?> type) {
        if (!type.isRecord()) {
            return;
        }
        for (RecordComponent component : type.getRecordComponents()) {
            String canonical = component.getName();
            JsonAlias alias = component.getAccessor().getAnnotation(JsonAlias.class);
            if (alias != null) {
                for (String key : alias.value()) {
                    JsonNode aliased = node.remove(key);
                    if (aliased == null) {
                        continue;
                    }
                    if (node.has(canonical)) {
                        LOG.warn("Config key '{}' ignored, '{}' is also set", key, canonical);
                    } else {
                        node.set(canonical, aliased);
                    }
                }
            }
            if (node.get(canonical) instanceof ObjectNode child) {
                canonicalizeKeys(child, component.getType());
            }
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
