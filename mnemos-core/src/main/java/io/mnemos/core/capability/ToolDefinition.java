package io.mnemos.core.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A tool the agent may call, as stored in a capability definition file. {@code handlerModule} names a class
 * and {@code handlerFunction} one of its public static methods taking the input map.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("input_schema") Map<String, Object> inputSchema,
    @JsonProperty("tier") Integer tier,
    @JsonProperty("handler_module") String handlerModule,
    @JsonProperty("handler_function") String handlerFunction,
    @JsonProperty("input_examples") List<Map<String, Object>> inputExamples,
    @JsonProperty("category") String category,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("created_by") String createdBy
) {
    public static final int DEFAULT_TIER = 2;
    // Names double as file names under generated/.
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (description == null) {
            throw new IllegalArgumentException("description is required for tool " + name);
        }
        if (inputSchema == null) {
            throw new IllegalArgumentException("input_schema is required for tool " + name);
        }
        name = name.trim();
        if (!NAME.matcher(name).matches() || name.contains("..")) {
            throw new IllegalArgumentException("tool name must match [A-Za-z0-9_.-]+ without '..', got '" + name + "'");
        }
        tier = tier == null ? DEFAULT_TIER : tier;
        if (tier < 0 || tier > 3) {
            throw new IllegalArgumentException("tier must be within 0..3 for tool " + name + ", got " + tier);
        }
        inputSchema = Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
        inputExamples = inputExamples == null ? List.of() : List.copyOf(inputExamples);
        category = category == null || category.isBlank() ? "general" : category;
        enabled = enabled == null ? Boolean.TRUE : enabled;
        createdBy = createdBy == null || createdBy.isBlank() ? "system" : createdBy;
    }

    public static ToolDefinition of(String name, String description, Map<String, Object> inputSchema, int tier, String category) {
        return new ToolDefinition(name, description, inputSchema, tier, null, null, null, category, true, null, null);
    }

    public boolean active() {
        return enabled;
    }

    public boolean core() {
        return tier <= 1;
    }

    public boolean hasHandlerReference() {
        return handlerModule != null && !handlerModule.isBlank() && handlerFunction != null && !handlerFunction.isBlank();
    }

    /**
     * The shape offered to the inference call, without storage metadata.
     */
    public Map<String, Object> toApiSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", name);
        schema.put("description", description);
        schema.put("input_schema", inputSchema);
        return schema;
    }

    public ToolDefinition withCreated(String at, String by) {
        return new ToolDefinition(
            name, description, inputSchema, tier, handlerModule, handlerFunction, inputExamples, category, enabled, at, by
        );
    }
}
