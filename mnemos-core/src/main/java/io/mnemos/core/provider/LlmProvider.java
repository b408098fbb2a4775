package io.mnemos.core.provider;

import io.mnemos.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Opaque inference call. {@code tools} use the registry's {@code {name, description, input_schema}} shape;
 * providers translate it to their wire format. Failures come back as an {@link LlmResponse#failed() error
 * response} rather than an exception.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools);
}
