package io.mnemos.core.capability;

import java.util.Map;

@FunctionalInterface
public interface ToolHandler {

    Object handle(Map<String, Object> input) throws Exception;
}
