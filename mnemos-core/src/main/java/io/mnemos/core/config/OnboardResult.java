package io.mnemos.core.config;

import java.nio.file.Path;
import java.util.List;

public record OnboardResult(
    Path configPath,
    Path capabilitiesPath,
    boolean createdConfig,
    boolean overwrittenConfig,
    List<String> seededDefinitions
) {
    public OnboardResult {
        seededDefinitions = seededDefinitions == null ? List.of() : List.copyOf(seededDefinitions);
    }
}
