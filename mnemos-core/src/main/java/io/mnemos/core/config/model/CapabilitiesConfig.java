package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CapabilitiesConfig(String directory) {

    public static CapabilitiesConfig defaults() {
        return new CapabilitiesConfig("~/.mnemos/capabilities");
    }
}
