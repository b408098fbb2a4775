package io.mnemos.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the capability directory and copies the bundled definitions into it. Existing files are
 * never overwritten so local edits survive a re-onboard.
 */
public final class CapabilityBootstrap {
    public static final List<String> SUBDIRECTORIES = List.of("core", "builtin", "generated");
    static final List<String> BUNDLED = List.of(
        "core/cognitive.json",
        "core/registry.json",
        "builtin/knowledge.json"
    );

    private CapabilityBootstrap() {
    }

    public static List<String> ensureCapabilityDirectory(Path root) throws IOException {
        for (String subdirectory : SUBDIRECTORIES) {
            Files.createDirectories(root.resolve(subdirectory));
        }

        List<String> seeded = new ArrayList<>();
        for (String relative : BUNDLED) {
            Path target = root.resolve(relative);
            if (Files.exists(target)) {
                continue;
            }
            try (InputStream in = CapabilityBootstrap.class.getResourceAsStream("/capabilities/" + relative)) {
                if (in == null) {
                    throw new IOException("Bundled capability definition missing: " + relative);
                }
                Files.copy(in, target);
                seeded.add(relative);
            }
        }
        return seeded;
    }
}
