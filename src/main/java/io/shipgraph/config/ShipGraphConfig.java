package io.shipgraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ShipGraphConfig {
    public static final String DEFAULT_ROOT = "data";

    private final Path rootDir;

    public ShipGraphConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ShipGraphConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ShipGraphConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("shipgraph.db");
    }

    public Path checkpointsDir() {
        return rootDir.resolve("checkpoints");
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("runs.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("shipgraph-settings.json");
    }
}
