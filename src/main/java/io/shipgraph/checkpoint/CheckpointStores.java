package io.shipgraph.checkpoint;

import io.shipgraph.config.EngineSettings;
import io.shipgraph.config.ShipGraphConfig;

public final class CheckpointStores {
    private CheckpointStores() {
    }

    public static CheckpointStore open(ShipGraphConfig config, EngineSettings settings) {
        return switch (settings.checkpointer()) {
            case "memory" -> new InMemoryCheckpointStore(settings.historyLimit());
            case "file" -> new FileCheckpointStore(config.checkpointsDir(), settings.historyLimit());
            case "sqlite" -> new SqliteCheckpointStore(config.dbFile(), settings.historyLimit()).init();
            default -> throw new IllegalArgumentException("Unknown checkpointer: " + settings.checkpointer());
        };
    }
}
