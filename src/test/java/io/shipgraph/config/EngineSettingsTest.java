package io.shipgraph.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("shipgraph-test-settings-missing-");
        try {
            EngineSettings settings = EngineSettings.load(ShipGraphConfig.fromRoot(root.toString()));
            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertEquals("sqlite", settings.checkpointer());
            Assertions.assertEquals(25, settings.maxSupersteps());
            Assertions.assertEquals(EngineSettings.DEFAULT_HISTORY_LIMIT, settings.historyLimit());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileOverridesOnlyGivenFieldsAndClampsValues() throws Exception {
        Path root = Files.createTempDirectory("shipgraph-test-settings-partial-");
        try {
            ShipGraphConfig config = ShipGraphConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "maxConcurrency": 0,
                      "taskTimeoutMs": 10,
                      "checkpointer": " FILE ",
                      "journalEnabled": false,
                      "historyLimit": -5,
                      "somethingNew": true
                    }
                    """);
            EngineSettings settings = EngineSettings.load(config);
            Assertions.assertEquals(1, settings.maxConcurrency());
            Assertions.assertEquals(1_000L, settings.taskTimeoutMs());
            Assertions.assertEquals("file", settings.checkpointer());
            Assertions.assertFalse(settings.journalEnabled());
            Assertions.assertEquals(0, settings.historyLimit());
            Assertions.assertEquals(EngineSettings.DEFAULT_MAX_SUPERSTEPS, settings.maxSupersteps());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownCheckpointerIsRejected() throws Exception {
        Path root = Files.createTempDirectory("shipgraph-test-settings-bad-");
        try {
            ShipGraphConfig config = ShipGraphConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"checkpointer\":\"redis\"}");
            Assertions.assertThrows(IllegalArgumentException.class, () -> EngineSettings.load(config));
            Assertions.assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withCheckpointer("postgres"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("shipgraph-test-settings-malformed-");
        try {
            ShipGraphConfig config = ShipGraphConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{maxSupersteps:");
            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> EngineSettings.load(config));
            Assertions.assertTrue(error.getMessage().contains("shipgraph-settings.json"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void configDerivesPathsUnderRoot() {
        ShipGraphConfig config = ShipGraphConfig.fromRoot("some/root");
        Assertions.assertTrue(config.rootDir().isAbsolute());
        Assertions.assertEquals(config.rootDir().resolve("shipgraph.db"), config.dbFile());
        Assertions.assertEquals(config.rootDir().resolve("journal").resolve("runs.log"), config.journalFile());
        Assertions.assertEquals(ShipGraphConfig.DEFAULT_ROOT, ShipGraphConfig.fromRoot(" ").rootDir().getFileName().toString());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
