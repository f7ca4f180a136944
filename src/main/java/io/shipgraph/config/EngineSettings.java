package io.shipgraph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.shipgraph.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

public record EngineSettings(
        int maxConcurrency,
        int maxSupersteps,
        long taskTimeoutMs,
        String checkpointer,
        boolean journalEnabled,
        int historyLimit
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final int DEFAULT_MAX_SUPERSTEPS = 25;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 300_000L;
    public static final String DEFAULT_CHECKPOINTER = "sqlite";
    // historyLimit 0 keeps every checkpoint of a thread
    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final Set<String> CHECKPOINTERS = Set.of("memory", "sqlite", "file");

    public EngineSettings {
        maxConcurrency = Math.max(1, maxConcurrency);
        maxSupersteps = Math.max(1, maxSupersteps);
        taskTimeoutMs = Math.max(1_000L, taskTimeoutMs);
        historyLimit = Math.max(0, historyLimit);
        checkpointer = checkpointer == null || checkpointer.isBlank()
                ? DEFAULT_CHECKPOINTER
                : checkpointer.trim().toLowerCase(Locale.ROOT);
        if (!CHECKPOINTERS.contains(checkpointer)) {
            throw new IllegalArgumentException("Unknown checkpointer: " + checkpointer + ", expected one of " + CHECKPOINTERS);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_MAX_CONCURRENCY,
                DEFAULT_MAX_SUPERSTEPS,
                DEFAULT_TASK_TIMEOUT_MS,
                DEFAULT_CHECKPOINTER,
                true,
                DEFAULT_HISTORY_LIMIT
        );
    }

    public static EngineSettings load(ShipGraphConfig config) {
        return load(config.settingsFile());
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    public EngineSettings withCheckpointer(String value) {
        return new EngineSettings(maxConcurrency, maxSupersteps, taskTimeoutMs, value, journalEnabled, historyLimit);
    }

    public EngineSettings withMaxConcurrency(int value) {
        return new EngineSettings(value, maxSupersteps, taskTimeoutMs, checkpointer, journalEnabled, historyLimit);
    }

    public EngineSettings withMaxSupersteps(int value) {
        return new EngineSettings(maxConcurrency, value, taskTimeoutMs, checkpointer, journalEnabled, historyLimit);
    }

    public EngineSettings withTaskTimeoutMs(long value) {
        return new EngineSettings(maxConcurrency, maxSupersteps, value, checkpointer, journalEnabled, historyLimit);
    }

    public EngineSettings withHistoryLimit(int value) {
        return new EngineSettings(maxConcurrency, maxSupersteps, taskTimeoutMs, checkpointer, journalEnabled, value);
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new EngineSettings(
                file.maxConcurrency() == null ? defaults.maxConcurrency() : file.maxConcurrency(),
                file.maxSupersteps() == null ? defaults.maxSupersteps() : file.maxSupersteps(),
                file.taskTimeoutMs() == null ? defaults.taskTimeoutMs() : file.taskTimeoutMs(),
                file.checkpointer() == null ? defaults.checkpointer() : file.checkpointer(),
                file.journalEnabled() == null ? defaults.journalEnabled() : file.journalEnabled(),
                file.historyLimit() == null ? defaults.historyLimit() : file.historyLimit()
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxConcurrency,
            Integer maxSupersteps,
            Long taskTimeoutMs,
            String checkpointer,
            Boolean journalEnabled,
            Integer historyLimit
    ) {
    }
}
