package io.shipgraph.observability;

import io.shipgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines record of run lifecycle events. Identifiers stay in clear text,
 * {@code details} go through {@link SensitiveDataMasker}.
 */
public final class RunJournal {
    private static final Logger LOG = LoggerFactory.getLogger(RunJournal.class);

    public static final String RUN_START = "run.start";
    public static final String SUPERSTEP_COMMIT = "superstep.commit";
    public static final String RUN_INTERRUPT = "run.interrupt";
    public static final String RUN_RESUME = "run.resume";
    public static final String RUN_COMPLETE = "run.complete";
    public static final String RUN_FAIL = "run.fail";
    public static final String RUN_CANCEL = "run.cancel";

    private final Path journalFile;

    public RunJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.toAbsolutePath().getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently by another process.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize run journal: " + journalFile, e);
        }
    }

    public static RunJournal disabled() {
        return new RunJournal();
    }

    private RunJournal() {
        this.journalFile = null;
    }

    public boolean enabled() {
        return journalFile != null;
    }

    public Path file() {
        return journalFile;
    }

    public synchronized void record(Entry entry) {
        if (journalFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", entry.action());
        row.put("thread_id", entry.threadId());
        row.put("superstep", entry.superstep());
        row.put("result", entry.result());
        row.put("details", SensitiveDataMasker.masked(Jsons.tree(entry.details())));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            // Journal failures never fail a run.
            LOG.warn("Failed to append to run journal {}: {}", journalFile, e.getMessage());
        }
    }

    public record Entry(
            String action,
            String threadId,
            Integer superstep,
            String result,
            Map<String, Object> details
    ) {
        public static Entry of(String action, String threadId, Integer superstep, String result, Map<String, Object> details) {
            return new Entry(action, threadId, superstep, result, details == null ? Map.of() : details);
        }
    }
}
