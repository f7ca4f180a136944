package io.shipgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class RunJournalTest {

    @Test
    void writesOneMaskedJsonLinePerEntry() throws Exception {
        Path root = Files.createTempDirectory("shipgraph-test-journal-");
        try {
            Path file = root.resolve("journal").resolve("runs.log");
            RunJournal journal = new RunJournal(file);
            journal.record(RunJournal.Entry.of(RunJournal.RUN_START, "t-1", 0, "new_thread", Map.of()));
            journal.record(RunJournal.Entry.of(RunJournal.RUN_RESUME, "t-1", 1, "ok",
                    Map.of("value", "token is sk-abcdefghijklmnopqrstuvwx", "secret", "x")));

            List<String> lines = Files.readAllLines(file);
            Assertions.assertEquals(2, lines.size());
            JsonNode resume = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("run.resume", resume.get("action").asText());
            Assertions.assertEquals("t-1", resume.get("thread_id").asText());
            Assertions.assertEquals(1, resume.get("superstep").asInt());
            Assertions.assertEquals("***", resume.get("details").get("secret").asText());
            Assertions.assertEquals("token is [REDACTED]", resume.get("details").get("value").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void disabledJournalWritesNothing() {
        RunJournal journal = RunJournal.disabled();
        Assertions.assertFalse(journal.enabled());
        journal.record(RunJournal.Entry.of(RunJournal.RUN_FAIL, "t-1", null, "node_execution", null));
        Assertions.assertNull(journal.file());
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
