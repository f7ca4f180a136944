package io.shipgraph.checkpoint;

import io.shipgraph.util.AtomicFiles;
import io.shipgraph.util.ThreadIds;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per thread under {@code threads/}, plus one file per saved checkpoint under
 * {@code history/<thread>/}. Every file is written to a temp file and moved into place.
 */
public final class FileCheckpointStore implements CheckpointStore {
    private static final String SUFFIX = ".json";

    private final Path threadsDir;
    private final Path historyDir;
    private final int historyLimit;

    public FileCheckpointStore(Path rootDir) {
        this(rootDir, 0);
    }

    public FileCheckpointStore(Path rootDir, int historyLimit) {
        this.historyLimit = Math.max(0, historyLimit);
        this.threadsDir = rootDir.resolve("threads");
        this.historyDir = rootDir.resolve("history");
        try {
            Files.createDirectories(threadsDir);
            Files.createDirectories(historyDir);
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to create checkpoint directory " + rootDir, e);
        }
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) {
        String threadId = ThreadIds.require(checkpoint.threadId());
        String payload = CheckpointCodec.encode(checkpoint);
        try {
            Path threadHistory = historyDir.resolve(threadId);
            List<Path> files = historyFiles(threadId);
            long sequence = files.isEmpty() ? 1L : sequenceOf(files.get(files.size() - 1)) + 1L;
            AtomicFiles.writeString(threadHistory.resolve(String.format("%010d-%06d%s", sequence, checkpoint.superstep(), SUFFIX)), payload);
            AtomicFiles.writeString(threadsDir.resolve(threadId + SUFFIX), payload);
            int excess = historyLimit > 0 ? files.size() + 1 - historyLimit : 0;
            for (int i = 0; i < excess; i++) {
                Files.deleteIfExists(files.get(i));
            }
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to write checkpoint of thread " + threadId, e);
        }
    }

    @Override
    public synchronized Optional<Checkpoint> load(String threadId) {
        if (!ThreadIds.isValid(threadId)) {
            return Optional.empty();
        }
        Path file = threadsDir.resolve(threadId + SUFFIX);
        try {
            return Optional.of(CheckpointCodec.decode(Files.readString(file, StandardCharsets.UTF_8), file.toString()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to read checkpoint " + file, e);
        }
    }

    @Override
    public synchronized boolean delete(String threadId) {
        if (!ThreadIds.isValid(threadId)) {
            return false;
        }
        try {
            boolean removed = Files.deleteIfExists(threadsDir.resolve(threadId + SUFFIX));
            for (Path file : historyFiles(threadId)) {
                Files.deleteIfExists(file);
            }
            Files.deleteIfExists(historyDir.resolve(threadId));
            return removed;
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to delete checkpoints of thread " + threadId, e);
        }
    }

    @Override
    public synchronized List<Checkpoint> history(String threadId, int limit) {
        List<Checkpoint> out = new ArrayList<>();
        if (!ThreadIds.isValid(threadId)) {
            return out;
        }
        try {
            List<Path> files = historyFiles(threadId);
            for (int i = files.size() - 1; i >= 0; i--) {
                if (limit > 0 && out.size() >= limit) {
                    break;
                }
                Path file = files.get(i);
                out.add(CheckpointCodec.decode(Files.readString(file, StandardCharsets.UTF_8), file.toString()));
            }
            return out;
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to read checkpoint history of thread " + threadId, e);
        }
    }

    @Override
    public synchronized List<String> listThreads() {
        try (Stream<Path> files = Files.list(threadsDir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX) && !name.startsWith("."))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to list checkpoint threads in " + threadsDir, e);
        }
    }

    @Override
    public String backend() {
        return "file";
    }

    private static long sequenceOf(Path historyFile) {
        String name = historyFile.getFileName().toString();
        int dash = name.indexOf('-');
        try {
            return Long.parseLong(dash > 0 ? name.substring(0, dash) : name.substring(0, name.length() - SUFFIX.length()));
        } catch (NumberFormatException e) {
            throw new CheckpointIOException("Unexpected checkpoint history file " + historyFile, e);
        }
    }

    private List<Path> historyFiles(String threadId) throws IOException {
        Path dir = historyDir.resolve(threadId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(SUFFIX) && !name.startsWith(".");
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }
}
