package io.shipgraph.checkpoint;

import io.shipgraph.util.ThreadIds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class InMemoryCheckpointStore implements CheckpointStore {
    private final Map<String, Deque<String>> threads = new TreeMap<>();
    private final int historyLimit;

    public InMemoryCheckpointStore() {
        this(0);
    }

    public InMemoryCheckpointStore(int historyLimit) {
        this.historyLimit = Math.max(0, historyLimit);
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) {
        ThreadIds.require(checkpoint.threadId());
        String encoded = CheckpointCodec.encode(checkpoint);
        Deque<String> history = threads.computeIfAbsent(checkpoint.threadId(), k -> new ArrayDeque<>());
        history.addFirst(encoded);
        while (historyLimit > 0 && history.size() > historyLimit) {
            history.removeLast();
        }
    }

    @Override
    public synchronized Optional<Checkpoint> load(String threadId) {
        Deque<String> history = threads.get(threadId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CheckpointCodec.decode(history.peekFirst(), "memory:" + threadId));
    }

    @Override
    public synchronized boolean delete(String threadId) {
        return threads.remove(threadId) != null;
    }

    @Override
    public synchronized List<Checkpoint> history(String threadId, int limit) {
        Deque<String> history = threads.get(threadId);
        List<Checkpoint> out = new ArrayList<>();
        if (history == null) {
            return out;
        }
        for (String encoded : history) {
            if (limit > 0 && out.size() >= limit) {
                break;
            }
            out.add(CheckpointCodec.decode(encoded, "memory:" + threadId));
        }
        return out;
    }

    @Override
    public synchronized List<String> listThreads() {
        return new ArrayList<>(threads.keySet());
    }

    @Override
    public String backend() {
        return "memory";
    }
}
