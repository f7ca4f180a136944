package io.shipgraph.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of thread checkpoints. Implementations must make {@link #save} atomic: a reader
 * sees either the previous checkpoint or the new one, never a partial write.
 *
 * <p>Every method reports persistence failures as {@link CheckpointIOException}.
 */
public interface CheckpointStore extends AutoCloseable {
    void save(Checkpoint checkpoint);

    Optional<Checkpoint> load(String threadId);

    boolean delete(String threadId);

    /**
     * Checkpoints of a thread, newest first. {@code limit <= 0} returns all of them.
     */
    List<Checkpoint> history(String threadId, int limit);

    List<String> listThreads();

    String backend();

    @Override
    default void close() {
    }
}
