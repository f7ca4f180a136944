package io.shipgraph.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.shipgraph.util.Jsons;

final class CheckpointCodec {
    private CheckpointCodec() {
    }

    static String encode(Checkpoint checkpoint) {
        try {
            return Jsons.compactMapper().writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointIOException("Failed to serialize checkpoint of thread " + checkpoint.threadId(), e);
        }
    }

    static Checkpoint decode(String json, String source) {
        try {
            return Jsons.compactMapper().readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointIOException("Failed to parse checkpoint from " + source, e);
        }
    }
}
