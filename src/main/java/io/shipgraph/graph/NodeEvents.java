package io.shipgraph.graph;

public interface NodeEvents {
    NodeEvents NONE = new NodeEvents() {
        @Override
        public void status(String message) {
        }

        @Override
        public void progress(String stage, Integer percent) {
        }

        @Override
        public void token(String content) {
        }
    };

    void status(String message);

    void progress(String stage, Integer percent);

    void token(String content);
}
