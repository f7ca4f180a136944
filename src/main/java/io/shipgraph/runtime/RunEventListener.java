package io.shipgraph.runtime;

@FunctionalInterface
public interface RunEventListener {
    RunEventListener NONE = event -> {
    };

    void onEvent(RunEvent event);
}
