package io.shipgraph.cli;

import io.shipgraph.checkpoint.InMemoryCheckpointStore;
import io.shipgraph.model.RunStatus;
import io.shipgraph.runtime.GraphRuntime;
import io.shipgraph.runtime.RunResult;
import io.shipgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ReviewDemoGraphTest {

    @Test
    void workersFanOutPerAreaBeforeReview() {
        try (GraphRuntime runtime = new GraphRuntime(ReviewDemoGraph.build(), new InMemoryCheckpointStore())) {
            RunResult result = runtime.invoke(ReviewDemoGraph.input("search service", List.of("security", "latency")), "demo");
            Assertions.assertEquals(RunStatus.INTERRUPTED, result.status());
            Assertions.assertEquals(ReviewDemoGraph.REVIEW, result.interrupt().node());
            Assertions.assertEquals(2, result.state().get("findings").size());
            Assertions.assertEquals("latency", result.state().get("findings").get(1).get("id").asText());
            Assertions.assertEquals(Jsons.tree(List.of("planned 2 area(s)", "drafted report")), result.state().get("log"));

            RunResult done = runtime.resume("demo", "");
            Assertions.assertEquals(RunStatus.COMPLETED, done.status());
            Assertions.assertTrue(done.state().get("approved").asBoolean());
        }
    }

    @Test
    void approvalWordsMatchCaseInsensitively() {
        Assertions.assertTrue(ReviewDemoGraph.isApproval(" LGTM "));
        Assertions.assertTrue(ReviewDemoGraph.isApproval(""));
        Assertions.assertTrue(ReviewDemoGraph.isApproval("y"));
        Assertions.assertFalse(ReviewDemoGraph.isApproval("approve, but shorten it"));
    }

    @Test
    void nonTextAnswerFailsTheReview() {
        try (GraphRuntime runtime = new GraphRuntime(ReviewDemoGraph.build(), new InMemoryCheckpointStore())) {
            runtime.invoke(ReviewDemoGraph.input("x", List.of()), "numeric");
            RunResult failed = runtime.resume("numeric", 42);
            Assertions.assertEquals(RunStatus.FAILED, failed.status());
            Assertions.assertEquals(RunStatus.INTERRUPTED.name(),
                    ShipGraphCommand.statusOf(runtime.getState("numeric").orElseThrow()));
        }
    }
}
