package io.runscope.replay;

import io.runscope.model.CycleInfo;
import io.runscope.model.StageStatus;
import io.runscope.model.VisitedStage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

final class CycleLoopsTest {

    @Test
    void hiddenUntilOneAwayFromLimit() {
        Assertions.assertFalse(CycleLoops.isVisible(cycle(1, 3, null)));
        Assertions.assertTrue(CycleLoops.isVisible(cycle(2, 3, null)));
        Assertions.assertTrue(CycleLoops.isVisible(cycle(3, 3, null)));
        Assertions.assertFalse(CycleLoops.isVisible(null));
        Assertions.assertEquals(List.of(), CycleLoops.loopedNodes(history("plan", "verify", "plan"), cycle(1, 3, null)));
    }

    @Test
    void retryTargetSliceBetweenFirstTwoVisits() {
        List<VisitedStage> history = history("plan", "implement", "test", "verify", "implement", "test", "verify");
        List<String> looped = CycleLoops.loopedNodes(history, cycle(2, 3, "implement"));
        Assertions.assertEquals(List.of("implement", "test", "verify"), looped);
    }

    @Test
    void repeatedNodesWhenNoRetryTarget() {
        List<VisitedStage> history = history("plan", "implement", "verify", "implement", "verify", "report");
        Assertions.assertEquals(List.of("implement", "verify"), CycleLoops.loopedNodes(history, cycle(3, 3, null)));
    }

    @Test
    void fallsBackWhenRetryTargetVisitedOnce() {
        List<VisitedStage> history = history("plan", "implement", "test", "test");
        Assertions.assertEquals(List.of("test", "verify"), CycleLoops.loopedNodes(history, cycle(2, 3, "implement")));
    }

    @Test
    void branchVisitsDoNotCount() {
        VisitedStage branch = VisitedStage.branchStarted("impl", 1, "2026-03-01T10:00:00Z", "fan", "a", "parallel/fan/a/impl");
        List<VisitedStage> history = List.of(
                visit("fan"),
                branch,
                branch,
                visit("verify")
        );
        Assertions.assertEquals(List.of("verify"), CycleLoops.loopedNodes(history, cycle(2, 3, null)));
    }

    private static CycleInfo cycle(int count, int limit, String retryTarget) {
        return new CycleInfo("verify", retryTarget, "sig", count, limit, count >= limit);
    }

    private static List<VisitedStage> history(String... nodeIds) {
        return Arrays.stream(nodeIds).map(CycleLoopsTest::visit).toList();
    }

    private static VisitedStage visit(String nodeId) {
        return VisitedStage.started(nodeId, 1, "2026-03-01T10:00:00Z")
                .finish(StageStatus.PASS, "2026-03-01T10:00:01Z", 1L, null);
    }
}
