package io.runscope.replay;

import io.runscope.model.CycleInfo;
import io.runscope.model.VisitedStage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifies the graph nodes that make up a deterministic failure loop.
 *
 * <p>With a declared retry target the loop is exactly the main-line visits between the first two
 * visits to that target. Without one, or when the target was not visited twice, every main-line
 * node visited at least twice is reported; that set is approximate.
 */
public final class CycleLoops {
    private CycleLoops() {
    }

    /** A loop is worth showing once it is one occurrence away from the limit. */
    public static boolean isVisible(CycleInfo cycleInfo) {
        return cycleInfo != null && cycleInfo.signatureCount() >= cycleInfo.signatureLimit() - 1;
    }

    public static List<String> loopedNodes(List<VisitedStage> history, CycleInfo cycleInfo) {
        if (!isVisible(cycleInfo) || history == null) {
            return List.of();
        }
        List<VisitedStage> main = new ArrayList<>();
        for (VisitedStage visit : history) {
            if (!visit.isBranch()) {
                main.add(visit);
            }
        }

        String retryTarget = cycleInfo.retryTargetNodeId();
        if (retryTarget != null) {
            int first = indexOf(main, retryTarget, 0);
            int second = first < 0 ? -1 : indexOf(main, retryTarget, first + 1);
            if (first >= 0 && second > first) {
                Set<String> loop = new LinkedHashSet<>();
                for (int i = first; i < second; i++) {
                    loop.add(main.get(i).nodeId());
                }
                if (cycleInfo.failingNodeId() != null) {
                    loop.add(cycleInfo.failingNodeId());
                }
                return List.copyOf(loop);
            }
        }

        Map<String, Integer> visits = new LinkedHashMap<>();
        for (VisitedStage visit : main) {
            visits.merge(visit.nodeId(), 1, Integer::sum);
        }
        List<String> nodes = new ArrayList<>();
        visits.forEach((nodeId, count) -> {
            if (count >= 2) {
                nodes.add(nodeId);
            }
        });
        if (cycleInfo.failingNodeId() != null && !nodes.contains(cycleInfo.failingNodeId())) {
            nodes.add(cycleInfo.failingNodeId());
        }
        return List.copyOf(nodes);
    }

    private static int indexOf(List<VisitedStage> visits, String nodeId, int from) {
        for (int i = from; i < visits.size(); i++) {
            if (nodeId.equals(visits.get(i).nodeId())) {
                return i;
            }
        }
        return -1;
    }
}
