package io.runscope.replay;

import io.runscope.model.CycleInfo;
import io.runscope.model.VisitedStage;

import java.util.List;
import java.util.Optional;

public record ReplayResult(List<VisitedStage> history, Optional<CycleInfo> cycleInfo) {
    public ReplayResult {
        history = history == null ? List.of() : List.copyOf(history);
        cycleInfo = cycleInfo == null ? Optional.empty() : cycleInfo;
    }

    public static ReplayResult empty() {
        return new ReplayResult(List.of(), Optional.empty());
    }
}
