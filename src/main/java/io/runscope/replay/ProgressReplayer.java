package io.runscope.replay;

import io.runscope.model.CycleInfo;
import io.runscope.model.StageStatus;
import io.runscope.model.VisitedStage;
import io.runscope.util.OptionalFiles;
import io.runscope.util.Timestamps;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays one {@code progress.ndjson} into the ordered list of stage visits.
 *
 * <p>A visit enters the history as {@code running} on its start event so in-progress work is
 * visible, and is replaced in place by its finished form when the matching end event arrives.
 * Branch visits nest under the latest main-line visit that preceded the branch's first event.
 * Malformed lines and end events without a matching start are skipped.
 */
public final class ProgressReplayer {
    public static final String PROGRESS_FILE = "progress.ndjson";

    public ReplayResult replay(Path progressFile) {
        return OptionalFiles.tryRead(progressFile)
                .map(this::replay)
                .orElseGet(ReplayResult::empty);
    }

    public ReplayResult replay(String text) {
        if (text == null || text.isEmpty()) {
            return ReplayResult.empty();
        }
        Pass pass = new Pass();
        for (String line : text.split("\n")) {
            ProgressEvent.parse(line)
                    .filter(ProgressEvent::hasTimestamp)
                    .ifPresent(pass::apply);
        }
        return new ReplayResult(pass.history, Optional.ofNullable(pass.cycleInfo));
    }

    private static final class Pass {
        private final List<VisitedStage> history = new ArrayList<>();
        // key -> index in history of the visit still running
        private final Map<String, Integer> inFlight = new HashMap<>();
        private final Map<String, Integer> branchInFlight = new HashMap<>();
        private final Map<String, String> fanOutForBranch = new HashMap<>();
        private CycleInfo cycleInfo;

        void apply(ProgressEvent event) {
            switch (event.kind()) {
                case BRANCH_PROGRESS -> applyBranch(event);
                case CYCLE_CHECK, CYCLE_BREAKER -> applyCycle(event);
                case STAGE_ATTEMPT_START, STAGE_ATTEMPT_END -> applyMain(event);
                case LOOP_RESTART, UNKNOWN -> {
                }
            }
        }

        private void applyMain(ProgressEvent event) {
            if (event.nodeId() == null) {
                return;
            }
            String key = event.nodeId() + ":" + event.attempt();
            if (event.kind() == ProgressEventKind.STAGE_ATTEMPT_START) {
                history.add(VisitedStage.started(event.nodeId(), event.attempt(), event.ts()));
                inFlight.put(key, history.size() - 1);
                return;
            }
            Integer index = inFlight.remove(key);
            if (index != null) {
                finish(index, event.status(), event.ts(), event.failureReason());
            }
        }

        private void applyBranch(ProgressEvent event) {
            String branchKey = event.branchKey();
            String branchNodeId = event.branchNodeId();
            if (branchKey == null || branchNodeId == null) {
                return;
            }
            if (!fanOutForBranch.containsKey(branchKey)) {
                lastMainNodeId().ifPresent(nodeId -> fanOutForBranch.put(branchKey, nodeId));
            }
            String fanOutNode = fanOutForBranch.get(branchKey);
            if (fanOutNode == null) {
                return;
            }
            String key = fanOutNode + "/" + branchKey + "/" + branchNodeId + ":" + event.branchAttempt();
            if (event.branchKind() == ProgressEventKind.STAGE_ATTEMPT_START) {
                history.add(VisitedStage.branchStarted(
                        branchNodeId,
                        event.branchAttempt(),
                        event.ts(),
                        fanOutNode,
                        branchKey,
                        stagePath(event.branchLogsRoot(), branchNodeId)
                ));
                branchInFlight.put(key, history.size() - 1);
            } else if (event.branchKind() == ProgressEventKind.STAGE_ATTEMPT_END) {
                Integer index = branchInFlight.remove(key);
                if (index != null) {
                    finish(index, event.branchStatus(), event.ts(), event.branchFailureReason());
                }
            }
        }

        private void applyCycle(ProgressEvent event) {
            if (event.nodeId() == null) {
                return;
            }
            if (cycleInfo != null && event.signatureCount() < cycleInfo.signatureCount()) {
                return;
            }
            boolean limitReached = event.signatureLimit() > 0 && event.signatureCount() >= event.signatureLimit();
            cycleInfo = new CycleInfo(
                    event.nodeId(),
                    null,
                    event.signature(),
                    event.signatureCount(),
                    event.signatureLimit(),
                    event.kind() == ProgressEventKind.CYCLE_BREAKER || limitReached
            );
        }

        private void finish(int index, String outcome, String finishedAt, String reason) {
            VisitedStage running = history.get(index);
            history.set(index, running.finish(
                    StageStatus.fromOutcome(outcome),
                    finishedAt,
                    Timestamps.secondsBetween(running.startedAt(), finishedAt),
                    reason == null || reason.isEmpty() ? null : reason
            ));
        }

        private Optional<String> lastMainNodeId() {
            for (int i = history.size() - 1; i >= 0; i--) {
                VisitedStage visit = history.get(i);
                if (!visit.isBranch()) {
                    return Optional.of(visit.nodeId());
                }
            }
            return Optional.empty();
        }
    }

    static String stagePath(String branchLogsRoot, String branchNodeId) {
        if (branchLogsRoot == null) {
            return null;
        }
        String[] parts = branchLogsRoot.split("/", -1);
        int from = Math.max(0, parts.length - 3);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < parts.length; i++) {
            if (i > from) {
                sb.append('/');
            }
            sb.append(parts[i]);
        }
        return sb.append('/').append(branchNodeId).toString();
    }
}
