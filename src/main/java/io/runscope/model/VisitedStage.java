package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One attempt of one graph node, main-line or inside a fan-out branch.
 *
 * <p>A {@code running} visit has no {@code finishedAt} and no duration; a finished visit has both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VisitedStage(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("status") StageStatus status,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("finished_at") String finishedAt,
        @JsonProperty("duration_s") Long durationS,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("fan_out_node") String fanOutNode,
        @JsonProperty("branch_key") String branchKey,
        @JsonProperty("stage_path") String stagePath,
        @JsonProperty("restartIndex") Integer restartIndex
) {
    public static VisitedStage started(String nodeId, int attempt, String startedAt) {
        return new VisitedStage(nodeId, attempt, StageStatus.RUNNING, startedAt,
                null, null, null, null, null, null, null);
    }

    public static VisitedStage branchStarted(
            String nodeId,
            int attempt,
            String startedAt,
            String fanOutNode,
            String branchKey,
            String stagePath
    ) {
        return new VisitedStage(nodeId, attempt, StageStatus.RUNNING, startedAt,
                null, null, null, fanOutNode, branchKey, stagePath, null);
    }

    public VisitedStage finish(StageStatus outcome, String finishedAt, long durationS, String reason) {
        return new VisitedStage(nodeId, attempt, outcome, startedAt, finishedAt, durationS,
                reason, fanOutNode, branchKey, stagePath, restartIndex);
    }

    public VisitedStage withRestartIndex(int index) {
        return new VisitedStage(nodeId, attempt, status, startedAt, finishedAt, durationS,
                failureReason, fanOutNode, branchKey, stagePath, index);
    }

    @JsonIgnore
    public boolean isBranch() {
        return fanOutNode != null;
    }
}
