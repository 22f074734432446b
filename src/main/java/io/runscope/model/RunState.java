package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one run handed to consumers. {@code computedStatus} is derived from the run
 * status and the liveness flag when the snapshot is built and cannot be set independently.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunState(
        @JsonProperty("run") RunRecord run,
        @JsonProperty("containerAlive") boolean containerAlive,
        @JsonProperty("computedStatus") ComputedStatus computedStatus,
        @JsonProperty("lastChecked") Instant lastChecked,
        @JsonProperty("dot") String dot,
        @JsonProperty("stages") List<StageInfo> stages,
        @JsonProperty("stageHistory") List<VisitedStage> stageHistory,
        @JsonProperty("cycleInfo") CycleInfo cycleInfo,
        @JsonProperty("restartCount") Integer restartCount,
        @JsonProperty("worktreePath") String worktreePath,
        @JsonProperty("format") RunFormat format
) {
    public RunState {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(format, "format");
        computedStatus = ComputedStatus.derive(run.status(), containerAlive);
        stages = stages == null ? null : List.copyOf(stages);
        stageHistory = stageHistory == null ? null : List.copyOf(stageHistory);
    }

    public static RunState of(RunRecord run, boolean containerAlive, RunFormat format) {
        return new RunState(run, containerAlive, null, Instant.now(),
                null, null, null, null, null, null, format);
    }

    public RunStatus status() {
        return run.status();
    }

    /** Structural equality ignoring {@code lastChecked}. */
    public boolean sameContent(RunState other) {
        if (other == null) {
            return false;
        }
        return containerAlive == other.containerAlive
                && computedStatus == other.computedStatus
                && format == other.format
                && Objects.equals(run, other.run)
                && Objects.equals(dot, other.dot)
                && Objects.equals(stages, other.stages)
                && Objects.equals(stageHistory, other.stageHistory)
                && Objects.equals(cycleInfo, other.cycleInfo)
                && Objects.equals(restartCount, other.restartCount)
                && Objects.equals(worktreePath, other.worktreePath);
    }

    /** True when status or liveness differ, the change a poll is looking for. */
    public boolean livenessChangedFrom(RunState previous) {
        return previous == null
                || computedStatus != previous.computedStatus
                || containerAlive != previous.containerAlive;
    }
}
