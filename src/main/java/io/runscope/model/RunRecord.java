package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunRecord(
        @JsonProperty("id") String id,
        @JsonProperty("repo") String repo,
        @JsonProperty("dot_file") String dotFile,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("current_node") String currentNode,
        @JsonProperty("container_id") String containerId,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("finished_at") String finishedAt,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("last_heartbeat") String lastHeartbeat,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("attractor_run_id") String attractorRunId,
        @JsonProperty("attractor_logs_root") String attractorLogsRoot,
        @JsonProperty("has_checkpoint") Boolean hasCheckpoint,
        @JsonProperty("params") Map<String, String> params,
        @JsonProperty("artifacts") List<String> artifacts,
        @JsonProperty("source") String source,
        @JsonProperty("completed_nodes") List<String> completedNodes
) {
}
