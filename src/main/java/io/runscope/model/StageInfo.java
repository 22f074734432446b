package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageInfo(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("status") String status,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("context_updates") Map<String, Object> contextUpdates
) {
    public static StageInfo inferredPass(String nodeId) {
        return new StageInfo(nodeId, "pass", null, null);
    }
}
