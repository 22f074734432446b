package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleInfo(
        @JsonProperty("failingNodeId") String failingNodeId,
        @JsonProperty("retryTargetNodeId") String retryTargetNodeId,
        @JsonProperty("signature") String signature,
        @JsonProperty("signatureCount") int signatureCount,
        @JsonProperty("signatureLimit") int signatureLimit,
        @JsonProperty("isBreaker") boolean isBreaker
) {
    public CycleInfo withRetryTarget(String nodeId) {
        return new CycleInfo(failingNodeId, nodeId, signature, signatureCount, signatureLimit, isBreaker);
    }
}
