package io.runscope.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RunSummary(
        @JsonProperty("id") String id,
        @JsonProperty("graph_name") String graphName,
        @JsonProperty("repo") String repo,
        @JsonProperty("goal") String goal,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("status") String status,
        @JsonProperty("source_dir") String sourceDir
) {
    public static RunSummary unknown(String id, String sourceDir) {
        return new RunSummary(id, null, null, null, null, "unknown", sourceDir);
    }
}
