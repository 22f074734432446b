package io.runscope.catalog;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A stage directory's {@code status.json} fields flattened next to its file listing. */
@JsonPropertyOrder({"node_id", "files"})
public record StageDetail(
        @JsonProperty("node_id") String nodeId,
        @JsonIgnore Map<String, Object> statusFields,
        @JsonProperty("files") List<String> files
) {
    public StageDetail {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (statusFields != null) {
            fields.putAll(statusFields);
        }
        // Own properties win over same-named status keys.
        fields.remove("node_id");
        fields.remove("files");
        statusFields = Collections.unmodifiableMap(fields);
        files = files == null ? List.of() : List.copyOf(files);
    }

    @JsonAnyGetter
    public Map<String, Object> anyStatusFields() {
        return statusFields;
    }
}
