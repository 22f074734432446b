package io.runscope.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.model.RunFormat;
import io.runscope.model.RunRecord;
import io.runscope.model.RunState;
import io.runscope.model.RunStatus;
import io.runscope.probe.LivenessProbe;
import io.runscope.util.Jsons;
import io.runscope.util.OptionalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the single {@code run.json} layout, where the file is the whole run record.
 *
 * <p>Fields are picked one by one: a field with an unexpected shape is dropped, the rest of the
 * record still comes through.
 */
public final class StatusFileReader implements RunFormatReader {
    private static final Logger log = LoggerFactory.getLogger(StatusFileReader.class);

    private final LivenessProbe probe;

    public StatusFileReader(LivenessProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    @Override
    public RunFormat format() {
        return RunFormat.KILROY_DASH;
    }

    @Override
    public Optional<RunState> read(String runId, Path runDir) {
        Path marker = runDir.resolve(format().markerFile());
        Optional<JsonNode> json = OptionalFiles.tryReadJson(marker);
        if (json.isEmpty()) {
            log.debug("Status file missing or unreadable | runId={} path={}", runId, marker);
            return Optional.empty();
        }
        RunRecord run = toRecord(json.get());
        String containerId = run.containerId() == null ? "" : run.containerId();
        boolean alive = run.status() == RunStatus.EXECUTING
                && !containerId.isBlank()
                && probe.isContainerAlive(containerId);
        return Optional.of(RunState.of(run, alive, format()));
    }

    static RunRecord toRecord(JsonNode node) {
        JsonNode checkpoint = node.get("has_checkpoint");
        return new RunRecord(
                Jsons.textField(node, "id"),
                Jsons.textField(node, "repo"),
                Jsons.textField(node, "dot_file"),
                RunStatus.fromString(Jsons.textField(node, "status")),
                Jsons.textField(node, "current_node"),
                Jsons.textField(node, "container_id"),
                Jsons.textField(node, "started_at"),
                Jsons.textField(node, "finished_at"),
                Jsons.intField(node, "exit_code"),
                Jsons.textField(node, "last_heartbeat"),
                Jsons.textField(node, "failure_reason"),
                Jsons.textField(node, "attractor_run_id"),
                Jsons.textField(node, "attractor_logs_root"),
                checkpoint != null && checkpoint.isBoolean() ? checkpoint.asBoolean() : null,
                params(node.get("params")),
                textList(node.get("artifacts")),
                Jsons.textField(node, "source"),
                textList(node.get("completed_nodes"))
        );
    }

    // Scalars keep their text; nested values are kept as compact JSON.
    private static Map<String, String> params(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            out.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return out;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) {
                out.add(item.asText());
            }
        }
        return out;
    }
}
