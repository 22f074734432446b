package io.runscope.format;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.model.StageInfo;
import io.runscope.util.Jsons;
import io.runscope.util.OptionalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Per-node {@code status.json} artifacts found under a log directory. */
public final class StageArtifacts {
    public static final String STATUS_FILE = "status.json";
    private static final Logger log = LoggerFactory.getLogger(StageArtifacts.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private StageArtifacts() {
    }

    public static Optional<JsonNode> readStatus(Path nodeDir) {
        return OptionalFiles.tryReadJson(nodeDir.resolve(STATUS_FILE));
    }

    public static Optional<StageInfo> readStage(Path nodeDir, String nodeId) {
        return readStatus(nodeDir).map(status -> toStageInfo(nodeId, status));
    }

    /**
     * Every immediate subdirectory with a status artifact becomes a stage; a subdirectory
     * without one is reported as {@code pass} only when the checkpoint lists it as completed.
     */
    public static List<StageInfo> readStages(Path logDir, Collection<String> completedNodes) {
        Set<String> completed = completedNodes == null ? Set.of() : Set.copyOf(completedNodes);
        List<StageInfo> stages = new ArrayList<>();
        for (Path nodeDir : listSubdirectories(logDir)) {
            String nodeId = nodeDir.getFileName().toString();
            Optional<StageInfo> stage = readStage(nodeDir, nodeId);
            if (stage.isPresent()) {
                stages.add(stage.get());
            } else if (completed.contains(nodeId)) {
                stages.add(StageInfo.inferredPass(nodeId));
            }
        }
        return stages;
    }

    static StageInfo toStageInfo(String nodeId, JsonNode status) {
        JsonNode rawStatus = status.get("status");
        String value = rawStatus == null || rawStatus.isNull() ? "unknown" : rawStatus.asText("unknown");
        JsonNode updates = status.get("context_updates");
        Map<String, Object> contextUpdates = updates != null && updates.isObject()
                ? Jsons.mapper().convertValue(updates, MAP_TYPE)
                : null;
        return new StageInfo(nodeId, value, Jsons.textField(status, "failure_reason"), contextUpdates);
    }

    private static List<Path> listSubdirectories(Path dir) {
        List<Path> out = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path path : stream) {
                out.add(path);
            }
        } catch (IOException e) {
            log.debug("Stage directory listing failed | dir={} error={}", dir, e.getMessage());
            return out;
        }
        out.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return out;
    }
}
