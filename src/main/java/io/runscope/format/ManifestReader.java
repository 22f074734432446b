package io.runscope.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.model.CycleInfo;
import io.runscope.model.RunFormat;
import io.runscope.model.RunRecord;
import io.runscope.model.RunState;
import io.runscope.model.RunStatus;
import io.runscope.model.StageInfo;
import io.runscope.model.VisitedStage;
import io.runscope.probe.LivenessProbe;
import io.runscope.replay.ProgressEvent;
import io.runscope.replay.ProgressReplayer;
import io.runscope.replay.ReplayResult;
import io.runscope.replay.RestartChainWalker;
import io.runscope.util.Jsons;
import io.runscope.util.OptionalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the multi-file engine layout: {@code manifest.json}, {@code checkpoint.json},
 * {@code final.json}, {@code run.pid}, {@code progress.ndjson} and per-node {@code status.json}.
 *
 * <p>Checkpoint, final outcome and pid are taken from the latest restart directory first and
 * fall back to the root directory.
 */
public final class ManifestReader implements RunFormatReader {
    public static final String CHECKPOINT_FILE = "checkpoint.json";
    public static final String FINAL_FILE = "final.json";
    public static final String PID_FILE = "run.pid";
    public static final int HEARTBEAT_TAIL_BYTES = 4096;
    private static final Pattern RETRY_TARGET = Pattern.compile("\\bretry_target\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern LEADING_INT = Pattern.compile("^\\s*(-?\\d+)");
    private static final Logger log = LoggerFactory.getLogger(ManifestReader.class);

    private final LivenessProbe probe;
    private final RestartChainWalker chainWalker;
    private final ProgressReplayer replayer;

    public ManifestReader(LivenessProbe probe) {
        this(probe, new RestartChainWalker(), new ProgressReplayer());
    }

    public ManifestReader(LivenessProbe probe, RestartChainWalker chainWalker, ProgressReplayer replayer) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.chainWalker = Objects.requireNonNull(chainWalker, "chainWalker");
        this.replayer = Objects.requireNonNull(replayer, "replayer");
    }

    @Override
    public RunFormat format() {
        return RunFormat.ATTRACTOR;
    }

    @Override
    public Optional<RunState> read(String runId, Path runDir) {
        Optional<JsonNode> manifest = OptionalFiles.tryReadJson(runDir.resolve(format().markerFile()));
        if (manifest.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(readState(runId, runDir, manifest.get()));
        } catch (RuntimeException e) {
            log.warn("Manifest run read failed | runId={} dir={} error={}", runId, runDir, e.toString(), e);
            return Optional.empty();
        }
    }

    private RunState readState(String runId, Path runDir, JsonNode manifest) {
        String goal = Jsons.textField(manifest, "goal");
        String logsRoot = Optional.ofNullable(Jsons.textField(manifest, "logs_root")).orElse(runDir.toString());
        String repoPath = Jsons.textField(manifest, "repo_path");
        String dot = Optional.ofNullable(Jsons.textField(manifest, "graph_dot"))
                .flatMap(graphDot -> resolve(runDir, graphDot))
                .flatMap(OptionalFiles::tryRead)
                .orElse(null);

        List<Path> chain = chainWalker.walk(runDir);
        Path latestDir = chain.get(chain.size() - 1);
        List<Path> latestThenRoot = latestDir.equals(runDir) ? List.of(runDir) : List.of(latestDir, runDir);

        Checkpoint checkpoint = firstJson(latestThenRoot, CHECKPOINT_FILE)
                .map(Checkpoint::from)
                .orElse(Checkpoint.NONE);
        FinalOutcome outcome = firstJson(latestThenRoot, FINAL_FILE)
                .map(FinalOutcome::from)
                .orElse(FinalOutcome.NONE);
        String heartbeat = lastHeartbeat(latestDir).orElse(checkpoint.timestamp());

        boolean alive = false;
        if (outcome.status() == null && checkpoint.present()) {
            alive = readPid(latestThenRoot).map(probe::isProcessAlive).orElse(false);
        }
        RunStatus status;
        if (outcome.status() != null) {
            status = outcome.status();
        } else if (checkpoint.present()) {
            status = alive ? RunStatus.EXECUTING : RunStatus.INTERRUPTED;
        } else {
            status = RunStatus.PENDING;
        }

        List<VisitedStage> history = new ArrayList<>();
        CycleInfo cycleInfo = null;
        for (int i = 0; i < chain.size(); i++) {
            ReplayResult replay = replayer.replay(chain.get(i).resolve(ProgressReplayer.PROGRESS_FILE));
            for (VisitedStage visit : replay.history()) {
                history.add(visit.withRestartIndex(i));
            }
            if (replay.cycleInfo().isPresent()) {
                cycleInfo = replay.cycleInfo().get();
            }
        }
        if (cycleInfo != null && dot != null) {
            Matcher matcher = RETRY_TARGET.matcher(dot);
            if (matcher.find()) {
                cycleInfo = cycleInfo.withRetryTarget(matcher.group(1));
            }
        }

        Map<String, StageInfo> stages = new LinkedHashMap<>();
        for (Path dir : chain) {
            for (StageInfo stage : StageArtifacts.readStages(dir, checkpoint.completedNodes())) {
                stages.put(stage.nodeId(), stage);
            }
        }

        RunRecord run = new RunRecord(
                runId,
                lastSegment(repoPath),
                Jsons.textField(manifest, "graph_name"),
                status,
                checkpoint.currentNode(),
                null,
                Jsons.textField(manifest, "started_at"),
                outcome.finishedAt(),
                null,
                heartbeat,
                outcome.failureReason(),
                runId,
                logsRoot,
                checkpoint.present(),
                goal == null ? null : Map.of("goal", goal),
                null,
                null,
                checkpoint.completedNodes()
        );
        int restartCount = chain.size() - 1;
        return new RunState(
                run,
                alive,
                null,
                Instant.now(),
                dot,
                new ArrayList<>(stages.values()),
                history,
                cycleInfo,
                restartCount > 0 ? restartCount : null,
                Jsons.textField(manifest, "worktree"),
                format()
        );
    }

    private static Optional<JsonNode> firstJson(List<Path> dirs, String fileName) {
        for (Path dir : dirs) {
            Optional<JsonNode> node = OptionalFiles.tryReadJson(dir.resolve(fileName));
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }

    static Optional<String> lastHeartbeat(Path logDir) {
        Optional<String> tail = OptionalFiles.tryReadTail(logDir.resolve(ProgressReplayer.PROGRESS_FILE), HEARTBEAT_TAIL_BYTES);
        if (tail.isEmpty()) {
            return Optional.empty();
        }
        String[] lines = tail.get().split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            Optional<ProgressEvent> event = ProgressEvent.parse(lines[i]);
            if (event.isPresent() && event.get().hasTimestamp()) {
                return Optional.of(event.get().ts());
            }
        }
        return Optional.empty();
    }

    private static Optional<Long> readPid(List<Path> dirs) {
        for (Path dir : dirs) {
            Optional<Long> pid = OptionalFiles.tryRead(dir.resolve(PID_FILE)).flatMap(ManifestReader::parsePid);
            if (pid.isPresent()) {
                return pid;
            }
        }
        return Optional.empty();
    }

    static Optional<Long> parsePid(String raw) {
        Matcher matcher = LEADING_INT.matcher(raw == null ? "" : raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Path> resolve(Path runDir, String raw) {
        try {
            return Optional.of(runDir.resolve(raw));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static String lastSegment(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        int idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    private record Checkpoint(boolean present, String currentNode, List<String> completedNodes, String timestamp) {
        static final Checkpoint NONE = new Checkpoint(false, null, List.of(), null);

        static Checkpoint from(JsonNode node) {
            List<String> completed = new ArrayList<>();
            JsonNode raw = node.get("completed_nodes");
            if (raw != null && raw.isArray()) {
                raw.forEach(item -> completed.add(item.asText()));
            }
            return new Checkpoint(
                    true,
                    Jsons.textField(node, "current_node"),
                    List.copyOf(completed),
                    Jsons.textField(node, "timestamp")
            );
        }
    }

    private record FinalOutcome(RunStatus status, String failureReason, String finishedAt) {
        static final FinalOutcome NONE = new FinalOutcome(null, null, null);

        static FinalOutcome from(JsonNode node) {
            JsonNode raw = node.get("status");
            String value = raw == null || raw.isNull() ? "" : raw.asText("");
            RunStatus status = switch (value) {
                case "success" -> RunStatus.COMPLETED;
                case "fail" -> RunStatus.FAILED;
                default -> null;
            };
            return new FinalOutcome(status, Jsons.textField(node, "failure_reason"), Jsons.textField(node, "timestamp"));
        }
    }
}
