package io.runscope.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.config.RunScopeConfig;
import io.runscope.format.ManifestReader;
import io.runscope.format.RunFormatDispatcher;
import io.runscope.format.StageArtifacts;
import io.runscope.model.RunFormat;
import io.runscope.replay.ProgressReplayer;
import io.runscope.turns.PricingEstimator;
import io.runscope.turns.TurnLog;
import io.runscope.turns.TurnLogParser;
import io.runscope.util.Jsons;
import io.runscope.util.OptionalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Directory-level view over the configured runs roots: run listing, run directory resolution and
 * direct access to individual stage artifacts.
 */
public final class RunCatalog {
    public static final int GOAL_MAX_CHARS = 200;
    private static final String LIVE_FILE = "live.json";
    private static final String EVENTS_FILE = "events.ndjson";
    private static final String RESPONSE_FILE = "response.md";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final Logger log = LoggerFactory.getLogger(RunCatalog.class);

    private final RunScopeConfig config;
    private final RunFormatDispatcher dispatcher;
    private final TurnLogParser turnLogParser;
    private final PricingEstimator pricingEstimator;
    private final ConcurrentMap<String, Path> dirForRun;

    public RunCatalog(RunScopeConfig config, RunFormatDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.turnLogParser = new TurnLogParser();
        this.pricingEstimator = new PricingEstimator();
        this.dirForRun = new ConcurrentHashMap<>();
    }

    /** Run ids across all roots, de-duplicated with the first root winning, newest first. */
    public List<String> listRuns() {
        List<String> ids = new ArrayList<>(listRunDirs().keySet());
        ids.sort(Comparator.reverseOrder());
        return ids;
    }

    public List<RunSummary> listSummaries() {
        List<RunSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, Path> entry : listRunDirs().entrySet()) {
            summaries.add(summarize(entry.getKey(), entry.getValue()));
        }
        summaries.sort((a, b) -> {
            if (a.startedAt() != null && b.startedAt() != null) {
                return b.startedAt().compareTo(a.startedAt());
            }
            return b.id().compareTo(a.id());
        });
        return summaries;
    }

    /**
     * Resolves the directory holding a run. Hits are remembered for the life of the process since
     * run directories never move; misses are not, so a run created later is still found.
     */
    public Optional<Path> findDirectory(String runId) {
        if (!isSafeSegment(runId)) {
            return Optional.empty();
        }
        Path known = dirForRun.get(runId);
        if (known != null) {
            return Optional.of(known);
        }
        for (Path root : config.runsDirs()) {
            Path runDir = root.resolve(runId);
            if (dispatcher.markerExists(runDir)) {
                Path previous = dirForRun.putIfAbsent(runId, runDir);
                return Optional.of(previous == null ? runDir : previous);
            }
        }
        return Optional.empty();
    }

    public Optional<StageDetail> stageDetail(String runId, String nodePath) {
        Optional<Path> stageDir = stageDirectory(runId, nodePath);
        if (stageDir.isEmpty() || !Files.isDirectory(stageDir.get())) {
            return Optional.empty();
        }
        Map<String, Object> status = StageArtifacts.readStatus(stageDir.get())
                .map(node -> Jsons.mapper().convertValue(node, MAP_TYPE))
                .orElse(Map.of());
        List<String> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(stageDir.get(), Files::isRegularFile)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (!name.endsWith(".tgz")) {
                    files.add(name);
                }
            }
        } catch (IOException e) {
            log.debug("Stage listing failed | runId={} node={} error={}", runId, nodePath, e.getMessage());
            return Optional.empty();
        }
        files.sort(String::compareTo);
        return Optional.of(new StageDetail(nodePath, status, files));
    }

    public Optional<Path> stageFile(String runId, String nodePath, String fileName) {
        if (!isSafeSegment(fileName)) {
            return Optional.empty();
        }
        return stageDirectory(runId, nodePath)
                .map(dir -> dir.resolve(fileName))
                .filter(Files::isRegularFile);
    }

    /** Conversation turns of one stage, with the final response text and a cost estimate. */
    public Optional<TurnLog> turns(String runId, String nodePath) {
        Optional<Path> stageDir = stageDirectory(runId, nodePath);
        if (stageDir.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> events = OptionalFiles.tryRead(stageDir.get().resolve(EVENTS_FILE));
        if (events.isEmpty()) {
            return Optional.empty();
        }
        TurnLog turns = turnLogParser.parse(events.get());
        Optional<String> response = OptionalFiles.tryRead(stageDir.get().resolve(RESPONSE_FILE))
                .filter(text -> !text.isBlank());
        if (response.isPresent()) {
            turns = turns.withResponseText(response.get());
        }
        Path runDir = findDirectory(runId).orElseThrow();
        return Optional.of(turns.withPricing(pricingEstimator.estimate(runDir, stageDir.get(), turns).orElse(null)));
    }

    Optional<Path> stageDirectory(String runId, String nodePath) {
        if (!isSafeNodePath(nodePath)) {
            return Optional.empty();
        }
        return findDirectory(runId).flatMap(runDir -> {
            try {
                Path stageDir = runDir.resolve(nodePath).normalize();
                return stageDir.startsWith(runDir.normalize()) ? Optional.of(stageDir) : Optional.empty();
            } catch (InvalidPathException e) {
                return Optional.empty();
            }
        });
    }

    private Map<String, Path> listRunDirs() {
        Map<String, Path> out = new LinkedHashMap<>();
        for (Path root : config.runsDirs()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
                for (Path dir : stream) {
                    out.putIfAbsent(dir.getFileName().toString(), root);
                }
            } catch (IOException e) {
                log.debug("Runs root listing failed | root={} error={}", root, e.getMessage());
            }
        }
        return out;
    }

    private RunSummary summarize(String id, Path root) {
        Path runDir = root.resolve(id);
        try {
            String graphName = null;
            String repo = null;
            String goal = null;
            String startedAt = null;

            Optional<JsonNode> manifest = OptionalFiles.tryReadJson(runDir.resolve(RunFormat.ATTRACTOR.markerFile()));
            if (manifest.isPresent()) {
                graphName = textOrEmpty(manifest.get(), "graph_name");
                repo = lastSegment(textOrEmpty(manifest.get(), "repo_path"));
                String rawGoal = textOrEmpty(manifest.get(), "goal");
                goal = rawGoal.isEmpty() ? null : truncate(rawGoal, GOAL_MAX_CHARS);
                startedAt = Jsons.textField(manifest.get(), "started_at");
            } else {
                Optional<JsonNode> run = OptionalFiles.tryReadJson(runDir.resolve(RunFormat.KILROY_DASH.markerFile()));
                if (run.isPresent()) {
                    graphName = textOrEmpty(run.get(), "dot_file");
                    repo = lastSegment(textOrEmpty(run.get(), "repo"));
                    startedAt = Jsons.textField(run.get(), "started_at");
                }
            }
            if (startedAt == null || startedAt.isEmpty()) {
                startedAt = firstProgressTimestamp(runDir).orElse(null);
            }
            return new RunSummary(id, graphName, repo, goal, startedAt, summaryStatus(runDir), root.toString());
        } catch (RuntimeException e) {
            log.debug("Run summary failed | runId={} error={}", id, e.toString());
            return RunSummary.unknown(id, root.toString());
        }
    }

    private static String summaryStatus(Path runDir) {
        Optional<JsonNode> outcome = OptionalFiles.tryReadJson(runDir.resolve(ManifestReader.FINAL_FILE));
        if (outcome.isPresent()) {
            String status = textOrEmpty(outcome.get(), "status");
            if ("success".equals(status)) {
                return "completed";
            }
            return "fail".equals(status) ? "failed" : "running";
        }
        Optional<JsonNode> live = OptionalFiles.tryReadJson(runDir.resolve(LIVE_FILE));
        if (live.isPresent()) {
            String event = textOrEmpty(live.get(), "event");
            if ("completed".equals(event) || "failed".equals(event) || "interrupted".equals(event)) {
                return event;
            }
        }
        return "running";
    }

    private static Optional<String> firstProgressTimestamp(Path runDir) {
        Optional<String> text = OptionalFiles.tryRead(runDir.resolve(ProgressReplayer.PROGRESS_FILE));
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (String line : text.get().split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode event = Jsons.mapper().readTree(line);
                String ts = textOrEmpty(event, "ts");
                if (ts.isEmpty()) {
                    ts = textOrEmpty(event, "timestamp");
                }
                return ts.isEmpty() ? Optional.empty() : Optional.of(ts);
            } catch (IOException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static boolean isSafeSegment(String raw) {
        return raw != null
                && !raw.isBlank()
                && !raw.contains("/")
                && !raw.contains("\\")
                && !raw.contains("..");
    }

    static boolean isSafeNodePath(String raw) {
        return raw != null
                && !raw.isBlank()
                && !raw.contains("..")
                && !raw.startsWith("/")
                && !raw.contains("\\");
    }

    private static String textOrEmpty(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }

    private static String lastSegment(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        int idx = path.lastIndexOf('/');
        String last = idx < 0 ? path : path.substring(idx + 1);
        return last.isEmpty() ? null : last;
    }

    private static String truncate(String raw, int max) {
        return raw.length() <= max ? raw : raw.substring(0, max);
    }
}
