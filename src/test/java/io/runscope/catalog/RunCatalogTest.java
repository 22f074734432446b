package io.runscope.catalog;

import io.runscope.config.RunScopeConfig;
import io.runscope.format.RunFormatDispatcher;
import io.runscope.probe.FakeLivenessProbe;
import io.runscope.turns.TurnLog;
import io.runscope.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class RunCatalogTest {

    @Test
    void listsRunsAcrossRootsFirstRootWinning() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-list-");
        try {
            Fixture fixture = Fixture.create(base);

            Assertions.assertEquals(List.of("20260303-c", "20260302-b", "20260301-a"), fixture.catalog.listRuns());
            Assertions.assertEquals(Optional.of(fixture.rootA.resolve("20260301-a")), fixture.catalog.findDirectory("20260301-a"));
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void summariesCarryMetadataAndStatus() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-summaries-");
        try {
            Fixture fixture = Fixture.create(base);

            List<RunSummary> summaries = fixture.catalog.listSummaries();

            Assertions.assertEquals(List.of("20260303-c", "20260302-b", "20260301-a"),
                    summaries.stream().map(RunSummary::id).toList());
            RunSummary c = summaries.get(0);
            Assertions.assertEquals("2026-03-03T08:00:00Z", c.startedAt());
            Assertions.assertEquals("interrupted", c.status());
            Assertions.assertEquals(fixture.rootB.toString(), c.sourceDir());

            RunSummary b = summaries.get(1);
            Assertions.assertEquals("pipeline.dot", b.graphName());
            Assertions.assertEquals("widgets", b.repo());
            Assertions.assertEquals("running", b.status());

            RunSummary a = summaries.get(2);
            Assertions.assertEquals("feature-graph", a.graphName());
            Assertions.assertEquals("gadgets", a.repo());
            Assertions.assertEquals(RunCatalog.GOAL_MAX_CHARS, a.goal().length());
            Assertions.assertEquals("completed", a.status());
            Assertions.assertEquals(fixture.rootA.toString(), a.sourceDir());
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void unsafeOrMissingRunIdsResolveEmpty() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-find-");
        try {
            Fixture fixture = Fixture.create(base);

            Assertions.assertTrue(fixture.catalog.findDirectory("../20260301-a").isEmpty());
            Assertions.assertTrue(fixture.catalog.findDirectory("a/b").isEmpty());
            Assertions.assertTrue(fixture.catalog.findDirectory(" ").isEmpty());
            Assertions.assertTrue(fixture.catalog.findDirectory("20260303-c").isEmpty());

            write(fixture.rootB.resolve("20260303-c").resolve("manifest.json"), "{\"graph_name\":\"late\"}");
            Assertions.assertEquals(Optional.of(fixture.rootB.resolve("20260303-c")), fixture.catalog.findDirectory("20260303-c"));
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void stageDetailListsFilesAndStatusFields() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-stage-");
        try {
            Fixture fixture = Fixture.create(base);

            StageDetail detail = fixture.catalog.stageDetail("20260301-a", "implement").orElseThrow();

            Assertions.assertEquals("implement", detail.nodeId());
            Assertions.assertEquals(List.of("events.ndjson", "response.md", "status.json"), detail.files());
            Assertions.assertEquals("success", detail.statusFields().get("status"));
            Assertions.assertTrue(detail.statusFields().containsKey("failure_reason"));
            String json = Jsons.toCompactJson(detail);
            Assertions.assertTrue(json.startsWith("{\"node_id\":\"implement\""), json);
            Assertions.assertTrue(json.contains("\"status\":\"success\""), json);
            Assertions.assertEquals(json.indexOf("\"node_id\""), json.lastIndexOf("\"node_id\""), json);
            Assertions.assertFalse(detail.statusFields().containsKey("node_id"));

            Assertions.assertTrue(fixture.catalog.stageDetail("20260301-a", "parallel/fan/a/impl").isPresent());
            Assertions.assertTrue(fixture.catalog.stageDetail("20260301-a", "../20260302-b").isEmpty());
            Assertions.assertTrue(fixture.catalog.stageDetail("20260301-a", "/etc").isEmpty());
            Assertions.assertTrue(fixture.catalog.stageDetail("20260301-a", "missing").isEmpty());
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void stageFileRejectsTraversal() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-file-");
        try {
            Fixture fixture = Fixture.create(base);
            Path runDir = fixture.rootA.resolve("20260301-a");

            Assertions.assertEquals(Optional.of(runDir.resolve("implement").resolve("response.md")),
                    fixture.catalog.stageFile("20260301-a", "implement", "response.md"));
            Assertions.assertTrue(fixture.catalog.stageFile("20260301-a", "implement", "../../manifest.json").isEmpty());
            Assertions.assertTrue(fixture.catalog.stageFile("20260301-a", "implement", "nope.txt").isEmpty());
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void turnsAttachResponseTextAndEstimate() throws Exception {
        Path base = Files.createTempDirectory("runscope-test-catalog-turns-");
        try {
            Fixture fixture = Fixture.create(base);

            TurnLog turns = fixture.catalog.turns("20260301-a", "implement").orElseThrow();

            Assertions.assertEquals(2, turns.turns().size());
            Assertions.assertEquals("All green.", turns.responseText());
            Assertions.assertNotNull(turns.pricing());
            Assertions.assertEquals("openai/gpt-5", turns.pricing().modelId());
            Assertions.assertTrue(fixture.catalog.turns("20260301-a", "plan").isEmpty());
        } finally {
            deleteRecursively(base);
        }
    }

    private static final class Fixture {
        private final Path rootA;
        private final Path rootB;
        private final RunCatalog catalog;

        private Fixture(Path rootA, Path rootB) {
            this.rootA = rootA;
            this.rootB = rootB;
            this.catalog = new RunCatalog(
                    RunScopeConfig.fromRunsDirs(List.of(rootA, rootB)),
                    new RunFormatDispatcher(new FakeLivenessProbe())
            );
        }

        static Fixture create(Path base) throws IOException {
            Path rootA = Files.createDirectories(base.resolve("a"));
            Path rootB = Files.createDirectories(base.resolve("b"));

            Path runA = rootA.resolve("20260301-a");
            write(runA.resolve("manifest.json"), "{\"graph_name\":\"feature-graph\",\"repo_path\":\"/src/gadgets\","
                    + "\"goal\":\"" + "g".repeat(250) + "\",\"started_at\":\"2026-03-01T10:00:00Z\"}");
            write(runA.resolve("final.json"), "{\"status\":\"success\"}");
            write(runA.resolve("implement").resolve("status.json"), "{\"node_id\":\"implement\",\"status\":\"success\",\"failure_reason\":null}");
            write(runA.resolve("implement").resolve("events.ndjson"), String.join("\n",
                    "{\"kind\":\"SESSION_START\",\"session_id\":\"s\",\"data\":{\"model\":\"gpt-5\",\"profile\":\"openai\"}}",
                    "{\"kind\":\"USER_INPUT\",\"data\":{\"text\":\"go\"}}",
                    "{\"kind\":\"ASSISTANT_TEXT_END\",\"data\":{\"text\":\"done\"}}"));
            write(runA.resolve("implement").resolve("response.md"), "All green.");
            write(runA.resolve("implement").resolve("logs.tgz"), "binary");
            write(runA.resolve("plan").resolve("status.json"), "{\"status\":\"success\"}");
            Files.createDirectories(runA.resolve("parallel").resolve("fan").resolve("a").resolve("impl"));

            write(rootA.resolve("20260302-b").resolve("run.json"),
                    "{\"id\":\"20260302-b\",\"repo\":\"/src/widgets\",\"dot_file\":\"pipeline.dot\","
                            + "\"status\":\"executing\",\"started_at\":\"2026-03-02T09:00:00Z\"}");

            write(rootB.resolve("20260301-a").resolve("run.json"), "{\"id\":\"shadowed\"}");
            Path runC = rootB.resolve("20260303-c");
            write(runC.resolve("progress.ndjson"),
                    "{\"event\":\"stage_attempt_start\",\"ts\":\"2026-03-03T08:00:00Z\",\"node_id\":\"plan\"}\n");
            write(runC.resolve("live.json"), "{\"event\":\"interrupted\"}");
            return new Fixture(rootA, rootB);
        }
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
