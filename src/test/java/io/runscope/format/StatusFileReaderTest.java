package io.runscope.format;

import io.runscope.model.ComputedStatus;
import io.runscope.model.RunFormat;
import io.runscope.model.RunState;
import io.runscope.model.RunStatus;
import io.runscope.probe.FakeLivenessProbe;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class StatusFileReaderTest {

    @Test
    void executingRunWithDeadContainerIsStalled() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-stalled-");
        try {
            writeRunJson(runDir, "executing", "c0ffee");
            FakeLivenessProbe probe = new FakeLivenessProbe().containerAlive("c0ffee", false);

            RunState state = new StatusFileReader(probe).read("run-1", runDir).orElseThrow();

            Assertions.assertEquals(RunStatus.EXECUTING, state.status());
            Assertions.assertFalse(state.containerAlive());
            Assertions.assertEquals(ComputedStatus.STALLED, state.computedStatus());
            Assertions.assertEquals(RunFormat.KILROY_DASH, state.format());
            Assertions.assertEquals(List.of("c0ffee"), probe.containerChecks());
            Assertions.assertNull(state.stageHistory());
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void executingRunWithLiveContainerIsExecuting() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-alive-");
        try {
            writeRunJson(runDir, "executing", "c0ffee");
            FakeLivenessProbe probe = new FakeLivenessProbe().containerAlive("c0ffee", true);

            RunState state = new StatusFileReader(probe).read("run-1", runDir).orElseThrow();

            Assertions.assertTrue(state.containerAlive());
            Assertions.assertEquals(ComputedStatus.EXECUTING, state.computedStatus());
            Assertions.assertEquals("implement", state.run().currentNode());
            Assertions.assertEquals(Map.of("goal", "ship it"), state.run().params());
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void finishedRunIsNeverProbed() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-finished-");
        try {
            writeRunJson(runDir, "completed", "c0ffee");
            FakeLivenessProbe probe = new FakeLivenessProbe().containerAlive("c0ffee", true);

            RunState state = new StatusFileReader(probe).read("run-1", runDir).orElseThrow();

            Assertions.assertEquals(ComputedStatus.COMPLETED, state.computedStatus());
            Assertions.assertFalse(state.containerAlive());
            Assertions.assertTrue(probe.containerChecks().isEmpty());
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void blankContainerIdIsNotProbed() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-blank-");
        try {
            writeRunJson(runDir, "executing", " ");
            FakeLivenessProbe probe = new FakeLivenessProbe();

            RunState state = new StatusFileReader(probe).read("run-1", runDir).orElseThrow();

            Assertions.assertEquals(ComputedStatus.STALLED, state.computedStatus());
            Assertions.assertTrue(probe.containerChecks().isEmpty());
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void malformedOrMissingFileReadsEmpty() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-malformed-");
        try {
            StatusFileReader reader = new StatusFileReader(new FakeLivenessProbe());
            Assertions.assertEquals(Optional.empty(), reader.read("run-1", runDir));

            Files.writeString(runDir.resolve("run.json"), "{\"id\": \"run-1\", \"status\": ", StandardCharsets.UTF_8);
            Assertions.assertEquals(Optional.empty(), reader.read("run-1", runDir));
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void unknownStatusValueDerivesUnknown() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-unknown-");
        try {
            writeRunJson(runDir, "paused-by-operator", "");
            RunState state = new StatusFileReader(new FakeLivenessProbe()).read("run-1", runDir).orElseThrow();

            Assertions.assertNull(state.status());
            Assertions.assertEquals(ComputedStatus.UNKNOWN, state.computedStatus());
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void oddlyShapedSecondaryFieldsDoNotHideTheRun() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-shapes-");
        try {
            String json = "{\"id\": \"run-1\", \"status\": \"completed\", \"exit_code\": \"zero\","
                    + " \"has_checkpoint\": \"yes\","
                    + " \"artifacts\": [{\"path\": \"out.txt\"}, \"report.md\"],"
                    + " \"params\": {\"retries\": {\"max\": 3}, \"goal\": \"ship it\", \"budget\": 5},"
                    + " \"completed_nodes\": \"plan\"}";
            Files.writeString(runDir.resolve("run.json"), json, StandardCharsets.UTF_8);

            RunState state = new StatusFileReader(new FakeLivenessProbe()).read("run-1", runDir).orElseThrow();

            Assertions.assertEquals(RunStatus.COMPLETED, state.status());
            Assertions.assertEquals(ComputedStatus.COMPLETED, state.computedStatus());
            Assertions.assertNull(state.run().exitCode());
            Assertions.assertNull(state.run().hasCheckpoint());
            Assertions.assertNull(state.run().completedNodes());
            Assertions.assertEquals(List.of("report.md"), state.run().artifacts());
            Assertions.assertEquals("{\"max\":3}", state.run().params().get("retries"));
            Assertions.assertEquals("ship it", state.run().params().get("goal"));
            Assertions.assertEquals("5", state.run().params().get("budget"));
        } finally {
            deleteRecursively(runDir);
        }
    }

    @Test
    void nonObjectRunFileReadsEmpty() throws Exception {
        Path runDir = Files.createTempDirectory("runscope-test-status-array-");
        try {
            Files.writeString(runDir.resolve("run.json"), "[1, 2]", StandardCharsets.UTF_8);

            Assertions.assertEquals(Optional.empty(),
                    new StatusFileReader(new FakeLivenessProbe()).read("run-1", runDir));
        } finally {
            deleteRecursively(runDir);
        }
    }

    static void writeRunJson(Path runDir, String status, String containerId) throws IOException {
        String json = "{\n"
                + "  \"id\": \"run-1\",\n"
                + "  \"repo\": \"widgets\",\n"
                + "  \"dot_file\": \"pipeline.dot\",\n"
                + "  \"status\": \"" + status + "\",\n"
                + "  \"current_node\": \"implement\",\n"
                + "  \"container_id\": \"" + containerId + "\",\n"
                + "  \"started_at\": \"2026-03-01T10:00:00Z\",\n"
                + "  \"last_heartbeat\": \"2026-03-01T10:05:00Z\",\n"
                + "  \"params\": {\"goal\": \"ship it\"},\n"
                + "  \"some_future_field\": 42\n"
                + "}\n";
        Files.writeString(runDir.resolve("run.json"), json, StandardCharsets.UTF_8);
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
