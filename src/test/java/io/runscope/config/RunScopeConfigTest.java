package io.runscope.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class RunScopeConfigTest {

    @Test
    void runsDirsListWinsOverLegacyVariable() {
        RunScopeConfig config = RunScopeConfig.fromEnvironment(
                Map.of(
                        RunScopeConfig.ENV_RUNS_DIRS, "/a/runs" + File.pathSeparator + " /b/runs " + File.pathSeparator,
                        RunScopeConfig.ENV_LEGACY_RUNS_DIR, "/legacy"
                ),
                "/home/dev"
        );
        Assertions.assertEquals(List.of(Path.of("/a/runs"), Path.of("/b/runs")), config.runsDirs());
    }

    @Test
    void legacyVariableThenHomeDefault() {
        RunScopeConfig legacy = RunScopeConfig.fromEnvironment(Map.of(RunScopeConfig.ENV_LEGACY_RUNS_DIR, "/legacy"), "/home/dev");
        Assertions.assertEquals(List.of(Path.of("/legacy")), legacy.runsDirs());

        RunScopeConfig fallback = RunScopeConfig.fromEnvironment(Map.of("HOME", "/home/ops"), "/home/dev");
        Assertions.assertEquals(
                List.of(Path.of("/home/ops/.local/state/kilroy/attractor/runs")),
                fallback.runsDirs()
        );
    }

    @Test
    void defaultsAndCopies() {
        RunScopeConfig config = RunScopeConfig.fromRunsDirs(List.of(Path.of("/x"), Path.of("/x/../x")));
        Assertions.assertEquals(1, config.runsDirs().size());
        Assertions.assertEquals(RunScopeConfig.DEFAULT_DEBOUNCE, config.debounce());
        Assertions.assertEquals(RunScopeConfig.DEFAULT_POLL_INTERVAL, config.pollInterval());
        Assertions.assertEquals("docker", config.dockerBinary());
        Assertions.assertEquals(RunScopeConfig.DEFAULT_READER_THREADS, config.readerThreads());

        RunScopeConfig tuned = config.withDebounce(Duration.ofMillis(20)).withPollInterval(Duration.ZERO);
        Assertions.assertEquals(Duration.ofMillis(20), tuned.debounce());
        Assertions.assertEquals(RunScopeConfig.DEFAULT_POLL_INTERVAL, tuned.pollInterval());
        Assertions.assertEquals(config.runsDirs(), tuned.runsDirs());
    }

    @Test
    void requiresAtLeastOneRunsDir() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> RunScopeConfig.fromRunsDirs(List.of()));
    }
}
