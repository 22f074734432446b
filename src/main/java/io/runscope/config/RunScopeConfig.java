package io.runscope.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public final class RunScopeConfig {
    public static final String ENV_RUNS_DIRS = "RUNSCOPE_RUNS_DIRS";
    public static final String ENV_LEGACY_RUNS_DIR = "KILROY_RUNS_DIR";
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(200);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONTAINER_PROBE_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_DOCKER_BINARY = "docker";
    public static final int DEFAULT_READER_THREADS = 4;

    private final List<Path> runsDirs;
    private final Duration debounce;
    private final Duration pollInterval;
    private final Duration containerProbeTimeout;
    private final String dockerBinary;
    private final int readerThreads;

    public RunScopeConfig(
            List<Path> runsDirs,
            Duration debounce,
            Duration pollInterval,
            Duration containerProbeTimeout,
            String dockerBinary,
            int readerThreads
    ) {
        if (runsDirs == null || runsDirs.isEmpty()) {
            throw new IllegalArgumentException("at least one runs directory is required");
        }
        this.runsDirs = normalize(runsDirs);
        this.debounce = positiveOr(debounce, DEFAULT_DEBOUNCE);
        this.pollInterval = positiveOr(pollInterval, DEFAULT_POLL_INTERVAL);
        this.containerProbeTimeout = positiveOr(containerProbeTimeout, DEFAULT_CONTAINER_PROBE_TIMEOUT);
        this.dockerBinary = dockerBinary == null || dockerBinary.isBlank() ? DEFAULT_DOCKER_BINARY : dockerBinary.trim();
        this.readerThreads = Math.max(1, readerThreads);
    }

    public static RunScopeConfig fromRunsDirs(Collection<Path> runsDirs) {
        return new RunScopeConfig(
                runsDirs == null ? List.of() : new ArrayList<>(runsDirs),
                DEFAULT_DEBOUNCE,
                DEFAULT_POLL_INTERVAL,
                DEFAULT_CONTAINER_PROBE_TIMEOUT,
                DEFAULT_DOCKER_BINARY,
                DEFAULT_READER_THREADS
        );
    }

    public static RunScopeConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), System.getProperty("user.home"));
    }

    static RunScopeConfig fromEnvironment(Map<String, String> env, String userHome) {
        List<Path> dirs = parseDirList(env.get(ENV_RUNS_DIRS));
        if (dirs.isEmpty()) {
            dirs = parseDirList(env.get(ENV_LEGACY_RUNS_DIR));
        }
        if (dirs.isEmpty()) {
            dirs = List.of(defaultRunsDir(env.getOrDefault("HOME", userHome)));
        }
        return fromRunsDirs(dirs);
    }

    static Path defaultRunsDir(String home) {
        Path base = home == null || home.isBlank() ? Paths.get("/root") : Paths.get(home);
        return base.resolve(".local").resolve("state").resolve("kilroy").resolve("attractor").resolve("runs");
    }

    static List<Path> parseDirList(String raw) {
        List<Path> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.split(File.pathSeparator)) {
            if (token != null && !token.isBlank()) {
                out.add(Paths.get(token.trim()));
            }
        }
        return out;
    }

    public RunScopeConfig withDebounce(Duration value) {
        return new RunScopeConfig(runsDirs, value, pollInterval, containerProbeTimeout, dockerBinary, readerThreads);
    }

    public RunScopeConfig withPollInterval(Duration value) {
        return new RunScopeConfig(runsDirs, debounce, value, containerProbeTimeout, dockerBinary, readerThreads);
    }

    public RunScopeConfig withDockerBinary(String value) {
        return new RunScopeConfig(runsDirs, debounce, pollInterval, containerProbeTimeout, value, readerThreads);
    }

    public List<Path> runsDirs() {
        return runsDirs;
    }

    public Duration debounce() {
        return debounce;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration containerProbeTimeout() {
        return containerProbeTimeout;
    }

    public String dockerBinary() {
        return dockerBinary;
    }

    public int readerThreads() {
        return readerThreads;
    }

    private static List<Path> normalize(List<Path> dirs) {
        LinkedHashSet<Path> out = new LinkedHashSet<>();
        for (Path dir : dirs) {
            if (dir != null) {
                out.add(dir.toAbsolutePath().normalize());
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("at least one runs directory is required");
        }
        return List.copyOf(out);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
