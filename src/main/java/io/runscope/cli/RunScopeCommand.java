package io.runscope.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.runscope.catalog.StageDetail;
import io.runscope.config.RunScopeConfig;
import io.runscope.model.RunState;
import io.runscope.replay.CycleLoops;
import io.runscope.turns.TurnLog;
import io.runscope.util.Jsons;
import io.runscope.watch.RunWatcher;
import io.runscope.watch.Subscription;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "runscope",
        mixinStandardHelpOptions = true,
        description = "Inspect pipeline runs reconstructed from their run directories",
        subcommands = {
                RunScopeCommand.RunsCommand.class,
                RunScopeCommand.SummariesCommand.class,
                RunScopeCommand.StateCommand.class,
                RunScopeCommand.WatchCommand.class,
                RunScopeCommand.StageCommand.class,
                RunScopeCommand.TurnsCommand.class,
                RunScopeCommand.LoopsCommand.class
        }
)
public final class RunScopeCommand implements Runnable {
    private static final long STATE_TIMEOUT_SECONDS = 30L;

    @Option(names = {"--runs-dir"}, description = "Runs root directory (repeatable; overrides RUNSCOPE_RUNS_DIRS)")
    List<Path> runsDirs = new ArrayList<>();

    @Option(names = {"--docker-binary"}, description = "Docker CLI used for container liveness checks", defaultValue = "docker")
    String dockerBinary;

    @Override
    public void run() {
        System.out.println("Use subcommands: runs | summaries | state | watch | stage | turns | loops");
    }

    RunScopeConfig config() {
        RunScopeConfig config = runsDirs == null || runsDirs.isEmpty()
                ? RunScopeConfig.fromEnvironment()
                : RunScopeConfig.fromRunsDirs(runsDirs);
        return config.withDockerBinary(dockerBinary);
    }

    RunWatcher watcher() {
        return new RunWatcher(config());
    }

    static Optional<RunState> awaitState(RunWatcher watcher, String runId) throws Exception {
        try {
            return watcher.getState(runId).get(STATE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IllegalStateException("Failed to read run " + runId + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out reading run " + runId, e);
        }
    }

    static int notFound(String what) {
        System.out.println("{\"error\":\"" + what + " not found\"}");
        return 1;
    }

    @Command(name = "runs", description = "List run ids, newest first")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Override
        public Integer call() {
            try (RunWatcher watcher = parent.watcher()) {
                for (String runId : watcher.listRuns()) {
                    System.out.println(runId);
                }
            }
            return 0;
        }
    }

    @Command(name = "summaries", description = "List run summaries as JSON")
    static final class SummariesCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Override
        public Integer call() {
            try (RunWatcher watcher = parent.watcher()) {
                System.out.println(Jsons.toJson(watcher.catalog().listSummaries()));
            }
            return 0;
        }
    }

    @Command(name = "state", description = "Print the reconstructed state of one run")
    static final class StateCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            try (RunWatcher watcher = parent.watcher()) {
                Optional<RunState> state = awaitState(watcher, runId);
                if (state.isEmpty()) {
                    return notFound("run");
                }
                System.out.println(Jsons.toJson(state.get()));
                return 0;
            }
        }
    }

    @Command(name = "watch", description = "Print each new snapshot of one run as a JSON line until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            RunWatcher watcher = parent.watcher();
            if (watcher.findDirectory(runId).isEmpty()) {
                watcher.close();
                return notFound("run");
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Subscription subscription = watcher.subscribe(runId, state -> System.out.println(Jsons.toCompactJson(state)));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                subscription.cancel();
                watcher.close();
                stopped.countDown();
            }, "runscope-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "stage", description = "Print status fields and file names of one stage")
    static final class StageCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Node path, e.g. implement or par/branch-a/implement")
        String nodePath;

        @Override
        public Integer call() {
            try (RunWatcher watcher = parent.watcher()) {
                Optional<StageDetail> detail = watcher.catalog().stageDetail(runId, nodePath);
                if (detail.isEmpty()) {
                    return notFound("stage");
                }
                System.out.println(Jsons.toJson(detail.get()));
                return 0;
            }
        }
    }

    @Command(name = "turns", description = "Print the conversation turns and cost estimate of one stage")
    static final class TurnsCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Node path")
        String nodePath;

        @Override
        public Integer call() {
            try (RunWatcher watcher = parent.watcher()) {
                Optional<TurnLog> turns = watcher.catalog().turns(runId, nodePath);
                if (turns.isEmpty()) {
                    return notFound("turn log");
                }
                System.out.println(Jsons.toJson(turns.get()));
                return 0;
            }
        }
    }

    @Command(name = "loops", description = "Print the nodes caught in a deterministic failure loop")
    static final class LoopsCommand implements Callable<Integer> {
        @ParentCommand
        RunScopeCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            try (RunWatcher watcher = parent.watcher()) {
                Optional<RunState> state = awaitState(watcher, runId);
                if (state.isEmpty()) {
                    return notFound("run");
                }
                RunState run = state.get();
                ObjectNode out = Jsons.mapper().createObjectNode();
                out.put("runId", runId);
                boolean visible = run.cycleInfo() != null && CycleLoops.isVisible(run.cycleInfo());
                out.put("visible", visible);
                if (run.cycleInfo() != null) {
                    out.set("cycleInfo", Jsons.mapper().valueToTree(run.cycleInfo()));
                }
                ArrayNode nodes = out.putArray("loopedNodes");
                List<String> looped = run.cycleInfo() == null || run.stageHistory() == null
                        ? List.of()
                        : CycleLoops.loopedNodes(run.stageHistory(), run.cycleInfo());
                looped.forEach(nodes::add);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }
}
