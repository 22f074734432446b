package io.runscope.watch;

import io.runscope.catalog.RunCatalog;
import io.runscope.config.RunScopeConfig;
import io.runscope.format.RunFormatDispatcher;
import io.runscope.model.RunState;
import io.runscope.model.RunStatus;
import io.runscope.probe.CommandLivenessProbe;
import io.runscope.probe.LivenessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Caches reconstructed run snapshots and keeps them fresh while anyone is interested.
 *
 * <p>All registry state lives on a single loop thread. File IO and liveness probes run on the
 * reader pool and hop back to the loop to commit, so a slow probe for one run never holds up
 * another. Listeners are invoked on the loop thread and must not block.
 */
public final class RunWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunWatcher.class);
    private static final long SHUTDOWN_WAIT_MS = 5_000L;

    private enum Trigger {
        WATCH,
        POLL
    }

    private final RunScopeConfig config;
    private final RunFormatDispatcher dispatcher;
    private final RunCatalog catalog;
    private final RunRegistry registry;
    private final ScheduledThreadPoolExecutor loop;
    private final ExecutorService readers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RunWatcher(RunScopeConfig config) {
        this(config, new CommandLivenessProbe(config.dockerBinary(), config.containerProbeTimeout()));
    }

    public RunWatcher(RunScopeConfig config, LivenessProbe probe) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = new RunFormatDispatcher(Objects.requireNonNull(probe, "probe"));
        this.catalog = new RunCatalog(config, dispatcher);
        this.registry = new RunRegistry();
        this.loop = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "runscope-loop");
            t.setDaemon(true);
            return t;
        });
        this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.loop.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        AtomicInteger readerIds = new AtomicInteger();
        this.readers = Executors.newFixedThreadPool(config.readerThreads(), r -> {
            Thread t = new Thread(r, "runscope-reader-" + readerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RunCatalog catalog() {
        return catalog;
    }

    public List<String> listRuns() {
        return catalog.listRuns();
    }

    public Optional<Path> findDirectory(String runId) {
        return catalog.findDirectory(runId);
    }

    /**
     * Cached snapshot when one exists; otherwise resolves and reads the run, caches the result and
     * arms monitoring. Completes with empty when the run cannot be found.
     */
    public CompletableFuture<Optional<RunState>> getState(String runId) {
        CompletableFuture<Optional<RunState>> result = new CompletableFuture<>();
        boolean accepted = submitToLoop(() -> {
            Optional<RunState> cached = registry.state(runId);
            if (cached.isPresent()) {
                result.complete(cached);
                return;
            }
            load(runId, false).whenComplete((state, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(state);
                }
            });
        });
        if (!accepted) {
            result.completeExceptionally(new IllegalStateException("Run watcher is shut down"));
        }
        return result;
    }

    /**
     * Registers a listener for snapshots of one run and arms monitoring. The current snapshot, if
     * any, is delivered right away. Cancelling the last subscription of a run stops monitoring it.
     * When no directory exists for the run id, the subscription is cancelled and never delivers;
     * callers see that through {@link Subscription#isActive()}.
     */
    public Subscription subscribe(String runId, Consumer<RunState> listener) {
        RunChannel.Member member = new RunChannel.Member(runId, listener, this::unsubscribe);
        boolean accepted = submitToLoop(() -> {
            if (!member.isActive()) {
                return;
            }
            registry.channel(runId).add(member);
            Optional<RunState> cached = registry.state(runId);
            if (cached.isPresent()) {
                member.deliver(cached.get());
                return;
            }
            load(runId, true);
        });
        if (!accepted) {
            member.cancel();
        }
        return member;
    }

    /** Drops the cached snapshot and stops watching and polling the run. Subscribers are kept. */
    public CompletableFuture<Void> invalidate(String runId) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean accepted = submitToLoop(() -> {
            registry.teardown(runId);
            log.debug("Run invalidated | runId={}", runId);
            done.complete(null);
        });
        if (!accepted) {
            done.complete(null);
        }
        return done;
    }

    public CompletableFuture<Void> stop(String runId) {
        return invalidate(runId);
    }

    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            loop.submit(registry::teardownAll).get(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("Run watcher teardown incomplete | error={}", e.toString());
        }
        loop.shutdownNow();
        readers.shutdownNow();
        try {
            loop.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            readers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Run watcher stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    CompletableFuture<Boolean> isMonitoring(String runId) {
        CompletableFuture<Boolean> out = new CompletableFuture<>();
        if (!submitToLoop(() -> out.complete(registry.isWatching(runId)))) {
            out.complete(false);
        }
        return out;
    }

    CompletableFuture<Boolean> isPolling(String runId) {
        CompletableFuture<Boolean> out = new CompletableFuture<>();
        if (!submitToLoop(() -> out.complete(registry.isPolling(runId)))) {
            out.complete(false);
        }
        return out;
    }

    // Loop thread only. A subscriber load only arms monitoring while the run still has subscribers.
    private CompletableFuture<Optional<RunState>> load(String runId, boolean forSubscribers) {
        CompletableFuture<Optional<RunState>> result = new CompletableFuture<>();
        CompletableFuture
                .supplyAsync(() -> readFresh(runId), readers)
                .whenComplete((loaded, error) -> {
                    boolean accepted = submitToLoop(() -> {
                        if (error != null) {
                            log.warn("Run read failed | runId={} error={}", runId, error.toString());
                            result.completeExceptionally(error);
                            return;
                        }
                        result.complete(commitLoad(runId, loaded, forSubscribers));
                    });
                    if (!accepted) {
                        result.complete(Optional.empty());
                    }
                });
        return result;
    }

    private Loaded readFresh(String runId) {
        Optional<Path> runDir = catalog.findDirectory(runId);
        if (runDir.isEmpty()) {
            return Loaded.NOT_FOUND;
        }
        return new Loaded(runDir.get(), dispatcher.read(runId, runDir.get()).orElse(null));
    }

    private Optional<RunState> commitLoad(String runId, Loaded loaded, boolean forSubscribers) {
        Optional<RunState> cached = registry.state(runId);
        if (cached.isPresent()) {
            return cached;
        }
        if (loaded.runDir() == null) {
            log.debug("Run not found | runId={}", runId);
            if (forSubscribers) {
                registry.existingChannel(runId).ifPresent(RunChannel::cancelAll);
            }
            return Optional.empty();
        }
        if (forSubscribers && !hasSubscribers(runId)) {
            log.debug("Subscribers left before first read finished | runId={}", runId);
            return Optional.ofNullable(loaded.state());
        }
        armMonitoring(runId, loaded.runDir());
        if (loaded.state() == null) {
            return Optional.empty();
        }
        registry.putState(runId, loaded.state());
        updatePolling(runId, loaded.state());
        registry.existingChannel(runId).ifPresent(channel -> channel.publish(loaded.state()));
        return Optional.of(loaded.state());
    }

    private void armMonitoring(String runId, Path runDir) {
        if (registry.isWatching(runId)) {
            return;
        }
        DirectoryWatch watch = null;
        try {
            watch = DirectoryWatch.start(runId, runDir, () -> onFileChange(runId));
        } catch (IOException e) {
            log.warn("Watch failed, relying on polling | runId={} dir={} error={}", runId, runDir, e.getMessage());
        }
        registry.putWatch(runId, new RunRegistry.WatchHandle(runDir, watch));
        log.info("Watch armed | runId={} dir={}", runId, runDir);
    }

    // Watch thread.
    private void onFileChange(String runId) {
        submitToLoop(() -> {
            RunRegistry.WatchHandle handle = registry.watch(runId);
            if (handle == null) {
                return;
            }
            handle.debounce(loop.schedule(
                    () -> reread(runId, Trigger.WATCH),
                    config.debounce().toMillis(),
                    TimeUnit.MILLISECONDS
            ));
        });
    }

    private void updatePolling(String runId, RunState state) {
        if (state.status() == RunStatus.EXECUTING) {
            if (!registry.isPolling(runId)) {
                long intervalMs = config.pollInterval().toMillis();
                registry.putPoll(runId, loop.scheduleWithFixedDelay(
                        () -> pollTick(runId),
                        intervalMs,
                        intervalMs,
                        TimeUnit.MILLISECONDS
                ));
                log.debug("Poll armed | runId={} intervalMs={}", runId, intervalMs);
            }
        } else if (state.status() != null && state.status().isTerminal()) {
            registry.stopPoll(runId);
        }
    }

    private void pollTick(String runId) {
        try {
            Optional<RunState> cached = registry.state(runId);
            if (cached.isEmpty() || cached.get().status() != RunStatus.EXECUTING) {
                registry.stopPoll(runId);
                return;
            }
            reread(runId, Trigger.POLL);
        } catch (RuntimeException e) {
            log.warn("Poll tick failed | runId={} error={}", runId, e.toString(), e);
        }
    }

    private void reread(String runId, Trigger trigger) {
        RunRegistry.WatchHandle handle = registry.watch(runId);
        if (handle == null) {
            return;
        }
        Path runDir = handle.runDir();
        CompletableFuture
                .supplyAsync(() -> dispatcher.read(runId, runDir), readers)
                .whenComplete((state, error) -> submitToLoop(() -> commitReread(runId, handle, trigger, state, error)));
    }

    private void commitReread(
            String runId,
            RunRegistry.WatchHandle handle,
            Trigger trigger,
            Optional<RunState> fresh,
            Throwable error
    ) {
        if (registry.watch(runId) != handle) {
            return;
        }
        if (error != null) {
            log.warn("Run re-read failed | runId={} trigger={} error={}", runId, trigger, error.toString());
            return;
        }
        if (fresh == null || fresh.isEmpty()) {
            return;
        }
        RunState next = fresh.get();
        RunState previous = registry.state(runId).orElse(null);
        boolean changed = previous == null
                || (trigger == Trigger.WATCH ? !next.sameContent(previous) : next.livenessChangedFrom(previous));
        if (changed) {
            registry.putState(runId, next);
            log.debug(
                    "Run state changed | runId={} trigger={} status={} computed={}",
                    runId,
                    trigger,
                    next.status(),
                    next.computedStatus()
            );
            registry.existingChannel(runId).ifPresent(channel -> channel.publish(next));
        }
        registry.state(runId).ifPresent(current -> updatePolling(runId, current));
    }

    private boolean hasSubscribers(String runId) {
        return registry.existingChannel(runId).map(channel -> !channel.isEmpty()).orElse(false);
    }

    private void unsubscribe(RunChannel.Member member) {
        String runId = member.runId();
        submitToLoop(() -> registry.existingChannel(runId).ifPresent(channel -> {
            channel.remove(member);
            if (channel.isEmpty()) {
                registry.removeChannel(runId);
                registry.teardown(runId);
                log.debug("Last subscriber left | runId={}", runId);
            }
        }));
    }

    private boolean submitToLoop(Runnable task) {
        if (closed.get()) {
            return false;
        }
        try {
            loop.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private record Loaded(Path runDir, RunState state) {
        static final Loaded NOT_FOUND = new Loaded(null, null);
    }
}
