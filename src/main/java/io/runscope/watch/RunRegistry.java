package io.runscope.watch;

import io.runscope.model.RunState;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-run mutable state of the watcher: cached snapshot, watch handle and poll handle, plus the
 * subscriber channels. Only the watcher loop thread touches it, so no locking is needed as long
 * as every check-then-mutate stays inside one loop task.
 */
final class RunRegistry {
    private final Map<String, RunState> states = new HashMap<>();
    private final Map<String, WatchHandle> watches = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> polls = new HashMap<>();
    private final Map<String, RunChannel> channels = new HashMap<>();

    Optional<RunState> state(String runId) {
        return Optional.ofNullable(states.get(runId));
    }

    void putState(String runId, RunState state) {
        states.put(runId, state);
    }

    WatchHandle watch(String runId) {
        return watches.get(runId);
    }

    boolean isWatching(String runId) {
        return watches.containsKey(runId);
    }

    void putWatch(String runId, WatchHandle handle) {
        WatchHandle previous = watches.put(runId, handle);
        if (previous != null && previous != handle) {
            previous.close();
        }
    }

    boolean isPolling(String runId) {
        return polls.containsKey(runId);
    }

    void putPoll(String runId, ScheduledFuture<?> poll) {
        ScheduledFuture<?> previous = polls.put(runId, poll);
        if (previous != null && previous != poll) {
            previous.cancel(false);
        }
    }

    void stopPoll(String runId) {
        ScheduledFuture<?> poll = polls.remove(runId);
        if (poll != null) {
            poll.cancel(false);
        }
    }

    RunChannel channel(String runId) {
        return channels.computeIfAbsent(runId, RunChannel::new);
    }

    Optional<RunChannel> existingChannel(String runId) {
        return Optional.ofNullable(channels.get(runId));
    }

    void removeChannel(String runId) {
        channels.remove(runId);
    }

    /** Drops the cached snapshot and stops the watch and poll of one run. Channels are kept. */
    void teardown(String runId) {
        states.remove(runId);
        stopPoll(runId);
        WatchHandle handle = watches.remove(runId);
        if (handle != null) {
            handle.close();
        }
    }

    void teardownAll() {
        for (String runId : Set.copyOf(monitoredRunIds())) {
            teardown(runId);
        }
        channels.clear();
    }

    Set<String> monitoredRunIds() {
        Set<String> out = new LinkedHashSet<>(states.keySet());
        out.addAll(watches.keySet());
        out.addAll(polls.keySet());
        return out;
    }

    /** Watch plus the pending debounce timer for one run directory. */
    static final class WatchHandle {
        private final Path runDir;
        private final DirectoryWatch watch;
        private ScheduledFuture<?> pendingDebounce;

        WatchHandle(Path runDir, DirectoryWatch watch) {
            this.runDir = runDir;
            this.watch = watch;
        }

        Path runDir() {
            return runDir;
        }

        boolean hasFileWatch() {
            return watch != null;
        }

        void debounce(ScheduledFuture<?> next) {
            if (pendingDebounce != null) {
                pendingDebounce.cancel(false);
            }
            pendingDebounce = next;
        }

        void close() {
            if (pendingDebounce != null) {
                pendingDebounce.cancel(false);
                pendingDebounce = null;
            }
            if (watch != null) {
                watch.close();
            }
        }
    }
}
