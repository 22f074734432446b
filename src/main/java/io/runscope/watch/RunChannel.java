package io.runscope.watch;

import io.runscope.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel for one run id. Confined to the watcher loop thread.
 */
final class RunChannel {
    private static final Logger log = LoggerFactory.getLogger(RunChannel.class);

    private final String runId;
    private final List<Member> members = new ArrayList<>();

    RunChannel(String runId) {
        this.runId = runId;
    }

    void add(Member member) {
        if (member.isActive() && !members.contains(member)) {
            members.add(member);
        }
    }

    boolean remove(Member member) {
        return members.remove(member);
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    int size() {
        return members.size();
    }

    /** Cancels every member; each cancellation runs its own unsubscribe. */
    void cancelAll() {
        for (Member member : List.copyOf(members)) {
            member.cancel();
        }
    }

    void publish(RunState state) {
        for (Member member : List.copyOf(members)) {
            member.deliver(state);
        }
    }

    static final class Member implements Subscription {
        private final String runId;
        private final Consumer<RunState> listener;
        private final Consumer<Member> onCancel;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Member(String runId, Consumer<RunState> listener, Consumer<Member> onCancel) {
            this.runId = runId;
            this.listener = Objects.requireNonNull(listener, "listener");
            this.onCancel = onCancel;
        }

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false) && onCancel != null) {
                onCancel.accept(this);
            }
        }

        void deliver(RunState state) {
            if (!active.get()) {
                return;
            }
            try {
                listener.accept(state);
            } catch (RuntimeException e) {
                log.warn("Run listener failed | runId={} error={}", runId, e.toString(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "RunChannel{" + runId + ", members=" + members.size() + "}";
    }
}
