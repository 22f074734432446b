package io.runscope.watch;

/** Handle for one listener on one run; cancelling it more than once has no effect. */
public interface Subscription {
    String runId();

    boolean isActive();

    void cancel();
}
