package io.runscope.probe;

/**
 * Answers whether the process or container behind a run is still alive.
 *
 * <p>Implementations never throw: any inspection error counts as "not alive".
 */
public interface LivenessProbe {
    boolean isContainerAlive(String containerId);

    boolean isProcessAlive(long pid);
}
