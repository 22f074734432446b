package io.runscope.probe;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Liveness probe whose answers are set by the test. Records every container and pid asked about. */
public final class FakeLivenessProbe implements LivenessProbe {
    private final Set<String> aliveContainers = ConcurrentHashMap.newKeySet();
    private final Set<Long> alivePids = ConcurrentHashMap.newKeySet();
    private final List<String> containerChecks = new ArrayList<>();
    private final List<Long> pidChecks = new ArrayList<>();

    public FakeLivenessProbe containerAlive(String containerId, boolean alive) {
        if (alive) {
            aliveContainers.add(containerId);
        } else {
            aliveContainers.remove(containerId);
        }
        return this;
    }

    public FakeLivenessProbe processAlive(long pid, boolean alive) {
        if (alive) {
            alivePids.add(pid);
        } else {
            alivePids.remove(pid);
        }
        return this;
    }

    @Override
    public boolean isContainerAlive(String containerId) {
        synchronized (containerChecks) {
            containerChecks.add(containerId);
        }
        return aliveContainers.contains(containerId);
    }

    @Override
    public boolean isProcessAlive(long pid) {
        synchronized (pidChecks) {
            pidChecks.add(pid);
        }
        return alivePids.contains(pid);
    }

    public List<String> containerChecks() {
        synchronized (containerChecks) {
            return List.copyOf(containerChecks);
        }
    }

    public List<Long> pidChecks() {
        synchronized (pidChecks) {
            return List.copyOf(pidChecks);
        }
    }
}
