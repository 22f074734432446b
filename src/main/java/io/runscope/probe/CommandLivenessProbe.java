package io.runscope.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class CommandLivenessProbe implements LivenessProbe {
    private static final Logger log = LoggerFactory.getLogger(CommandLivenessProbe.class);

    private final String dockerBinary;
    private final Duration timeout;

    public CommandLivenessProbe(String dockerBinary, Duration timeout) {
        if (dockerBinary == null || dockerBinary.isBlank()) {
            throw new IllegalArgumentException("docker binary cannot be empty");
        }
        this.dockerBinary = dockerBinary;
        this.timeout = timeout == null || timeout.isNegative() || timeout.isZero()
                ? Duration.ofSeconds(5)
                : timeout;
    }

    @Override
    public boolean isContainerAlive(String containerId) {
        if (containerId == null || containerId.isBlank()) {
            return false;
        }
        List<String> command = List.of(dockerBinary, "inspect", "--format", "{{.State.Status}}", containerId.trim());
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.debug("Container probe spawn failed | containerId={} error={}", containerId, e.getMessage());
            return false;
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.debug("Container probe timed out | containerId={} timeout={}", containerId, timeout);
                return false;
            }
            if (process.exitValue() != 0) {
                return false;
            }
            String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            return "running".equals(out.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return false;
        } catch (IOException | RuntimeException e) {
            process.destroyForcibly();
            log.debug("Container probe failed | containerId={} error={}", containerId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isProcessAlive(long pid) {
        if (pid <= 0L) {
            return false;
        }
        try {
            return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        } catch (RuntimeException e) {
            log.debug("Process probe failed | pid={} error={}", pid, e.getMessage());
            return false;
        }
    }
}
