package io.runscope.replay;

import io.runscope.util.OptionalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Follows {@code loop_restart} pointers from a run's root log directory to build
 * {@code [root, restart-1, restart-2, ...]}.
 */
public final class RestartChainWalker {
    public static final int MAX_HOPS = 50;
    private static final Logger log = LoggerFactory.getLogger(RestartChainWalker.class);

    public List<Path> walk(Path rootDir) {
        List<Path> dirs = new ArrayList<>();
        dirs.add(rootDir);
        Path current = rootDir;
        for (int hop = 0; hop < MAX_HOPS; hop++) {
            Optional<String> text = OptionalFiles.tryRead(current.resolve(ProgressReplayer.PROGRESS_FILE));
            if (text.isEmpty()) {
                break;
            }
            Optional<Path> next = lastRestartPointer(text.get());
            if (next.isEmpty() || sameDir(next.get(), current)) {
                break;
            }
            if (containsDir(dirs, next.get())) {
                log.debug("Restart chain revisits a directory; stopping | root={} dir={}", rootDir, next.get());
                break;
            }
            dirs.add(next.get());
            current = next.get();
        }
        return dirs;
    }

    static Optional<Path> lastRestartPointer(String text) {
        String pointer = null;
        for (String line : text.split("\n")) {
            Optional<ProgressEvent> event = ProgressEvent.parse(line);
            if (event.isPresent()
                    && event.get().kind() == ProgressEventKind.LOOP_RESTART
                    && event.get().newLogsRoot() != null) {
                pointer = event.get().newLogsRoot();
            }
        }
        if (pointer == null || pointer.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(pointer));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static boolean containsDir(List<Path> dirs, Path candidate) {
        for (Path dir : dirs) {
            if (sameDir(dir, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameDir(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }
}
