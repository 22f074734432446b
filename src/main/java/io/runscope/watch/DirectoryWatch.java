package io.runscope.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recursive watch over one run directory. Every relevant create or modify event invokes the
 * change callback on the watch thread; coalescing is left to the caller.
 *
 * <p>{@code events.ndjson} and compressed archives are ignored: they are appended continuously
 * and carry nothing that changes run state.
 */
final class DirectoryWatch implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWatch.class);

    private final Path root;
    private final WatchService watchService;
    private final Map<WatchKey, Path> keys;
    private final Runnable onChange;
    private final Thread thread;

    private DirectoryWatch(Path root, WatchService watchService, Runnable onChange, String name) {
        this.root = root;
        this.watchService = watchService;
        this.keys = new ConcurrentHashMap<>();
        this.onChange = onChange;
        this.thread = new Thread(this::pump, name);
        this.thread.setDaemon(true);
    }

    static DirectoryWatch start(String runId, Path root, Runnable onChange) throws IOException {
        WatchService service = FileSystems.getDefault().newWatchService();
        DirectoryWatch watch = new DirectoryWatch(root, service, onChange, "runscope-watch-" + runId);
        try {
            watch.registerTree(root);
        } catch (IOException e) {
            service.close();
            throw e;
        }
        watch.thread.start();
        return watch;
    }

    static boolean isIgnored(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        String name = file.getFileName().toString();
        return "events.ndjson".equals(name) || name.endsWith(".tgz") || name.endsWith(".gz");
    }

    Path root() {
        return root;
    }

    @Override
    public void close() {
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("Watch service close failed | root={} error={}", root, e.getMessage());
        }
        thread.interrupt();
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                register(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void register(Path dir) throws IOException {
        WatchKey key = dir.register(
                watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY
        );
        keys.put(key, dir);
    }

    private void pump() {
        while (true) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    relevant = true;
                    continue;
                }
                if (dir == null || !(event.context() instanceof Path)) {
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                    try {
                        registerTree(child);
                    } catch (IOException | ClosedWatchServiceException e) {
                        log.debug("Watch registration failed | dir={} error={}", child, e.toString());
                    }
                }
                if (!isIgnored(child)) {
                    relevant = true;
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
            if (relevant) {
                try {
                    onChange.run();
                } catch (RuntimeException e) {
                    log.warn("Watch callback failed | root={} error={}", root, e.toString(), e);
                }
            }
        }
    }
}
