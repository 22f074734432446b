package io.runscope.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Best-effort reads for files a pipeline may not have written yet.
 *
 * <p>A missing, unreadable or malformed file is reported as {@link Optional#empty()}; callers
 * treat absence as ordinary control flow.
 */
public final class OptionalFiles {
    private static final Logger log = LoggerFactory.getLogger(OptionalFiles.class);

    private OptionalFiles() {
    }

    public static Optional<String> tryRead(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("Optional read failed | path={} error={}", path, e.toString());
            return Optional.empty();
        }
    }

    /** Reads and parses a JSON object; any other JSON shape counts as malformed. */
    public static Optional<JsonNode> tryReadJson(Path path) {
        return tryRead(path).flatMap(raw -> parseObject(raw, path));
    }

    /** Reads at most {@code maxBytes} from the end of the file. */
    public static Optional<String> tryReadTail(Path path, int maxBytes) {
        if (path == null || maxBytes <= 0) {
            return Optional.empty();
        }
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long size = file.length();
            int tailSize = (int) Math.min(size, maxBytes);
            byte[] buf = new byte[tailSize];
            file.seek(size - tailSize);
            file.readFully(buf);
            return Optional.of(new String(buf, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            log.debug("Optional tail read failed | path={} error={}", path, e.toString());
            return Optional.empty();
        }
    }

    private static Optional<JsonNode> parseObject(String raw, Path path) {
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (IOException e) {
            log.debug("Optional JSON parse failed | path={} error={}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
