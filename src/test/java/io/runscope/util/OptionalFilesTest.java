package io.runscope.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class OptionalFilesTest {

    @Test
    void missingAndMalformedFilesAreEmpty() throws Exception {
        Path dir = Files.createTempDirectory("runscope-test-optional-files-");
        try {
            Assertions.assertTrue(OptionalFiles.tryRead(dir.resolve("absent.json")).isEmpty());
            Assertions.assertTrue(OptionalFiles.tryRead(dir).isEmpty());

            Files.writeString(dir.resolve("broken.json"), "{\"a\":", StandardCharsets.UTF_8);
            Assertions.assertTrue(OptionalFiles.tryReadJson(dir.resolve("broken.json")).isEmpty());

            Files.writeString(dir.resolve("array.json"), "[1]", StandardCharsets.UTF_8);
            Assertions.assertTrue(OptionalFiles.tryReadJson(dir.resolve("array.json")).isEmpty());

            Files.writeString(dir.resolve("ok.json"), "{\"a\":1}", StandardCharsets.UTF_8);
            Assertions.assertEquals(1, OptionalFiles.tryReadJson(dir.resolve("ok.json")).orElseThrow().path("a").asInt());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void tailReturnsOnlyTheLastBytes() throws Exception {
        Path dir = Files.createTempDirectory("runscope-test-optional-tail-");
        try {
            Path file = dir.resolve("progress.ndjson");
            Files.writeString(file, "0123456789", StandardCharsets.UTF_8);

            Assertions.assertEquals("6789", OptionalFiles.tryReadTail(file, 4).orElseThrow());
            Assertions.assertEquals("0123456789", OptionalFiles.tryReadTail(file, 4096).orElseThrow());
            Assertions.assertTrue(OptionalFiles.tryReadTail(dir.resolve("absent"), 10).isEmpty());
        } finally {
            deleteRecursively(dir);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
