package io.runscope.format;

import io.runscope.model.RunFormat;
import io.runscope.model.RunState;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Adapter from one on-disk run layout to a normalized {@link RunState}.
 */
public interface RunFormatReader {
    RunFormat format();

    /** Whether this layout's marker file is present in {@code runDir}. */
    default boolean applies(Path runDir) {
        return runDir != null && Files.isRegularFile(runDir.resolve(format().markerFile()));
    }

    /**
     * Reads the snapshot. An unreadable marker file means the layout does not apply and yields
     * {@link Optional#empty()}; missing secondary files only thin out the snapshot.
     */
    Optional<RunState> read(String runId, Path runDir);
}
