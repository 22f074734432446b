package io.runscope.format;

import io.runscope.model.RunState;
import io.runscope.probe.LivenessProbe;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Tries each layout in order. A layout whose marker file is missing or unreadable does not apply
 * and the next one is tried.
 */
public final class RunFormatDispatcher {
    private final List<RunFormatReader> readers;

    public RunFormatDispatcher(LivenessProbe probe) {
        this(List.of(new StatusFileReader(probe), new ManifestReader(probe)));
    }

    public RunFormatDispatcher(List<RunFormatReader> readers) {
        if (readers == null || readers.isEmpty()) {
            throw new IllegalArgumentException("at least one run format reader is required");
        }
        this.readers = List.copyOf(readers);
    }

    public boolean markerExists(Path runDir) {
        return readerFor(runDir).isPresent();
    }

    public Optional<RunFormatReader> readerFor(Path runDir) {
        for (RunFormatReader reader : readers) {
            if (reader.applies(runDir)) {
                return Optional.of(reader);
            }
        }
        return Optional.empty();
    }

    public Optional<RunState> read(String runId, Path runDir) {
        for (RunFormatReader reader : readers) {
            if (!reader.applies(runDir)) {
                continue;
            }
            Optional<RunState> state = reader.read(runId, runDir);
            if (state.isPresent()) {
                return state;
            }
        }
        return Optional.empty();
    }
}
