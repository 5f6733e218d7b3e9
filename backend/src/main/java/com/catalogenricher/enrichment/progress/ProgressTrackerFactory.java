package com.catalogenricher.enrichment.progress;

import com.catalogenricher.domain.TableLayout;
import com.catalogenricher.enrichment.config.CheckpointProperties;
import com.catalogenricher.enrichment.table.TableStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Creates one {@link ProgressTracker} per input table. The checkpoint lives at
 * {@code <checkpoint-dir>/<stem>_partial.json}; an input that is itself a {@code _partial.json} file is its own
 * checkpoint.
 */
@Component
@RequiredArgsConstructor
public class ProgressTrackerFactory {

    static final String PARTIAL_SUFFIX = "_partial";
    static final String CHECKPOINT_EXTENSION = ".json";

    private final CheckpointProperties checkpointProperties;
    private final TableStore tableStore;
    private final CheckpointStore checkpointStore;
    private final Clock clock;

    public ProgressTracker forInput(Path input, TableLayout layout) {
        return new ProgressTracker(input, checkpointPathFor(input), layout, tableStore, checkpointStore,
                Duration.ofMillis(Math.max(0, checkpointProperties.getMinIntervalMs())), clock);
    }

    Path checkpointPathFor(Path input) {
        String fileName = input.getFileName().toString();
        if (fileName.endsWith(PARTIAL_SUFFIX + CHECKPOINT_EXTENSION)) {
            return input;
        }
        return Path.of(checkpointProperties.getDirectory()).resolve(stemOf(input) + PARTIAL_SUFFIX + CHECKPOINT_EXTENSION);
    }

    /**
     * File name without extension and without a trailing {@code _partial}.
     */
    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        if (stem.endsWith(PARTIAL_SUFFIX)) {
            stem = stem.substring(0, stem.length() - PARTIAL_SUFFIX.length());
        }
        return stem;
    }
}
