package com.catalogenricher.enrichment.progress;

import java.nio.file.Path;

/**
 * Durable side-file storage for checkpoints. Writes must be atomic: a reader sees either the previous
 * snapshot or the new one, never a torn file.
 */
public interface CheckpointStore {

    boolean exists(Path path);

    CheckpointSnapshot read(Path path);

    void write(Path path, CheckpointSnapshot snapshot);

    void delete(Path path);
}
