package com.catalogenricher.enrichment.progress;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.TableLayout;
import com.catalogenricher.domain.TabularData;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.table.TableStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Owns row status transitions and the checkpoint side file for one input table.
 * <p>
 * Row writes take the shared side of a read/write lock, so fetch workers updating different rows do not block
 * each other. A checkpoint takes the exclusive side while copying the table, then writes outside the lock.
 * Only one checkpoint write runs at a time.
 */
@Slf4j
public class ProgressTracker {

    private final Path inputPath;
    private final Path checkpointPath;
    private final TableLayout layout;
    private final TableStore tableStore;
    private final CheckpointStore checkpointStore;
    private final Duration minInterval;
    private final Clock clock;

    private final ReentrantReadWriteLock rowLock = new ReentrantReadWriteLock();
    private final Object writerMonitor = new Object();
    private final AtomicInteger checkpointsWritten = new AtomicInteger();
    private long lastCheckpointAtMillis = Long.MIN_VALUE;
    private boolean lastWriteFailed;

    public ProgressTracker(Path inputPath, Path checkpointPath, TableLayout layout, TableStore tableStore,
                           CheckpointStore checkpointStore, Duration minInterval, Clock clock) {
        this.inputPath = inputPath;
        this.checkpointPath = checkpointPath;
        this.layout = layout;
        this.tableStore = tableStore;
        this.checkpointStore = checkpointStore;
        this.minInterval = minInterval;
        this.clock = clock;
    }

    /**
     * Loads the checkpoint if one exists, else the input table with every row PENDING.
     * An unreadable checkpoint is logged and ignored.
     */
    public LoadedTable load() {
        if (checkpointStore.exists(checkpointPath)) {
            try {
                CheckpointSnapshot snapshot = checkpointStore.read(checkpointPath);
                WorkingTable table = snapshot.toTable(layout);
                log.info("Resuming from checkpoint {} ({} rows, saved {})", checkpointPath, table.size(), snapshot.savedAt());
                return new LoadedTable(table, snapshot.toManifest(), true);
            } catch (CheckpointException | IllegalArgumentException e) {
                log.warn("Checkpoint {} unreadable, starting from input: {}", checkpointPath, e.getMessage());
            }
        }
        TabularData data = tableStore.load(inputPath);
        WorkingTable table = WorkingTable.fromTabular(data, layout);
        log.info("Loaded {} rows from {}", table.size(), inputPath);
        return new LoadedTable(table, new ClassificationManifest(), false);
    }

    public boolean shouldSkip(CatalogRecord record) {
        return record.isTerminal();
    }

    public boolean markFromDb(CatalogRecord record) {
        return transition(record, RecordStatus.FROM_DB, null);
    }

    public boolean markDone(CatalogRecord record) {
        return transition(record, RecordStatus.DONE, null);
    }

    /**
     * Applies {@code merge}, marks DONE and adds {@code sourceTag} as one step, so a snapshot never sees merged data
     * on a row that is still PENDING. No-op when the row is already terminal.
     */
    public boolean markDoneWith(CatalogRecord record, Consumer<CatalogRecord> merge, String sourceTag) {
        rowLock.readLock().lock();
        try {
            if (record.isTerminal()) {
                log.debug("Row {} already {}, result discarded", record.getRowId(), record.getStatus());
                return false;
            }
            merge.accept(record);
            record.advanceTo(RecordStatus.DONE);
            record.addSourceTag(sourceTag);
            return true;
        } finally {
            rowLock.readLock().unlock();
        }
    }

    public boolean markNotFound(CatalogRecord record, String reason) {
        return transition(record, RecordStatus.NOT_FOUND, reason);
    }

    public boolean markInvalidId(CatalogRecord record, String reason) {
        return transition(record, RecordStatus.INVALID_ID, reason);
    }

    public boolean markNoId(CatalogRecord record, String reason) {
        return transition(record, RecordStatus.NO_ID, reason);
    }

    public void appendSource(CatalogRecord record, String tag) {
        updateRow(record, r -> r.addSourceTag(tag));
    }

    /**
     * Applies a row-scoped mutation while no checkpoint snapshot is being taken.
     */
    public void updateRow(CatalogRecord record, Consumer<CatalogRecord> mutation) {
        rowLock.readLock().lock();
        try {
            mutation.accept(record);
        } finally {
            rowLock.readLock().unlock();
        }
    }

    private boolean transition(CatalogRecord record, RecordStatus target, String reason) {
        rowLock.readLock().lock();
        try {
            RecordStatus from = record.getStatus();
            if (!record.advanceTo(target)) {
                log.debug("Row {} stays {} (requested {})", record.getRowId(), from, target);
                return false;
            }
            if (reason != null) {
                record.setFailureReason(reason);
            }
            return true;
        } finally {
            rowLock.readLock().unlock();
        }
    }

    /**
     * Persists a snapshot unless an unforced call arrives within the minimum interval of the last successful
     * write. A failed write is logged and lifts the throttle for the next call. Never throws.
     *
     * @return true if a snapshot was written
     */
    public boolean checkpoint(WorkingTable table, ClassificationManifest manifest, boolean force, String reason) {
        synchronized (writerMonitor) {
            long now = clock.millis();
            if (!force && !lastWriteFailed && lastCheckpointAtMillis != Long.MIN_VALUE
                    && now - lastCheckpointAtMillis < minInterval.toMillis()) {
                return false;
            }
            CheckpointSnapshot snapshot;
            rowLock.writeLock().lock();
            try {
                snapshot = CheckpointSnapshot.capture(table, manifest, clock.instant(), reason);
            } finally {
                rowLock.writeLock().unlock();
            }
            try {
                checkpointStore.write(checkpointPath, snapshot);
                lastCheckpointAtMillis = now;
                lastWriteFailed = false;
                checkpointsWritten.incrementAndGet();
                log.debug("Checkpoint written to {} ({})", checkpointPath, reason);
                return true;
            } catch (RuntimeException e) {
                lastWriteFailed = true;
                log.warn("Checkpoint write failed ({}), will retry at next opportunity: {}", reason, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Writes the final output, then retires the checkpoint. If the output write fails the checkpoint stays and the
     * exception propagates.
     */
    public void finalizeRun(WorkingTable table, Path outputPath) {
        TabularData output;
        rowLock.writeLock().lock();
        try {
            output = table.toTabular();
        } finally {
            rowLock.writeLock().unlock();
        }
        tableStore.save(outputPath, output);
        try {
            checkpointStore.delete(checkpointPath);
        } catch (CheckpointException e) {
            log.warn("Final output written to {} but checkpoint {} could not be removed: {}",
                    outputPath, checkpointPath, e.getMessage());
        }
    }

    public Path getInputPath() {
        return inputPath;
    }

    public Path getCheckpointPath() {
        return checkpointPath;
    }

    public int getCheckpointsWritten() {
        return checkpointsWritten.get();
    }
}
