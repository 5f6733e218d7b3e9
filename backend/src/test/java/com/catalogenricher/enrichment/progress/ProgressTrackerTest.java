package com.catalogenricher.enrichment.progress;

import com.catalogenricher.domain.CacheCategory;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.TabularData;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.TestTables;
import com.catalogenricher.enrichment.table.CsvTableStore;
import com.catalogenricher.enrichment.table.TableStore;
import com.catalogenricher.enrichment.table.TableStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class ProgressTrackerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Path input;
    private Path checkpoint;
    private final TableStore tableStore = new CsvTableStore();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        input = tempDir.resolve("books.csv");
        checkpoint = tempDir.resolve("out").resolve("books_partial.json");
        tableStore.save(input, new TabularData(List.of("barcode", "isbn", "title"),
                List.of(List.of("B1", "9787111111111", ""), List.of("B2", "bad", ""))));
    }

    private ProgressTracker tracker(CheckpointStore store) {
        return new ProgressTracker(input, checkpoint, TestTables.LAYOUT, tableStore, store, Duration.ofSeconds(5), clock);
    }

    @Test
    @DisplayName("fresh load reads the input with every row PENDING")
    void loadsInput() {
        LoadedTable loaded = tracker(new JsonCheckpointStore()).load();

        assertThat(loaded.resumed()).isFalse();
        assertThat(loaded.table().size()).isEqualTo(2);
        assertThat(loaded.manifest().size()).isZero();
    }

    @Test
    @DisplayName("checkpoint round-trip restores status, values, tags, identifier and categories")
    void resumesFromCheckpoint() {
        ProgressTracker tracker = tracker(new JsonCheckpointStore());
        LoadedTable loaded = tracker.load();
        WorkingTable table = loaded.table();
        table.get(0).assignNormalizedIdentifier("9787111111111");
        tracker.markDoneWith(table.get(0), r -> r.setValue("title", "Dune"), "api");
        tracker.markInvalidId(table.get(1), "invalid identifier 'bad'");
        loaded.manifest().assign(0, CacheCategory.NEW);

        assertThat(tracker.checkpoint(table, loaded.manifest(), true, "test")).isTrue();
        LoadedTable resumed = tracker(new JsonCheckpointStore()).load();

        assertThat(resumed.resumed()).isTrue();
        assertThat(resumed.table().get(0).getStatus()).isEqualTo(RecordStatus.DONE);
        assertThat(resumed.table().get(0).getValue("title")).isEqualTo("Dune");
        assertThat(resumed.table().get(0).getSourceTags()).containsExactly("api");
        assertThat(resumed.table().get(0).getNormalizedIdentifier()).isEqualTo("9787111111111");
        assertThat(resumed.table().get(1).getStatus()).isEqualTo(RecordStatus.INVALID_ID);
        assertThat(resumed.table().get(1).getFailureReason()).isEqualTo("invalid identifier 'bad'");
        assertThat(resumed.manifest().categoryOf(0)).contains(CacheCategory.NEW);
        assertThat(resumed.table().columns()).isEqualTo(table.columns());
    }

    @Test
    @DisplayName("unreadable checkpoint falls back to the input")
    void corruptCheckpointIgnored() throws Exception {
        Files.createDirectories(checkpoint.getParent());
        Files.writeString(checkpoint, "{not json");

        LoadedTable loaded = tracker(new JsonCheckpointStore()).load();

        assertThat(loaded.resumed()).isFalse();
        assertThat(loaded.table().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("unforced checkpoints are throttled by the minimum interval; forced ones are not")
    void throttling() {
        ProgressTracker tracker = tracker(new JsonCheckpointStore());
        LoadedTable loaded = tracker.load();

        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), false, "first")).isTrue();
        clock.advance(Duration.ofSeconds(1));
        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), false, "too soon")).isFalse();
        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), true, "forced")).isTrue();
        clock.advance(Duration.ofSeconds(6));
        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), false, "later")).isTrue();
        assertThat(tracker.getCheckpointsWritten()).isEqualTo(3);
    }

    @Test
    @DisplayName("a failed write is swallowed and lifts the throttle for the next attempt")
    void failedWriteRetriedNextTime() {
        CheckpointStore store = spy(new JsonCheckpointStore());
        doCallRealMethod()
                .doThrow(new CheckpointException("disk full", null))
                .doCallRealMethod()
                .when(store).write(any(), any());
        ProgressTracker tracker = tracker(store);
        LoadedTable loaded = tracker.load();

        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), true, "ok")).isTrue();
        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), true, "fails")).isFalse();
        // within the minimum interval, but the previous write failed
        assertThat(tracker.checkpoint(loaded.table(), loaded.manifest(), false, "retry")).isTrue();
        assertThat(Files.exists(checkpoint)).isTrue();
    }

    @Test
    @DisplayName("terminal rows cannot be re-marked")
    void transitionsAreMonotonic() {
        ProgressTracker tracker = tracker(new JsonCheckpointStore());
        WorkingTable table = tracker.load().table();

        assertThat(tracker.markNotFound(table.get(0), "http 404")).isTrue();
        assertThat(tracker.markDoneWith(table.get(0), r -> r.setValue("title", "late"), "api")).isFalse();
        assertThat(tracker.markFromDb(table.get(0))).isFalse();
        assertThat(table.get(0).getValue("title")).isEmpty();
        assertThat(table.get(0).getFailureReason()).isEqualTo("http 404");
    }

    @Test
    @DisplayName("finalize writes the output and removes the checkpoint")
    void finalizeRemovesCheckpoint() {
        ProgressTracker tracker = tracker(new JsonCheckpointStore());
        LoadedTable loaded = tracker.load();
        tracker.markDone(loaded.table().get(0));
        tracker.checkpoint(loaded.table(), loaded.manifest(), true, "before finalize");
        Path output = tempDir.resolve("out").resolve("books_enriched.csv");

        tracker.finalizeRun(loaded.table(), output);

        assertThat(Files.exists(checkpoint)).isFalse();
        TabularData written = tableStore.load(output);
        assertThat(written.rowAsMap(0)).containsEntry("processing_status", "DONE");
        assertThat(written.rowAsMap(1)).containsEntry("processing_status", "PENDING");
    }

    @Test
    @DisplayName("output failure keeps the checkpoint and propagates")
    void outputFailureKeepsCheckpoint() {
        TableStore failingOutput = mock(TableStore.class);
        when(failingOutput.load(any())).thenReturn(tableStore.load(input));
        doThrow(new TableStoreException("read-only")).when(failingOutput).save(any(), any());
        ProgressTracker tracker = new ProgressTracker(input, checkpoint, TestTables.LAYOUT, failingOutput,
                new JsonCheckpointStore(), Duration.ZERO, clock);
        LoadedTable loaded = tracker.load();
        tracker.checkpoint(loaded.table(), loaded.manifest(), true, "before finalize");

        assertThatThrownBy(() -> tracker.finalizeRun(loaded.table(), tempDir.resolve("x.csv")))
                .isInstanceOf(TableStoreException.class);
        assertThat(Files.exists(checkpoint)).isTrue();
    }

    @Test
    @DisplayName("row mutations through updateRow are visible in the next snapshot")
    void updateRowVisibleInSnapshot() {
        ProgressTracker tracker = tracker(new JsonCheckpointStore());
        LoadedTable loaded = tracker.load();
        tracker.updateRow(loaded.table().get(1), r -> r.setValue("title", "patched"));
        tracker.appendSource(loaded.table().get(1), "cache");

        tracker.checkpoint(loaded.table(), loaded.manifest(), true, "patched");
        CheckpointSnapshot snapshot = new JsonCheckpointStore().read(checkpoint);

        CheckpointSnapshot.RowSnapshot row = snapshot.rows().get(1);
        assertThat(row.values()).containsEntry("title", "patched");
        assertThat(row.sourceTags()).containsExactly("cache");
        assertThat(snapshot.reason()).isEqualTo("patched");
        assertThat(snapshot.categories()).isEqualTo(new ClassificationManifest().toKeyedMap());
        assertThat(snapshot.rows().get(0).values()).containsKeys("barcode", "isbn", "title");
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
