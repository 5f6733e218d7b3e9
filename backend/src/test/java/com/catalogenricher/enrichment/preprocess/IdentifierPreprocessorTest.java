package com.catalogenricher.enrichment.preprocess;

import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.TestTables;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierPreprocessorTest {

    @TempDir
    Path tempDir;

    private final IdentifierPreprocessor preprocessor = new IdentifierPreprocessor();

    @Test
    @DisplayName("valid identifiers are normalized, invalid ones marked INVALID_ID, rows with nothing marked NO_ID")
    void classifiesIdentifiers() {
        WorkingTable table = TestTables.barcodeAndIsbn(
                "B1", "978-7-111-11111-1",
                "B2", "12345",
                "", "",
                "B4", "nan");
        ProgressTracker tracker = TestTables.tracker(tempDir);

        PreprocessStats stats = preprocessor.preprocess(table, tracker);

        assertThat(table.get(0).getNormalizedIdentifier()).isEqualTo("9787111111111");
        assertThat(table.get(0).getStatus()).isEqualTo(RecordStatus.PENDING);
        assertThat(table.get(1).getStatus()).isEqualTo(RecordStatus.INVALID_ID);
        assertThat(table.get(1).getFailureReason()).contains("12345");
        assertThat(table.get(2).getStatus()).isEqualTo(RecordStatus.NO_ID);
        assertThat(table.get(3).getStatus()).isEqualTo(RecordStatus.PENDING);
        assertThat(stats.normalized()).isEqualTo(1);
        assertThat(stats.invalid()).isEqualTo(1);
        assertThat(stats.noIdentifier()).isEqualTo(1);
        assertThat(stats.missingWithBarcode()).isEqualTo(1);
    }

    @Test
    @DisplayName("running twice changes nothing")
    void idempotent() {
        WorkingTable table = TestTables.barcodeAndIsbn("B1", "9787111111111", "B2", "bad");
        ProgressTracker tracker = TestTables.tracker(tempDir);

        preprocessor.preprocess(table, tracker);
        PreprocessStats second = preprocessor.preprocess(table, tracker);

        assertThat(second.normalized()).isZero();
        assertThat(second.alreadyNormalized()).isEqualTo(1);
        assertThat(table.get(0).getNormalizedIdentifier()).isEqualTo("9787111111111");
        assertThat(table.get(1).getStatus()).isEqualTo(RecordStatus.INVALID_ID);
    }

    @Test
    @DisplayName("terminal rows keep their status")
    void terminalRowsUntouched() {
        WorkingTable table = TestTables.barcodeAndIsbn("B1", "bad");
        table.get(0).advanceTo(RecordStatus.DONE);

        preprocessor.preprocess(table, TestTables.tracker(tempDir));

        assertThat(table.get(0).getStatus()).isEqualTo(RecordStatus.DONE);
    }
}
