package com.catalogenricher.enrichment.progress;

import com.catalogenricher.enrichment.config.CheckpointProperties;
import com.catalogenricher.enrichment.table.CsvTableStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerFactoryTest {

    private final CheckpointProperties properties = new CheckpointProperties();
    private final ProgressTrackerFactory factory = new ProgressTrackerFactory(properties, new CsvTableStore(),
            new JsonCheckpointStore(), Clock.systemUTC());

    @Test
    @DisplayName("checkpoint lives in the checkpoint directory under the input stem")
    void checkpointPathFromStem() {
        properties.setDirectory("work");
        assertThat(factory.checkpointPathFor(Path.of("data", "books.csv")))
                .isEqualTo(Path.of("work", "books_partial.json"));
    }

    @Test
    @DisplayName("a partial checkpoint passed as input is its own checkpoint")
    void partialInputIsItsOwnCheckpoint() {
        Path partial = Path.of("work", "books_partial.json");
        assertThat(factory.checkpointPathFor(partial)).isEqualTo(partial);
        assertThat(ProgressTrackerFactory.stemOf(partial)).isEqualTo("books");
    }
}
