package com.catalogenricher.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class RecordStatusTest {

    @Test
    @DisplayName("PENDING may move to every terminal status")
    void pendingMovesToAnyTerminal() {
        assertThat(RecordStatus.PENDING.allowedTargets())
                .containsExactlyInAnyOrder(RecordStatus.FROM_DB, RecordStatus.NOT_FOUND, RecordStatus.INVALID_ID,
                        RecordStatus.NO_ID, RecordStatus.DONE);
        assertThat(RecordStatus.PENDING.isTerminal()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = RecordStatus.class, names = "PENDING", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("terminal statuses have no outgoing transitions")
    void terminalStatusesAreFinal(RecordStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (RecordStatus target : RecordStatus.values()) {
            assertThat(status.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    @DisplayName("fromCell is lenient: blank and unknown values read as PENDING")
    void fromCellLenient() {
        assertThat(RecordStatus.fromCell(" done ")).isEqualTo(RecordStatus.DONE);
        assertThat(RecordStatus.fromCell("from_db")).isEqualTo(RecordStatus.FROM_DB);
        assertThat(RecordStatus.fromCell("")).isEqualTo(RecordStatus.PENDING);
        assertThat(RecordStatus.fromCell(null)).isEqualTo(RecordStatus.PENDING);
        assertThat(RecordStatus.fromCell("whatever")).isEqualTo(RecordStatus.PENDING);
    }
}
