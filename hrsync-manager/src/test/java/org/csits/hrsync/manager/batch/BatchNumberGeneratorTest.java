package org.csits.hrsync.manager.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class BatchNumberGeneratorTest {

    private final BatchNumberGenerator generator = new BatchNumberGenerator();

    @Test
    void nextBatchNumber_formatIsTimestampUnderscoreSequence() {
        String batch = generator.nextBatchNumber(LocalDateTime.of(2025, 6, 3, 14, 5, 9), 0);

        assertThat(batch).isEqualTo("20250603140509_001");
    }

    @Test
    void nextBatchNumber_sequenceFollowsExistingCount() {
        LocalDateTime now = LocalDateTime.now();
        String batch = generator.nextBatchNumber(now, 11);

        assertThat(batch).matches("\\d{14}_012");
    }

    @Test
    void nextBatchNumber_rejectsNegativeCount() {
        assertThatThrownBy(() -> generator.nextBatchNumber(LocalDateTime.now(), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
