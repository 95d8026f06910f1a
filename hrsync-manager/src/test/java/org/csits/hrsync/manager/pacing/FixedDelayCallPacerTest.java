package org.csits.hrsync.manager.pacing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class FixedDelayCallPacerTest {

    @Test
    void perMinute_derivesInterval() {
        assertThat(FixedDelayCallPacer.perMinute(10).intervalMillis()).isEqualTo(6000L);
        assertThat(FixedDelayCallPacer.perMinute(7).intervalMillis()).isEqualTo(8571L);
    }

    @Test
    void perMinute_rejectsNonPositiveRate() {
        assertThatThrownBy(() -> FixedDelayCallPacer.perMinute(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pace_consecutiveCallsAreSpacedByInterval() throws InterruptedException {
        // 6000 次/分钟 => 10 ms
        CallPacer pacer = FixedDelayCallPacer.perMinute(6000);
        int calls = 5;

        long start = System.nanoTime();
        for (int i = 0; i < calls; i++) {
            pacer.pace();
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMillis).isGreaterThanOrEqualTo(calls * pacer.intervalMillis());
    }

    @Test
    void pace_propagatesInterruption() {
        CallPacer pacer = new FixedDelayCallPacer(10_000);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(pacer::pace).isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
