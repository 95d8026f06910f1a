package org.csits.hrsync.manager.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalTickSchedulerTest {

    private LocalTickScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new LocalTickScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void arm_firesRepeatedlyUntilCancelled() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        scheduler.arm("job", latch::countDown, 0, 1);

        assertThat(scheduler.isArmed("job")).isTrue();
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.cancel("job");
        assertThat(scheduler.isArmed("job")).isFalse();
    }

    @Test
    void arm_keepsFiringAfterTickThrows() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(2);
        scheduler.arm("job", () -> {
            calls.incrementAndGet();
            latch.countDown();
            throw new IllegalStateException("boom");
        }, 0, 1);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(calls.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void cancel_unknownKeyIsNoop() {
        scheduler.cancel("nothing");
        assertThat(scheduler.isArmed("nothing")).isFalse();
    }

    @Test
    void arm_rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> scheduler.arm("job", () -> { }, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
