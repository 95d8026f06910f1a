package org.csits.hrsync.manager.trigger;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ExternalTickSchedulerTest {

    @Test
    void armAndCancel_trackState() {
        ExternalTickScheduler scheduler = new ExternalTickScheduler();

        scheduler.arm("job", () -> { }, 10, 420);
        assertThat(scheduler.isArmed("job")).isTrue();

        scheduler.cancel("job");
        assertThat(scheduler.isArmed("job")).isFalse();
    }
}
