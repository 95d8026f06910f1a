package org.csits.hrsync.manager.pacing;

import lombok.extern.slf4j.Slf4j;

/**
 * 固定间隔节流：每次调用后休眠 60000 / maxCallsPerMinute 毫秒。
 * 单线程串行调用下即可保证不超过每分钟上限。
 */
@Slf4j
public class FixedDelayCallPacer implements CallPacer {

    private final long intervalMillis;

    public FixedDelayCallPacer(long intervalMillis) {
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("intervalMillis must not be negative: " + intervalMillis);
        }
        this.intervalMillis = intervalMillis;
    }

    public static FixedDelayCallPacer perMinute(int maxCallsPerMinute) {
        if (maxCallsPerMinute <= 0) {
            throw new IllegalArgumentException("maxCallsPerMinute must be positive: " + maxCallsPerMinute);
        }
        return new FixedDelayCallPacer(60000L / maxCallsPerMinute);
    }

    @Override
    public void pace() throws InterruptedException {
        if (intervalMillis == 0) {
            return;
        }
        log.trace("节流等待 {} ms", intervalMillis);
        Thread.sleep(intervalMillis);
    }

    @Override
    public long intervalMillis() {
        return intervalMillis;
    }
}
