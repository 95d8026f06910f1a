package org.csits.hrsync.manager.trigger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 进程内触发实现：单线程定时线程池，固定延迟调度，触发之间不会重叠。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hrsync.scheduler.type", havingValue = "local", matchIfMissing = true)
public class LocalTickScheduler implements TickScheduler {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger(0);

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "hrsync-tick-" + THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final Map<String, ScheduledFuture<?>> armed = new ConcurrentHashMap<>();

    @Override
    public synchronized void arm(String jobKey, Runnable tick, long initialDelaySeconds, long intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive: " + intervalSeconds);
        }
        cancel(jobKey);
        Runnable guarded = () -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                // 异常逃逸会使后续触发全部停止
                log.error("周期触发执行失败: jobKey={}", jobKey, e);
            }
        };
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
            guarded, Math.max(0, initialDelaySeconds), intervalSeconds, TimeUnit.SECONDS);
        armed.put(jobKey, future);
        log.info("挂载周期触发: jobKey={}, initialDelay={}s, interval={}s", jobKey, initialDelaySeconds, intervalSeconds);
    }

    @Override
    public synchronized void cancel(String jobKey) {
        ScheduledFuture<?> future = armed.remove(jobKey);
        if (future != null) {
            // 不中断正在执行的触发，由作业在批次边界感知取消
            future.cancel(false);
            log.info("取消周期触发: jobKey={}", jobKey);
        }
    }

    @Override
    public boolean isArmed(String jobKey) {
        ScheduledFuture<?> future = armed.get(jobKey);
        return future != null && !future.isDone();
    }

    @PreDestroy
    public void shutdown() {
        armed.clear();
        executor.shutdownNow();
    }
}
