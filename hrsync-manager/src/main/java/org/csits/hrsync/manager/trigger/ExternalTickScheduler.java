package org.csits.hrsync.manager.trigger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 外部调度触发实现：周期由调度中心（xxl-job）按 cron 驱动，这里只记录挂载状态，
 * 调度中心的任务在未挂载时直接跳过。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hrsync.scheduler.type", havingValue = "xxl-job")
public class ExternalTickScheduler implements TickScheduler {

    private final Map<String, Long> armed = new ConcurrentHashMap<>();

    @Override
    public void arm(String jobKey, Runnable tick, long initialDelaySeconds, long intervalSeconds) {
        armed.put(jobKey, System.currentTimeMillis());
        log.info("挂载外部触发: jobKey={}, 周期由调度中心配置", jobKey);
    }

    @Override
    public void cancel(String jobKey) {
        if (armed.remove(jobKey) != null) {
            log.info("取消外部触发: jobKey={}", jobKey);
        }
    }

    @Override
    public boolean isArmed(String jobKey) {
        return armed.containsKey(jobKey);
    }
}
