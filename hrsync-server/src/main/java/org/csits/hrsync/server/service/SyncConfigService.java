package org.csits.hrsync.server.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.SyncConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载并校验同步配置，首次访问时读取，之后缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;

    @Value("${hrsync.conf.location:classpath:conf/sync.yaml}")
    private String confLocation;

    private volatile SyncConfig cached;

    public SyncConfig getConfig() {
        SyncConfig config = cached;
        if (config == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = load();
                }
                config = cached;
            }
        }
        return config;
    }

    /**
     * 重新读取配置文件。进行中的作业在下次调度时生效
     */
    public synchronized SyncConfig reload() {
        cached = load();
        return cached;
    }

    /**
     * 按名称从目标目录取字段目标
     *
     * @throws IllegalArgumentException 名称不存在
     */
    public FieldTarget resolveTarget(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("目标名不能为空");
        }
        FieldTarget target = getConfig().getTargets().get(name.trim());
        if (target == null) {
            throw new IllegalArgumentException("未配置的字段目标: " + name);
        }
        return target;
    }

    public Map<String, FieldTarget> listTargets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(getConfig().getTargets()));
    }

    private SyncConfig load() {
        Resource resource = resourceLoader.getResource(confLocation);
        if (!resource.exists()) {
            log.warn("同步配置文件不存在，使用默认值: {}", confLocation);
            return validate(new SyncConfig());
        }
        try {
            SyncConfig config = yamlConfigLoader.loadSyncConfig(resource);
            log.info("同步配置已加载: location={}, targets={}", confLocation, config.getTargets().keySet());
            return validate(config);
        } catch (IOException e) {
            throw new UncheckedIOException("读取同步配置失败: " + confLocation, e);
        }
    }

    static SyncConfig validate(SyncConfig config) {
        if (config.getApi() == null) {
            config.setApi(new SyncConfig.ApiConfig());
        }
        if (config.getBatch() == null) {
            config.setBatch(new SyncConfig.BatchConfig());
        }
        if (config.getPacing() == null) {
            config.setPacing(new SyncConfig.PacingConfig());
        }
        if (config.getRetry() == null) {
            config.setRetry(new SyncConfig.RetryConfig());
        }
        if (config.getTargets() == null) {
            config.setTargets(new LinkedHashMap<>());
        }
        SyncConfig.BatchConfig batch = config.getBatch();
        requirePositive(batch.getBatchSize(), "batch.batch_size");
        requirePositive(batch.getTickIntervalSec(), "batch.tick_interval_sec");
        requirePositive(batch.getTickTimeBudgetSec(), "batch.tick_time_budget_sec");
        requirePositive(config.getPacing().getMaxCallsPerMinute(), "pacing.max_calls_per_minute");
        if (batch.getFirstTickDelaySec() == null || batch.getFirstTickDelaySec() < 0) {
            batch.setFirstTickDelaySec(0);
        }

        long batchMillis = (long) batch.getBatchSize() * (60000L / config.getPacing().getMaxCallsPerMinute());
        if (batchMillis > batch.getTickTimeBudgetSec() * 1000L) {
            log.warn("batch_size({}) x 节流间隔约 {} 秒，超过单次调度时间预算 {} 秒，每次调度将提前截断",
                batch.getBatchSize(), batchMillis / 1000, batch.getTickTimeBudgetSec());
        }
        if (batch.getTickIntervalSec() <= batch.getTickTimeBudgetSec()) {
            log.warn("tick_interval_sec({}) 不大于 tick_time_budget_sec({})",
                batch.getTickIntervalSec(), batch.getTickTimeBudgetSec());
        }
        return config;
    }

    private static void requirePositive(Integer value, String name) {
        if (value == null || value <= 0) {
            throw new IllegalArgumentException(name + " 必须为正整数");
        }
    }
}
