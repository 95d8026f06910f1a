package org.csits.hrsync.server.service;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.SyncConfig;
import org.springframework.stereotype.Service;

/**
 * 重试服务
 * 用于快照类只读调用的有限重试，单行写入不重试
 */
@Slf4j
@Service
public class RetryService {

    /**
     * 执行带重试的操作
     *
     * @param operation 要执行的操作
     * @param retryConfig 重试配置
     * @param operationName 操作名称（用于日志）
     * @param <T> 返回类型
     * @return 操作结果
     * @throws InterruptedException 重试等待期间被中断
     * @throws RuntimeException 所有重试失败后抛出最后一次异常
     */
    public <T> T executeWithRetry(Supplier<T> operation, SyncConfig.RetryConfig retryConfig,
                                  String operationName) throws InterruptedException {
        int maxRetries = retryConfig != null && retryConfig.getMaxRetries() != null
            ? Math.max(0, retryConfig.getMaxRetries()) : 0;
        int retryInterval = retryConfig != null && retryConfig.getRetryIntervalSec() != null
            ? Math.max(0, retryConfig.getRetryIntervalSec()) : 10;

        RuntimeException lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.info("重试 {} (第 {}/{} 次)", operationName, attempt, maxRetries);
                }
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("{} 失败 (第 {}/{} 次): {}", operationName, attempt + 1, maxRetries + 1, e.getMessage());

                if (attempt < maxRetries && retryInterval > 0) {
                    log.info("等待 {} 秒后重试...", retryInterval);
                    Thread.sleep(retryInterval * 1000L);
                }
            }
        }

        log.error("{} 失败，已达到最大重试次数 {}", operationName, maxRetries);
        throw lastException;
    }
}
