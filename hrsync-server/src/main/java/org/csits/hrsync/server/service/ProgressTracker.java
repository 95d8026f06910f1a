package org.csits.hrsync.server.service;

import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobCheckpointEntity;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.csits.hrsync.server.dto.SyncConfig;
import org.springframework.stereotype.Service;

/**
 * 作业进度跟踪服务
 * 将断点进度同步到作业运行记录，并估算剩余时间
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressTracker {

    private final JobRunRepository jobRunRepository;

    /**
     * 以断点为准更新作业运行记录，调度次数加一
     */
    public void updateProgress(Long jobRunId, JobCheckpointEntity checkpoint, int totalRows, String message) {
        JobRunEntity entity = jobRunRepository.findById(jobRunId).orElse(null);
        if (entity == null) {
            log.warn("作业运行记录不存在，无法更新进度: jobRunId={}", jobRunId);
            return;
        }
        entity.setNextRowIndex(checkpoint.getNextRowIndex());
        entity.setTotalRows(totalRows);
        entity.setCompletedCount(checkpoint.getCompletedCount());
        entity.setSkippedCount(checkpoint.getSkippedCount());
        entity.setFailedCount(checkpoint.getFailedCount());
        entity.setTickCount((entity.getTickCount() != null ? entity.getTickCount() : 0) + 1);
        entity.setMessage(message);
        jobRunRepository.save(entity);

        log.debug("作业进度更新: jobRunId={}, next={}/{}, progress={}%",
            jobRunId, checkpoint.getNextRowIndex(), totalRows, percent(checkpoint.getNextRowIndex(), totalRows));
    }

    /**
     * 计算进度百分比
     */
    public static int percent(int nextRowIndex, int totalRows) {
        if (totalRows <= 0) {
            return 100;
        }
        return (int) Math.min(100, Math.max(0, (long) nextRowIndex * 100 / totalRows));
    }

    /**
     * 估算剩余秒数：剩余行按节流间隔计，剩余调度之间按调度间隔计
     */
    public static long estimateRemainingSeconds(int nextRowIndex, int totalRows, SyncConfig config) {
        int remaining = Math.max(0, totalRows - nextRowIndex);
        if (remaining == 0) {
            return 0;
        }
        int batchSize = config.getBatch().getBatchSize();
        long intervalMillis = 60000L / config.getPacing().getMaxCallsPerMinute();
        long remainingTicks = (remaining + batchSize - 1) / batchSize;
        long callSeconds = remaining * intervalMillis / 1000;
        long waitSeconds = (remainingTicks - 1) * config.getBatch().getTickIntervalSec();
        return callSeconds + waitSeconds;
    }

    /**
     * 作业耗时（秒），未结束时计到当前
     */
    public static Long durationSeconds(JobRunEntity entity) {
        if (entity.getStartTime() == null) {
            return null;
        }
        LocalDateTime end = entity.getEndTime() != null ? entity.getEndTime() : LocalDateTime.now();
        return java.time.Duration.between(entity.getStartTime(), end).getSeconds();
    }
}
