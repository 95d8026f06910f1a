package org.csits.hrsync.server.service;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobCheckpointRepository;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.dao.UpdateRowRepository;
import org.csits.hrsync.dao.UpdateRowStatus;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.RetrySummary;
import org.csits.hrsync.server.dto.TickContext;
import org.csits.hrsync.server.dto.UpdateOutcome;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.springframework.stereotype.Service;

/**
 * 行状态统计与失败行重试。重试同步执行，不经过调度与断点。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowStatusReporter {

    private final UpdateRowRepository updateRowRepository;
    private final JobCheckpointRepository checkpointRepository;
    private final JobRunRepository jobRunRepository;
    private final SnapshotLoader snapshotLoader;
    private final UpdateExecutor updateExecutor;
    private final EngineLock engineLock;

    /**
     * 按行状态统计
     */
    public Map<String, Long> summarize() {
        return updateRowRepository.countByStatus();
    }

    /**
     * 使用最近一次作业的字段目标重试
     *
     * @throws IllegalArgumentException 从未执行过作业
     */
    public RetrySummary retryFailedRows() {
        JobRunEntity latest = jobRunRepository.findLatest()
            .orElseThrow(() -> new IllegalArgumentException("没有历史作业，请指定字段目标"));
        return retryFailedRows(new FieldTarget(latest.getFieldPath(), latest.getFieldType(), latest.getEnumListName()));
    }

    /**
     * 对当前所有 FAILED 行各重新执行一次，其它状态的行不受影响
     *
     * @throws JobAlreadyRunningException 批量作业或另一次重试执行中
     * @throws org.csits.hrsync.server.client.HrApiException 列表值快照加载失败
     */
    public RetrySummary retryFailedRows(FieldTarget target) {
        if (!engineLock.tryLock()) {
            throw new JobAlreadyRunningException("批量调度或失败行重试执行中，不能重试失败行");
        }
        try {
            if (checkpointRepository.exists()) {
                throw new JobAlreadyRunningException("批量作业执行中，不能重试失败行");
            }
            return doRetry(target);
        } finally {
            engineLock.unlock();
        }
    }

    private RetrySummary doRetry(FieldTarget target) {
        RetrySummary summary = new RetrySummary();
        List<UpdateRowEntity> failedRows = updateRowRepository.findByStatus(UpdateRowStatus.FAILED.name());
        if (failedRows.isEmpty()) {
            log.info("没有失败行需要重试");
            return summary;
        }
        log.info("开始重试失败行: count={}, field={}", failedRows.size(), target.getFieldPath());

        TickContext context;
        try {
            context = snapshotLoader.load(target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            summary.setInterrupted(true);
            return summary;
        }

        for (UpdateRowEntity row : failedRows) {
            row.setStatus(UpdateRowStatus.PROCESSING.name());
            updateRowRepository.update(row);
            UpdateOutcome outcome;
            try {
                outcome = updateExecutor.execute(row, target, context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                row.setStatus(UpdateRowStatus.FAILED.name());
                updateRowRepository.update(row);
                summary.setInterrupted(true);
                log.warn("失败行重试被中断: 已重试 {} 行", summary.getAttempted());
                break;
            } catch (RuntimeException e) {
                log.error("行 {} 重试异常", row.getRowIndex(), e);
                outcome = UpdateOutcome.failed(row.getResolvedRecordId(), null, e.toString());
            }
            outcome.applyTo(row);
            row.setFieldPath(target.getFieldPath());
            updateRowRepository.update(row);
            summary.record(outcome);
        }
        log.info("失败行重试完成: {}", summary);
        return summary;
    }
}
