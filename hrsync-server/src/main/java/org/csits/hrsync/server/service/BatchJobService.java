package org.csits.hrsync.server.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobCheckpointEntity;
import org.csits.hrsync.dao.JobCheckpointRepository;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.csits.hrsync.dao.JobRunStatus;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.dao.UpdateRowRepository;
import org.csits.hrsync.dao.UpdateRowStatus;
import org.csits.hrsync.manager.batch.BatchNumberGenerator;
import org.csits.hrsync.manager.trigger.TickScheduler;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.dto.BatchJobStatus;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.SyncConfig;
import org.csits.hrsync.server.dto.TickContext;
import org.csits.hrsync.server.dto.TickResult;
import org.csits.hrsync.server.dto.UpdateOutcome;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.csits.hrsync.server.exception.NoActiveJobException;
import org.springframework.stereotype.Service;

/**
 * 批量作业调度。每次调度处理一段有界的行，进度写入断点后退出，由周期触发续跑直至全部处理完。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchJobService {

    public static final String JOB_KEY = "hrsync-batch";

    private final UpdateRowRepository updateRowRepository;
    private final JobCheckpointRepository checkpointRepository;
    private final JobRunRepository jobRunRepository;
    private final JobStateMachine jobStateMachine;
    private final JobRunLogger jobRunLogger;
    private final ProgressTracker progressTracker;
    private final SnapshotLoader snapshotLoader;
    private final UpdateExecutor updateExecutor;
    private final TickScheduler tickScheduler;
    private final SyncConfigService syncConfigService;
    private final BatchNumberGenerator batchNumberGenerator;
    private final EngineLock engineLock;

    /**
     * 启动批量作业：创建运行记录与断点并挂载周期触发
     *
     * @throws JobAlreadyRunningException 已有作业在执行
     * @throws IllegalArgumentException 没有待更新行
     */
    public JobRunEntity startJob(FieldTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("字段目标不能为空");
        }
        if (checkpointRepository.exists()) {
            throw new JobAlreadyRunningException("已有批量作业在执行，请先停止或等待完成");
        }
        long totalRows = updateRowRepository.count();
        if (totalRows == 0) {
            throw new IllegalArgumentException("没有待更新行，请先上传");
        }

        LocalDateTime now = LocalDateTime.now();
        LocalDateTime today = LocalDate.now().atStartOfDay();
        long existingToday = jobRunRepository.countByCreatedAtBetween(today, today.plusDays(1));

        JobRunEntity run = new JobRunEntity();
        run.setBatchNumber(batchNumberGenerator.nextBatchNumber(now, existingToday));
        run.setFieldPath(target.getFieldPath());
        run.setFieldType(target.getFieldType());
        run.setEnumListName(target.getEnumListName());
        run.setStatus(JobRunStatus.RUNNING.name());
        run.setTotalRows((int) totalRows);
        run.setNextRowIndex(0);
        run.setCompletedCount(0);
        run.setSkippedCount(0);
        run.setFailedCount(0);
        run.setTickCount(0);
        run.setStartTime(now);
        run.setMessage("已启动");
        jobRunRepository.save(run);

        JobCheckpointEntity checkpoint = new JobCheckpointEntity();
        checkpoint.setJobRunId(run.getId());
        checkpoint.setNextRowIndex(0);
        checkpoint.setFieldPath(target.getFieldPath());
        checkpoint.setFieldType(target.getFieldType());
        checkpoint.setEnumListName(target.getEnumListName());
        checkpoint.setStartedAt(now);
        checkpoint.setLastProgressAt(now);
        checkpoint.setCompletedCount(0);
        checkpoint.setSkippedCount(0);
        checkpoint.setFailedCount(0);
        if (!checkpointRepository.createIfAbsent(checkpoint)) {
            jobStateMachine.markCancelled(run.getId(), "启动被拒绝", "已有批量作业在执行");
            throw new JobAlreadyRunningException("已有批量作业在执行，请先停止或等待完成");
        }

        int reset = updateRowRepository.resetSettledNotFor(target.getFieldPath());
        if (reset > 0) {
            jobRunLogger.info(run.getId(), "START", String.format("%d 行的已有结果属于其它字段，已重置为 PENDING", reset));
        }

        SyncConfig.BatchConfig batch = syncConfigService.getConfig().getBatch();
        tickScheduler.arm(JOB_KEY, this::tick, batch.getFirstTickDelaySec(), batch.getTickIntervalSec());
        jobRunLogger.info(run.getId(), "START", String.format("批次 %s 启动: field=%s, rows=%d, batchSize=%d",
            run.getBatchNumber(), target.getFieldPath(), totalRows, batch.getBatchSize()));
        return run;
    }

    /**
     * 执行一次调度。上一次调度尚未结束时直接返回
     */
    public TickResult tick() {
        if (!engineLock.tryLock()) {
            log.warn("上一次调度或失败行重试仍在执行，本次跳过");
            return TickResult.of(TickResult.Outcome.OVERLAPPED, "上一次调度或失败行重试仍在执行");
        }
        try {
            return doTick();
        } finally {
            engineLock.unlock();
        }
    }

    private TickResult doTick() {
        Optional<JobCheckpointEntity> found = checkpointRepository.find();
        if (!found.isPresent()) {
            tickScheduler.cancel(JOB_KEY);
            log.info("无进行中的批量作业，取消残留触发");
            return TickResult.of(TickResult.Outcome.IDLE, "无进行中的作业");
        }
        JobCheckpointEntity checkpoint = found.get();
        if (!checkpoint.isIntact()) {
            tickScheduler.cancel(JOB_KEY);
            checkpointRepository.delete();
            if (checkpoint.getJobRunId() != null) {
                jobStateMachine.markCancelled(checkpoint.getJobRunId(), "断点损坏，作业终止", "断点损坏: " + checkpoint);
            }
            jobRunLogger.error(checkpoint.getJobRunId(), "CHECKPOINT", "断点损坏，已清除: " + checkpoint);
            return TickResult.of(TickResult.Outcome.IDLE, "断点损坏，已清除");
        }

        Long jobRunId = checkpoint.getJobRunId();
        int totalRows = (int) updateRowRepository.count();
        int start = checkpoint.getNextRowIndex();
        if (start >= totalRows) {
            return drain(checkpoint, totalRows, 0);
        }

        SyncConfig config = syncConfigService.getConfig();
        FieldTarget target = new FieldTarget(
            checkpoint.getFieldPath(), checkpoint.getFieldType(), checkpoint.getEnumListName());
        TickContext context;
        try {
            context = snapshotLoader.load(target);
        } catch (HrApiException e) {
            jobRunLogger.warn(jobRunId, "SNAPSHOT", "快照加载失败，本次调度中止，断点保持在 " + start + ": " + e.getMessage());
            return new TickResult(TickResult.Outcome.ABORTED, 0, start, totalRows, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("快照加载被中断，本次调度中止: jobRunId={}", jobRunId);
            return new TickResult(TickResult.Outcome.ABORTED, 0, start, totalRows, "interrupted");
        }

        int end = Math.min(start + config.getBatch().getBatchSize(), totalRows);
        long deadline = System.currentTimeMillis() + config.getBatch().getTickTimeBudgetSec() * 1000L;
        List<UpdateRowEntity> slice = updateRowRepository.findRange(start, end);
        log.info("调度开始: jobRunId={}, 行区间 [{}, {}), 共 {} 行", jobRunId, start, end, totalRows);

        int processedUntil = start;
        int processed = 0;
        boolean stoppedEarly = false;
        for (UpdateRowEntity row : slice) {
            if (processed > 0 && System.currentTimeMillis() >= deadline) {
                log.info("超出单次调度时间预算，剩余行留到下次调度: next={}", processedUntil);
                stoppedEarly = true;
                break;
            }
            UpdateRowStatus status = row.statusValue();
            if (status.isSettled() && Objects.equals(row.getFieldPath(), target.getFieldPath())) {
                count(checkpoint, status);
                processedUntil = row.getRowIndex() + 1;
                processed++;
                continue;
            }
            UpdateRowStatus before = status;
            row.setStatus(UpdateRowStatus.PROCESSING.name());
            updateRowRepository.update(row);
            UpdateOutcome outcome;
            try {
                outcome = updateExecutor.execute(row, target, context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                row.setStatus(before.name());
                updateRowRepository.update(row);
                log.warn("调度被中断，行 {} 留待下次调度", row.getRowIndex());
                stoppedEarly = true;
                break;
            } catch (RuntimeException e) {
                log.error("行 {} 执行异常", row.getRowIndex(), e);
                outcome = UpdateOutcome.failed(row.getResolvedRecordId(), null, e.toString());
            }
            outcome.applyTo(row);
            row.setFieldPath(target.getFieldPath());
            updateRowRepository.update(row);
            count(checkpoint, outcome.getStatus());
            processedUntil = row.getRowIndex() + 1;
            processed++;
        }
        if (!stoppedEarly) {
            processedUntil = end;
        }

        checkpoint.setNextRowIndex(Math.max(start, processedUntil));
        checkpoint.setLastProgressAt(LocalDateTime.now());
        if (!checkpointRepository.update(checkpoint)) {
            log.info("作业已在调度期间被取消，本次进度不再写回断点: jobRunId={}", jobRunId);
            return new TickResult(TickResult.Outcome.CANCELLED, processed, processedUntil, totalRows, "作业已取消");
        }
        String message = String.format("已处理 %d/%d 行 (completed=%d, skipped=%d, failed=%d)",
            checkpoint.getNextRowIndex(), totalRows, checkpoint.getCompletedCount(),
            checkpoint.getSkippedCount(), checkpoint.getFailedCount());
        progressTracker.updateProgress(jobRunId, checkpoint, totalRows, message);
        jobRunLogger.info(jobRunId, "TICK", message);

        if (checkpoint.getNextRowIndex() >= totalRows) {
            return drain(checkpoint, totalRows, processed);
        }
        return new TickResult(TickResult.Outcome.PROGRESSED, processed, checkpoint.getNextRowIndex(), totalRows, message);
    }

    private TickResult drain(JobCheckpointEntity checkpoint, int totalRows, int processed) {
        Long jobRunId = checkpoint.getJobRunId();
        if (!checkpointRepository.deleteForJob(jobRunId)) {
            log.info("作业已在调度期间被取消，不再收尾: jobRunId={}", jobRunId);
            return new TickResult(TickResult.Outcome.CANCELLED, processed, checkpoint.getNextRowIndex(), totalRows, "作业已取消");
        }
        tickScheduler.cancel(JOB_KEY);
        jobStateMachine.markDraining(jobRunId, "全部行已处理，收尾中");
        String summary = String.format("作业完成: total=%d, completed=%d, skipped=%d, failed=%d",
            totalRows, checkpoint.getCompletedCount(), checkpoint.getSkippedCount(), checkpoint.getFailedCount());
        jobStateMachine.markCompleted(jobRunId, summary);
        jobRunLogger.info(jobRunId, "COMPLETE", summary);
        return new TickResult(TickResult.Outcome.COMPLETED, processed, checkpoint.getNextRowIndex(), totalRows, summary);
    }

    /**
     * 停止进行中的作业。已处理的行保留结果，未处理的行保持 PENDING
     *
     * @throws NoActiveJobException 没有进行中的作业
     */
    public JobRunEntity stopJob() {
        Optional<JobCheckpointEntity> found = checkpointRepository.find();
        tickScheduler.cancel(JOB_KEY);
        if (!found.isPresent() || !checkpointRepository.delete()) {
            throw new NoActiveJobException("当前没有进行中的批量作业");
        }
        Long jobRunId = found.get().getJobRunId();
        jobStateMachine.markCancelled(jobRunId, "操作员停止", null);
        jobRunLogger.info(jobRunId, "STOP", "作业已停止, next=" + found.get().getNextRowIndex());
        return jobRunId != null ? jobRunRepository.findById(jobRunId).orElse(null) : null;
    }

    public boolean isJobActive() {
        return checkpointRepository.exists();
    }

    /**
     * 当前作业状态；无进行中作业时返回最近一次作业的结果
     */
    public BatchJobStatus getStatus() {
        BatchJobStatus status = new BatchJobStatus();
        int totalRows = (int) updateRowRepository.count();
        status.setTotalRows(totalRows);
        status.setRowStatusCounts(updateRowRepository.countByStatus());
        status.setTriggerArmed(tickScheduler.isArmed(JOB_KEY));

        Optional<JobCheckpointEntity> checkpoint = checkpointRepository.find();
        Optional<JobRunEntity> run = checkpoint.isPresent() && checkpoint.get().getJobRunId() != null
            ? jobRunRepository.findById(checkpoint.get().getJobRunId())
            : jobRunRepository.findLatest();

        if (!checkpoint.isPresent() && !run.isPresent()) {
            status.setState(JobRunStatus.NOT_STARTED);
            return status;
        }
        run.ifPresent(r -> {
            status.setJobRunId(r.getId());
            status.setBatchNumber(r.getBatchNumber());
            status.setState(JobRunStatus.valueOf(r.getStatus()));
            status.setFieldPath(r.getFieldPath());
            status.setFieldType(r.getFieldType());
            status.setEnumListName(r.getEnumListName());
            status.setNextRowIndex(nvl(r.getNextRowIndex()));
            status.setCompleted(nvl(r.getCompletedCount()));
            status.setSkipped(nvl(r.getSkippedCount()));
            status.setFailed(nvl(r.getFailedCount()));
            status.setStartedAt(r.getStartTime());
            status.setEndTime(r.getEndTime());
            if (!checkpoint.isPresent() && r.getTotalRows() != null) {
                status.setTotalRows(r.getTotalRows());
            }
        });
        if (checkpoint.isPresent()) {
            JobCheckpointEntity cp = checkpoint.get();
            if (status.getState() == null) {
                status.setState(JobRunStatus.RUNNING);
            }
            status.setFieldPath(cp.getFieldPath());
            status.setFieldType(cp.getFieldType());
            status.setEnumListName(cp.getEnumListName());
            status.setNextRowIndex(nvl(cp.getNextRowIndex()));
            status.setCompleted(nvl(cp.getCompletedCount()));
            status.setSkipped(nvl(cp.getSkippedCount()));
            status.setFailed(nvl(cp.getFailedCount()));
            status.setStartedAt(cp.getStartedAt());
            status.setLastProgressAt(cp.getLastProgressAt());
            status.setEstimatedRemainingSeconds(ProgressTracker.estimateRemainingSeconds(
                status.getNextRowIndex(), totalRows, syncConfigService.getConfig()));
        }
        status.setProgress(ProgressTracker.percent(status.getNextRowIndex(), status.getTotalRows()));
        return status;
    }

    private static void count(JobCheckpointEntity checkpoint, UpdateRowStatus status) {
        switch (status) {
            case COMPLETED:
                checkpoint.setCompletedCount(checkpoint.getCompletedCount() + 1);
                break;
            case SKIPPED:
                checkpoint.setSkippedCount(checkpoint.getSkippedCount() + 1);
                break;
            default:
                checkpoint.setFailedCount(checkpoint.getFailedCount() + 1);
                break;
        }
    }

    private static int nvl(Integer value) {
        return value != null ? value : 0;
    }
}
