package org.csits.hrsync.server.service;

import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.csits.hrsync.dao.JobRunStatus;
import org.springframework.stereotype.Service;

/**
 * 作业状态机服务
 * 管理作业运行记录的状态转换和验证
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStateMachine {

    private final JobRunRepository jobRunRepository;

    /**
     * 状态转换定义
     */
    private enum StateTransition {
        // 运行中 -> 收尾
        RUNNING_TO_DRAINING(JobRunStatus.RUNNING, JobRunStatus.DRAINING),
        // 收尾 -> 完成
        DRAINING_TO_COMPLETED(JobRunStatus.DRAINING, JobRunStatus.COMPLETED),
        // 运行中 -> 取消
        RUNNING_TO_CANCELLED(JobRunStatus.RUNNING, JobRunStatus.CANCELLED),
        // 收尾 -> 取消（收尾期间收到停止请求）
        DRAINING_TO_CANCELLED(JobRunStatus.DRAINING, JobRunStatus.CANCELLED);

        private final JobRunStatus from;
        private final JobRunStatus to;

        StateTransition(JobRunStatus from, JobRunStatus to) {
            this.from = from;
            this.to = to;
        }

        public boolean matches(JobRunStatus current, JobRunStatus target) {
            return this.from == current && this.to == target;
        }
    }

    /**
     * 转换作业状态
     *
     * @param jobRunId 作业运行记录 ID
     * @param targetStatus 目标状态
     * @param message 状态消息
     * @return 是否转换成功
     */
    public boolean transitionTo(Long jobRunId, JobRunStatus targetStatus, String message) {
        JobRunEntity entity = jobRunRepository.findById(jobRunId).orElse(null);
        if (entity == null) {
            log.error("作业运行记录不存在: jobRunId={}", jobRunId);
            return false;
        }

        JobRunStatus current = entity.getStatus() != null ? JobRunStatus.valueOf(entity.getStatus()) : null;

        // 幂等：当前已是目标状态则直接成功
        if (current == targetStatus) {
            log.debug("作业已是目标状态，跳过转换: jobRunId={}, status={}", jobRunId, current);
            return true;
        }

        if (!isValidTransition(current, targetStatus)) {
            log.error("非法的状态转换: jobRunId={}, from={}, to={}", jobRunId, current, targetStatus);
            return false;
        }

        entity.setStatus(targetStatus.name());
        if (message != null) {
            entity.setMessage(message);
        }
        if (targetStatus == JobRunStatus.COMPLETED || targetStatus == JobRunStatus.CANCELLED) {
            entity.setEndTime(LocalDateTime.now());
        }

        jobRunRepository.save(entity);
        log.info("作业状态转换: jobRunId={}, {} -> {}, message={}", jobRunId, current, targetStatus, message);
        return true;
    }

    private boolean isValidTransition(JobRunStatus current, JobRunStatus target) {
        for (StateTransition transition : StateTransition.values()) {
            if (transition.matches(current, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 标记作业进入收尾
     */
    public boolean markDraining(Long jobRunId, String message) {
        return transitionTo(jobRunId, JobRunStatus.DRAINING, message);
    }

    /**
     * 标记作业完成，由收尾状态进入
     */
    public boolean markCompleted(Long jobRunId, String message) {
        return transitionTo(jobRunId, JobRunStatus.COMPLETED, message);
    }

    /**
     * 标记作业取消
     */
    public boolean markCancelled(Long jobRunId, String message, String errorMessage) {
        if (errorMessage != null) {
            jobRunRepository.findById(jobRunId).ifPresent(entity -> {
                entity.setErrorMessage(errorMessage);
                jobRunRepository.save(entity);
            });
        }
        return transitionTo(jobRunId, JobRunStatus.CANCELLED, message);
    }
}
