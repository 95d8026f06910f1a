package org.csits.hrsync.job;

import com.xxl.job.core.context.XxlJobHelper;
import com.xxl.job.core.handler.annotation.XxlJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.RetrySummary;
import org.csits.hrsync.server.dto.TickResult;
import org.csits.hrsync.server.service.BatchJobService;
import org.csits.hrsync.server.service.RowStatusReporter;
import org.csits.hrsync.server.service.SyncConfigService;
import org.springframework.stereotype.Component;

/**
 * 提供给 xxl-job 的批量更新任务处理器。
 *
 * 调度中心配置示例：
 * - JobHandler：hrSyncTickHandler，cron 与 batch.tick_interval_sec 保持一致（如每 7 分钟），无参数
 * - JobHandler：hrSyncRetryFailedHandler，手动触发，执行参数为目标名（如 "department"），为空时沿用最近一次作业的目标
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HrSyncXxlJobHandler {

    private final BatchJobService batchJobService;
    private final RowStatusReporter rowStatusReporter;
    private final SyncConfigService syncConfigService;

    @XxlJob("hrSyncTickHandler")
    public void tick() {
        TickResult result;
        try {
            result = batchJobService.tick();
        } catch (RuntimeException e) {
            log.error("hrSyncTickHandler failed", e);
            XxlJobHelper.log(e);
            XxlJobHelper.handleFail("hrSyncTickHandler 执行失败：" + e.getMessage());
            throw e;
        }
        XxlJobHelper.log("hrSyncTickHandler outcome={}, next={}/{}, message={}",
            result.getOutcome(), result.getNextRowIndex(), result.getTotalRows(), result.getMessage());
        if (result.getOutcome() == TickResult.Outcome.ABORTED) {
            XxlJobHelper.handleFail("本次调度中止：" + result.getMessage());
        }
    }

    @XxlJob("hrSyncRetryFailedHandler")
    public void retryFailed() {
        String param = XxlJobHelper.getJobParam();
        XxlJobHelper.log("hrSyncRetryFailedHandler start, param={}", param);
        try {
            RetrySummary summary = param == null || param.trim().isEmpty()
                ? rowStatusReporter.retryFailedRows()
                : rowStatusReporter.retryFailedRows(syncConfigService.resolveTarget(param.trim()));
            XxlJobHelper.log("hrSyncRetryFailedHandler done, {}", summary);
            if (summary.getFailed() > 0) {
                XxlJobHelper.handleSuccess("仍有 " + summary.getFailed() + " 行失败");
            }
        } catch (RuntimeException e) {
            log.error("hrSyncRetryFailedHandler failed, param={}", param, e);
            XxlJobHelper.log(e);
            XxlJobHelper.handleFail("hrSyncRetryFailedHandler 执行失败：" + e.getMessage());
            throw e;
        }
    }
}
