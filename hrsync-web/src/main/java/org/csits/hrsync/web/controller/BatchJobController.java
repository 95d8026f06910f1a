package org.csits.hrsync.web.controller;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.server.dto.BatchJobStatus;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.RetrySummary;
import org.csits.hrsync.server.dto.TickResult;
import org.csits.hrsync.server.service.BatchJobService;
import org.csits.hrsync.server.service.RowStatusReporter;
import org.csits.hrsync.server.service.SyncConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 批量作业控制API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/batch")
@RequiredArgsConstructor
public class BatchJobController {

    private final BatchJobService batchJobService;
    private final RowStatusReporter rowStatusReporter;
    private final SyncConfigService syncConfigService;

    /**
     * 启动批量作业。target 为配置中的目标名；未指定时使用请求体中的字段目标
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(
        @RequestParam(required = false) String target,
        @RequestBody(required = false) FieldTarget fieldTarget) {
        FieldTarget resolved = target != null ? syncConfigService.resolveTarget(target) : fieldTarget;
        log.info("启动批量作业: target={}, field={}", target, resolved != null ? resolved.getFieldPath() : null);
        JobRunEntity run = batchJobService.startJob(resolved);

        Map<String, Object> result = new HashMap<>();
        result.put("jobRunId", run.getId());
        result.put("batchNumber", run.getBatchNumber());
        result.put("totalRows", run.getTotalRows());
        result.put("message", "批量作业已启动");
        return ResponseEntity.ok(result);
    }

    /**
     * 停止进行中的作业
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        JobRunEntity run = batchJobService.stopJob();

        Map<String, Object> result = new HashMap<>();
        if (run != null) {
            result.put("jobRunId", run.getId());
            result.put("batchNumber", run.getBatchNumber());
            result.put("nextRowIndex", run.getNextRowIndex());
        }
        result.put("message", "批量作业已停止");
        return ResponseEntity.ok(result);
    }

    /**
     * 手动执行一次调度
     */
    @PostMapping("/tick")
    public ResponseEntity<TickResult> tick() {
        return ResponseEntity.ok(batchJobService.tick());
    }

    @GetMapping("/status")
    public ResponseEntity<BatchJobStatus> status() {
        return ResponseEntity.ok(batchJobService.getStatus());
    }

    /**
     * 重试失败行。未指定 target 时沿用最近一次作业的字段目标
     */
    @PostMapping("/retry-failed")
    public ResponseEntity<RetrySummary> retryFailed(@RequestParam(required = false) String target) {
        RetrySummary summary = target != null
            ? rowStatusReporter.retryFailedRows(syncConfigService.resolveTarget(target))
            : rowStatusReporter.retryFailedRows();
        return ResponseEntity.ok(summary);
    }
}
