package org.csits.hrsync.web.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.csits.hrsync.server.service.JobRunLogger;
import org.csits.hrsync.server.service.ProgressTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 作业运行历史API接口
 */
@RestController
@RequestMapping("/api/job-runs")
@RequiredArgsConstructor
public class JobRunController {

    private final JobRunRepository jobRunRepository;
    private final JobRunLogger jobRunLogger;

    /**
     * 查询作业运行记录，按创建时间倒序
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
        @RequestParam(required = false) String status,
        @RequestParam(defaultValue = "0") int page,
        @RequestParam(defaultValue = "20") int size) {

        List<JobRunEntity> filtered = jobRunRepository.findAll().stream()
            .filter(r -> status == null || status.equals(r.getStatus()))
            .collect(Collectors.toList());

        // 分页
        int total = filtered.size();
        int start = Math.min(Math.max(page, 0) * Math.max(size, 1), total);
        int end = Math.min(start + Math.max(size, 1), total);
        List<JobRunEntity> paged = filtered.subList(start, end);

        Map<String, Object> result = new HashMap<>();
        result.put("total", total);
        result.put("page", page);
        result.put("size", size);
        result.put("data", paged);
        return ResponseEntity.ok(result);
    }

    /**
     * 查询单条运行记录，附带解析后的执行日志
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable Long id) {
        return jobRunRepository.findById(id)
            .map(run -> {
                Map<String, Object> result = new HashMap<>();
                result.put("jobRun", run);
                result.put("durationSeconds", ProgressTracker.durationSeconds(run));
                result.put("logs", jobRunLogger.readLog(run));
                return ResponseEntity.ok(result);
            })
            .orElse(ResponseEntity.notFound().build());
    }
}
