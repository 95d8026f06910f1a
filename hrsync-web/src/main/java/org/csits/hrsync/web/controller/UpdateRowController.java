package org.csits.hrsync.web.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.server.service.RowStatusReporter;
import org.csits.hrsync.server.service.UpdateRowService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 待更新行API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/rows")
@RequiredArgsConstructor
public class UpdateRowController {

    private final UpdateRowService updateRowService;
    private final RowStatusReporter rowStatusReporter;

    /**
     * 追加暂存行，请求体为 [{businessId, rawValue}]
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> stage(@RequestBody List<UpdateRowEntity> rows) {
        List<UpdateRowEntity> staged = updateRowService.stage(rows);

        Map<String, Object> result = new HashMap<>();
        result.put("staged", staged.size());
        result.put("firstRowIndex", staged.isEmpty() ? null : staged.get(0).getRowIndex());
        result.put("total", updateRowService.count());
        return ResponseEntity.ok(result);
    }

    /**
     * 分页查询
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
        @RequestParam(required = false) String status,
        @RequestParam(defaultValue = "0") int offset,
        @RequestParam(defaultValue = "50") int limit) {
        List<UpdateRowEntity> rows = updateRowService.list(status, offset, limit);

        Map<String, Object> result = new HashMap<>();
        result.put("total", updateRowService.count());
        result.put("offset", offset);
        result.put("limit", limit);
        result.put("data", rows);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Long>> summary() {
        return ResponseEntity.ok(rowStatusReporter.summarize());
    }

    /**
     * 清空行表
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        long before = updateRowService.count();
        updateRowService.clear();
        log.info("行表已清空: {} 行", before);

        Map<String, Object> result = new HashMap<>();
        result.put("deleted", before);
        return ResponseEntity.ok(result);
    }
}
