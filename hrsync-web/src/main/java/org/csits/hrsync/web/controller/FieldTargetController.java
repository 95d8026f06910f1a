package org.csits.hrsync.web.controller;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.service.SyncConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 字段目标目录API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/targets")
@RequiredArgsConstructor
public class FieldTargetController {

    private final SyncConfigService syncConfigService;

    @GetMapping
    public ResponseEntity<Map<String, FieldTarget>> list() {
        return ResponseEntity.ok(syncConfigService.listTargets());
    }

    /**
     * 重新读取同步配置
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, FieldTarget>> reload() {
        syncConfigService.reload();
        log.info("同步配置已重新加载");
        return ResponseEntity.ok(syncConfigService.listTargets());
    }
}
