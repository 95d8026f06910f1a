package org.csits.hrsync.web;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.csits.hrsync.server.exception.NoActiveJobException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 将服务层异常映射为 {"error": ...} 响应。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(NoActiveJobException.class)
    public ResponseEntity<Map<String, Object>> handleNoActiveJob(NoActiveJobException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(JobAlreadyRunningException e) {
        log.warn("操作被拒绝: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    /**
     * HR 平台调用失败，如重试失败行时列表值快照不可用
     */
    @ExceptionHandler(HrApiException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(HrApiException e) {
        log.error("HR 平台调用失败: code={}", e.getStatusCode(), e);
        Map<String, Object> body = new HashMap<>();
        body.put("error", e.getMessage());
        body.put("upstreamStatus", e.getStatusCode());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
