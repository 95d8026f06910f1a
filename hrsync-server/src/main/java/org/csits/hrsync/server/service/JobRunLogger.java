package org.csits.hrsync.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.dao.JobRunRepository;
import org.springframework.stereotype.Component;

/**
 * 作业执行日志记录封装。历史日志追加到 job_run.execution_log（JSON 数组）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRunLogger {

    private static final TypeReference<List<Map<String, Object>>> LOG_LIST_TYPE =
        new TypeReference<List<Map<String, Object>>>() {};

    private final JobRunRepository jobRunRepository;
    private final ObjectMapper objectMapper;

    public void info(Long jobRunId, String stage, String message) {
        append(jobRunId, "INFO", stage, message);
        log.info("[jobRunId={}] [{}] {}", jobRunId, stage, message);
    }

    public void warn(Long jobRunId, String stage, String message) {
        append(jobRunId, "WARN", stage, message);
        log.warn("[jobRunId={}] [{}] {}", jobRunId, stage, message);
    }

    public void error(Long jobRunId, String stage, String message) {
        append(jobRunId, "ERROR", stage, message);
        log.error("[jobRunId={}] [{}] {}", jobRunId, stage, message);
    }

    /**
     * 读取执行日志
     */
    public List<Map<String, Object>> readLog(JobRunEntity entity) {
        String raw = entity.getExecutionLog();
        if (raw == null || raw.trim().isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<Map<String, Object>> list = objectMapper.readValue(raw, LOG_LIST_TYPE);
            return list != null ? list : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.warn("执行日志解析失败: jobRunId={}, error={}", entity.getId(), e.getMessage());
            return new ArrayList<>();
        }
    }

    private void append(Long jobRunId, String logLevel, String stage, String message) {
        if (jobRunId == null) {
            return;
        }
        jobRunRepository.findById(jobRunId).ifPresent(entity -> {
            List<Map<String, Object>> list = readLog(entity);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("log_level", logLevel);
            entry.put("stage", stage);
            entry.put("message", message);
            entry.put("created_at", LocalDateTime.now().toString());
            list.add(entry);
            try {
                entity.setExecutionLog(objectMapper.writeValueAsString(list));
                jobRunRepository.save(entity);
            } catch (JsonProcessingException e) {
                log.warn("执行日志写入失败，跳过: jobRunId={}, error={}", jobRunId, e.getMessage());
            }
        });
    }
}
