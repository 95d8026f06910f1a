package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 作业运行记录实体，对应 job_run。每次启动批量作业生成一条，作业结束后保留用于审计。
 */
@Data
public class JobRunEntity {

    private Long id;

    /** 批次号 yyyyMMdd_NNN */
    private String batchNumber;

    private String fieldPath;

    private String fieldType;

    private String enumListName;

    private String status;

    private Integer totalRows;

    private Integer nextRowIndex;

    private Integer completedCount;

    private Integer skippedCount;

    private Integer failedCount;

    private Integer tickCount;

    /** 当前阶段或最近一条状态说明 */
    private String message;

    private String errorMessage;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 执行日志，JSON 数组，元素含 log_level、stage、message、created_at。
     */
    private String executionLog;
}
