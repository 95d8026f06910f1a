package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 批量作业断点实体，对应 job_checkpoint。全局至多一条，id 固定为 1。
 */
@Data
public class JobCheckpointEntity {

    public static final int SINGLETON_ID = 1;

    /** 关联的作业运行记录 */
    private Long jobRunId;

    /** 第一条未处理的行号，作业内只增不减 */
    private Integer nextRowIndex;

    private String fieldPath;

    private String fieldType;

    private String enumListName;

    private LocalDateTime startedAt;

    private LocalDateTime lastProgressAt;

    private Integer completedCount;

    private Integer skippedCount;

    private Integer failedCount;

    /**
     * 断点是否可用于续跑：字段路径、行号与计数齐全且非负。
     */
    public boolean isIntact() {
        return fieldPath != null && !fieldPath.trim().isEmpty()
            && nextRowIndex != null && nextRowIndex >= 0
            && completedCount != null && completedCount >= 0
            && skippedCount != null && skippedCount >= 0
            && failedCount != null && failedCount >= 0;
    }

    public JobCheckpointEntity copy() {
        JobCheckpointEntity e = new JobCheckpointEntity();
        e.setJobRunId(jobRunId);
        e.setNextRowIndex(nextRowIndex);
        e.setFieldPath(fieldPath);
        e.setFieldType(fieldType);
        e.setEnumListName(enumListName);
        e.setStartedAt(startedAt);
        e.setLastProgressAt(lastProgressAt);
        e.setCompletedCount(completedCount);
        e.setSkippedCount(skippedCount);
        e.setFailedCount(failedCount);
        return e;
    }
}
