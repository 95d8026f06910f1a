package org.csits.hrsync.server.dto;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Data;
import org.csits.hrsync.dao.JobRunStatus;

/**
 * 批量作业状态视图。
 */
@Data
public class BatchJobStatus {

    private JobRunStatus state;

    private Long jobRunId;

    private String batchNumber;

    private String fieldPath;

    private String fieldType;

    private String enumListName;

    private int nextRowIndex;

    private int totalRows;

    private int completed;

    private int skipped;

    private int failed;

    /**
     * 进度百分比，0-100
     */
    private int progress;

    private LocalDateTime startedAt;

    private LocalDateTime lastProgressAt;

    private LocalDateTime endTime;

    private boolean triggerArmed;

    private Map<String, Long> rowStatusCounts;

    private Long estimatedRemainingSeconds;
}
