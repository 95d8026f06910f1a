package org.csits.hrsync.dao;

/**
 * 批量作业状态。NOT_STARTED 不落库，仅用于状态查询时表示当前无作业。
 */
public enum JobRunStatus {
    NOT_STARTED,
    RUNNING,
    DRAINING,
    COMPLETED,
    CANCELLED
}
