package org.csits.hrsync.dao;

/**
 * 待更新行状态。
 */
public enum UpdateRowStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    SKIPPED,
    FAILED;

    /**
     * 写入已成功落地（含值未变化），重复执行不再调用远端。
     */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == FAILED;
    }
}
