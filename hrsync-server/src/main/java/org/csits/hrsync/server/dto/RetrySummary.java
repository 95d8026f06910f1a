package org.csits.hrsync.server.dto;

import lombok.Data;

/**
 * 失败行重试汇总。
 */
@Data
public class RetrySummary {

    private int attempted;

    private int completed;

    private int skipped;

    private int failed;

    /**
     * 因线程中断未能完成全部重试
     */
    private boolean interrupted;

    public void record(UpdateOutcome outcome) {
        attempted++;
        switch (outcome.getStatus()) {
            case COMPLETED:
                completed++;
                break;
            case SKIPPED:
                skipped++;
                break;
            default:
                failed++;
                break;
        }
    }
}
