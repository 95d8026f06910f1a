package org.csits.hrsync.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次调度的执行结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TickResult {

    public enum Outcome {
        /** 无进行中的作业 */
        IDLE,
        /** 上一次调度仍在执行 */
        OVERLAPPED,
        /** 快照加载失败，断点未移动 */
        ABORTED,
        PROGRESSED,
        COMPLETED,
        /** 调度期间作业被取消 */
        CANCELLED
    }

    private Outcome outcome;

    private int processedRows;

    private int nextRowIndex;

    private int totalRows;

    private String message;

    public static TickResult of(Outcome outcome, String message) {
        return new TickResult(outcome, 0, 0, 0, message);
    }
}
