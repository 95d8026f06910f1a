package org.csits.hrsync.manager.trigger;

/**
 * 批量作业周期触发设施。同一 jobKey 至多挂载一个触发器。
 */
public interface TickScheduler {

    /**
     * 挂载周期触发，已挂载时先取消旧触发器。
     *
     * @param jobKey 触发器标识
     * @param tick 每次触发执行的动作
     * @param initialDelaySeconds 首次触发延迟
     * @param intervalSeconds 上次执行结束到下次触发的间隔
     */
    void arm(String jobKey, Runnable tick, long initialDelaySeconds, long intervalSeconds);

    /**
     * 取消触发器，未挂载时无操作
     */
    void cancel(String jobKey);

    boolean isArmed(String jobKey);
}
