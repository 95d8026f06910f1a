package org.csits.hrsync.manager.pacing;

/**
 * 外部调用节流。每次对 HR 平台发起调用后执行一次 {@link #pace()}。
 */
public interface CallPacer {

    /**
     * 阻塞到允许发起下一次调用为止。
     *
     * @throws InterruptedException 等待期间线程被中断
     */
    void pace() throws InterruptedException;

    /**
     * 两次调用之间的最小间隔（毫秒）
     */
    long intervalMillis();
}
