package org.csits.hrsync.server.service;

import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * 批量调度与失败行重试共用的执行锁，同一时刻只允许一条访问 HR 平台的串行调用序列。
 */
@Component
public class EngineLock {

    private final ReentrantLock lock = new ReentrantLock();

    public boolean tryLock() {
        return lock.tryLock();
    }

    public void unlock() {
        lock.unlock();
    }
}
