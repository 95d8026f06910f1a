package org.csits.hrsync.server.exception;

/**
 * 已有批量作业在执行。
 */
public class JobAlreadyRunningException extends RuntimeException {

    public JobAlreadyRunningException(String message) {
        super(message);
    }
}
