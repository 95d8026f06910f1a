package org.csits.hrsync.server.exception;

/**
 * 当前没有进行中的批量作业。
 */
public class NoActiveJobException extends RuntimeException {

    public NoActiveJobException(String message) {
        super(message);
    }
}
