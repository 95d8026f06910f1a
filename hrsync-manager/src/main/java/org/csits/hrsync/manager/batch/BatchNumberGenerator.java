package org.csits.hrsync.manager.batch;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * 批次号生成：yyyyMMddHHmmss_当日序号。
 * 当日序号由调用方根据当日已有作业数给出，重启后不会重复。
 */
@Component
public class BatchNumberGenerator {

    private static final DateTimeFormatter PREFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * @param now 作业创建时间
     * @param existingToday 当日已创建的作业数
     */
    public String nextBatchNumber(LocalDateTime now, long existingToday) {
        if (existingToday < 0) {
            throw new IllegalArgumentException("existingToday must not be negative: " + existingToday);
        }
        return PREFIX.format(now) + "_" + String.format("%03d", existingToday + 1);
    }
}
