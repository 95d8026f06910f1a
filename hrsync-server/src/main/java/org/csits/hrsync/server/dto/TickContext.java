package org.csits.hrsync.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 单次调度（或一次失败重试）使用的快照上下文，调度结束即丢弃。
 */
@Data
@AllArgsConstructor
public class TickContext {

    private IdentifierMap identifiers;

    /**
     * 目标字段非枚举时为空
     */
    private EnumLabelMap enumLabels;
}
