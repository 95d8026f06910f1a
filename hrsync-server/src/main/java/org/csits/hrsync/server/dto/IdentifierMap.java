package org.csits.hrsync.server.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 业务标识到 HR 平台记录 ID 的本地快照，仅在单次调度内使用。
 */
public final class IdentifierMap {

    private static final IdentifierMap EMPTY = new IdentifierMap(Collections.emptyMap());

    private final Map<String, String> recordIdsByBusinessId;

    private IdentifierMap(Map<String, String> recordIdsByBusinessId) {
        this.recordIdsByBusinessId = recordIdsByBusinessId;
    }

    public static IdentifierMap empty() {
        return EMPTY;
    }

    /**
     * 键会去除首尾空白；重复键保留先出现的记录
     */
    public static IdentifierMap of(Map<String, String> entries) {
        Map<String, String> copy = new HashMap<>();
        entries.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.putIfAbsent(k.trim(), v);
            }
        });
        return new IdentifierMap(Collections.unmodifiableMap(copy));
    }

    public Optional<String> lookup(String businessId) {
        if (businessId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(recordIdsByBusinessId.get(businessId.trim()));
    }

    public int size() {
        return recordIdsByBusinessId.size();
    }
}
