package org.csits.hrsync.server.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 枚举显示名到列表值 ID 的快照，同时维护忽略大小写的索引。
 */
public final class EnumLabelMap {

    private final String listName;

    private final Map<String, String> exact;

    private final Map<String, String> folded;

    private EnumLabelMap(String listName, Map<String, String> exact, Map<String, String> folded) {
        this.listName = listName;
        this.exact = exact;
        this.folded = folded;
    }

    public static EnumLabelMap of(String listName, Map<String, String> idsByLabel) {
        Map<String, String> exact = new HashMap<>();
        Map<String, String> folded = new HashMap<>();
        idsByLabel.forEach((label, id) -> {
            if (label != null && id != null) {
                exact.putIfAbsent(label, id);
                folded.putIfAbsent(fold(label), id);
            }
        });
        return new EnumLabelMap(listName, Collections.unmodifiableMap(exact), Collections.unmodifiableMap(folded));
    }

    /**
     * 先精确匹配，再忽略大小写匹配
     */
    public Optional<String> lookup(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String id = exact.get(label);
        if (id == null) {
            id = folded.get(fold(label));
        }
        return Optional.ofNullable(id);
    }

    public String getListName() {
        return listName;
    }

    public int size() {
        return exact.size();
    }

    private static String fold(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
