package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的待更新行仓储实现，读写均复制对象，行为与数据库实现保持一致。
 */
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "memory")
public class InMemoryUpdateRowRepository implements UpdateRowRepository {

    private final TreeMap<Integer, UpdateRowEntity> store = new TreeMap<>();

    @Override
    public synchronized int appendAll(List<UpdateRowEntity> rows) {
        int next = store.isEmpty() ? 0 : store.lastKey() + 1;
        for (UpdateRowEntity row : rows) {
            UpdateRowEntity copy = row.copy();
            copy.setRowIndex(next);
            if (copy.getStatus() == null) {
                copy.setStatus(UpdateRowStatus.PENDING.name());
            }
            copy.setUpdatedAt(LocalDateTime.now());
            store.put(next, copy);
            row.setRowIndex(next);
            next++;
        }
        return rows.size();
    }

    @Override
    public synchronized boolean update(UpdateRowEntity row) {
        if (row.getRowIndex() == null || !store.containsKey(row.getRowIndex())) {
            return false;
        }
        UpdateRowEntity copy = row.copy();
        copy.setUpdatedAt(LocalDateTime.now());
        store.put(row.getRowIndex(), copy);
        return true;
    }

    @Override
    public synchronized Optional<UpdateRowEntity> findByRowIndex(int rowIndex) {
        UpdateRowEntity e = store.get(rowIndex);
        return e != null ? Optional.of(e.copy()) : Optional.empty();
    }

    @Override
    public synchronized List<UpdateRowEntity> findRange(int fromInclusive, int toExclusive) {
        if (toExclusive <= fromInclusive) {
            return new java.util.ArrayList<>();
        }
        return store.subMap(fromInclusive, true, toExclusive, false).values().stream()
            .map(UpdateRowEntity::copy)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<UpdateRowEntity> findByStatus(String status) {
        return store.values().stream()
            .filter(e -> status.equals(e.getStatus()))
            .map(UpdateRowEntity::copy)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<UpdateRowEntity> findAll() {
        return store.values().stream()
            .map(UpdateRowEntity::copy)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized long count() {
        return store.size();
    }

    @Override
    public synchronized Map<String, Long> countByStatus() {
        return store.values().stream()
            .collect(Collectors.groupingBy(UpdateRowEntity::getStatus, TreeMap::new, Collectors.counting()));
    }

    @Override
    public synchronized int resetSettledNotFor(String fieldPath) {
        int n = 0;
        for (UpdateRowEntity e : store.values()) {
            if (e.statusValue().isSettled() && !Objects.equals(fieldPath, e.getFieldPath())) {
                e.setStatus(UpdateRowStatus.PENDING.name());
                e.setHttpCode(null);
                e.setErrorMessage(null);
                e.setVerifiedValue(null);
                e.setFieldPath(null);
                e.setUpdatedAt(LocalDateTime.now());
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized void deleteAll() {
        store.clear();
    }
}
