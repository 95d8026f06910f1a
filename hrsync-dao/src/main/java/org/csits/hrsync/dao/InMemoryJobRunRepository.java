package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的作业运行记录仓储实现。
 */
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "memory")
public class InMemoryJobRunRepository implements JobRunRepository {

    private static final Comparator<JobRunEntity> NEWEST_FIRST =
        Comparator.comparing(JobRunEntity::getCreatedAt).thenComparing(JobRunEntity::getId).reversed();

    private final AtomicLong idGenerator = new AtomicLong(0);

    private final Map<Long, JobRunEntity> store = new ConcurrentHashMap<>();

    @Override
    public JobRunEntity save(JobRunEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        if (entity.getId() == null) {
            entity.setId(idGenerator.incrementAndGet());
            if (entity.getCreatedAt() == null) {
                entity.setCreatedAt(now);
            }
            if (entity.getStartTime() == null) {
                entity.setStartTime(now);
            }
        }
        entity.setUpdatedAt(now);
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public Optional<JobRunEntity> findById(Long id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<JobRunEntity> findAll() {
        return store.values().stream()
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<JobRunEntity> findLatest() {
        return store.values().stream().min(NEWEST_FIRST);
    }

    @Override
    public long count() {
        return store.size();
    }

    @Override
    public long countByCreatedAtBetween(LocalDateTime startInclusive, LocalDateTime endExclusive) {
        return store.values().stream()
            .filter(e -> e.getCreatedAt() != null)
            .filter(e -> !e.getCreatedAt().isBefore(startInclusive) && e.getCreatedAt().isBefore(endExclusive))
            .count();
    }
}
