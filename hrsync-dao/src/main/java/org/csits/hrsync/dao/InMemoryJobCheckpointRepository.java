package org.csits.hrsync.dao;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的断点仓储实现，进程重启后断点丢失，仅用于本地调试与测试。
 */
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "memory")
public class InMemoryJobCheckpointRepository implements JobCheckpointRepository {

    private final AtomicReference<JobCheckpointEntity> current = new AtomicReference<>();

    @Override
    public Optional<JobCheckpointEntity> find() {
        JobCheckpointEntity e = current.get();
        return e != null ? Optional.of(e.copy()) : Optional.empty();
    }

    @Override
    public boolean createIfAbsent(JobCheckpointEntity entity) {
        return current.compareAndSet(null, entity.copy());
    }

    @Override
    public boolean update(JobCheckpointEntity entity) {
        JobCheckpointEntity replacement = entity.copy();
        while (true) {
            JobCheckpointEntity old = current.get();
            if (old == null || !Objects.equals(old.getJobRunId(), entity.getJobRunId())) {
                return false;
            }
            if (current.compareAndSet(old, replacement)) {
                return true;
            }
        }
    }

    @Override
    public boolean delete() {
        return current.getAndSet(null) != null;
    }

    @Override
    public boolean deleteForJob(Long jobRunId) {
        while (true) {
            JobCheckpointEntity old = current.get();
            if (old == null || !Objects.equals(old.getJobRunId(), jobRunId)) {
                return false;
            }
            if (current.compareAndSet(old, null)) {
                return true;
            }
        }
    }

    @Override
    public boolean exists() {
        return current.get() != null;
    }
}
