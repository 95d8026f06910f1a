package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 作业运行记录仓储接口，支持内存和数据库两种实现。
 */
public interface JobRunRepository {

    /**
     * 保存作业运行记录（新增或更新）
     */
    JobRunEntity save(JobRunEntity entity);

    Optional<JobRunEntity> findById(Long id);

    /**
     * 查询所有作业运行记录，按创建时间倒序
     */
    List<JobRunEntity> findAll();

    /**
     * 最近一次作业运行记录
     */
    Optional<JobRunEntity> findLatest();

    long count();

    /**
     * 统计某时间区间内创建的作业数（startInclusive <= created_at < endExclusive）
     */
    long countByCreatedAtBetween(LocalDateTime startInclusive, LocalDateTime endExclusive);
}
