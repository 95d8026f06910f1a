package org.csits.hrsync.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的断点仓储实现，读写 job_checkpoint。主键固定为 1，由唯一约束保证单作业。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseJobCheckpointRepository implements JobCheckpointRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO job_checkpoint (id, job_run_id, next_row_index, field_path, field_type, enum_list_name, " +
        "started_at, last_progress_at, completed_count, skipped_count, failed_count) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE job_checkpoint SET job_run_id = ?, next_row_index = ?, field_path = ?, field_type = ?, " +
        "enum_list_name = ?, started_at = ?, last_progress_at = ?, completed_count = ?, skipped_count = ?, " +
        "failed_count = ? WHERE id = ? AND job_run_id = ?";

    private static final String SELECT_SQL =
        "SELECT * FROM job_checkpoint WHERE id = ?";

    private static final String DELETE_SQL =
        "DELETE FROM job_checkpoint WHERE id = ?";

    private static final String DELETE_FOR_JOB_SQL =
        "DELETE FROM job_checkpoint WHERE id = ? AND job_run_id = ?";

    @Override
    public Optional<JobCheckpointEntity> find() {
        List<JobCheckpointEntity> list = jdbcTemplate.query(SELECT_SQL, new JobCheckpointRowMapper(),
            JobCheckpointEntity.SINGLETON_ID);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public boolean createIfAbsent(JobCheckpointEntity entity) {
        try {
            jdbcTemplate.update(INSERT_SQL,
                JobCheckpointEntity.SINGLETON_ID,
                entity.getJobRunId(),
                entity.getNextRowIndex(),
                entity.getFieldPath(),
                entity.getFieldType(),
                entity.getEnumListName(),
                toTimestamp(entity.getStartedAt()),
                toTimestamp(entity.getLastProgressAt()),
                entity.getCompletedCount(),
                entity.getSkippedCount(),
                entity.getFailedCount()
            );
            log.debug("写入断点: jobRunId={}, fieldPath={}", entity.getJobRunId(), entity.getFieldPath());
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("断点已存在，拒绝写入: jobRunId={}", entity.getJobRunId());
            return false;
        }
    }

    @Override
    public boolean update(JobCheckpointEntity entity) {
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getJobRunId(),
            entity.getNextRowIndex(),
            entity.getFieldPath(),
            entity.getFieldType(),
            entity.getEnumListName(),
            toTimestamp(entity.getStartedAt()),
            toTimestamp(entity.getLastProgressAt()),
            entity.getCompletedCount(),
            entity.getSkippedCount(),
            entity.getFailedCount(),
            JobCheckpointEntity.SINGLETON_ID,
            entity.getJobRunId()
        );
        if (rows == 0) {
            log.warn("更新断点失败，断点不存在或已属于其它作业: jobRunId={}", entity.getJobRunId());
            return false;
        }
        return true;
    }

    @Override
    public boolean delete() {
        return jdbcTemplate.update(DELETE_SQL, JobCheckpointEntity.SINGLETON_ID) > 0;
    }

    @Override
    public boolean deleteForJob(Long jobRunId) {
        return jdbcTemplate.update(DELETE_FOR_JOB_SQL, JobCheckpointEntity.SINGLETON_ID, jobRunId) > 0;
    }

    @Override
    public boolean exists() {
        return find().isPresent();
    }

    private static class JobCheckpointRowMapper implements RowMapper<JobCheckpointEntity> {
        @Override
        public JobCheckpointEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            JobCheckpointEntity e = new JobCheckpointEntity();
            long jobRunId = rs.getLong("job_run_id");
            e.setJobRunId(rs.wasNull() ? null : jobRunId);
            e.setNextRowIndex(getNullableInt(rs, "next_row_index"));
            e.setFieldPath(rs.getString("field_path"));
            e.setFieldType(rs.getString("field_type"));
            e.setEnumListName(rs.getString("enum_list_name"));
            e.setStartedAt(toLocalDateTime(rs.getTimestamp("started_at")));
            e.setLastProgressAt(toLocalDateTime(rs.getTimestamp("last_progress_at")));
            e.setCompletedCount(getNullableInt(rs, "completed_count"));
            e.setSkippedCount(getNullableInt(rs, "skipped_count"));
            e.setFailedCount(getNullableInt(rs, "failed_count"));
            return e;
        }

        private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
            int v = rs.getInt(column);
            return rs.wasNull() ? null : v;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
