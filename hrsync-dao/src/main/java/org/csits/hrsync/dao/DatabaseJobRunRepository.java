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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的作业运行记录仓储实现
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseJobRunRepository implements JobRunRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO job_run (batch_number, field_path, field_type, enum_list_name, status, total_rows, " +
        "next_row_index, completed_count, skipped_count, failed_count, tick_count, message, error_message, " +
        "start_time, end_time, execution_log, created_at, updated_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE job_run SET status = ?, total_rows = ?, next_row_index = ?, completed_count = ?, " +
        "skipped_count = ?, failed_count = ?, tick_count = ?, message = ?, error_message = ?, " +
        "start_time = ?, end_time = ?, execution_log = ?, updated_at = ? WHERE id = ?";

    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM job_run WHERE id = ?";

    private static final String SELECT_ALL_SQL =
        "SELECT * FROM job_run ORDER BY created_at DESC, id DESC";

    private static final String SELECT_LATEST_SQL =
        "SELECT * FROM job_run ORDER BY created_at DESC, id DESC LIMIT 1";

    private static final String COUNT_SQL =
        "SELECT COUNT(*) FROM job_run";

    private static final String COUNT_BETWEEN_SQL =
        "SELECT COUNT(*) FROM job_run WHERE created_at >= ? AND created_at < ?";

    @Override
    public JobRunEntity save(JobRunEntity entity) {
        if (entity.getId() == null) {
            return insert(entity);
        } else {
            return update(entity);
        }
    }

    private JobRunEntity insert(JobRunEntity entity) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        LocalDateTime now = LocalDateTime.now();
        if (entity.getStartTime() == null) {
            entity.setStartTime(now);
        }
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);

        jdbcTemplate.update(connection -> {
            java.sql.PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
            ps.setString(1, entity.getBatchNumber());
            ps.setString(2, entity.getFieldPath());
            ps.setString(3, entity.getFieldType());
            ps.setString(4, entity.getEnumListName());
            ps.setString(5, entity.getStatus());
            ps.setObject(6, entity.getTotalRows());
            ps.setObject(7, entity.getNextRowIndex());
            ps.setObject(8, entity.getCompletedCount());
            ps.setObject(9, entity.getSkippedCount());
            ps.setObject(10, entity.getFailedCount());
            ps.setObject(11, entity.getTickCount());
            ps.setString(12, entity.getMessage());
            ps.setString(13, entity.getErrorMessage());
            ps.setTimestamp(14, toTimestamp(entity.getStartTime()));
            ps.setTimestamp(15, toTimestamp(entity.getEndTime()));
            ps.setString(16, entity.getExecutionLog());
            ps.setTimestamp(17, toTimestamp(entity.getCreatedAt()));
            ps.setTimestamp(18, toTimestamp(entity.getUpdatedAt()));
            return ps;
        }, keyHolder);

        Long id = keyHolder.getKey().longValue();
        entity.setId(id);
        log.debug("插入作业运行记录: id={}, batchNumber={}, fieldPath={}",
            id, entity.getBatchNumber(), entity.getFieldPath());
        return entity;
    }

    private JobRunEntity update(JobRunEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getStatus(),
            entity.getTotalRows(),
            entity.getNextRowIndex(),
            entity.getCompletedCount(),
            entity.getSkippedCount(),
            entity.getFailedCount(),
            entity.getTickCount(),
            entity.getMessage(),
            entity.getErrorMessage(),
            toTimestamp(entity.getStartTime()),
            toTimestamp(entity.getEndTime()),
            entity.getExecutionLog(),
            toTimestamp(now),
            entity.getId()
        );

        if (rows == 0) {
            log.warn("更新作业运行记录失败，记录不存在: id={}", entity.getId());
        } else {
            entity.setUpdatedAt(now);
            log.debug("更新作业运行记录: id={}, status={}, nextRowIndex={}",
                entity.getId(), entity.getStatus(), entity.getNextRowIndex());
        }
        return entity;
    }

    @Override
    public Optional<JobRunEntity> findById(Long id) {
        List<JobRunEntity> results = jdbcTemplate.query(SELECT_BY_ID_SQL, new JobRunRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<JobRunEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new JobRunRowMapper());
    }

    @Override
    public Optional<JobRunEntity> findLatest() {
        List<JobRunEntity> results = jdbcTemplate.query(SELECT_LATEST_SQL, new JobRunRowMapper());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class);
        return count != null ? count : 0;
    }

    @Override
    public long countByCreatedAtBetween(LocalDateTime startInclusive, LocalDateTime endExclusive) {
        Long count = jdbcTemplate.queryForObject(COUNT_BETWEEN_SQL, Long.class,
            toTimestamp(startInclusive), toTimestamp(endExclusive));
        return count != null ? count : 0;
    }

    /**
     * RowMapper实现
     */
    private static class JobRunRowMapper implements RowMapper<JobRunEntity> {
        @Override
        public JobRunEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            JobRunEntity entity = new JobRunEntity();
            entity.setId(rs.getLong("id"));
            entity.setBatchNumber(rs.getString("batch_number"));
            entity.setFieldPath(rs.getString("field_path"));
            entity.setFieldType(rs.getString("field_type"));
            entity.setEnumListName(rs.getString("enum_list_name"));
            entity.setStatus(rs.getString("status"));
            entity.setTotalRows(getNullableInt(rs, "total_rows"));
            entity.setNextRowIndex(getNullableInt(rs, "next_row_index"));
            entity.setCompletedCount(getNullableInt(rs, "completed_count"));
            entity.setSkippedCount(getNullableInt(rs, "skipped_count"));
            entity.setFailedCount(getNullableInt(rs, "failed_count"));
            entity.setTickCount(getNullableInt(rs, "tick_count"));
            entity.setMessage(rs.getString("message"));
            entity.setErrorMessage(rs.getString("error_message"));
            entity.setStartTime(toLocalDateTime(rs.getTimestamp("start_time")));
            entity.setEndTime(toLocalDateTime(rs.getTimestamp("end_time")));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            entity.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
            entity.setExecutionLog(rs.getString("execution_log"));
            return entity;
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
