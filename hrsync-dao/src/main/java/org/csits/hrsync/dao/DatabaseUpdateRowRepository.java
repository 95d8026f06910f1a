package org.csits.hrsync.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * 基于数据库的待更新行仓储实现，读写 update_row。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "hrsync.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseUpdateRowRepository implements UpdateRowRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String NEXT_INDEX_SQL =
        "SELECT COALESCE(MAX(row_index) + 1, 0) FROM update_row";

    private static final String INSERT_SQL =
        "INSERT INTO update_row (row_index, business_id, raw_value, resolved_record_id, status, " +
        "http_code, error_message, verified_value, field_path, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE update_row SET resolved_record_id = ?, status = ?, http_code = ?, error_message = ?, " +
        "verified_value = ?, field_path = ?, updated_at = ? WHERE row_index = ?";

    private static final String SELECT_BY_INDEX_SQL =
        "SELECT * FROM update_row WHERE row_index = ?";

    private static final String SELECT_RANGE_SQL =
        "SELECT * FROM update_row WHERE row_index >= ? AND row_index < ? ORDER BY row_index";

    private static final String SELECT_BY_STATUS_SQL =
        "SELECT * FROM update_row WHERE status = ? ORDER BY row_index";

    private static final String SELECT_ALL_SQL =
        "SELECT * FROM update_row ORDER BY row_index";

    private static final String COUNT_SQL =
        "SELECT COUNT(*) FROM update_row";

    private static final String COUNT_BY_STATUS_SQL =
        "SELECT status, COUNT(*) AS cnt FROM update_row GROUP BY status ORDER BY status";

    private static final String RESET_SETTLED_SQL =
        "UPDATE update_row SET status = 'PENDING', http_code = NULL, error_message = NULL, verified_value = NULL, " +
        "field_path = NULL, updated_at = ? WHERE status IN ('COMPLETED', 'SKIPPED') " +
        "AND (field_path IS NULL OR field_path <> ?)";

    private static final String DELETE_ALL_SQL =
        "DELETE FROM update_row";

    @Override
    @Transactional
    public int appendAll(List<UpdateRowEntity> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        Integer base = jdbcTemplate.queryForObject(NEXT_INDEX_SQL, Integer.class);
        int next = base != null ? base : 0;
        LocalDateTime now = LocalDateTime.now();
        List<Object[]> args = new ArrayList<>(rows.size());
        for (UpdateRowEntity row : rows) {
            row.setRowIndex(next++);
            if (row.getStatus() == null) {
                row.setStatus(UpdateRowStatus.PENDING.name());
            }
            row.setUpdatedAt(now);
            args.add(new Object[]{
                row.getRowIndex(),
                row.getBusinessId(),
                row.getRawValue(),
                row.getResolvedRecordId(),
                row.getStatus(),
                row.getHttpCode(),
                row.getErrorMessage(),
                row.getVerifiedValue(),
                row.getFieldPath(),
                toTimestamp(now)
            });
        }
        jdbcTemplate.batchUpdate(INSERT_SQL, args);
        log.debug("暂存待更新行: count={}, firstIndex={}", rows.size(), rows.get(0).getRowIndex());
        return rows.size();
    }

    @Override
    public boolean update(UpdateRowEntity row) {
        LocalDateTime now = LocalDateTime.now();
        int n = jdbcTemplate.update(UPDATE_SQL,
            row.getResolvedRecordId(),
            row.getStatus(),
            row.getHttpCode(),
            row.getErrorMessage(),
            row.getVerifiedValue(),
            row.getFieldPath(),
            toTimestamp(now),
            row.getRowIndex()
        );
        if (n == 0) {
            log.warn("回写待更新行失败，记录不存在: rowIndex={}", row.getRowIndex());
            return false;
        }
        row.setUpdatedAt(now);
        return true;
    }

    @Override
    public Optional<UpdateRowEntity> findByRowIndex(int rowIndex) {
        List<UpdateRowEntity> list = jdbcTemplate.query(SELECT_BY_INDEX_SQL, new UpdateRowRowMapper(), rowIndex);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<UpdateRowEntity> findRange(int fromInclusive, int toExclusive) {
        return jdbcTemplate.query(SELECT_RANGE_SQL, new UpdateRowRowMapper(), fromInclusive, toExclusive);
    }

    @Override
    public List<UpdateRowEntity> findByStatus(String status) {
        return jdbcTemplate.query(SELECT_BY_STATUS_SQL, new UpdateRowRowMapper(), status);
    }

    @Override
    public List<UpdateRowEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new UpdateRowRowMapper());
    }

    @Override
    public long count() {
        Long n = jdbcTemplate.queryForObject(COUNT_SQL, Long.class);
        return n != null ? n : 0;
    }

    @Override
    public Map<String, Long> countByStatus() {
        Map<String, Long> result = new LinkedHashMap<>();
        jdbcTemplate.query(COUNT_BY_STATUS_SQL, rs -> {
            result.put(rs.getString("status"), rs.getLong("cnt"));
        });
        return result;
    }

    @Override
    public int resetSettledNotFor(String fieldPath) {
        int n = jdbcTemplate.update(RESET_SETTLED_SQL, toTimestamp(LocalDateTime.now()), fieldPath);
        if (n > 0) {
            log.info("重置其它字段的已结算行: fieldPath={}, count={}", fieldPath, n);
        }
        return n;
    }

    @Override
    public void deleteAll() {
        int n = jdbcTemplate.update(DELETE_ALL_SQL);
        log.info("清空待更新行: count={}", n);
    }

    private static class UpdateRowRowMapper implements RowMapper<UpdateRowEntity> {
        @Override
        public UpdateRowEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            UpdateRowEntity e = new UpdateRowEntity();
            e.setRowIndex(rs.getInt("row_index"));
            e.setBusinessId(rs.getString("business_id"));
            e.setRawValue(rs.getString("raw_value"));
            e.setResolvedRecordId(rs.getString("resolved_record_id"));
            e.setStatus(rs.getString("status"));
            int code = rs.getInt("http_code");
            e.setHttpCode(rs.wasNull() ? null : code);
            e.setErrorMessage(rs.getString("error_message"));
            e.setVerifiedValue(rs.getString("verified_value"));
            e.setFieldPath(rs.getString("field_path"));
            Timestamp updated = rs.getTimestamp("updated_at");
            e.setUpdatedAt(updated != null ? updated.toLocalDateTime() : null);
            return e;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }
}
