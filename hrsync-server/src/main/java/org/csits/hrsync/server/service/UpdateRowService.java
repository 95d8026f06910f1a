package org.csits.hrsync.server.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobCheckpointRepository;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.dao.UpdateRowRepository;
import org.csits.hrsync.dao.UpdateRowStatus;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.springframework.stereotype.Service;

/**
 * 待更新行的暂存、查询与清空。作业执行期间行表只读。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpdateRowService {

    private final UpdateRowRepository updateRowRepository;
    private final JobCheckpointRepository checkpointRepository;

    /**
     * 追加暂存行
     *
     * @throws IllegalArgumentException 业务标识为空
     * @throws JobAlreadyRunningException 批量作业执行中
     */
    public List<UpdateRowEntity> stage(List<UpdateRowEntity> rows) {
        requireNoActiveJob("暂存");
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("待暂存行不能为空");
        }
        List<UpdateRowEntity> staged = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            UpdateRowEntity row = rows.get(i);
            if (row == null || row.getBusinessId() == null || row.getBusinessId().trim().isEmpty()) {
                throw new IllegalArgumentException("第 " + (i + 1) + " 行业务标识为空");
            }
            staged.add(UpdateRowEntity.staged(row.getBusinessId().trim(), row.getRawValue()));
        }
        updateRowRepository.appendAll(staged);
        log.info("暂存待更新行: count={}, total={}", staged.size(), updateRowRepository.count());
        return staged;
    }

    /**
     * 分页查询，status 为空时查询全部
     */
    public List<UpdateRowEntity> list(String status, int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("offset 不能为负且 limit 必须为正");
        }
        if (status == null || status.trim().isEmpty()) {
            return updateRowRepository.findRange(offset, offset + limit);
        }
        UpdateRowStatus parsed;
        try {
            parsed = UpdateRowStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的行状态: " + status);
        }
        return updateRowRepository.findByStatus(parsed.name()).stream()
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    public long count() {
        return updateRowRepository.count();
    }

    /**
     * 清空行表
     *
     * @throws JobAlreadyRunningException 批量作业执行中
     */
    public void clear() {
        requireNoActiveJob("清空");
        updateRowRepository.deleteAll();
    }

    private void requireNoActiveJob(String action) {
        if (checkpointRepository.exists()) {
            throw new JobAlreadyRunningException("批量作业执行中，不能" + action + "行表");
        }
    }
}
