package org.csits.hrsync.dao;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 待更新行仓储接口，按行号寻址，支持内存和数据库两种实现。
 */
public interface UpdateRowRepository {

    /**
     * 追加暂存行，行号接续当前最大行号分配
     *
     * @return 追加的行数
     */
    int appendAll(List<UpdateRowEntity> rows);

    /**
     * 按行号回写状态与结果列
     *
     * @return 行不存在时返回 false
     */
    boolean update(UpdateRowEntity row);

    Optional<UpdateRowEntity> findByRowIndex(int rowIndex);

    /**
     * 查询行号区间 [fromInclusive, toExclusive)，按行号升序
     */
    List<UpdateRowEntity> findRange(int fromInclusive, int toExclusive);

    List<UpdateRowEntity> findByStatus(String status);

    /**
     * 查询全部行，按行号升序
     */
    List<UpdateRowEntity> findAll();

    long count();

    /**
     * 按状态统计行数
     */
    Map<String, Long> countByStatus();

    /**
     * 把结果不属于 fieldPath 的 COMPLETED / SKIPPED 行重置为 PENDING 并清空结果列
     *
     * @return 重置的行数
     */
    int resetSettledNotFor(String fieldPath);

    void deleteAll();
}
