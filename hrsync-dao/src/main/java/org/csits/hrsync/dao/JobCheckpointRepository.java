package org.csits.hrsync.dao;

import java.util.Optional;

/**
 * 断点仓储接口。断点是作业在两次调度之间唯一需要保留的状态，同一时刻最多存在一条。
 */
public interface JobCheckpointRepository {

    Optional<JobCheckpointEntity> find();

    /**
     * 不存在断点时写入；已存在则不做任何修改
     *
     * @return 是否写入成功
     */
    boolean createIfAbsent(JobCheckpointEntity entity);

    /**
     * 更新属于同一作业（jobRunId 相同）的断点，不会新建
     *
     * @return 断点已被删除或已属于其它作业时返回 false
     */
    boolean update(JobCheckpointEntity entity);

    /**
     * @return 删除前是否存在
     */
    boolean delete();

    /**
     * 仅当断点属于指定作业时删除
     */
    boolean deleteForJob(Long jobRunId);

    boolean exists();
}
