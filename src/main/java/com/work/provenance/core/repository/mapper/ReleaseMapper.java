package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.DaoExecutorEntity;
import com.work.provenance.core.repository.entity.ReleaseEntity;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * release 表与 dao_executor 表 Mapper。
 */
public interface ReleaseMapper extends BaseMapper<ReleaseEntity> {

    long countByProject(@Param("projectId") String projectId);

    ReleaseEntity selectByProjectIndex(@Param("projectId") String projectId, @Param("index") long index);

    List<ReleaseEntity> listByProject(@Param("projectId") String projectId,
                                      @Param("offset") long offset,
                                      @Param("limit") int limit);

    /**
     * 只更新可变字段，围栏条件：status / revoked / superseded_by 仍为调用方读到的值。
     */
    int updateMutableFenced(@Param("e") ReleaseEntity entity,
                            @Param("expectedStatus") int expectedStatus,
                            @Param("expectedRevoked") boolean expectedRevoked,
                            @Param("expectedSupersededBy") String expectedSupersededBy);

    DaoExecutorEntity selectDaoExecutor(@Param("contextId") String contextId);

    int upsertDaoExecutor(@Param("contextId") String contextId,
                          @Param("executor") String executor,
                          @Param("updatedAt") long updatedAt);

    int deleteDaoExecutor(@Param("contextId") String contextId);
}
