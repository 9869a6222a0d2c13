package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.GrantEntity;
import org.apache.ibatis.annotations.Param;

/**
 * 授权表 Mapper。
 */
public interface GrantMapper extends BaseMapper<GrantEntity> {

    GrantEntity selectByKey(@Param("principal") String principal,
                            @Param("relayer") String relayer,
                            @Param("contextId") String contextId);

    /**
     * PostgreSQL ON CONFLICT 覆盖写。
     */
    int upsert(@Param("e") GrantEntity entity);
}
