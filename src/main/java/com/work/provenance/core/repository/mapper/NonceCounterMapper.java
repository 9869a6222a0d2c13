package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.NonceCounterEntity;
import org.apache.ibatis.annotations.Param;

public interface NonceCounterMapper extends BaseMapper<NonceCounterEntity> {

    Long selectNonce(@Param("registry") String registry, @Param("principal") String principal);

    int insertIfNotExists(@Param("registry") String registry,
                          @Param("principal") String principal,
                          @Param("updatedAt") long updatedAt);

    /**
     * CAS：WHERE nonce = expected。
     */
    int casAdvance(@Param("registry") String registry,
                   @Param("principal") String principal,
                   @Param("expected") long expected,
                   @Param("updatedAt") long updatedAt);
}
