package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.LedgerEventEntity;
import org.apache.ibatis.annotations.Param;

import java.util.List;

public interface LedgerEventMapper extends BaseMapper<LedgerEventEntity> {

    List<LedgerEventEntity> listAfterSeq(@Param("afterSeq") Long afterSeq, @Param("limit") int limit);

    /**
     * 插入并回填 seq。
     */
    int insertEvent(LedgerEventEntity entity);
}
