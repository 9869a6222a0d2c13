package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.SnapshotEntity;
import org.apache.ibatis.annotations.Param;

public interface SnapshotMapper extends BaseMapper<SnapshotEntity> {

    long countByRepo(@Param("repoRef") String repoRef);

    SnapshotEntity selectByIndex(@Param("repoRef") String repoRef, @Param("index") long index);

    SnapshotEntity selectByRoot(@Param("repoRef") String repoRef, @Param("merkleRoot") String merkleRoot);

    int insertSnapshot(@Param("e") SnapshotEntity entity);
}
