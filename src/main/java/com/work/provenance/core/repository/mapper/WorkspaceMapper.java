package com.work.provenance.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.provenance.core.repository.entity.WorkspaceAuthorityEntity;
import org.apache.ibatis.annotations.Param;

/**
 * workspace authority 与成员表 Mapper。
 */
public interface WorkspaceMapper extends BaseMapper<WorkspaceAuthorityEntity> {

    String selectAuthority(@Param("contextId") String contextId);

    /**
     * ON CONFLICT DO NOTHING，返回 0 表示已存在。
     */
    int insertAuthorityIfAbsent(@Param("contextId") String contextId,
                                @Param("authority") String authority,
                                @Param("updatedAt") long updatedAt);

    /**
     * CAS：WHERE authority = expected。
     */
    int updateAuthorityFenced(@Param("contextId") String contextId,
                              @Param("expected") String expected,
                              @Param("authority") String authority,
                              @Param("updatedAt") long updatedAt);

    Boolean selectMemberActive(@Param("contextId") String contextId, @Param("member") String member);

    int upsertMember(@Param("contextId") String contextId,
                     @Param("member") String member,
                     @Param("active") boolean active,
                     @Param("updatedAt") long updatedAt);
}
