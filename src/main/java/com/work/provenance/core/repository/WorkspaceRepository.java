package com.work.provenance.core.repository;

import java.util.Optional;

/**
 * workspace 的 authority 与成员表，按 context 隔离。
 */
public interface WorkspaceRepository {

    Optional<String> findAuthority(String context);

    /**
     * 仅当 context 尚无 authority 时写入。
     *
     * @return 是否写入；false 表示已被设置（包括其他节点并发设置）
     */
    boolean insertAuthorityIfAbsent(String context, String authority, long updatedAt);

    /**
     * 仅当当前 authority 仍为 expected 时替换为 next。
     */
    boolean compareAndSetAuthority(String context, String expected, String next, long updatedAt);

    boolean isMember(String context, String member);

    void setMember(String context, String member, boolean isMember, long updatedAt);
}
