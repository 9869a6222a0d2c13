package com.work.provenance.core.support;

import com.work.provenance.core.repository.WorkspaceRepository;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现：authority 表 + 每个 context 一个成员集合。
 */
public class InMemoryWorkspaceRepository implements WorkspaceRepository {

    private final Map<String, String> authorityTable = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> memberTable = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findAuthority(String context) {
        return Optional.ofNullable(authorityTable.get(context));
    }

    @Override
    public boolean insertAuthorityIfAbsent(String context, String authority, long updatedAt) {
        return authorityTable.putIfAbsent(context, authority) == null;
    }

    @Override
    public boolean compareAndSetAuthority(String context, String expected, String next, long updatedAt) {
        return authorityTable.replace(context, expected, next);
    }

    @Override
    public boolean isMember(String context, String member) {
        Set<String> members = memberTable.get(context);
        return members != null && members.contains(member);
    }

    @Override
    public void setMember(String context, String member, boolean isMember, long updatedAt) {
        Set<String> members = memberTable.computeIfAbsent(context, key -> ConcurrentHashMap.newKeySet());
        if (isMember) {
            members.add(member);
        } else {
            members.remove(member);
        }
    }
}
