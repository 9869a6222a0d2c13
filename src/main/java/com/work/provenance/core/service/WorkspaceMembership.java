package com.work.provenance.core.service;

/**
 * 成员资格查询端口，release 与快照注册表只依赖这一个只读方法。
 */
public interface WorkspaceMembership {

    boolean isMember(String context, String identity);
}
