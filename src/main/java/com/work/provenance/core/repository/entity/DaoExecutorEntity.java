package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * context 级 DAO executor 配置表实体类。
 */
@TableName("dao_executor")
public class DaoExecutorEntity {

    @TableId(value = "context_id", type = IdType.INPUT)
    private String contextId;

    private String executor;

    private Long updatedAt;

    public DaoExecutorEntity() {
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public String getExecutor() {
        return executor;
    }

    public void setExecutor(String executor) {
        this.executor = executor;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
