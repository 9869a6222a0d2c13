package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * executor 为零地址表示清除。
 */
public class DaoExecutorRequest {

    @NotBlank(message = "context 不能为空")
    private String context;

    @NotBlank(message = "author 不能为空")
    private String author;

    @NotBlank(message = "executor 不能为空")
    private String executor;

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getExecutor() {
        return executor;
    }

    public void setExecutor(String executor) {
        this.executor = executor;
    }
}
