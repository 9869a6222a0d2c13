package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

public class SnapshotRefRequest {

    @NotBlank(message = "repo 不能为空")
    private String repo;

    @NotBlank(message = "root 不能为空")
    private String root;

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }
}
