package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

public class SupersedeReleaseRequest {

    @NotBlank(message = "newId 不能为空")
    private String newId;

    @NotBlank(message = "author 不能为空")
    private String author;

    public String getNewId() {
        return newId;
    }

    public void setNewId(String newId) {
        this.newId = newId;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }
}
