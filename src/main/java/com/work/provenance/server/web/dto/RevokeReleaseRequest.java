package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

public class RevokeReleaseRequest {

    @NotBlank(message = "author 不能为空")
    private String author;

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }
}
