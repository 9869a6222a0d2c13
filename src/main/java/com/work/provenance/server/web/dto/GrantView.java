package com.work.provenance.server.web.dto;

public class GrantView {

    private String principal;

    private String relayer;

    private String context;

    private String scopes;

    private Long expiry;

    private Boolean active;

    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public String getRelayer() {
        return relayer;
    }

    public void setRelayer(String relayer) {
        this.relayer = relayer;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String getScopes() {
        return scopes;
    }

    public void setScopes(String scopes) {
        this.scopes = scopes;
    }

    public Long getExpiry() {
        return expiry;
    }

    public void setExpiry(Long expiry) {
        this.expiry = expiry;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }
}
