package com.work.provenance.server.web.dto;

public class AuthorizationView {

    private String principal;

    private String relayer;

    private String context;

    private String capability;

    private Boolean authorized;

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

    public String getCapability() {
        return capability;
    }

    public void setCapability(String capability) {
        this.capability = capability;
    }

    public Boolean getAuthorized() {
        return authorized;
    }

    public void setAuthorized(Boolean authorized) {
        this.authorized = authorized;
    }
}
