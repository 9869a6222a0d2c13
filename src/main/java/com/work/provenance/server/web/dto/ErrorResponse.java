package com.work.provenance.server.web.dto;

/**
 * 统一错误响应：code 为稳定的错误分类，reason 为简短的机器可读原因。
 */
public class ErrorResponse {

    private String code;

    private String reason;

    private String message;

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
