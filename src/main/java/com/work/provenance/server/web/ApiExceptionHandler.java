package com.work.provenance.server.web;

import com.work.provenance.core.exception.ErrorCode;
import com.work.provenance.core.exception.ProvenanceException;
import com.work.provenance.server.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 将组件异常映射为 HTTP 状态码与统一的 {@link ErrorResponse}。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProvenanceException.class)
    public ResponseEntity<ErrorResponse> handleProvenance(ProvenanceException e) {
        HttpStatus status = statusOf(e.getCode());
        log.debug("request rejected code={} reason={} msg={}", e.getCode(), e.getReason(), e.getMessage());
        return ResponseEntity.status(status).body(body(e.getCode(), e.getReason(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        String message = fe == null ? "请求参数非法" : fe.getDefaultMessage();
        String field = fe == null ? "body" : fe.getField();
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_INPUT, "empty " + field, message));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissing(Exception e) {
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_INPUT, "missing parameter", e.getMessage()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case INVALID_INPUT:
            case BAD_EXPIRY:
                return HttpStatus.BAD_REQUEST;
            case SIGNATURE_INVALID:
            case SIGNATURE_EXPIRED:
                return HttpStatus.UNAUTHORIZED;
            case UNAUTHORIZED:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case PRECONDITION_FAILED:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ErrorResponse body(ErrorCode code, String reason, String message) {
        ErrorResponse r = new ErrorResponse();
        r.setCode(code.name());
        r.setReason(reason);
        r.setMessage(message);
        return r;
    }
}
